package org.skirmish.runtime.spi;

import java.util.Locale;

/**
 * Whether an ability is meant for units or buildings.
 */
public enum AbilityCategory {
    UNIT,
    BUILDING;

    public static AbilityCategory fromId(String id) {
        return valueOf(id.trim().toUpperCase(Locale.ROOT));
    }
}
