package org.skirmish.runtime.model;

import java.util.Locale;

/**
 * Unit categories. Buildings declare which categories they can produce.
 */
public enum UnitType {
    INFANTRY,
    CAVALRY,
    RANGED,
    ARTILLERY,
    NAVAL,
    SUPPORT,
    WORKER;

    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param id Category id, case-insensitive.
     * @return The unit type.
     * @throws IllegalArgumentException for unknown ids.
     */
    public static UnitType fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Unit category must not be null");
        }
        try {
            return valueOf(id.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown unit category: " + id, e);
        }
    }
}
