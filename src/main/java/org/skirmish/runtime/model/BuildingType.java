package org.skirmish.runtime.model;

import java.util.Locale;

public enum BuildingType {
    TOWN_CENTER,
    BARRACKS,
    ARCHERY_RANGE,
    STABLE,
    WORKSHOP,
    FARM,
    MINE,
    LUMBER_MILL,
    WALL,
    TOWER;

    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param id Type id such as {@code "town_center"}, case-insensitive.
     * @return The building type.
     * @throws IllegalArgumentException for unknown ids.
     */
    public static BuildingType fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Building type must not be null");
        }
        try {
            return valueOf(id.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown building type: " + id, e);
        }
    }
}
