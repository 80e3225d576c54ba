package org.skirmish.runtime.model;

/**
 * Terrain of a map tile. Water cannot be entered; buildings need open ground.
 */
public enum Terrain {
    PLAINS(1, true),
    FOREST(2, false),
    WATER(-1, false),
    MOUNTAIN(3, false),
    DESERT(2, true);

    private final int movementCost;
    private final boolean buildable;

    Terrain(int movementCost, boolean buildable) {
        this.movementCost = movementCost;
        this.buildable = buildable;
    }

    /**
     * @return The movement cost, or {@code -1} for impassable terrain.
     */
    public int getMovementCost() {
        return movementCost;
    }

    public boolean isPassable() {
        return movementCost > 0;
    }

    public boolean isBuildable() {
        return buildable;
    }
}
