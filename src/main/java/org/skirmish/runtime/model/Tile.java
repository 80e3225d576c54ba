package org.skirmish.runtime.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A single grid cell. Holds at most one occupant, referenced by id only: the owning
 * {@link Faction} holds the entity itself.
 * <p>
 * Occupancy must only be changed through {@link GameState}, which keeps the occupant id and
 * the entity position in agreement.
 */
public class Tile {

    private final int x;
    private final int y;
    private Terrain terrain;
    private String unitId;
    private String buildingId;
    private ResourceType resourceType;
    private int resourceAmount;
    private final Set<String> visibleTo = new LinkedHashSet<>();
    private final Set<String> exploredBy = new LinkedHashSet<>();

    public Tile(int x, int y, Terrain terrain) {
        this.x = x;
        this.y = y;
        this.terrain = terrain;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public Terrain getTerrain() {
        return terrain;
    }

    /**
     * Changes the terrain. Intended for map generation and test setup.
     *
     * @param terrain The new terrain.
     */
    public void setTerrain(Terrain terrain) {
        this.terrain = terrain;
    }

    public String getUnitId() {
        return unitId;
    }

    public String getBuildingId() {
        return buildingId;
    }

    public boolean isOccupied() {
        return unitId != null || buildingId != null;
    }

    public boolean isPassable() {
        return terrain.isPassable();
    }

    public int getMovementCost() {
        return terrain.getMovementCost();
    }

    /**
     * @return {@code true} if a unit may be placed here.
     */
    public boolean canPlaceUnit() {
        return isPassable() && !isOccupied();
    }

    /**
     * @return {@code true} if a building may be placed here.
     */
    public boolean canPlaceBuilding() {
        return terrain.isBuildable() && !isOccupied();
    }

    void placeUnit(String id) {
        if (!canPlaceUnit()) {
            throw new IllegalStateException("Cannot place unit " + id + " on tile (" + x + ", " + y + ")");
        }
        this.unitId = id;
    }

    void placeBuilding(String id) {
        if (!canPlaceBuilding()) {
            throw new IllegalStateException("Cannot place building " + id + " on tile (" + x + ", " + y + ")");
        }
        this.buildingId = id;
    }

    void clearUnit() {
        this.unitId = null;
    }

    void clearBuilding() {
        this.buildingId = null;
    }

    public ResourceType getResourceType() {
        return resourceType;
    }

    public int getResourceAmount() {
        return resourceAmount;
    }

    public boolean hasResourceNode() {
        return resourceType != null && resourceAmount > 0;
    }

    /**
     * Places a resource node on this tile, replacing any previous one.
     *
     * @param type The resource kind.
     * @param amount The amount available, non-negative.
     */
    public void setResourceNode(ResourceType type, int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Resource amount must not be negative: " + amount);
        }
        this.resourceType = type;
        this.resourceAmount = amount;
    }

    /**
     * Removes up to {@code requested} from the resource node.
     *
     * @param requested The amount to extract.
     * @return The amount actually extracted.
     */
    public int extractResource(int requested) {
        int taken = Math.max(0, Math.min(requested, resourceAmount));
        resourceAmount -= taken;
        return taken;
    }

    public boolean isVisibleTo(String agentId) {
        return visibleTo.contains(agentId);
    }

    public boolean isExploredBy(String agentId) {
        return exploredBy.contains(agentId);
    }

    /**
     * Marks this tile visible and explored for the agent.
     *
     * @param agentId The observing agent.
     */
    public void reveal(String agentId) {
        visibleTo.add(agentId);
        exploredBy.add(agentId);
    }

    void clearVisibility() {
        visibleTo.clear();
    }

    public Set<String> getVisibleTo() {
        return Collections.unmodifiableSet(visibleTo);
    }

    public Set<String> getExploredBy() {
        return Collections.unmodifiableSet(exploredBy);
    }

    /**
     * @param otherX Column of the other position.
     * @param otherY Row of the other position.
     * @return The Manhattan distance to the other position.
     */
    public int distanceTo(int otherX, int otherY) {
        return Math.abs(x - otherX) + Math.abs(y - otherY);
    }
}
