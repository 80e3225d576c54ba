package org.skirmish.runtime.view;

import org.skirmish.runtime.model.ResourceType;
import org.skirmish.runtime.model.Terrain;
import org.skirmish.runtime.model.Tile;

/**
 * A tile as one agent sees it. Tiles the agent has never explored carry their coordinates
 * only; every other field is empty.
 */
public record TileView(int x, int y, boolean explored, boolean visible, Terrain terrain,
                       String unitId, String buildingId, ResourceType resourceType, int resourceAmount) {

    public static TileView unexplored(int x, int y) {
        return new TileView(x, y, false, false, null, null, null, null, 0);
    }

    /**
     * @param tile The tile.
     * @param agentId The observing agent.
     * @return The redacted view of the tile for that agent.
     */
    public static TileView of(Tile tile, String agentId) {
        boolean visible = tile.isVisibleTo(agentId);
        boolean explored = tile.isExploredBy(agentId);
        if (!visible && !explored) {
            return unexplored(tile.getX(), tile.getY());
        }
        return new TileView(tile.getX(), tile.getY(), explored, visible, tile.getTerrain(),
                tile.getUnitId(), tile.getBuildingId(), tile.getResourceType(), tile.getResourceAmount());
    }
}
