package org.skirmish.runtime.view;

import java.util.List;

import org.skirmish.runtime.model.ResourceType;
import org.skirmish.runtime.model.Terrain;
import org.skirmish.runtime.model.Tile;

/**
 * Unredacted tile state for match snapshots.
 */
public record TileRecord(int x, int y, Terrain terrain, String unitId, String buildingId,
                         ResourceType resourceType, int resourceAmount,
                         List<String> visibleTo, List<String> exploredBy) {

    public TileRecord {
        visibleTo = List.copyOf(visibleTo);
        exploredBy = List.copyOf(exploredBy);
    }

    public static TileRecord of(Tile tile) {
        return new TileRecord(tile.getX(), tile.getY(), tile.getTerrain(), tile.getUnitId(), tile.getBuildingId(),
                tile.getResourceType(), tile.getResourceAmount(),
                List.copyOf(tile.getVisibleTo()), List.copyOf(tile.getExploredBy()));
    }
}
