package org.skirmish.runtime.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Rectangular tile grid addressed by {@code (x, y)} with {@code 0 <= x < width}.
 */
public class GameMap {

    // 8-neighbourhood, scanned in this fixed order
    private static final int[][] NEIGHBOUR_OFFSETS = {
            {-1, -1}, {0, -1}, {1, -1},
            {-1, 0}, {1, 0},
            {-1, 1}, {0, 1}, {1, 1}
    };

    private final int width;
    private final int height;
    private final Tile[][] tiles;

    /**
     * Creates a map covered entirely with plains.
     *
     * @param width Number of columns, positive.
     * @param height Number of rows, positive.
     */
    public GameMap(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Map dimensions must be positive: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.tiles = new Tile[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                tiles[y][x] = new Tile(x, y, Terrain.PLAINS);
            }
        }
    }

    /**
     * Generates a map with random terrain and resource nodes. The same seed always yields
     * the same map.
     * <p>
     * Terrain distribution: 60% plains, 20% forest, 10% mountain, 5% water, 5% desert.
     * About 10% of non-water tiles carry a resource node with 50 to 200 units.
     *
     * @param width Number of columns.
     * @param height Number of rows.
     * @param random The random source.
     * @return The generated map.
     */
    public static GameMap generate(int width, int height, Random random) {
        GameMap map = new GameMap(width, height);
        ResourceType[] kinds = ResourceType.values();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                Tile tile = map.tiles[y][x];
                double roll = random.nextDouble();
                if (roll < 0.6) {
                    tile.setTerrain(Terrain.PLAINS);
                } else if (roll < 0.8) {
                    tile.setTerrain(Terrain.FOREST);
                } else if (roll < 0.9) {
                    tile.setTerrain(Terrain.MOUNTAIN);
                } else if (roll < 0.95) {
                    tile.setTerrain(Terrain.WATER);
                } else {
                    tile.setTerrain(Terrain.DESERT);
                }
                if (tile.getTerrain() != Terrain.WATER && random.nextDouble() < 0.1) {
                    tile.setResourceNode(kinds[random.nextInt(kinds.length)], 50 + random.nextInt(151));
                }
            }
        }
        return map;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public boolean isInBounds(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    /**
     * @param x Column.
     * @param y Row.
     * @return The tile, or {@code null} when the position is outside the map.
     */
    public Tile getTile(int x, int y) {
        return isInBounds(x, y) ? tiles[y][x] : null;
    }

    /**
     * @param x Column of the centre.
     * @param y Row of the centre.
     * @return The in-bounds tiles of the 8-neighbourhood, excluding the centre, in a fixed order.
     */
    public List<Tile> getNeighbours(int x, int y) {
        List<Tile> result = new ArrayList<>(NEIGHBOUR_OFFSETS.length);
        for (int[] offset : NEIGHBOUR_OFFSETS) {
            Tile tile = getTile(x + offset[0], y + offset[1]);
            if (tile != null) {
                result.add(tile);
            }
        }
        return result;
    }

    /**
     * @param x Column of the centre.
     * @param y Row of the centre.
     * @param radius Maximum Manhattan distance, inclusive.
     * @return All in-bounds tiles within the radius, centre included, row by row.
     */
    public List<Tile> getTilesWithin(int x, int y, int radius) {
        List<Tile> result = new ArrayList<>();
        if (radius < 0) {
            return result;
        }
        for (int ty = Math.max(0, y - radius); ty <= Math.min(height - 1, y + radius); ty++) {
            int remaining = radius - Math.abs(ty - y);
            for (int tx = Math.max(0, x - remaining); tx <= Math.min(width - 1, x + remaining); tx++) {
                result.add(tiles[ty][tx]);
            }
        }
        return result;
    }

    void clearVisibility() {
        for (Tile[] row : tiles) {
            for (Tile tile : row) {
                tile.clearVisibility();
            }
        }
    }
}
