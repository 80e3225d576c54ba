package org.skirmish.runtime.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * The four resource kinds of the economy.
 * <p>
 * {@link #toString()} returns the lower-case id so that resource maps render as
 * {@code {"gold": 500}} when serialized.
 */
public enum ResourceType {
    GOLD,
    WOOD,
    FOOD,
    STONE;

    /**
     * @return The lower-case identifier used in action parameters and configuration.
     */
    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a resource id case-insensitively.
     *
     * @param id The id, e.g. {@code "gold"}.
     * @return The matching resource type.
     * @throws IllegalArgumentException if the id names no resource.
     */
    public static ResourceType fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Resource id must not be null");
        }
        try {
            return valueOf(id.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown resource type: " + id, e);
        }
    }

    @Override
    public String toString() {
        return getId();
    }

    /**
     * @return A new, empty, mutable resource map.
     */
    public static EnumMap<ResourceType, Integer> emptyMap() {
        return new EnumMap<>(ResourceType.class);
    }

    /**
     * Copies any resource map into a fresh {@link EnumMap}. Safe for empty source maps.
     *
     * @param source The map to copy, may be {@code null}.
     * @return A new mutable copy.
     */
    public static EnumMap<ResourceType, Integer> copyOf(Map<ResourceType, Integer> source) {
        EnumMap<ResourceType, Integer> copy = emptyMap();
        if (source != null) {
            copy.putAll(source);
        }
        return copy;
    }

    /**
     * @param source The map to wrap.
     * @return An unmodifiable snapshot of the given map.
     */
    public static Map<ResourceType, Integer> immutableCopyOf(Map<ResourceType, Integer> source) {
        return Collections.unmodifiableMap(copyOf(source));
    }

    /**
     * Scales every amount by a multiplier, rounding half up.
     *
     * @param source The amounts to scale.
     * @param multiplier The factor.
     * @return A new map with the scaled amounts.
     */
    public static EnumMap<ResourceType, Integer> scale(Map<ResourceType, Integer> source, double multiplier) {
        EnumMap<ResourceType, Integer> scaled = emptyMap();
        for (Map.Entry<ResourceType, Integer> entry : source.entrySet()) {
            scaled.put(entry.getKey(), (int) Math.round(entry.getValue() * multiplier));
        }
        return scaled;
    }

    /**
     * Multiplies every amount by an integer factor.
     *
     * @param source The amounts.
     * @param factor The factor, non-negative.
     * @return A new map with the multiplied amounts.
     * @throws ArithmeticException if an amount overflows an {@code int}.
     */
    public static EnumMap<ResourceType, Integer> times(Map<ResourceType, Integer> source, int factor) {
        EnumMap<ResourceType, Integer> result = emptyMap();
        for (Map.Entry<ResourceType, Integer> entry : source.entrySet()) {
            result.put(entry.getKey(), Math.multiplyExact(entry.getValue().intValue(), factor));
        }
        return result;
    }

    /**
     * @param amounts A resource map.
     * @return The sum over all kinds.
     */
    public static int total(Map<ResourceType, Integer> amounts) {
        int sum = 0;
        for (int value : amounts.values()) {
            sum += value;
        }
        return sum;
    }
}
