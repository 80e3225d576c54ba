package org.skirmish.runtime.actions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.skirmish.runtime.model.ResourceType;

/**
 * Typed access to the loosely typed parameter map of a proposed action. Decision makers
 * often produce numbers as strings or doubles; both are accepted when they hold integers.
 */
public final class ActionParameters {

    private final Map<String, Object> values;

    public ActionParameters(Map<String, Object> values) {
        this.values = values;
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    public String requireString(String key) throws ActionValidationException {
        Object value = values.get(key);
        if (value == null || value.toString().isBlank()) {
            throw new ActionValidationException("Missing parameter '" + key + "'");
        }
        return value.toString();
    }

    public String optionalString(String key) {
        Object value = values.get(key);
        return value == null ? null : value.toString();
    }

    public int requireInt(String key) throws ActionValidationException {
        if (!has(key)) {
            throw new ActionValidationException("Missing parameter '" + key + "'");
        }
        return toInt(key, values.get(key));
    }

    public int optionalInt(String key, int defaultValue) throws ActionValidationException {
        return has(key) ? toInt(key, values.get(key)) : defaultValue;
    }

    /**
     * @return The integer, or {@code null} when absent.
     */
    public Integer optionalInteger(String key) throws ActionValidationException {
        return has(key) ? toInt(key, values.get(key)) : null;
    }

    /**
     * @return The list of strings, empty when absent.
     */
    public List<String> stringList(String key) throws ActionValidationException {
        Object value = values.get(key);
        List<String> result = new ArrayList<>();
        if (value == null) {
            return result;
        }
        if (!(value instanceof Collection<?> collection)) {
            throw new ActionValidationException("Parameter '" + key + "' must be a list");
        }
        for (Object element : collection) {
            if (element != null) {
                result.add(element.toString());
            }
        }
        return result;
    }

    /**
     * @return The nested map, or {@code null} when absent.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> optionalMap(String key) throws ActionValidationException {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map<?, ?>)) {
            throw new ActionValidationException("Parameter '" + key + "' must be an object");
        }
        return (Map<String, Object>) value;
    }

    /**
     * Reads a map such as {@code {"gold": 50}}.
     *
     * @return The amounts, or {@code null} when absent.
     */
    public EnumMap<ResourceType, Integer> optionalResources(String key) throws ActionValidationException {
        Map<String, Object> raw = optionalMap(key);
        if (raw == null) {
            return null;
        }
        EnumMap<ResourceType, Integer> resources = ResourceType.emptyMap();
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            ResourceType type;
            try {
                type = ResourceType.fromId(entry.getKey());
            } catch (IllegalArgumentException e) {
                throw new ActionValidationException(e.getMessage());
            }
            int amount = toInt(key + "." + entry.getKey(), entry.getValue());
            if (amount < 0) {
                throw new ActionValidationException("Resource amounts must not be negative: " + entry.getKey());
            }
            resources.put(type, amount);
        }
        return resources;
    }

    private static int toInt(String key, Object value) throws ActionValidationException {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            long l = ((Number) value).longValue();
            if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) {
                throw new ActionValidationException("Parameter '" + key + "' is out of range");
            }
            return (int) l;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (d != Math.rint(d) || Double.isInfinite(d)) {
                throw new ActionValidationException("Parameter '" + key + "' must be an integer");
            }
            if (d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) {
                throw new ActionValidationException("Parameter '" + key + "' is out of range");
            }
            return (int) d;
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new ActionValidationException("Parameter '" + key + "' must be an integer");
        }
    }
}
