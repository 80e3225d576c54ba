package org.skirmish.runtime.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.skirmish.runtime.GameConstants;

/**
 * A named building blueprint, already merged with the template of its type.
 */
public record BuildingDesign(String name, String description, BuildingType type, int health,
                             Set<UnitType> producesUnits, Map<ResourceType, Integer> resourceGeneration,
                             Set<String> abilities, Set<String> inherentAbilities,
                             Map<ResourceType, Integer> creationCost) {

    public BuildingDesign {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Building design name must not be blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("Building design '" + name + "' needs a type");
        }
        if (health < 1 || health > GameConstants.MAX_BUILDING_HEALTH) {
            throw new IllegalArgumentException(String.format(
                    "Building health must be between 1 and %d, was %d", GameConstants.MAX_BUILDING_HEALTH, health));
        }
        description = description == null ? "" : description;
        producesUnits = producesUnits == null || producesUnits.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(UnitType.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(producesUnits));
        resourceGeneration = ResourceType.immutableCopyOf(resourceGeneration);
        inherentAbilities = inherentAbilities == null
                ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(inherentAbilities));
        Set<String> merged = new LinkedHashSet<>();
        if (abilities != null) {
            merged.addAll(abilities);
        }
        merged.addAll(inherentAbilities);
        abilities = Collections.unmodifiableSet(merged);
        creationCost = ResourceType.immutableCopyOf(creationCost);
    }

    /**
     * Creates a building from this design.
     *
     * @param id The new entity id.
     * @param ownerId The owning agent.
     * @param x Column.
     * @param y Row.
     * @param constructionComplete Whether the building is usable immediately.
     * @return The new building, not yet placed on the map.
     */
    public Building instantiate(String id, String ownerId, int x, int y, boolean constructionComplete) {
        return new Building(id, name, type, ownerId, x, y, health, constructionComplete, producesUnits,
                resourceGeneration, abilities, inherentAbilities, creationCost);
    }
}
