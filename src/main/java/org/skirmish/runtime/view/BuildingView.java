package org.skirmish.runtime.view;

import java.util.List;
import java.util.Map;

import org.skirmish.runtime.model.Building;
import org.skirmish.runtime.model.BuildingType;
import org.skirmish.runtime.model.ResourceType;
import org.skirmish.runtime.model.UnitType;

/**
 * Full detail of an own building.
 */
public record BuildingView(String id, String name, BuildingType type, String ownerId, String factionId, int x, int y,
                           int health, int maxHealth, boolean constructionComplete, List<UnitType> producesUnits,
                           Map<ResourceType, Integer> resourceGeneration, List<String> abilities,
                           List<String> inherentAbilities, Map<ResourceType, Integer> creationCost) {

    public BuildingView {
        producesUnits = List.copyOf(producesUnits);
        resourceGeneration = ResourceType.immutableCopyOf(resourceGeneration);
        abilities = List.copyOf(abilities);
        inherentAbilities = List.copyOf(inherentAbilities);
        creationCost = ResourceType.immutableCopyOf(creationCost);
    }

    public static BuildingView of(Building building) {
        return new BuildingView(building.getId(), building.getName(), building.getType(), building.getOwnerId(),
                building.getFactionId(), building.getX(), building.getY(), building.getHealth(),
                building.getMaxHealth(), building.isConstructionComplete(), List.copyOf(building.getProducesUnits()),
                building.getResourceGeneration(), List.copyOf(building.getAbilityIds()),
                List.copyOf(building.getInherentAbilities()), building.getCreationCost());
    }
}
