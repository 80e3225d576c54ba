package org.skirmish.runtime.view;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.skirmish.runtime.model.ResourceType;
import org.skirmish.runtime.model.Unit;
import org.skirmish.runtime.model.UnitStats;
import org.skirmish.runtime.model.UnitType;

/**
 * Full detail of an own unit.
 */
public record UnitView(String id, String name, UnitType type, String ownerId, String factionId, int x, int y,
                       int health, int maxHealth, int attack, int defense, int movementSpeed, int attackRange,
                       int sightRange, List<String> abilities, boolean hasMoved, boolean hasAttacked,
                       boolean isFortified, Map<String, Integer> statusEffects,
                       Map<ResourceType, Integer> creationCost, Map<ResourceType, Integer> upkeepCost,
                       int experience, int veterancyLevel) {

    public UnitView {
        abilities = List.copyOf(abilities);
        statusEffects = Collections.unmodifiableMap(new LinkedHashMap<>(statusEffects));
        creationCost = ResourceType.immutableCopyOf(creationCost);
        upkeepCost = ResourceType.immutableCopyOf(upkeepCost);
    }

    public static UnitView of(Unit unit) {
        UnitStats stats = unit.getStats();
        return new UnitView(unit.getId(), unit.getName(), unit.getType(), unit.getOwnerId(), unit.getFactionId(),
                unit.getX(), unit.getY(), stats.getHealth(), stats.getMaxHealth(), stats.getAttack(),
                stats.getDefense(), stats.getMovementSpeed(), stats.getAttackRange(), stats.getSightRange(),
                List.copyOf(unit.getAbilityIds()), unit.hasMoved(), unit.hasAttacked(), unit.isFortified(),
                unit.getStatusEffects(), unit.getCreationCost(), unit.getUpkeepCost(),
                unit.getExperience(), unit.getVeterancyLevel());
    }
}
