package org.skirmish.runtime.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.skirmish.runtime.GameConstants;

/**
 * A stationary structure. Buildings have no defense of their own and can be attacked.
 * Abilities inherent to the building's type are always present and cannot be removed.
 */
public class Building extends Entity {

    private final BuildingType type;
    private int health;
    private final int maxHealth;
    private boolean constructionComplete;
    private final Set<UnitType> producesUnits;
    private final EnumMap<ResourceType, Integer> resourceGeneration;
    private final Set<String> inherentAbilities;

    /**
     * @param maxHealth Maximum health, 1 to {@link GameConstants#MAX_BUILDING_HEALTH}.
     * @param inherentAbilities Ability ids that belong to the type; added to the ability set.
     * @throws IllegalArgumentException if {@code maxHealth} is out of bounds.
     */
    public Building(String id, String name, BuildingType type, String ownerId, int x, int y,
                    int maxHealth, boolean constructionComplete, Set<UnitType> producesUnits,
                    Map<ResourceType, Integer> resourceGeneration, Set<String> abilityIds,
                    Set<String> inherentAbilities, Map<ResourceType, Integer> creationCost) {
        super(id, name, ownerId, x, y, abilityIds, creationCost);
        if (maxHealth < 1 || maxHealth > GameConstants.MAX_BUILDING_HEALTH) {
            throw new IllegalArgumentException(String.format(
                    "Building health must be between 1 and %d, was %d", GameConstants.MAX_BUILDING_HEALTH, maxHealth));
        }
        this.type = type;
        this.maxHealth = maxHealth;
        this.health = maxHealth;
        this.constructionComplete = constructionComplete;
        this.producesUnits = producesUnits == null || producesUnits.isEmpty()
                ? EnumSet.noneOf(UnitType.class) : EnumSet.copyOf(producesUnits);
        this.resourceGeneration = ResourceType.copyOf(resourceGeneration);
        this.inherentAbilities = inherentAbilities == null
                ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(inherentAbilities));
        this.abilityIds.addAll(this.inherentAbilities);
    }

    public BuildingType getType() {
        return type;
    }

    @Override
    public int getHealth() {
        return health;
    }

    @Override
    public int getMaxHealth() {
        return maxHealth;
    }

    @Override
    public int getDefense() {
        return 0;
    }

    @Override
    public int takeDamage(int damage) {
        int before = health;
        health = Math.max(0, health - Math.max(0, damage));
        return before - health;
    }

    @Override
    public boolean isDestroyed() {
        return health <= 0;
    }

    public boolean isConstructionComplete() {
        return constructionComplete;
    }

    void completeConstruction() {
        this.constructionComplete = true;
    }

    /**
     * @return {@code true} if the building is complete, standing and operational.
     */
    public boolean isOperational() {
        return constructionComplete && !isDestroyed();
    }

    public Set<UnitType> getProducesUnits() {
        return Collections.unmodifiableSet(producesUnits);
    }

    /**
     * @param category The unit category to produce.
     * @return {@code true} if complete and the category is producible here.
     */
    public boolean canProduce(UnitType category) {
        return constructionComplete && producesUnits.contains(category);
    }

    public Map<ResourceType, Integer> getResourceGeneration() {
        return Collections.unmodifiableMap(resourceGeneration);
    }

    /**
     * @return The resources this building generates this round, empty unless operational.
     */
    public EnumMap<ResourceType, Integer> generateResources() {
        return isOperational() ? ResourceType.copyOf(resourceGeneration) : ResourceType.emptyMap();
    }

    public Set<String> getInherentAbilities() {
        return inherentAbilities;
    }

    /**
     * Removes an ability unless it is inherent to the building type.
     *
     * @param abilityId The ability to remove.
     * @return {@code true} if removed.
     */
    public boolean removeAbility(String abilityId) {
        if (inherentAbilities.contains(abilityId)) {
            return false;
        }
        return abilityIds.remove(abilityId);
    }
}
