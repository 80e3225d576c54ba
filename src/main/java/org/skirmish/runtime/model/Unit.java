package org.skirmish.runtime.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.skirmish.runtime.GameConstants;

/**
 * A mobile combat or worker entity.
 * <p>
 * Per-turn flags ({@code hasMoved}, {@code hasAttacked}, {@code hasGathered}) are cleared at the
 * end of every round. Fortification survives the round reset and only ends when the unit moves.
 */
public class Unit extends Entity {

    private final UnitType type;
    private final UnitStats stats;
    private boolean hasMoved;
    private boolean hasAttacked;
    private boolean hasGathered;
    private boolean fortified;
    private final Map<String, Integer> statusEffects = new LinkedHashMap<>();
    private final EnumMap<ResourceType, Integer> upkeepCost;
    private int experience;
    private int veterancyLevel;

    public Unit(String id, String name, UnitType type, String ownerId, int x, int y, UnitStats stats,
                Set<String> abilityIds, Map<ResourceType, Integer> creationCost,
                Map<ResourceType, Integer> upkeepCost) {
        super(id, name, ownerId, x, y, abilityIds, creationCost);
        this.type = type;
        this.stats = stats;
        this.upkeepCost = ResourceType.copyOf(upkeepCost);
    }

    public Unit(String id, String name, UnitType type, String ownerId, int x, int y, UnitStats stats,
                Set<String> abilityIds) {
        this(id, name, type, ownerId, x, y, stats, abilityIds, null, null);
    }

    public UnitType getType() {
        return type;
    }

    public UnitStats getStats() {
        return stats;
    }

    @Override
    public int getHealth() {
        return stats.getHealth();
    }

    @Override
    public int getMaxHealth() {
        return stats.getMaxHealth();
    }

    @Override
    public int getDefense() {
        return stats.getDefense();
    }

    public boolean isAlive() {
        return stats.getHealth() > 0;
    }

    @Override
    public boolean isDestroyed() {
        return !isAlive();
    }

    @Override
    public int takeDamage(int damage) {
        int before = stats.getHealth();
        stats.setHealth(before - Math.max(0, damage));
        return before - stats.getHealth();
    }

    /**
     * Restores health up to the maximum. Dead units cannot be healed.
     *
     * @param amount The amount to restore.
     * @return The health actually restored.
     */
    public int heal(int amount) {
        if (!isAlive()) {
            return 0;
        }
        int before = stats.getHealth();
        stats.setHealth(before + Math.max(0, amount));
        return stats.getHealth() - before;
    }

    public boolean canMove() {
        return isAlive() && !hasMoved;
    }

    public boolean canAttack() {
        return isAlive() && !hasAttacked;
    }

    public boolean canGather() {
        return isAlive() && !hasGathered;
    }

    public boolean hasMoved() {
        return hasMoved;
    }

    public boolean hasAttacked() {
        return hasAttacked;
    }

    public boolean hasGathered() {
        return hasGathered;
    }

    public boolean isFortified() {
        return fortified;
    }

    void markMoved() {
        this.hasMoved = true;
        this.fortified = false;
    }

    public void markAttacked() {
        this.hasAttacked = true;
    }

    public void markGathered() {
        this.hasGathered = true;
    }

    /**
     * Fortifies the unit in place.
     *
     * @return {@code false} if the unit already moved this turn or is dead.
     */
    public boolean fortify() {
        if (hasMoved || !isAlive()) {
            return false;
        }
        this.fortified = true;
        return true;
    }

    /**
     * Adds or replaces a timed status effect.
     *
     * @param name Effect name, e.g. {@link GameConstants#STATUS_BLINDED}.
     * @param turns Remaining rounds, positive.
     */
    public void addStatusEffect(String name, int turns) {
        if (turns <= 0) {
            throw new IllegalArgumentException("Status effect duration must be positive: " + turns);
        }
        statusEffects.put(name, turns);
    }

    public boolean hasStatusEffect(String name) {
        return statusEffects.containsKey(name);
    }

    public Map<String, Integer> getStatusEffects() {
        return Collections.unmodifiableMap(statusEffects);
    }

    public Map<ResourceType, Integer> getUpkeepCost() {
        return Collections.unmodifiableMap(upkeepCost);
    }

    public int getExperience() {
        return experience;
    }

    public int getVeterancyLevel() {
        return veterancyLevel;
    }

    /**
     * Adds experience and levels up once if the threshold of the next level is reached.
     *
     * @param amount Experience gained.
     * @return {@code true} if the unit gained a veterancy level.
     */
    public boolean gainExperience(int amount) {
        experience += amount;
        if (experience >= (veterancyLevel + 1) * GameConstants.EXPERIENCE_PER_LEVEL) {
            veterancyLevel++;
            stats.applyVeterancyBonus();
            return true;
        }
        return false;
    }

    /**
     * Clears the per-turn flags and counts down status effects. Fortification is kept.
     */
    void resetForNewRound() {
        hasMoved = false;
        hasAttacked = false;
        hasGathered = false;
        Iterator<Map.Entry<String, Integer>> it = statusEffects.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Integer> effect = it.next();
            int remaining = effect.getValue() - 1;
            if (remaining <= 0) {
                it.remove();
            } else {
                effect.setValue(remaining);
            }
        }
    }
}
