package org.skirmish.runtime.model;

import org.skirmish.runtime.GameConstants;

/**
 * Combat and movement stats of a unit. Construction validates every value against the caps
 * in {@link GameConstants}; later growth through veterancy is clamped to the same caps.
 */
public class UnitStats {

    private int health;
    private int maxHealth;
    private int attack;
    private int defense;
    private final int movementSpeed;
    private final int attackRange;
    private final int sightRange;

    /**
     * @param health Starting health, clamped to {@code [0, maxHealth]}.
     * @param maxHealth Maximum health, 1 to {@link GameConstants#MAX_UNIT_HEALTH}.
     * @param attack Attack, 0 to {@link GameConstants#MAX_UNIT_ATTACK}.
     * @param defense Defense, 0 to {@link GameConstants#MAX_UNIT_DEFENSE}.
     * @param movementSpeed Tiles per turn, 0 to {@link GameConstants#MAX_UNIT_SPEED}.
     * @param attackRange Manhattan attack range, 1 to {@link GameConstants#MAX_ATTACK_RANGE}.
     * @param sightRange Manhattan sight range, 0 to {@link GameConstants#MAX_SIGHT_RANGE}.
     * @throws IllegalArgumentException if a value is outside its bounds.
     */
    public UnitStats(int health, int maxHealth, int attack, int defense,
                     int movementSpeed, int attackRange, int sightRange) {
        requireWithin("max_health", maxHealth, 1, GameConstants.MAX_UNIT_HEALTH);
        requireWithin("attack", attack, 0, GameConstants.MAX_UNIT_ATTACK);
        requireWithin("defense", defense, 0, GameConstants.MAX_UNIT_DEFENSE);
        requireWithin("movement_speed", movementSpeed, 0, GameConstants.MAX_UNIT_SPEED);
        requireWithin("attack_range", attackRange, 1, GameConstants.MAX_ATTACK_RANGE);
        requireWithin("sight_range", sightRange, 0, GameConstants.MAX_SIGHT_RANGE);
        this.maxHealth = maxHealth;
        this.health = Math.max(0, Math.min(health, maxHealth));
        this.attack = attack;
        this.defense = defense;
        this.movementSpeed = movementSpeed;
        this.attackRange = attackRange;
        this.sightRange = sightRange;
    }

    private static void requireWithin(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(
                    String.format("%s must be between %d and %d, was %d", name, min, max, value));
        }
    }

    public int getHealth() {
        return health;
    }

    /**
     * Sets health, clamped to {@code [0, maxHealth]}.
     *
     * @param health The new health.
     */
    public void setHealth(int health) {
        this.health = Math.max(0, Math.min(health, maxHealth));
    }

    public int getMaxHealth() {
        return maxHealth;
    }

    public int getAttack() {
        return attack;
    }

    public int getDefense() {
        return defense;
    }

    public int getMovementSpeed() {
        return movementSpeed;
    }

    public int getAttackRange() {
        return attackRange;
    }

    public int getSightRange() {
        return sightRange;
    }

    void applyVeterancyBonus() {
        maxHealth = Math.min(maxHealth + GameConstants.LEVEL_UP_HEALTH_BONUS, GameConstants.MAX_UNIT_HEALTH);
        setHealth(health + GameConstants.LEVEL_UP_HEALTH_BONUS);
        attack = Math.min(attack + GameConstants.LEVEL_UP_ATTACK_BONUS, GameConstants.MAX_UNIT_ATTACK);
        defense = Math.min(defense + GameConstants.LEVEL_UP_DEFENSE_BONUS, GameConstants.MAX_UNIT_DEFENSE);
    }
}
