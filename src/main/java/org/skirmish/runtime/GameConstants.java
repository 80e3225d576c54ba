package org.skirmish.runtime;

/**
 * Hard limits of the game rules. Unlike the values in {@code reference.conf} these are not
 * tunable per match: unit and building designs above a cap are rejected at construction.
 */
public final class GameConstants {

    // Unit stat caps
    public static final int MAX_UNIT_HEALTH = 100;
    public static final int MAX_UNIT_ATTACK = 50;
    public static final int MAX_UNIT_DEFENSE = 30;
    public static final int MAX_UNIT_SPEED = 10;
    public static final int MAX_ATTACK_RANGE = 10;
    public static final int MAX_SIGHT_RANGE = 10;

    public static final int MAX_BUILDING_HEALTH = 200;

    // Faction caps
    public static final int MAX_UNITS_PER_FACTION = 20;
    public static final int MAX_BUILDINGS_PER_FACTION = 10;

    // Combat
    public static final double FORTIFY_DEFENSE_MULTIPLIER = 1.5;
    public static final int MINIMUM_DAMAGE = 1;
    public static final int EXPERIENCE_PER_ATTACK = 10;
    public static final int EXPERIENCE_PER_LEVEL = 100;
    public static final int LEVEL_UP_HEALTH_BONUS = 5;
    public static final int LEVEL_UP_ATTACK_BONUS = 2;
    public static final int LEVEL_UP_DEFENSE_BONUS = 1;

    // Status effect that halves the sight range of the affected unit
    public static final String STATUS_BLINDED = "blinded";

    private GameConstants() {
    }
}
