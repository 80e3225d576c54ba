package org.skirmish.runtime.model;

import java.util.List;
import java.util.Map;

/**
 * A named unit blueprint created by a faction during setup. Production looks designs up by
 * name; every unit built from a design starts with full health.
 *
 * @param name Unique name within the faction.
 * @param description Free text.
 * @param category Unit category, decides which buildings can produce it.
 * @param stats Prototype stats; validated against the global caps.
 * @param abilities Ability ids granted to every produced unit.
 * @param creationCost Cost per unit before the balance multiplier.
 * @param upkeepCost Informational upkeep per round.
 */
public record UnitDesign(String name, String description, UnitType category, StatBlock stats,
                         List<String> abilities, Map<ResourceType, Integer> creationCost,
                         Map<ResourceType, Integer> upkeepCost) {

    /**
     * Immutable stat values of a design.
     */
    public record StatBlock(int health, int attack, int defense, int movementSpeed, int attackRange, int sightRange) {

        /**
         * Validates the values by building a throwaway {@link UnitStats}.
         *
         * @throws IllegalArgumentException if a value exceeds its cap.
         */
        public StatBlock {
            new UnitStats(health, health, attack, defense, movementSpeed, attackRange, sightRange);
        }

        public UnitStats toUnitStats() {
            return new UnitStats(health, health, attack, defense, movementSpeed, attackRange, sightRange);
        }
    }

    public UnitDesign {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Unit design name must not be blank");
        }
        if (category == null || stats == null) {
            throw new IllegalArgumentException("Unit design '" + name + "' needs a category and stats");
        }
        description = description == null ? "" : description;
        abilities = abilities == null ? List.of() : List.copyOf(abilities);
        creationCost = ResourceType.immutableCopyOf(creationCost);
        upkeepCost = ResourceType.immutableCopyOf(upkeepCost);
    }
}
