package org.skirmish.runtime.model;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Match-wide multipliers, adjustable until play begins.
 */
public record BalanceSettings(double unitCostMultiplier, double buildingCostMultiplier,
                              double resourceGenerationRate, double combatDamageMultiplier,
                              double movementSpeedMultiplier) {

    private static final Logger LOG = LoggerFactory.getLogger(BalanceSettings.class);

    public BalanceSettings {
        requirePositive("unit_cost_multiplier", unitCostMultiplier);
        requirePositive("building_cost_multiplier", buildingCostMultiplier);
        requirePositive("resource_generation_rate", resourceGenerationRate);
        requirePositive("combat_damage_multiplier", combatDamageMultiplier);
        requirePositive("movement_speed_multiplier", movementSpeedMultiplier);
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0.0)) {
            throw new IllegalArgumentException(name + " must be positive, was " + value);
        }
    }

    /**
     * @return All multipliers at {@code 1.0}.
     */
    public static BalanceSettings defaults() {
        return new BalanceSettings(1.0, 1.0, 1.0, 1.0, 1.0);
    }

    /**
     * @param config The {@code balance} configuration block.
     * @return Settings read from configuration.
     */
    public static BalanceSettings fromConfig(com.typesafe.config.Config config) {
        return new BalanceSettings(
                config.getDouble("unit-cost-multiplier"),
                config.getDouble("building-cost-multiplier"),
                config.getDouble("resource-generation-rate"),
                config.getDouble("combat-damage-multiplier"),
                config.getDouble("movement-speed-multiplier"));
    }

    /**
     * Applies adjustments keyed by snake_case setting name. Unknown keys are ignored.
     *
     * @param adjustments Setting name to new value.
     * @return New settings with the adjustments applied.
     * @throws IllegalArgumentException if an adjusted value is not positive.
     */
    public BalanceSettings withAdjustments(Map<String, Double> adjustments) {
        double unitCost = unitCostMultiplier;
        double buildingCost = buildingCostMultiplier;
        double generation = resourceGenerationRate;
        double damage = combatDamageMultiplier;
        double speed = movementSpeedMultiplier;
        for (Map.Entry<String, Double> entry : adjustments.entrySet()) {
            double value = entry.getValue();
            switch (entry.getKey()) {
                case "unit_cost_multiplier" -> unitCost = value;
                case "building_cost_multiplier" -> buildingCost = value;
                case "resource_generation_rate" -> generation = value;
                case "combat_damage_multiplier" -> damage = value;
                case "movement_speed_multiplier" -> speed = value;
                default -> LOG.warn("Ignoring unknown balance setting '{}'", entry.getKey());
            }
        }
        return new BalanceSettings(unitCost, buildingCost, generation, damage, speed);
    }
}
