package org.skirmish.runtime.abilities.impl;

import java.util.LinkedHashMap;
import java.util.Map;

import org.skirmish.runtime.abilities.AbstractAbility;
import org.skirmish.runtime.model.Building;
import org.skirmish.runtime.model.Unit;
import org.skirmish.runtime.spi.AbilityContext;
import org.skirmish.runtime.spi.AbilityType;
import org.skirmish.runtime.spi.ActionKind;

/**
 * Heals every friendly unit within the radius at the end of each round.
 */
public class HealAuraAbility extends AbstractAbility {

    private final int healAmount;
    private final int radius;

    public HealAuraAbility(com.typesafe.config.Config options) {
        this(intOption(options, "healAmount", 10), intOption(options, "radius", 2));
    }

    public HealAuraAbility(int healAmount, int radius) {
        super("Heal Aura",
                String.format("Heals friendly units within %d tiles for %d HP per turn", radius, healAmount),
                AbilityType.ON_TURN);
        this.healAmount = healAmount;
        this.radius = radius;
    }

    @Override
    public boolean canApply(AbilityContext context) {
        return context.getActionKind() == ActionKind.END_TURN
                && operationalBuilding(context) != null
                && context.getGameState() != null;
    }

    @Override
    public Map<String, Object> apply(AbilityContext context) {
        Building building = operationalBuilding(context);
        Map<String, Integer> healed = new LinkedHashMap<>();
        for (Unit unit : context.getGameState().getAllUnits()) {
            if (unit.getOwnerId().equals(building.getOwnerId()) && building.distanceTo(unit) <= radius) {
                int restored = unit.heal(healAmount);
                if (restored > 0) {
                    healed.put(unit.getId(), restored);
                }
            }
        }
        return Map.of("healed", healed);
    }
}
