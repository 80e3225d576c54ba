package org.skirmish.runtime.abilities.impl;

import java.util.EnumMap;
import java.util.Map;

import org.skirmish.runtime.abilities.AbstractAbility;
import org.skirmish.runtime.model.ResourceType;
import org.skirmish.runtime.spi.AbilityContext;
import org.skirmish.runtime.spi.AbilityType;
import org.skirmish.runtime.spi.ActionKind;

/**
 * Multiplies the resources a building generates each round.
 */
public class ResourceBonusAbility extends AbstractAbility {

    private final double bonusMultiplier;

    public ResourceBonusAbility(com.typesafe.config.Config options) {
        this(doubleOption(options, "bonusMultiplier", 1.5));
    }

    public ResourceBonusAbility(double bonusMultiplier) {
        super("Resource Bonus",
                String.format("Increases resource generation by %d%%", Math.round((bonusMultiplier - 1) * 100)),
                AbilityType.ON_TURN);
        this.bonusMultiplier = bonusMultiplier;
    }

    @Override
    public boolean canApply(AbilityContext context) {
        return context.getActionKind() == ActionKind.GENERATE_RESOURCES
                && operationalBuilding(context) != null
                && context.getResources() != null;
    }

    @Override
    public Map<String, Object> apply(AbilityContext context) {
        EnumMap<ResourceType, Integer> bonus = ResourceType.emptyMap();
        for (Map.Entry<ResourceType, Integer> entry : context.getResources().entrySet()) {
            int extra = (int) (entry.getValue() * (bonusMultiplier - 1));
            bonus.put(entry.getKey(), extra);
            entry.setValue(entry.getValue() + extra);
        }
        return Map.of("multiplier", bonusMultiplier, "bonus_resources", bonus);
    }
}
