package org.skirmish.runtime.abilities.impl;

import java.util.EnumMap;
import java.util.Map;

import org.skirmish.runtime.abilities.AbstractAbility;
import org.skirmish.runtime.model.ResourceType;
import org.skirmish.runtime.spi.AbilityContext;
import org.skirmish.runtime.spi.AbilityType;
import org.skirmish.runtime.spi.ActionKind;

/**
 * Raises the amount a unit extracts from a resource node.
 */
public class GatherAbility extends AbstractAbility {

    private final double gatherMultiplier;

    public GatherAbility(com.typesafe.config.Config options) {
        this(doubleOption(options, "gatherMultiplier", 1.5));
    }

    public GatherAbility(double gatherMultiplier) {
        super("Gather",
                String.format("Gathers resources %d%% faster", Math.round((gatherMultiplier - 1) * 100)),
                AbilityType.PASSIVE);
        this.gatherMultiplier = gatherMultiplier;
    }

    @Override
    public boolean canApply(AbilityContext context) {
        return context.getActionKind() == ActionKind.GATHER
                && ownerUnit(context) != null
                && context.getResources() != null;
    }

    @Override
    public Map<String, Object> apply(AbilityContext context) {
        EnumMap<ResourceType, Integer> working = context.getResources();
        EnumMap<ResourceType, Integer> bonus = ResourceType.emptyMap();
        for (Map.Entry<ResourceType, Integer> entry : working.entrySet()) {
            int boosted = (int) (entry.getValue() * gatherMultiplier);
            bonus.put(entry.getKey(), boosted - entry.getValue());
            entry.setValue(boosted);
        }
        return Map.of("gather_multiplier", gatherMultiplier, "bonus_resources", bonus);
    }
}
