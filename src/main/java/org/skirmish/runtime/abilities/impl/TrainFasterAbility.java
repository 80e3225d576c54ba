package org.skirmish.runtime.abilities.impl;

import java.util.Map;

import org.skirmish.runtime.abilities.AbstractAbility;
import org.skirmish.runtime.spi.AbilityContext;
import org.skirmish.runtime.spi.AbilityType;
import org.skirmish.runtime.spi.ActionKind;

/**
 * Reports a training speed bonus whenever the building produces units.
 */
public class TrainFasterAbility extends AbstractAbility {

    private final double trainingSpeedMultiplier;

    public TrainFasterAbility(com.typesafe.config.Config options) {
        this(doubleOption(options, "trainingSpeedMultiplier", 1.5));
    }

    public TrainFasterAbility(double trainingSpeedMultiplier) {
        super("Train Faster",
                String.format("Units train %d%% faster", Math.round((trainingSpeedMultiplier - 1) * 100)),
                AbilityType.PASSIVE);
        this.trainingSpeedMultiplier = trainingSpeedMultiplier;
    }

    @Override
    public boolean canApply(AbilityContext context) {
        return context.getActionKind() == ActionKind.CREATE_UNIT && operationalBuilding(context) != null;
    }

    @Override
    public Map<String, Object> apply(AbilityContext context) {
        return Map.of("training_bonus", true, "multiplier", trainingSpeedMultiplier);
    }
}
