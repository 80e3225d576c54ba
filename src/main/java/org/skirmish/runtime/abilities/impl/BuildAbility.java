package org.skirmish.runtime.abilities.impl;

import java.util.Map;

import org.skirmish.runtime.abilities.AbstractAbility;
import org.skirmish.runtime.model.Unit;
import org.skirmish.runtime.spi.AbilityContext;
import org.skirmish.runtime.spi.AbilityType;
import org.skirmish.runtime.spi.ActionKind;

/**
 * Allows a unit to act as the builder of a new structure.
 */
public class BuildAbility extends AbstractAbility {

    private final double buildSpeed;

    public BuildAbility(com.typesafe.config.Config options) {
        this(doubleOption(options, "buildSpeed", 1.0));
    }

    public BuildAbility(double buildSpeed) {
        super("Build", "Can construct buildings", AbilityType.ACTIVE);
        this.buildSpeed = buildSpeed;
    }

    @Override
    public boolean canApply(AbilityContext context) {
        Unit unit = ownerUnit(context);
        return context.getActionKind() == ActionKind.BUILD && unit != null && unit.isAlive();
    }

    @Override
    public Map<String, Object> apply(AbilityContext context) {
        return Map.of("can_build", true, "build_speed", buildSpeed);
    }
}
