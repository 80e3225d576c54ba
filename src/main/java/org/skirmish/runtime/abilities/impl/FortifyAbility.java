package org.skirmish.runtime.abilities.impl;

import java.util.Map;

import org.skirmish.runtime.abilities.AbstractAbility;
import org.skirmish.runtime.model.Unit;
import org.skirmish.runtime.spi.AbilityContext;
import org.skirmish.runtime.spi.AbilityType;
import org.skirmish.runtime.spi.ActionKind;

/**
 * Fortification drill. Confirms a fortify order for units that have not moved, and adds a
 * further defense bonus on top of the standard fortified multiplier while defending.
 */
public class FortifyAbility extends AbstractAbility {

    private final double defenseMultiplier;

    public FortifyAbility(com.typesafe.config.Config options) {
        this(doubleOption(options, "defenseMultiplier", 1.5));
    }

    public FortifyAbility(double defenseMultiplier) {
        super("Fortify",
                String.format("+%d%% defense while fortified", Math.round((defenseMultiplier - 1) * 100)),
                AbilityType.ACTIVE);
        this.defenseMultiplier = defenseMultiplier;
    }

    @Override
    public boolean canApply(AbilityContext context) {
        Unit unit = ownerUnit(context);
        if (unit == null) {
            return false;
        }
        return switch (context.getActionKind()) {
            case FORTIFY -> !unit.hasMoved();
            case DEFEND -> unit.isFortified();
            default -> false;
        };
    }

    @Override
    public Map<String, Object> apply(AbilityContext context) {
        if (context.getActionKind() == ActionKind.FORTIFY) {
            return Map.of("fortified", true);
        }
        int before = context.getWorkingDefense();
        context.setWorkingDefense((int) (before * defenseMultiplier));
        return Map.of("defense_multiplier", defenseMultiplier, "defense_bonus", context.getWorkingDefense() - before);
    }
}
