package org.skirmish.runtime.abilities.impl;

import java.util.Map;

import org.skirmish.runtime.abilities.AbstractAbility;
import org.skirmish.runtime.model.Unit;
import org.skirmish.runtime.spi.AbilityContext;
import org.skirmish.runtime.spi.AbilityType;
import org.skirmish.runtime.spi.ActionKind;

/**
 * Increases attack damage when the attacker moved earlier in the same turn.
 */
public class ChargeAbility extends AbstractAbility {

    private final double damageMultiplier;

    public ChargeAbility(com.typesafe.config.Config options) {
        this(doubleOption(options, "damageMultiplier", 1.25));
    }

    public ChargeAbility(double damageMultiplier) {
        super("Charge",
                String.format("+%d%% damage when attacking after moving", Math.round((damageMultiplier - 1) * 100)),
                AbilityType.ON_ATTACK);
        this.damageMultiplier = damageMultiplier;
    }

    @Override
    public boolean canApply(AbilityContext context) {
        Unit unit = ownerUnit(context);
        return context.getActionKind() == ActionKind.ATTACK && unit != null && unit.hasMoved();
    }

    @Override
    public Map<String, Object> apply(AbilityContext context) {
        int before = context.getWorkingDamage();
        int charged = (int) (before * damageMultiplier);
        context.setWorkingDamage(charged);
        return Map.of("damage_multiplier", damageMultiplier, "damage_bonus", charged - before);
    }
}
