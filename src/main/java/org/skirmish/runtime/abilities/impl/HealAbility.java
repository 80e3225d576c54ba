package org.skirmish.runtime.abilities.impl;

import java.util.Map;

import org.skirmish.runtime.abilities.AbstractAbility;
import org.skirmish.runtime.model.Unit;
import org.skirmish.runtime.spi.AbilityContext;
import org.skirmish.runtime.spi.AbilityType;
import org.skirmish.runtime.spi.ActionKind;

/**
 * Restores health of a wounded friendly target unit.
 */
public class HealAbility extends AbstractAbility {

    private final int healAmount;

    public HealAbility(com.typesafe.config.Config options) {
        this(intOption(options, "healAmount", 15));
    }

    public HealAbility(int healAmount) {
        super("Heal", "Restores " + healAmount + " health to a friendly unit", AbilityType.ACTIVE);
        this.healAmount = healAmount;
    }

    @Override
    public boolean canApply(AbilityContext context) {
        if (context.getActionKind() != ActionKind.HEAL || context.getOwner() == null) {
            return false;
        }
        return context.getTarget() instanceof Unit target
                && target.isAlive()
                && target.getHealth() < target.getMaxHealth()
                && target.getOwnerId().equals(context.getOwner().getOwnerId());
    }

    @Override
    public Map<String, Object> apply(AbilityContext context) {
        Unit target = (Unit) context.getTarget();
        int healed = target.heal(healAmount);
        return Map.of("healed", healed, "target_health", target.getHealth());
    }
}
