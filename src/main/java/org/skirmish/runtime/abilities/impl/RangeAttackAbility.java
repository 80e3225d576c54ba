package org.skirmish.runtime.abilities.impl;

import java.util.Map;

import org.skirmish.runtime.abilities.AbstractAbility;
import org.skirmish.runtime.spi.AbilityContext;
import org.skirmish.runtime.spi.AbilityType;
import org.skirmish.runtime.spi.ActionKind;

/**
 * Marks a unit as a ranged attacker. Reports its range bonus; the attack range itself is part
 * of the unit's stats.
 */
public class RangeAttackAbility extends AbstractAbility {

    private final int rangeBonus;

    public RangeAttackAbility(com.typesafe.config.Config options) {
        this(intOption(options, "rangeBonus", 2));
    }

    public RangeAttackAbility(int rangeBonus) {
        super("Range Attack", "Attacks from " + rangeBonus + " extra tiles away", AbilityType.PASSIVE);
        this.rangeBonus = rangeBonus;
    }

    @Override
    public boolean canApply(AbilityContext context) {
        return context.getActionKind() == ActionKind.ATTACK && ownerUnit(context) != null;
    }

    @Override
    public Map<String, Object> apply(AbilityContext context) {
        return Map.of("range_bonus", rangeBonus);
    }
}
