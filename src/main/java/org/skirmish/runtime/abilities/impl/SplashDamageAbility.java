package org.skirmish.runtime.abilities.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.skirmish.runtime.abilities.AbstractAbility;
import org.skirmish.runtime.model.Entity;
import org.skirmish.runtime.model.Unit;
import org.skirmish.runtime.spi.AbilityContext;
import org.skirmish.runtime.spi.AbilityType;
import org.skirmish.runtime.spi.ActionKind;

/**
 * Deals a share of the attack damage to enemy units around the target. Splash damage ignores
 * defense. Units killed by splash are removed by the caller.
 */
public class SplashDamageAbility extends AbstractAbility {

    private final double splashFraction;
    private final int radius;

    public SplashDamageAbility(com.typesafe.config.Config options) {
        this(doubleOption(options, "splashFraction", 0.5), intOption(options, "radius", 1));
    }

    public SplashDamageAbility(double splashFraction, int radius) {
        super("Splash Damage",
                String.format("Deals %d%% damage to enemies within %d tiles of the target",
                        Math.round(splashFraction * 100), radius),
                AbilityType.ON_ATTACK);
        this.splashFraction = splashFraction;
        this.radius = radius;
    }

    @Override
    public boolean canApply(AbilityContext context) {
        return context.getActionKind() == ActionKind.ATTACK
                && context.getOwner() != null
                && context.getTarget() != null
                && context.getGameState() != null;
    }

    @Override
    public Map<String, Object> apply(AbilityContext context) {
        Entity attacker = context.getOwner();
        Entity target = context.getTarget();
        int splash = (int) (context.getWorkingDamage() * splashFraction);
        List<String> hit = new ArrayList<>();
        if (splash > 0) {
            for (Unit unit : context.getGameState().getAllUnits()) {
                if (unit == target || !unit.isAlive() || unit.getOwnerId().equals(attacker.getOwnerId())) {
                    continue;
                }
                if (unit.distanceTo(target) <= radius) {
                    unit.takeDamage(splash);
                    hit.add(unit.getId());
                }
            }
        }
        return Map.of("splash_damage", splash, "units_hit", hit);
    }
}
