package org.skirmish.runtime.abilities.impl;

import java.util.LinkedHashMap;
import java.util.Map;

import org.skirmish.runtime.GameConstants;
import org.skirmish.runtime.abilities.AbstractAbility;
import org.skirmish.runtime.model.Building;
import org.skirmish.runtime.model.Unit;
import org.skirmish.runtime.spi.AbilityContext;
import org.skirmish.runtime.spi.AbilityType;
import org.skirmish.runtime.spi.ActionKind;

/**
 * At the end of every round the building shoots the nearest enemy unit in range. Ties are
 * broken by turn order, then by the enemy faction's unit order.
 */
public class AutoAttackAbility extends AbstractAbility {

    private final int attackDamage;
    private final int attackRange;

    public AutoAttackAbility(com.typesafe.config.Config options) {
        this(intOption(options, "attackDamage", 15), intOption(options, "attackRange", 3));
    }

    public AutoAttackAbility(int attackDamage, int attackRange) {
        super("Auto Attack",
                String.format("Automatically attacks enemies within %d tiles for %d damage", attackRange, attackDamage),
                AbilityType.ON_TURN);
        this.attackDamage = attackDamage;
        this.attackRange = attackRange;
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
        Unit nearest = null;
        int nearestDistance = Integer.MAX_VALUE;
        for (Unit unit : context.getGameState().getAllUnits()) {
            if (!unit.isAlive() || unit.getOwnerId().equals(building.getOwnerId())) {
                continue;
            }
            int distance = building.distanceTo(unit);
            if (distance <= attackRange && distance < nearestDistance) {
                nearest = unit;
                nearestDistance = distance;
            }
        }
        Map<String, Object> effect = new LinkedHashMap<>();
        if (nearest == null) {
            effect.put("target_id", null);
            effect.put("damage", 0);
            return effect;
        }
        int defense = nearest.getDefense();
        if (nearest.isFortified()) {
            defense = (int) (defense * GameConstants.FORTIFY_DEFENSE_MULTIPLIER);
        }
        int damage = Math.max(GameConstants.MINIMUM_DAMAGE, attackDamage - defense);
        int dealt = nearest.takeDamage(damage);
        effect.put("target_id", nearest.getId());
        effect.put("damage", dealt);
        effect.put("target_destroyed", !nearest.isAlive());
        return effect;
    }
}
