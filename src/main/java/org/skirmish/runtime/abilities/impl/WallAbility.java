package org.skirmish.runtime.abilities.impl;

import java.util.Map;

import org.skirmish.runtime.abilities.AbstractAbility;
import org.skirmish.runtime.model.Building;
import org.skirmish.runtime.spi.AbilityContext;
import org.skirmish.runtime.spi.AbilityType;
import org.skirmish.runtime.spi.ActionKind;

/**
 * Armour plating for walls: adds flat defense when the building itself is attacked.
 */
public class WallAbility extends AbstractAbility {

    private final int armor;

    public WallAbility(com.typesafe.config.Config options) {
        this(intOption(options, "armor", 10));
    }

    public WallAbility(int armor) {
        super("Wall", "Blocks movement and absorbs " + armor + " damage per hit", AbilityType.ON_DEFEND);
        this.armor = armor;
    }

    @Override
    public boolean canApply(AbilityContext context) {
        return context.getActionKind() == ActionKind.DEFEND && context.getOwner() instanceof Building;
    }

    @Override
    public Map<String, Object> apply(AbilityContext context) {
        context.setWorkingDefense(context.getWorkingDefense() + armor);
        return Map.of("blocks_movement", true, "armor", armor);
    }
}
