package org.skirmish.runtime.view;

import java.util.List;

import org.skirmish.runtime.model.Unit;
import org.skirmish.runtime.model.UnitType;

/**
 * The publicly observable part of an enemy unit.
 */
public record EnemyUnitView(String id, String name, UnitType type, int x, int y, int health, int maxHealth,
                            List<String> abilities) {

    public EnemyUnitView {
        abilities = List.copyOf(abilities);
    }

    public static EnemyUnitView of(Unit unit) {
        return new EnemyUnitView(unit.getId(), unit.getName(), unit.getType(), unit.getX(), unit.getY(),
                unit.getHealth(), unit.getMaxHealth(), List.copyOf(unit.getAbilityIds()));
    }
}
