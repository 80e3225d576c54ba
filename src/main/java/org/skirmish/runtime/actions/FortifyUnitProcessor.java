package org.skirmish.runtime.actions;

import java.util.LinkedHashMap;
import java.util.Map;

import org.skirmish.runtime.abilities.AbilityExecutionResult;
import org.skirmish.runtime.model.Faction;
import org.skirmish.runtime.model.GameState;
import org.skirmish.runtime.model.Unit;
import org.skirmish.runtime.spi.AbilityContext;
import org.skirmish.runtime.spi.ActionKind;
import org.skirmish.runtime.spi.ActionResult;

/**
 * {@code fortify_unit}: digs in a unit that has not moved this turn. Parameter: {@code unit_id}.
 * Fortification lasts until the unit moves again.
 */
public class FortifyUnitProcessor extends AbstractActionProcessor {

    @Override
    protected ActionResult doProcess(ActionParameters params, Faction faction, GameState state)
            throws ActionValidationException {
        Unit unit = requireOwnUnit(faction, params.requireString("unit_id"));
        if (!unit.isAlive()) {
            throw new ActionValidationException("Unit " + unit.getId() + " is dead");
        }
        if (unit.hasMoved()) {
            throw new ActionValidationException("Unit cannot fortify after moving");
        }
        boolean alreadyFortified = unit.isFortified();
        AbilityExecutionResult abilities = state.getAbilityRegistry().executeAbilities(unit.getAbilityIds(),
                new AbilityContext(unit, ActionKind.FORTIFY, state));
        unit.fortify();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("unit_id", unit.getId());
        details.put("fortified", true);
        details.put("already_fortified", alreadyFortified);
        details.put("abilities_applied", abilities.applied());
        return ActionResult.ok(details);
    }
}
