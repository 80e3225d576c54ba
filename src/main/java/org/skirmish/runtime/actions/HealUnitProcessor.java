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
 * {@code heal_unit}: a unit with the {@code heal} ability restores an adjacent friendly unit.
 * Parameters: {@code healer_id}, {@code target_id}. Healing uses the healer's action for the
 * turn, like an attack.
 */
public class HealUnitProcessor extends AbstractActionProcessor {

    @Override
    protected ActionResult doProcess(ActionParameters params, Faction faction, GameState state)
            throws ActionValidationException {
        Unit healer = requireOwnUnit(faction, params.requireString("healer_id"));
        Unit target = requireOwnUnit(faction, params.requireString("target_id"));

        if (!healer.canAttack()) {
            throw new ActionValidationException("Healer cannot act this turn");
        }
        if (healer.distanceTo(target) > 1) {
            throw new ActionValidationException("Target is not adjacent to the healer");
        }
        int before = target.getHealth();
        AbilityExecutionResult abilities = state.getAbilityRegistry().executeAbilities(healer.getAbilityIds(),
                new AbilityContext(healer, ActionKind.HEAL, state).setTarget(target));
        if (!abilities.wasApplied("heal")) {
            throw new ActionValidationException("Healer has no applicable heal ability");
        }
        healer.markAttacked();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("healer_id", healer.getId());
        details.put("target_id", target.getId());
        details.put("healed", target.getHealth() - before);
        details.put("target_health", target.getHealth());
        return ActionResult.ok(details);
    }
}
