package org.skirmish.runtime.actions;

import java.util.LinkedHashMap;
import java.util.Map;

import org.skirmish.runtime.abilities.AbilityExecutionResult;
import org.skirmish.runtime.model.Faction;
import org.skirmish.runtime.model.GameState;
import org.skirmish.runtime.model.Tile;
import org.skirmish.runtime.model.Unit;
import org.skirmish.runtime.spi.AbilityContext;
import org.skirmish.runtime.spi.ActionKind;
import org.skirmish.runtime.spi.ActionResult;

/**
 * {@code move_unit}: moves an own unit up to its effective speed (Manhattan distance) onto a
 * free passable tile. Parameters: {@code unit_id}, {@code target_x}, {@code target_y}.
 */
public class MoveUnitProcessor extends AbstractActionProcessor {

    @Override
    protected ActionResult doProcess(ActionParameters params, Faction faction, GameState state)
            throws ActionValidationException {
        Unit unit = requireOwnUnit(faction, params.requireString("unit_id"));
        int targetX = params.requireInt("target_x");
        int targetY = params.requireInt("target_y");

        if (!unit.canMove()) {
            throw new ActionValidationException("Unit cannot move (already moved or dead)");
        }
        Tile target = state.getMap().getTile(targetX, targetY);
        if (target == null) {
            throw new ActionValidationException("Invalid target position");
        }
        if (!target.canPlaceUnit()) {
            throw new ActionValidationException("Target position is blocked");
        }
        int distance = unit.distanceTo(targetX, targetY);
        int speed = (int) Math.round(unit.getStats().getMovementSpeed() * state.getBalance().movementSpeedMultiplier());
        if (distance > speed) {
            throw new ActionValidationException("Target out of movement range (" + distance + " > " + speed + ")");
        }

        int fromX = unit.getX();
        int fromY = unit.getY();
        state.moveUnit(unit, targetX, targetY);
        AbilityExecutionResult abilities = state.getAbilityRegistry().executeAbilities(unit.getAbilityIds(),
                new AbilityContext(unit, ActionKind.MOVE, state).setDistance(distance));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("unit_id", unit.getId());
        details.put("old_position", Map.of("x", fromX, "y", fromY));
        details.put("new_position", Map.of("x", targetX, "y", targetY));
        details.put("distance", distance);
        details.put("abilities_applied", abilities.applied());
        return ActionResult.ok(details);
    }
}
