package org.skirmish.runtime.actions;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.skirmish.runtime.model.Building;
import org.skirmish.runtime.model.Entity;
import org.skirmish.runtime.model.Faction;
import org.skirmish.runtime.model.GameState;
import org.skirmish.runtime.model.Unit;
import org.skirmish.runtime.spi.ActionResult;

/**
 * {@code attack_unit}: an own unit attacks an enemy unit or building.
 * Parameters: {@code attacker_id}, {@code target_id}.
 * <p>
 * Destroyed targets, and units killed by splash effects, are removed from the match at once.
 */
public class AttackUnitProcessor extends AbstractActionProcessor {

    @Override
    protected ActionResult doProcess(ActionParameters params, Faction faction, GameState state)
            throws ActionValidationException {
        Unit attacker = requireOwnUnit(faction, params.requireString("attacker_id"));
        String targetId = params.requireString("target_id");

        Entity target = findTarget(state, targetId)
                .orElseThrow(() -> new ActionValidationException("Target " + targetId + " not found"));
        if (target.getOwnerId().equals(faction.getOwnerId())) {
            throw new ActionValidationException("Cannot attack own units or buildings");
        }

        CombatResolver.CombatOutcome outcome = CombatResolver.attack(attacker, target, state);
        if (!outcome.success()) {
            throw new ActionValidationException(outcome.error());
        }
        if (target.isDestroyed()) {
            if (target instanceof Unit unit) {
                state.removeUnit(unit);
            } else if (target instanceof Building building) {
                state.removeBuilding(building);
            }
            log.debug("Agent {} destroyed {}", faction.getOwnerId(), targetId);
        }
        int collateral = state.purgeDestroyed();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("attacker_id", attacker.getId());
        details.put("target_id", targetId);
        details.put("damage_dealt", outcome.damageDealt());
        details.put("health_lost", outcome.healthLost());
        details.put("target_destroyed", outcome.targetDestroyed());
        details.put("target_remaining_health", outcome.targetRemainingHealth());
        details.put("attacker_leveled_up", outcome.attackerLeveledUp());
        details.put("abilities_applied", outcome.abilitiesApplied());
        details.put("collateral_destroyed", collateral);
        return ActionResult.ok(details);
    }

    private static Optional<Entity> findTarget(GameState state, String targetId) {
        Optional<Unit> unit = state.findUnit(targetId);
        if (unit.isPresent()) {
            return Optional.of(unit.get());
        }
        return state.findBuilding(targetId).map(Entity.class::cast);
    }
}
