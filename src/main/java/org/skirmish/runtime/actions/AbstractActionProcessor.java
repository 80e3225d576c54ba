package org.skirmish.runtime.actions;

import java.util.EnumSet;
import java.util.Set;

import org.skirmish.runtime.model.Faction;
import org.skirmish.runtime.model.GamePhase;
import org.skirmish.runtime.model.GameState;
import org.skirmish.runtime.model.Unit;
import org.skirmish.runtime.spi.ActionResult;
import org.skirmish.runtime.spi.IActionProcessor;
import org.skirmish.runtime.spi.ProposedAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for processors: resolves the acting faction, checks the phase and turns
 * validation failures into failed results.
 */
public abstract class AbstractActionProcessor implements IActionProcessor {

    private static final Set<GamePhase> PLAYING_ONLY = EnumSet.of(GamePhase.PLAYING);

    protected final Logger log = LoggerFactory.getLogger(getClass());

    @Override
    public final ActionResult process(ProposedAction action, GameState state) {
        Faction faction = state.getFaction(action.agentId())
                .orElseThrow(() -> new CriticalActionException("Faction not found for agent " + action.agentId()));
        if (!allowedPhases().contains(state.getPhase())) {
            return ActionResult.failure("Action '" + action.actionType() + "' is not allowed in phase " + state.getPhase());
        }
        try {
            ActionResult result = doProcess(new ActionParameters(action.parameters()), faction, state);
            log.debug("Agent {} {}: {}", action.agentId(), action.actionType(), result.details());
            return result;
        } catch (ActionValidationException e) {
            log.debug("Agent {} {} rejected: {}", action.agentId(), action.actionType(), e.getMessage());
            return ActionResult.failure(e.getMessage());
        }
    }

    /**
     * @return The phases in which this action may be taken. Defaults to play only.
     */
    protected Set<GamePhase> allowedPhases() {
        return PLAYING_ONLY;
    }

    /**
     * Validates and applies the action. Implementations must throw before mutating anything.
     *
     * @param params The action parameters.
     * @param faction The acting agent's faction.
     * @param state The match.
     * @return The result of a successful action.
     * @throws ActionValidationException if the action is not legal.
     */
    protected abstract ActionResult doProcess(ActionParameters params, Faction faction, GameState state)
            throws ActionValidationException;

    protected static Unit requireOwnUnit(Faction faction, String unitId) throws ActionValidationException {
        return faction.getUnit(unitId)
                .orElseThrow(() -> new ActionValidationException("Unit " + unitId + " not found"));
    }
}
