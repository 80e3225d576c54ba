package org.skirmish.runtime.actions;

/**
 * Thrown when an action cannot be processed in a way that makes the rest of the agent's
 * turn meaningless, e.g. when the acting agent no longer has a faction.
 * <p>
 * The turn orchestrator records the action as a critical failure and abandons the remaining
 * actions of the turn.
 */
public class CriticalActionException extends RuntimeException {

    public CriticalActionException(String message) {
        super(message);
    }

    public CriticalActionException(String message, Throwable cause) {
        super(message, cause);
    }
}
