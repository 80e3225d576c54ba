package org.skirmish.runtime.actions;

/**
 * Thrown by a processor when a proposed action is not legal in the current state.
 * <p>
 * Always raised before the state is touched. {@link AbstractActionProcessor} converts it
 * into a failed {@link org.skirmish.runtime.spi.ActionResult} carrying the message; the
 * rest of the turn continues.
 */
public class ActionValidationException extends Exception {

    /**
     * @param message The failure reason reported to the agent.
     */
    public ActionValidationException(String message) {
        super(message);
    }
}
