package org.skirmish.runtime.spi;

import org.skirmish.runtime.model.GameState;

/**
 * Validates and applies one kind of {@link ProposedAction}.
 * <p>
 * Processors must leave the state untouched when validation fails. Unexpected runtime
 * exceptions are caught by the caller and turned into failed results.
 * </p>
 */
public interface IActionProcessor {

    /**
     * @param action The action to apply.
     * @param state The match to mutate.
     * @return The outcome; never {@code null}.
     */
    ActionResult process(ProposedAction action, GameState state);
}
