package org.skirmish.runtime.model;

/**
 * Match phases in their only legal order. Transitions may skip forward but never go back.
 */
public enum GamePhase {
    SETUP,
    BALANCING,
    PLAYING,
    ENDED;

    /**
     * @param next The requested phase.
     * @return {@code true} if moving from this phase to {@code next} keeps the order monotonic.
     */
    public boolean canTransitionTo(GamePhase next) {
        return next.ordinal() >= ordinal();
    }
}
