package org.skirmish.runtime;

/**
 * How an agent's turn ended.
 */
public enum TurnResult {
    /** The decision arrived in time and its actions were executed. */
    SUCCESS,
    /** The decision maker did not answer in time; nothing was executed. */
    TIMEOUT,
    /** The decision maker threw; nothing was executed. */
    ERROR,
    /** The match was already over. */
    GAME_ENDED
}
