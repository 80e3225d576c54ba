package org.skirmish.runtime.spi;

/**
 * The situation in which abilities are executed.
 */
public enum ActionKind {
    ATTACK,
    DEFEND,
    MOVE,
    FORTIFY,
    HEAL,
    BUILD,
    GATHER,
    CREATE_UNIT,
    RESEARCH,
    GENERATE_RESOURCES,
    END_TURN,
    OBSERVE
}
