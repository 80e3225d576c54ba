package org.skirmish.runtime.model;

public enum VictoryCondition {
    /** Last faction with units or buildings wins. */
    ELIMINATION,
    /** First faction whose resource total reaches the configured threshold wins. */
    RESOURCE,
    /** When the turn limit is reached the faction with the highest military strength wins. */
    TIME_LIMIT
}
