package org.skirmish.runtime.spi;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An action requested by a decision maker.
 *
 * @param actionType Processor key such as {@code move_unit}.
 * @param parameters Action-specific parameters, keyed by snake_case names.
 * @param agentId The agent proposing the action.
 * @param reasoning Free text explaining the choice, may be empty.
 * @param timestamp When the action was proposed.
 */
public record ProposedAction(String actionType, Map<String, Object> parameters, String agentId,
                             String reasoning, Instant timestamp) {

    public ProposedAction {
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        reasoning = reasoning == null ? "" : reasoning;
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public ProposedAction(String actionType, Map<String, Object> parameters, String agentId) {
        this(actionType, parameters, agentId, "", Instant.now());
    }
}
