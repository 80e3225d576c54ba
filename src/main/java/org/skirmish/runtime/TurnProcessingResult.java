package org.skirmish.runtime;

import java.time.Duration;
import java.util.List;

import org.skirmish.runtime.spi.ActionResult;
import org.skirmish.runtime.spi.ProposedAction;

/**
 * Record of one processed agent turn.
 *
 * @param agentId The acting agent.
 * @param turnNumber The match turn number when the turn started.
 * @param actions The proposed actions that were executed, after capping.
 * @param executionResults One result per executed action, in order.
 * @param turnResult How the turn ended.
 * @param processingTime Wall-clock time of decision and execution.
 * @param errorMessage Failure description for {@code TIMEOUT} and {@code ERROR}, else {@code null}.
 */
public record TurnProcessingResult(String agentId, int turnNumber, List<ProposedAction> actions,
                                   List<ActionResult> executionResults, TurnResult turnResult,
                                   Duration processingTime, String errorMessage) {

    public TurnProcessingResult {
        actions = List.copyOf(actions);
        executionResults = List.copyOf(executionResults);
    }

    /**
     * @return Number of actions that succeeded.
     */
    public long successfulActions() {
        return executionResults.stream().filter(ActionResult::success).count();
    }
}
