package org.skirmish.runtime.spi;

import java.util.List;

import org.skirmish.runtime.view.AgentView;

/**
 * An autonomous player. Called on a worker thread with a time limit; the view it receives is
 * an immutable snapshot, so implementations may keep it as long as they like.
 */
public interface IDecisionMaker {

    String getAgentId();

    /**
     * @param view The agent's fog-of-war filtered view of the match.
     * @return The actions to execute in order; {@code null} is treated as no actions.
     * @throws Exception Any failure; the turn is then recorded as an error.
     */
    List<ProposedAction> decide(AgentView view) throws Exception;
}
