package org.skirmish.runtime;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.skirmish.runtime.actions.ActionProcessors;
import org.skirmish.runtime.actions.CriticalActionException;
import org.skirmish.runtime.model.GamePhase;
import org.skirmish.runtime.model.GameState;
import org.skirmish.runtime.spi.ActionResult;
import org.skirmish.runtime.spi.IActionProcessor;
import org.skirmish.runtime.spi.IDecisionMaker;
import org.skirmish.runtime.spi.ProposedAction;
import org.skirmish.runtime.view.AgentView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs rounds of a match: asks each active agent for a decision within a time limit and
 * executes the returned actions through the registered processors.
 * <p>
 * The match state is only written from the thread calling {@link #processRound} or
 * {@link #processAgentTurn}. Decision makers run on daemon worker threads and only ever see an
 * immutable {@link AgentView}; a decision that times out is cancelled and discarded without
 * touching the state.
 * <p>
 * A failing action never ends the round. An action whose processor throws
 * {@link CriticalActionException} ends the rest of that agent's turn.
 */
public class TurnManager {

    private static final Logger LOG = LoggerFactory.getLogger(TurnManager.class);

    private final Map<String, IActionProcessor> processors = new LinkedHashMap<>();
    private final Duration turnTimeout;
    private final int maxActionsPerTurn;
    private final int historySize;
    private final Deque<TurnProcessingResult> history = new ArrayDeque<>();
    private final TurnStatistics statistics = new TurnStatistics();
    private final ExecutorService decisionExecutor;

    /**
     * Creates a turn manager with the built-in processors.
     *
     * @param settings Supplies timeout, action cap and history size.
     */
    public TurnManager(MatchSettings settings) {
        this(settings.getTurnTimeout(), settings.getMaxActionsPerTurn(), settings.getHistorySize());
    }

    /**
     * Creates a turn manager with the built-in processors.
     *
     * @param turnTimeout Maximum time a decision maker gets per turn.
     * @param maxActionsPerTurn Actions beyond this count are dropped.
     * @param historySize Number of turn records kept.
     */
    public TurnManager(Duration turnTimeout, int maxActionsPerTurn, int historySize) {
        if (turnTimeout.isNegative() || turnTimeout.isZero()) {
            throw new IllegalArgumentException("Turn timeout must be positive: " + turnTimeout);
        }
        this.turnTimeout = turnTimeout;
        this.maxActionsPerTurn = maxActionsPerTurn;
        this.historySize = historySize;
        AtomicInteger threadCounter = new AtomicInteger();
        this.decisionExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "decision-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        ActionProcessors.defaults().forEach(this::registerActionProcessor);
    }

    /**
     * Registers or replaces the processor for an action type.
     *
     * @param actionType The action type key, e.g. {@code move_unit}.
     * @param processor The processor.
     */
    public void registerActionProcessor(String actionType, IActionProcessor processor) {
        processors.put(actionType, processor);
        LOG.debug("Registered action processor {} for '{}'", processor.getClass().getSimpleName(), actionType);
    }

    /**
     * Runs the remaining slots of the current round, starting at the current player. Agents
     * without units and buildings, or without a decision maker, are skipped. After the last
     * slot the end-of-round effects run and victory is evaluated.
     *
     * @param agents Decision makers by agent id.
     * @param state The match, in phase {@link GamePhase#PLAYING}.
     * @return One record per agent that took a turn, empty when the match has no factions.
     * @throws IllegalStateException if the match is not playing.
     */
    public List<TurnProcessingResult> processRound(Map<String, IDecisionMaker> agents, GameState state) {
        if (state.getPhase() != GamePhase.PLAYING) {
            throw new IllegalStateException("Rounds can only be processed while PLAYING, phase is " + state.getPhase());
        }
        if (state.getTurnOrder().isEmpty()) {
            LOG.warn("Match {} has no factions, nothing to process", state.getGameId());
            return List.of();
        }
        List<TurnProcessingResult> results = new ArrayList<>();
        boolean roundCompleted = false;
        while (!roundCompleted) {
            String agentId = state.getCurrentPlayer().orElseThrow();
            IDecisionMaker agent = agents.get(agentId);
            if (agent == null) {
                LOG.debug("No decision maker for agent {}, skipping", agentId);
            } else if (!state.isFactionAlive(agentId)) {
                LOG.debug("Agent {} has been eliminated, skipping", agentId);
            } else {
                results.add(processAgentTurn(agent, state));
            }
            roundCompleted = state.advanceTurn();
        }
        state.checkVictoryConditions().ifPresent(winner ->
                LOG.info("Agent {} won match {} on turn {}", winner, state.getGameId(), state.getTurnNumber()));
        return results;
    }

    /**
     * Plays rounds until the match ends or {@code maxRounds} rounds have been played.
     *
     * @param agents Decision makers by agent id.
     * @param state The match, in phase {@link GamePhase#PLAYING}.
     * @param maxRounds Upper bound on rounds to play.
     * @return The winner, if the match ended with one.
     */
    public Optional<String> runMatch(Map<String, IDecisionMaker> agents, GameState state, int maxRounds) {
        for (int round = 0; round < maxRounds && state.getPhase() == GamePhase.PLAYING; round++) {
            processRound(agents, state);
        }
        return state.getWinner();
    }

    /**
     * Runs one agent's turn: builds its view, waits for its decision with the configured
     * timeout and executes up to the configured number of actions.
     *
     * @param agent The decision maker.
     * @param state The match.
     * @return The turn record, also appended to the history.
     */
    public TurnProcessingResult processAgentTurn(IDecisionMaker agent, GameState state) {
        String agentId = agent.getAgentId();
        int turnNumber = state.getTurnNumber();
        long start = System.nanoTime();
        if (state.getPhase() == GamePhase.ENDED) {
            return finish(new TurnProcessingResult(agentId, turnNumber, List.of(), List.of(),
                    TurnResult.GAME_ENDED, elapsedSince(start), null));
        }

        AgentView view;
        try {
            view = state.getAgentView(agentId);
        } catch (IllegalArgumentException e) {
            LOG.warn("Agent {} cannot take a turn: {}", agentId, e.getMessage());
            return finish(new TurnProcessingResult(agentId, turnNumber, List.of(), List.of(),
                    TurnResult.ERROR, elapsedSince(start), e.getMessage()));
        }
        List<ProposedAction> actions;
        Future<List<ProposedAction>> decision = decisionExecutor.submit(() -> agent.decide(view));
        try {
            actions = decision.get(turnTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            decision.cancel(true);
            LOG.warn("Agent {} timed out after {} ms on turn {}", agentId, turnTimeout.toMillis(), turnNumber);
            return finish(new TurnProcessingResult(agentId, turnNumber, List.of(), List.of(),
                    TurnResult.TIMEOUT, elapsedSince(start), "Decision timed out after " + turnTimeout.toMillis() + " ms"));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.warn("Agent {} failed to decide on turn {}: {}", agentId, turnNumber, cause.getMessage());
            return finish(new TurnProcessingResult(agentId, turnNumber, List.of(), List.of(),
                    TurnResult.ERROR, elapsedSince(start), "Decision failed: " + cause.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            decision.cancel(true);
            return finish(new TurnProcessingResult(agentId, turnNumber, List.of(), List.of(),
                    TurnResult.ERROR, elapsedSince(start), "Interrupted while waiting for decision"));
        }

        List<ProposedAction> proposed = actions == null ? List.of() : actions;
        if (proposed.size() > maxActionsPerTurn) {
            LOG.debug("Agent {} proposed {} actions, executing the first {}", agentId, proposed.size(), maxActionsPerTurn);
            proposed = proposed.subList(0, maxActionsPerTurn);
        }

        List<ProposedAction> executed = new ArrayList<>();
        List<ActionResult> results = new ArrayList<>();
        for (ProposedAction action : proposed) {
            ActionResult result = agentId.equals(action.agentId())
                    ? executeAction(action, state)
                    : ActionResult.failure("Action belongs to agent " + action.agentId() + ", not " + agentId);
            executed.add(action);
            results.add(result);
            statistics.recordAction(agentId, result.success());
            if (result.critical()) {
                LOG.warn("Critical failure for agent {}, ending turn: {}", agentId, result.error());
                break;
            }
        }
        return finish(new TurnProcessingResult(agentId, turnNumber, executed, results,
                TurnResult.SUCCESS, elapsedSince(start), null));
    }

    /**
     * Executes a single action through its processor. Also used during setup for design
     * actions.
     *
     * @param action The action.
     * @param state The match.
     * @return The result; unexpected processor exceptions become failed results.
     */
    public ActionResult executeAction(ProposedAction action, GameState state) {
        IActionProcessor processor = processors.get(action.actionType());
        if (processor == null) {
            return ActionResult.failure("Unknown action type: " + action.actionType());
        }
        try {
            return processor.process(action, state);
        } catch (CriticalActionException e) {
            LOG.warn("Critical error processing '{}' for agent {}: {}", action.actionType(), action.agentId(), e.getMessage());
            return ActionResult.critical("Processor error: " + e.getMessage());
        } catch (RuntimeException e) {
            LOG.warn("Error processing '{}' for agent {}: {}", action.actionType(), action.agentId(), e.getMessage());
            LOG.debug("Processor error details", e);
            return ActionResult.failure("Processor error: " + e.getMessage());
        }
    }

    private TurnProcessingResult finish(TurnProcessingResult result) {
        statistics.recordTurn(result.agentId(), result.turnResult(), result.processingTime());
        history.addLast(result);
        while (history.size() > historySize) {
            history.removeFirst();
        }
        LOG.debug("Agent {} turn {} finished with {} ({} actions)",
                result.agentId(), result.turnNumber(), result.turnResult(), result.actions().size());
        return result;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    public TurnStatistics getStatistics() {
        return statistics;
    }

    /**
     * @return The most recent turn records, oldest first.
     */
    public List<TurnProcessingResult> getHistory() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }

    public Duration getTurnTimeout() {
        return turnTimeout;
    }

    public int getMaxActionsPerTurn() {
        return maxActionsPerTurn;
    }

    /**
     * Clears statistics and history.
     */
    public void resetStatistics() {
        statistics.reset();
        history.clear();
    }

    /**
     * Stops the decision worker threads. Pending decisions are interrupted.
     */
    public void shutdown() {
        decisionExecutor.shutdownNow();
    }
}
