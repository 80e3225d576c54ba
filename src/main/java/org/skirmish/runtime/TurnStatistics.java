package org.skirmish.runtime;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregated turn and action counters, overall and per agent.
 */
public class TurnStatistics {

    /**
     * Overall figures.
     */
    public record Summary(long turnsProcessed, Duration totalProcessingTime, Duration averageProcessingTime,
                          long timeouts, double timeoutRate, long errors, double errorRate) {
    }

    /**
     * Figures for one agent.
     */
    public record AgentPerformance(String agentId, long turnsProcessed, long successfulTurns, double turnSuccessRate,
                                   long totalActions, long successfulActions, long failedActions,
                                   double actionSuccessRate, long timeouts, long errors,
                                   Duration averageProcessingTime) {
    }

    private static final class AgentCounters {
        long turns;
        long successfulTurns;
        long actions;
        long successfulActions;
        long timeouts;
        long errors;
        long processingNanos;
    }

    private long turnsProcessed;
    private long processingNanos;
    private long timeouts;
    private long errors;
    private final Map<String, AgentCounters> agents = new LinkedHashMap<>();

    /**
     * Records the end of a turn.
     *
     * @param agentId The agent.
     * @param result How the turn ended.
     * @param processingTime Wall-clock time of the turn.
     */
    public synchronized void recordTurn(String agentId, TurnResult result, Duration processingTime) {
        AgentCounters counters = agents.computeIfAbsent(agentId, id -> new AgentCounters());
        turnsProcessed++;
        processingNanos += processingTime.toNanos();
        counters.turns++;
        counters.processingNanos += processingTime.toNanos();
        switch (result) {
            case SUCCESS -> counters.successfulTurns++;
            case TIMEOUT -> {
                timeouts++;
                counters.timeouts++;
            }
            case ERROR -> {
                errors++;
                counters.errors++;
            }
            case GAME_ENDED -> {
            }
        }
    }

    /**
     * Records one executed action.
     *
     * @param agentId The agent.
     * @param success Whether the action succeeded.
     */
    public synchronized void recordAction(String agentId, boolean success) {
        AgentCounters counters = agents.computeIfAbsent(agentId, id -> new AgentCounters());
        counters.actions++;
        if (success) {
            counters.successfulActions++;
        }
    }

    public synchronized Summary summary() {
        Duration total = Duration.ofNanos(processingNanos);
        Duration average = turnsProcessed == 0 ? Duration.ZERO : Duration.ofNanos(processingNanos / turnsProcessed);
        return new Summary(turnsProcessed, total, average, timeouts, rate(timeouts, turnsProcessed),
                errors, rate(errors, turnsProcessed));
    }

    /**
     * @param agentId The agent.
     * @return The agent's figures; all zero for unknown agents.
     */
    public synchronized AgentPerformance agentPerformance(String agentId) {
        AgentCounters c = agents.getOrDefault(agentId, new AgentCounters());
        Duration average = c.turns == 0 ? Duration.ZERO : Duration.ofNanos(c.processingNanos / c.turns);
        return new AgentPerformance(agentId, c.turns, c.successfulTurns, rate(c.successfulTurns, c.turns),
                c.actions, c.successfulActions, c.actions - c.successfulActions,
                rate(c.successfulActions, c.actions), c.timeouts, c.errors, average);
    }

    /**
     * @return Figures for every agent seen so far, in first-seen order.
     */
    public synchronized Map<String, AgentPerformance> allAgentPerformance() {
        Map<String, AgentPerformance> result = new LinkedHashMap<>();
        for (String agentId : agents.keySet()) {
            result.put(agentId, agentPerformance(agentId));
        }
        return Collections.unmodifiableMap(result);
    }

    public synchronized void reset() {
        turnsProcessed = 0;
        processingNanos = 0;
        timeouts = 0;
        errors = 0;
        agents.clear();
    }

    private static double rate(long part, long whole) {
        return whole == 0 ? 0.0 : (double) part / whole;
    }
}
