package org.skirmish.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.skirmish.runtime.actions.ActionProcessors;
import org.skirmish.runtime.actions.CriticalActionException;
import org.skirmish.runtime.model.Faction;
import org.skirmish.runtime.model.GamePhase;
import org.skirmish.runtime.model.GameState;
import org.skirmish.runtime.model.Unit;
import org.skirmish.runtime.model.UnitStats;
import org.skirmish.runtime.spi.ActionResult;
import org.skirmish.runtime.spi.IDecisionMaker;
import org.skirmish.runtime.spi.ProposedAction;
import org.skirmish.runtime.view.AgentView;
import org.skirmish.test.utils.MatchTestUtils;

@Tag("unit")
class TurnManagerTest {

    private TurnManager turnManager;
    private GameState state;
    private Unit scoutA;
    private Unit scoutB;

    /**
     * Decision maker answering with a scripted function of its view.
     */
    private static final class ScriptedAgent implements IDecisionMaker {
        interface Script {
            List<ProposedAction> decide(AgentView view) throws Exception;
        }

        private final String agentId;
        private final Script script;
        private final List<Integer> seenTurns = new ArrayList<>();

        ScriptedAgent(String agentId, Script script) {
            this.agentId = agentId;
            this.script = script;
        }

        static ScriptedAgent idle(String agentId) {
            return new ScriptedAgent(agentId, view -> List.of());
        }

        @Override
        public String getAgentId() {
            return agentId;
        }

        @Override
        public List<ProposedAction> decide(AgentView view) throws Exception {
            seenTurns.add(view.turnNumber());
            return script.decide(view);
        }
    }

    @BeforeEach
    void setUp() {
        turnManager = new TurnManager(Duration.ofSeconds(2), 5, 10);
        state = MatchTestUtils.newState();
        MatchTestUtils.addFaction(state, "agent-a");
        MatchTestUtils.addFaction(state, "agent-b");
        scoutA = MatchTestUtils.spawnUnit(state, "agent-a", 2, 2, 15, 5, 1);
        scoutB = MatchTestUtils.spawnUnit(state, "agent-b", 7, 7, 15, 5, 1);
        MatchTestUtils.startPlaying(state);
    }

    @AfterEach
    void tearDown() {
        turnManager.shutdown();
    }

    private static ProposedAction move(String agentId, Unit unit, int x, int y) {
        return MatchTestUtils.action(agentId, ActionProcessors.MOVE_UNIT,
                Map.of("unit_id", unit.getId(), "target_x", x, "target_y", y));
    }

    @Test
    void roundGivesEveryAgentOneTurnInOrder() {
        ScriptedAgent a = new ScriptedAgent("agent-a", view -> List.of(move("agent-a", scoutA, 3, 2)));
        ScriptedAgent b = new ScriptedAgent("agent-b", view -> List.of(move("agent-b", scoutB, 7, 6)));

        List<TurnProcessingResult> results = turnManager.processRound(Map.of("agent-a", a, "agent-b", b), state);

        assertThat(results).extracting(TurnProcessingResult::agentId).containsExactly("agent-a", "agent-b");
        assertThat(results).allSatisfy(r -> {
            assertThat(r.turnResult()).isEqualTo(TurnResult.SUCCESS);
            assertThat(r.successfulActions()).isEqualTo(1);
        });
        assertThat(scoutA.getX()).isEqualTo(3);
        assertThat(scoutB.getY()).isEqualTo(6);
        assertThat(state.getTurnNumber()).isEqualTo(1);
        assertThat(a.seenTurns).containsExactly(0);
    }

    @Test
    void slowDecisionMakersTimeOutWithoutChangingTheMatch() {
        turnManager.shutdown();
        turnManager = new TurnManager(Duration.ofMillis(100), 5, 10);
        AtomicBoolean interrupted = new AtomicBoolean();
        ScriptedAgent slow = new ScriptedAgent("agent-a", view -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                interrupted.set(true);
                throw e;
            }
            return List.of(move("agent-a", scoutA, 3, 2));
        });
        Faction faction = state.getFaction("agent-a").orElseThrow();
        Map<?, ?> resourcesBefore = Map.copyOf(faction.getResources());

        TurnProcessingResult result = turnManager.processAgentTurn(slow, state);

        assertThat(result.turnResult()).isEqualTo(TurnResult.TIMEOUT);
        assertThat(result.actions()).isEmpty();
        assertThat(result.executionResults()).isEmpty();
        assertThat(result.errorMessage()).isEqualTo("Decision timed out after 100 ms");
        assertThat(scoutA.getX()).isEqualTo(2);
        assertThat(faction.getResources()).isEqualTo(resourcesBefore);
        await().atMost(Duration.ofSeconds(2)).untilTrue(interrupted);
        assertThat(turnManager.getStatistics().summary().timeouts()).isEqualTo(1);
    }

    @Test
    void failingDecisionMakersAreRecordedAsErrors() {
        ScriptedAgent broken = new ScriptedAgent("agent-a", view -> {
            throw new IllegalStateException("model unavailable");
        });

        TurnProcessingResult result = turnManager.processAgentTurn(broken, state);

        assertThat(result.turnResult()).isEqualTo(TurnResult.ERROR);
        assertThat(result.errorMessage()).isEqualTo("Decision failed: model unavailable");
        assertThat(result.actions()).isEmpty();
    }

    @Test
    void failedActionsDoNotStopTheTurn() {
        ScriptedAgent agent = new ScriptedAgent("agent-a", view -> List.of(
                MatchTestUtils.action("agent-a", "summon_dragon", Map.of()),
                move("agent-a", scoutA, 9, 9),
                move("agent-a", scoutA, 2, 3)));

        TurnProcessingResult result = turnManager.processAgentTurn(agent, state);

        assertThat(result.turnResult()).isEqualTo(TurnResult.SUCCESS);
        assertThat(result.executionResults()).extracting(ActionResult::success).containsExactly(false, false, true);
        assertThat(result.executionResults().get(0).error()).isEqualTo("Unknown action type: summon_dragon");
        assertThat(scoutA.getY()).isEqualTo(3);
    }

    @Test
    void criticalFailuresEndTheTurn() {
        turnManager.registerActionProcessor("self_destruct", (action, s) -> {
            throw new CriticalActionException("faction state corrupted");
        });
        ScriptedAgent agent = new ScriptedAgent("agent-a", view -> List.of(
                MatchTestUtils.action("agent-a", "self_destruct", Map.of()),
                move("agent-a", scoutA, 3, 2)));

        TurnProcessingResult result = turnManager.processAgentTurn(agent, state);

        assertThat(result.actions()).hasSize(1);
        assertThat(result.executionResults().get(0).critical()).isTrue();
        assertThat(result.executionResults().get(0).error()).isEqualTo("Processor error: faction state corrupted");
        assertThat(scoutA.getX()).isEqualTo(2);
    }

    @Test
    void unexpectedProcessorExceptionsBecomeFailures() {
        turnManager.registerActionProcessor("flaky", (action, s) -> {
            throw new IllegalArgumentException("bad input");
        });

        ActionResult result = turnManager.executeAction(MatchTestUtils.action("agent-a", "flaky", Map.of()), state);

        assertThat(result.success()).isFalse();
        assertThat(result.critical()).isFalse();
        assertThat(result.error()).isEqualTo("Processor error: bad input");
    }

    @Test
    void actionsBeyondTheCapAreDropped() {
        turnManager.shutdown();
        turnManager = new TurnManager(Duration.ofSeconds(2), 2, 10);
        ScriptedAgent agent = new ScriptedAgent("agent-a", view -> List.of(
                MatchTestUtils.action("agent-a", ActionProcessors.FORTIFY_UNIT, Map.of("unit_id", scoutA.getId())),
                MatchTestUtils.action("agent-a", ActionProcessors.FORTIFY_UNIT, Map.of("unit_id", scoutA.getId())),
                move("agent-a", scoutA, 3, 2)));

        TurnProcessingResult result = turnManager.processAgentTurn(agent, state);

        assertThat(result.actions()).hasSize(2);
        assertThat(scoutA.getX()).isEqualTo(2);
        assertThat(scoutA.isFortified()).isTrue();
    }

    @Test
    void actionsForOtherAgentsAreRefused() {
        ScriptedAgent impostor = new ScriptedAgent("agent-a", view -> List.of(move("agent-b", scoutB, 7, 6)));

        TurnProcessingResult result = turnManager.processAgentTurn(impostor, state);

        assertThat(result.executionResults().get(0).error()).isEqualTo("Action belongs to agent agent-b, not agent-a");
        assertThat(scoutB.getY()).isEqualTo(7);
    }

    @Test
    void historyIsBoundedAndStatisticsAccumulate() {
        turnManager.shutdown();
        turnManager = new TurnManager(Duration.ofSeconds(2), 5, 2);
        ScriptedAgent agent = new ScriptedAgent("agent-a", view -> List.of(
                MatchTestUtils.action("agent-a", ActionProcessors.FORTIFY_UNIT, Map.of("unit_id", scoutA.getId())),
                MatchTestUtils.action("agent-a", "unknown", Map.of())));

        for (int i = 0; i < 3; i++) {
            turnManager.processAgentTurn(agent, state);
        }

        assertThat(turnManager.getHistory()).hasSize(2);
        TurnStatistics.AgentPerformance performance = turnManager.getStatistics().agentPerformance("agent-a");
        assertThat(performance.turnsProcessed()).isEqualTo(3);
        assertThat(performance.totalActions()).isEqualTo(6);
        assertThat(performance.successfulActions()).isEqualTo(3);
        assertThat(performance.actionSuccessRate()).isEqualTo(0.5);

        turnManager.resetStatistics();
        assertThat(turnManager.getHistory()).isEmpty();
        assertThat(turnManager.getStatistics().summary().turnsProcessed()).isZero();
    }

    @Test
    void eliminatedAgentsAreSkippedAndTheMatchEnds() {
        state = MatchTestUtils.newState();
        MatchTestUtils.addFaction(state, "agent-a");
        MatchTestUtils.addFaction(state, "agent-b");
        Unit knight = MatchTestUtils.spawnUnit(state, "agent-a", 4, 4, 40, 5, 1);
        Unit victim = MatchTestUtils.spawnUnit(state, "agent-b", 5, 4, new UnitStats(10, 50, 5, 5, 2, 1, 3));
        MatchTestUtils.startPlaying(state);
        ScriptedAgent a = new ScriptedAgent("agent-a", view -> List.of(MatchTestUtils.action("agent-a",
                ActionProcessors.ATTACK_UNIT, Map.of("attacker_id", knight.getId(), "target_id", victim.getId()))));
        ScriptedAgent b = ScriptedAgent.idle("agent-b");

        assertThat(turnManager.runMatch(Map.of("agent-a", a, "agent-b", b), state, 5)).contains("agent-a");

        assertThat(b.seenTurns).isEmpty();
        assertThat(state.getPhase()).isEqualTo(GamePhase.ENDED);
        assertThat(turnManager.processAgentTurn(a, state).turnResult()).isEqualTo(TurnResult.GAME_ENDED);
        assertThatThrownBy(() -> turnManager.processRound(Map.of("agent-a", a), state))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void nonPositiveTimeoutsAreRejected() {
        assertThatThrownBy(() -> new TurnManager(Duration.ZERO, 5, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void roundsOfMatchesWithoutFactionsAreEmpty() {
        GameState empty = MatchTestUtils.newState();
        MatchTestUtils.startPlaying(empty);

        List<TurnProcessingResult> results = turnManager.processRound(Map.of(), empty);

        assertThat(results).isEmpty();
        assertThat(empty.getPhase()).isEqualTo(GamePhase.PLAYING);
    }

    @Test
    void decisionMakersWithoutFactionGetAnErrorTurn() {
        ScriptedAgent stranger = ScriptedAgent.idle("agent-x");

        TurnProcessingResult result = turnManager.processAgentTurn(stranger, state);

        assertThat(result.turnResult()).isEqualTo(TurnResult.ERROR);
        assertThat(result.errorMessage()).contains("agent-x");
        assertThat(stranger.seenTurns).isEmpty();
        assertThat(turnManager.getHistory()).containsExactly(result);
        assertThat(turnManager.getStatistics().agentPerformance("agent-x").turnsProcessed()).isEqualTo(1);
    }
}
