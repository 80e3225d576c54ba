package org.skirmish.runtime.actions;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.skirmish.runtime.model.Building;
import org.skirmish.runtime.model.BuildingType;
import org.skirmish.runtime.model.Faction;
import org.skirmish.runtime.model.GameState;
import org.skirmish.runtime.model.Unit;
import org.skirmish.runtime.model.UnitStats;
import org.skirmish.runtime.spi.ActionResult;
import org.skirmish.test.utils.MatchTestUtils;

@Tag("unit")
class AttackUnitProcessorTest {

    private final AttackUnitProcessor processor = new AttackUnitProcessor();

    private GameState state;

    @BeforeEach
    void setUp() {
        state = MatchTestUtils.newState();
        MatchTestUtils.addFaction(state, "agent-a");
        MatchTestUtils.addFaction(state, "agent-b");
    }

    private ActionResult attack(String agentId, String attackerId, String targetId) {
        return processor.process(MatchTestUtils.action(agentId, ActionProcessors.ATTACK_UNIT,
                Map.of("attacker_id", attackerId, "target_id", targetId)), state);
    }

    @Test
    void reportsDamageAndRemainingHealth() {
        Unit attacker = MatchTestUtils.spawnUnit(state, "agent-a", 5, 5, 15, 5, 1);
        Unit target = MatchTestUtils.spawnUnit(state, "agent-b", 6, 5, 10, 5, 1);
        MatchTestUtils.startPlaying(state);

        ActionResult result = attack("agent-a", attacker.getId(), target.getId());

        assertThat(result.success()).isTrue();
        assertThat(result.get("damage_dealt")).isEqualTo(10);
        assertThat(result.get("target_destroyed")).isEqualTo(false);
        assertThat(result.get("target_remaining_health")).isEqualTo(40);
    }

    @Test
    void destroyedUnitsLeaveTheMatchImmediately() {
        Unit attacker = MatchTestUtils.spawnUnit(state, "agent-a", 5, 5, 40, 5, 1);
        Unit target = MatchTestUtils.spawnUnit(state, "agent-b", 6, 5, new UnitStats(10, 50, 5, 5, 2, 1, 3));
        MatchTestUtils.startPlaying(state);

        ActionResult result = attack("agent-a", attacker.getId(), target.getId());

        Faction defender = state.getFaction("agent-b").orElseThrow();
        assertThat(result.get("target_destroyed")).isEqualTo(true);
        assertThat(state.findUnit(target.getId())).isEmpty();
        assertThat(defender.getUnits()).isEmpty();
        assertThat(defender.getUnitsLost()).isEqualTo(1);
        assertThat(state.getMap().getTile(6, 5).getUnitId()).isNull();
    }

    @Test
    void lethalHitsReportTheFullDamageAndTheHealthLost() {
        Unit attacker = MatchTestUtils.spawnUnit(state, "agent-a", 5, 5, 40, 5, 1);
        Unit target = MatchTestUtils.spawnUnit(state, "agent-b", 6, 5, new UnitStats(3, 50, 5, 5, 2, 1, 3));
        MatchTestUtils.startPlaying(state);

        ActionResult result = attack("agent-a", attacker.getId(), target.getId());

        assertThat(result.get("damage_dealt")).isEqualTo(35);
        assertThat(result.get("health_lost")).isEqualTo(3);
        assertThat(result.get("target_remaining_health")).isEqualTo(0);
    }

    @Test
    void destroyedBuildingsFreeTheirTile() {
        Unit attacker = MatchTestUtils.spawnUnit(state, "agent-a", 5, 5, 90, 5, 1);
        Building farm = MatchTestUtils.placeBuilding(state, "agent-b", BuildingType.FARM, 6, 5);
        MatchTestUtils.startPlaying(state);

        ActionResult result = attack("agent-a", attacker.getId(), farm.getId());

        assertThat(result.get("target_destroyed")).isEqualTo(true);
        assertThat(state.findBuilding(farm.getId())).isEmpty();
        assertThat(state.getMap().getTile(6, 5).getBuildingId()).isNull();
    }

    @Test
    void ownUnitsAreNotValidTargets() {
        Unit attacker = MatchTestUtils.spawnUnit(state, "agent-a", 5, 5, 15, 5, 1);
        Unit friend = MatchTestUtils.spawnUnit(state, "agent-a", 6, 5, 10, 5, 1);
        MatchTestUtils.startPlaying(state);

        ActionResult result = attack("agent-a", attacker.getId(), friend.getId());

        assertThat(result.error()).isEqualTo("Cannot attack own units or buildings");
        assertThat(friend.getHealth()).isEqualTo(50);
        assertThat(attacker.hasAttacked()).isFalse();
    }

    @Test
    void unknownTargetsAndOutOfRangeAttacksFail() {
        Unit attacker = MatchTestUtils.spawnUnit(state, "agent-a", 1, 1, 15, 5, 1);
        Unit far = MatchTestUtils.spawnUnit(state, "agent-b", 8, 8, 10, 5, 1);
        MatchTestUtils.startPlaying(state);

        assertThat(attack("agent-a", attacker.getId(), "unit-99").error()).isEqualTo("Target unit-99 not found");
        assertThat(attack("agent-a", attacker.getId(), far.getId()).error()).isEqualTo("Target out of range");
    }

    @Test
    void actionsOfAgentsWithoutFactionAreCritical() {
        MatchTestUtils.startPlaying(state);

        assertThatThrownBy(() -> attack("agent-x", "unit-1", "unit-2"))
                .isInstanceOf(CriticalActionException.class)
                .hasMessageContaining("agent-x");
    }
}
