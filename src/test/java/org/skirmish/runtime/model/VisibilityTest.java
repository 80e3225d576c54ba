package org.skirmish.runtime.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.skirmish.runtime.GameConstants;
import org.skirmish.runtime.view.AgentView;
import org.skirmish.runtime.view.TileView;
import org.skirmish.test.utils.MatchTestUtils;

@Tag("unit")
class VisibilityTest {

    private GameState state;

    @BeforeEach
    void setUp() {
        state = MatchTestUtils.newState(12, 12, MatchTestUtils.defaultSettings());
        MatchTestUtils.addFaction(state, "agent-a");
        MatchTestUtils.addFaction(state, "agent-b");
    }

    @Test
    void tilesAreVisibleExactlyWithinSightOfOwnUnits() {
        Unit scout = MatchTestUtils.spawnUnit(state, "agent-a", 5, 5, 10, 5, 1);
        Unit sentry = MatchTestUtils.spawnUnit(state, "agent-a", 1, 10, 10, 5, 1);
        MatchTestUtils.spawnUnit(state, "agent-b", 10, 1, 10, 5, 1);

        state.recomputeVisibility();

        for (int y = 0; y < 12; y++) {
            for (int x = 0; x < 12; x++) {
                boolean expected = scout.distanceTo(x, y) <= 3 || sentry.distanceTo(x, y) <= 3;
                assertThat(state.isVisibleTo("agent-a", x, y))
                        .as("tile (%d, %d)", x, y)
                        .isEqualTo(expected);
            }
        }
    }

    @Test
    void blindedUnitsSeeHalfAsFar() {
        Unit scout = MatchTestUtils.spawnUnit(state, "agent-a", 5, 5, 10, 5, 1);
        scout.addStatusEffect(GameConstants.STATUS_BLINDED, 2);

        state.recomputeVisibility();

        assertThat(state.getEffectiveSightRange(scout)).isEqualTo(1);
        assertThat(state.isVisibleTo("agent-a", 5, 6)).isTrue();
        assertThat(state.isVisibleTo("agent-a", 5, 7)).isFalse();
    }

    @Test
    void leftAreasStayExploredButNotVisible() {
        Unit scout = MatchTestUtils.spawnUnit(state, "agent-a", 1, 1, 10, 5, 1);
        MatchTestUtils.startPlaying(state);

        state.moveUnit(scout, 4, 1);
        state.moveUnit(scout, 7, 1);
        state.recomputeVisibility();

        Tile origin = state.getMap().getTile(0, 0);
        assertThat(origin.isVisibleTo("agent-a")).isFalse();
        assertThat(origin.isExploredBy("agent-a")).isTrue();
    }

    @Test
    void agentViewHidesUnexploredTilesAndUnseenEnemies() {
        MatchTestUtils.spawnUnit(state, "agent-a", 2, 2, 10, 5, 1);
        Unit seen = MatchTestUtils.spawnUnit(state, "agent-b", 4, 2, 10, 5, 1);
        Unit hidden = MatchTestUtils.spawnUnit(state, "agent-b", 10, 10, 10, 5, 1);
        state.getMap().getTile(11, 11).setResourceNode(ResourceType.GOLD, 150);
        MatchTestUtils.startPlaying(state);

        AgentView view = state.getAgentView("agent-a");

        assertThat(view.isMyTurn()).isTrue();
        assertThat(view.visibleEnemies()).containsOnlyKeys("agent-b");
        assertThat(view.visibleEnemies().get("agent-b")).extracting(e -> e.id()).containsExactly(seen.getId());
        assertThat(view.visibleEnemies().get("agent-b")).extracting(e -> e.id()).doesNotContain(hidden.getId());

        TileView unexplored = view.tileAt(11, 11);
        assertThat(unexplored.explored()).isFalse();
        assertThat(unexplored.terrain()).isNull();
        assertThat(unexplored.resourceAmount()).isZero();

        TileView enemyTile = view.tileAt(4, 2);
        assertThat(enemyTile.visible()).isTrue();
        assertThat(enemyTile.unitId()).isEqualTo(seen.getId());
        assertThat(view.myFaction().ownerId()).isEqualTo("agent-a");
    }

    @Test
    void agentViewIsADetachedCopy() {
        Unit own = MatchTestUtils.spawnUnit(state, "agent-a", 2, 2, 10, 5, 1);
        MatchTestUtils.startPlaying(state);
        AgentView view = state.getAgentView("agent-a");

        own.takeDamage(20);
        state.moveUnit(own, 3, 2);

        assertThat(view.myFaction().units().get(0).health()).isEqualTo(50);
        assertThat(view.myFaction().units().get(0).x()).isEqualTo(2);
        assertThat(view.tileAt(2, 2).unitId()).isEqualTo(own.getId());
        assertThat(state.getAgentView("agent-a").myFaction().units().get(0).health()).isEqualTo(30);
        assertThat(state.getAgentView("agent-b").isMyTurn()).isFalse();
    }
}
