package org.skirmish.runtime.view;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.skirmish.runtime.model.BuildingType;
import org.skirmish.runtime.model.GameState;
import org.skirmish.runtime.model.ResourceType;
import org.skirmish.test.utils.MatchTestUtils;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

@Tag("unit")
class GameStateSerializerTest {

    private GameState state;

    @BeforeEach
    void setUp() {
        state = MatchTestUtils.newState(6, 6, MatchTestUtils.defaultSettings());
        MatchTestUtils.addFaction(state, "agent-a");
        MatchTestUtils.addFaction(state, "agent-b");
        MatchTestUtils.spawnUnit(state, "agent-a", 1, 1, 10, 5, 1, "fortify");
        MatchTestUtils.placeBuilding(state, "agent-a", BuildingType.FARM, 2, 1);
        MatchTestUtils.spawnUnit(state, "agent-b", 4, 4, 10, 5, 1);
        state.getMap().getTile(0, 5).setResourceNode(ResourceType.GOLD, 80);
        MatchTestUtils.startPlaying(state);
    }

    @Test
    void agentViewUsesSnakeCaseKeysAndLowerCaseEnums() {
        JsonObject json = JsonParser.parseString(GameStateSerializer.toJson(state.getAgentView("agent-a")))
                .getAsJsonObject();

        assertThat(json.get("turn_number").getAsInt()).isZero();
        assertThat(json.get("is_my_turn").getAsBoolean()).isTrue();
        assertThat(json.get("phase").getAsString()).isEqualTo("playing");
        assertThat(json.get("current_player").getAsString()).isEqualTo("agent-a");

        JsonObject faction = json.getAsJsonObject("my_faction");
        assertThat(faction.getAsJsonObject("resources").get("gold").getAsInt()).isEqualTo(500);
        JsonObject unit = faction.getAsJsonArray("units").get(0).getAsJsonObject();
        assertThat(unit.get("type").getAsString()).isEqualTo("infantry");
        assertThat(unit.has("has_moved")).isTrue();
        assertThat(unit.get("abilities").getAsJsonArray().get(0).getAsString()).isEqualTo("fortify");
        assertThat(faction.getAsJsonArray("buildings").get(0).getAsJsonObject().get("type").getAsString())
                .isEqualTo("farm");
        assertThat(json.getAsJsonObject("balance_settings").get("unit_cost_multiplier").getAsDouble())
                .isEqualTo(1.0);
    }

    @Test
    void hiddenTilesSerializeTheirRedactedFieldsAsNull() {
        JsonObject json = JsonParser.parseString(GameStateSerializer.toJson(state.getAgentView("agent-a")))
                .getAsJsonObject();

        JsonObject hidden = json.getAsJsonArray("map").get(5).getAsJsonArray().get(5).getAsJsonObject();
        assertThat(hidden.get("explored").getAsBoolean()).isFalse();
        assertThat(hidden.get("terrain").isJsonNull()).isTrue();
    }

    @Test
    void snapshotContainsEveryFactionAndTheFullMap() {
        JsonObject json = JsonParser.parseString(GameStateSerializer.toJson(state.snapshot())).getAsJsonObject();

        assertThat(json.get("game_id").getAsString()).isEqualTo("test-match");
        assertThat(json.getAsJsonObject("factions").keySet()).containsExactly("agent-a", "agent-b");
        assertThat(json.getAsJsonArray("map_grid")).hasSize(6);
        JsonObject goldTile = json.getAsJsonArray("map_grid").get(5).getAsJsonArray().get(0).getAsJsonObject();
        assertThat(goldTile.get("resource_type").getAsString()).isEqualTo("gold");
        assertThat(goldTile.get("resource_amount").getAsInt()).isEqualTo(80);
        assertThat(json.getAsJsonArray("player_turn_order")).hasSize(2);
        assertThat(json.get("winner").isJsonNull()).isTrue();
        assertThat(json.getAsJsonArray("event_log")).isNotEmpty();
    }
}
