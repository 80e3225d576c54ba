package org.skirmish.test.utils;

import java.util.Map;
import java.util.Random;
import java.util.Set;

import org.skirmish.runtime.MatchSettings;
import org.skirmish.runtime.abilities.AbilityRegistry;
import org.skirmish.runtime.model.Building;
import org.skirmish.runtime.model.BuildingType;
import org.skirmish.runtime.model.Faction;
import org.skirmish.runtime.model.FactionTheme;
import org.skirmish.runtime.model.GameMap;
import org.skirmish.runtime.model.GamePhase;
import org.skirmish.runtime.model.GameState;
import org.skirmish.runtime.model.ResourceType;
import org.skirmish.runtime.model.Unit;
import org.skirmish.runtime.model.UnitStats;
import org.skirmish.runtime.model.UnitType;
import org.skirmish.runtime.spi.ProposedAction;

import com.typesafe.config.ConfigFactory;

/**
 * Builds small, fully controlled matches for tests: all-plains maps, factions without
 * starting units and units placed at explicit positions.
 */
public final class MatchTestUtils {

    private static final AbilityRegistry DEFAULT_REGISTRY = AbilityRegistry.createDefault();

    private MatchTestUtils() {
    }

    /**
     * @param hocon Overrides of the {@code skirmish} block, e.g. {@code "turn.max-turns = 3"}.
     * @return Settings with the overrides applied on top of {@code reference.conf}.
     */
    public static MatchSettings settings(String hocon) {
        return MatchSettings.fromConfig(ConfigFactory.parseString(hocon));
    }

    public static MatchSettings defaultSettings() {
        return settings("");
    }

    public static AbilityRegistry registry() {
        return DEFAULT_REGISTRY;
    }

    /**
     * @return A match on a 10x10 plains map with default settings, in {@link GamePhase#SETUP}.
     */
    public static GameState newState() {
        return newState(10, 10, defaultSettings());
    }

    public static GameState newState(int width, int height, MatchSettings settings) {
        return new GameState("test-match", new GameMap(width, height), DEFAULT_REGISTRY, settings, new Random(7));
    }

    /**
     * Adds a faction without starting units. Must be called during setup.
     */
    public static Faction addFaction(GameState state, String agentId) {
        Faction faction = new Faction("faction-" + agentId, agentId, "Faction " + agentId, FactionTheme.of(agentId));
        if (!state.addFaction(faction, false)) {
            throw new IllegalStateException("Could not add faction for " + agentId);
        }
        return faction;
    }

    public static void startPlaying(GameState state) {
        state.setPhase(GamePhase.PLAYING);
    }

    public static Unit spawnUnit(GameState state, String agentId, int x, int y, int attack, int defense,
                                 int attackRange, String... abilities) {
        return spawnUnit(state, agentId, x, y, new UnitStats(50, 50, attack, defense, 3, attackRange, 3), abilities);
    }

    public static Unit spawnUnit(GameState state, String agentId, int x, int y, UnitStats stats, String... abilities) {
        Faction faction = state.getFaction(agentId).orElseThrow();
        Unit unit = new Unit(state.nextEntityId("unit"), "Test Unit", UnitType.INFANTRY, agentId, x, y, stats,
                Set.of(abilities));
        if (!state.spawnUnit(faction, unit)) {
            throw new IllegalStateException("Could not spawn unit at (" + x + ", " + y + ")");
        }
        return unit;
    }

    /**
     * Places a complete building of the given type, built from the configured template.
     */
    public static Building placeBuilding(GameState state, String agentId, BuildingType type, int x, int y) {
        Faction faction = state.getFaction(agentId).orElseThrow();
        Building building = state.getSettings().getBuildingTemplates().get(type)
                .toDesign(type.getId())
                .instantiate(state.nextEntityId("building"), agentId, x, y, true);
        if (!state.placeBuilding(faction, building)) {
            throw new IllegalStateException("Could not place building at (" + x + ", " + y + ")");
        }
        return building;
    }

    public static ProposedAction action(String agentId, String type, Map<String, Object> parameters) {
        return new ProposedAction(type, parameters, agentId);
    }

    public static Map<ResourceType, Integer> gold(int amount) {
        return Map.of(ResourceType.GOLD, amount);
    }
}
