package org.skirmish.runtime;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.skirmish.runtime.model.BalanceSettings;
import org.skirmish.runtime.model.BuildingTemplates;
import org.skirmish.runtime.model.ResourceType;
import org.skirmish.runtime.model.VictoryCondition;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Typed view of the {@code skirmish} configuration block. Read once per match.
 */
public final class MatchSettings {

    private final long seed;
    private final int mapWidth;
    private final int mapHeight;
    private final int maxPlayers;
    private final int eventLogSize;
    private final int gatherYield;
    private final Map<ResourceType, Integer> startingResources;
    private final BalanceSettings balance;
    private final Duration turnTimeout;
    private final int maxActionsPerTurn;
    private final int maxTurns;
    private final int historySize;
    private final List<VictoryCondition> victoryConditions;
    private final int resourceVictoryThreshold;
    private final BuildingTemplates buildingTemplates;

    private MatchSettings(Config config) {
        this.seed = config.getLong("seed");
        this.mapWidth = config.getInt("map.width");
        this.mapHeight = config.getInt("map.height");
        this.maxPlayers = config.getInt("max-players");
        this.eventLogSize = config.getInt("event-log-size");
        this.gatherYield = config.getInt("gather-yield");
        EnumMap<ResourceType, Integer> starting = BuildingTemplates.readResources(config, "starting-resources");
        this.startingResources = Collections.unmodifiableMap(starting);
        this.balance = BalanceSettings.fromConfig(config.getConfig("balance"));
        this.turnTimeout = config.getDuration("turn.timeout");
        this.maxActionsPerTurn = config.getInt("turn.max-actions");
        this.maxTurns = config.getInt("turn.max-turns");
        this.historySize = config.getInt("turn.history-size");
        List<VictoryCondition> conditions = new ArrayList<>();
        for (String name : config.getStringList("victory.conditions")) {
            conditions.add(VictoryCondition.valueOf(name.trim().toUpperCase(Locale.ROOT)));
        }
        this.victoryConditions = List.copyOf(conditions);
        this.resourceVictoryThreshold = config.getInt("victory.resource-threshold");
        this.buildingTemplates = BuildingTemplates.fromConfig(config.getConfig("buildings"));

        if (mapWidth <= 0 || mapHeight <= 0) {
            throw new IllegalArgumentException("Map dimensions must be positive");
        }
        if (maxActionsPerTurn < 0 || maxPlayers < 1 || eventLogSize < 1 || historySize < 1) {
            throw new IllegalArgumentException("Invalid limits in skirmish configuration");
        }
    }

    /**
     * @param config The {@code skirmish} block; missing keys fall back to {@code reference.conf}.
     * @return The settings.
     */
    public static MatchSettings fromConfig(Config config) {
        Config defaults = ConfigFactory.defaultReference().getConfig("skirmish");
        return new MatchSettings(config.withFallback(defaults).resolve());
    }

    /**
     * @return Settings from the application configuration and {@code reference.conf}.
     */
    public static MatchSettings load() {
        return new MatchSettings(ConfigFactory.load().getConfig("skirmish"));
    }

    public long getSeed() {
        return seed;
    }

    public int getMapWidth() {
        return mapWidth;
    }

    public int getMapHeight() {
        return mapHeight;
    }

    public int getMaxPlayers() {
        return maxPlayers;
    }

    public int getEventLogSize() {
        return eventLogSize;
    }

    /**
     * @return The base amount a unit extracts from a resource node per gather action.
     */
    public int getGatherYield() {
        return gatherYield;
    }

    public Map<ResourceType, Integer> getStartingResources() {
        return startingResources;
    }

    public BalanceSettings getBalance() {
        return balance;
    }

    public Duration getTurnTimeout() {
        return turnTimeout;
    }

    public int getMaxActionsPerTurn() {
        return maxActionsPerTurn;
    }

    public int getMaxTurns() {
        return maxTurns;
    }

    public int getHistorySize() {
        return historySize;
    }

    public List<VictoryCondition> getVictoryConditions() {
        return victoryConditions;
    }

    public int getResourceVictoryThreshold() {
        return resourceVictoryThreshold;
    }

    public BuildingTemplates getBuildingTemplates() {
        return buildingTemplates;
    }
}
