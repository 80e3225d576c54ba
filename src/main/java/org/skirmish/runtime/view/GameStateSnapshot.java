package org.skirmish.runtime.view;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.skirmish.runtime.model.BalanceSettings;
import org.skirmish.runtime.model.GameEvent;
import org.skirmish.runtime.model.GamePhase;
import org.skirmish.runtime.model.VictoryCondition;

/**
 * Complete immutable copy of a match, the unit of serialization.
 *
 * @param mapGrid Rows of tiles, {@code mapGrid.get(y).get(x)}.
 * @param eventLog The most recent events, oldest first.
 * @param winner The winning agent, or {@code null} while undecided or after a draw.
 */
public record GameStateSnapshot(String gameId, int turnNumber, GamePhase phase, int currentPlayerIndex,
                                int mapWidth, int mapHeight, List<List<TileRecord>> mapGrid,
                                Map<String, FactionView> factions, List<String> playerTurnOrder,
                                BalanceSettings balanceSettings, List<VictoryCondition> victoryConditions,
                                List<GameEvent> eventLog, String winner) {

    public GameStateSnapshot {
        mapGrid = mapGrid.stream().map(List::copyOf).toList();
        factions = Collections.unmodifiableMap(new LinkedHashMap<>(factions));
        playerTurnOrder = List.copyOf(playerTurnOrder);
        victoryConditions = List.copyOf(victoryConditions);
        eventLog = List.copyOf(eventLog);
    }
}
