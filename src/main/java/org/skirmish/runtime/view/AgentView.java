package org.skirmish.runtime.view;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.skirmish.runtime.model.BalanceSettings;
import org.skirmish.runtime.model.GamePhase;
import org.skirmish.runtime.model.VictoryCondition;

/**
 * Everything one agent is allowed to know, frozen at the moment of creation.
 *
 * @param map Rows of the redacted map, {@code map.get(y).get(x)}.
 * @param visibleEnemies Enemy units on tiles currently visible to the agent, by owning agent.
 * @param abilityCatalog Ability id to description, for designing units and buildings.
 */
public record AgentView(String gameId, int turnNumber, GamePhase phase, String currentPlayer, boolean isMyTurn,
                        FactionView myFaction, List<List<TileView>> map,
                        Map<String, List<EnemyUnitView>> visibleEnemies,
                        List<VictoryCondition> victoryConditions, BalanceSettings balanceSettings,
                        Map<String, String> abilityCatalog) {

    public AgentView {
        List<List<TileView>> rows = new ArrayList<>(map.size());
        for (List<TileView> row : map) {
            rows.add(List.copyOf(row));
        }
        map = Collections.unmodifiableList(rows);
        Map<String, List<EnemyUnitView>> enemies = new LinkedHashMap<>();
        visibleEnemies.forEach((agent, units) -> enemies.put(agent, List.copyOf(units)));
        visibleEnemies = Collections.unmodifiableMap(enemies);
        victoryConditions = List.copyOf(victoryConditions);
        abilityCatalog = Collections.unmodifiableMap(new LinkedHashMap<>(abilityCatalog));
    }

    /**
     * @param x Column.
     * @param y Row.
     * @return The tile view at the position.
     */
    public TileView tileAt(int x, int y) {
        return map.get(y).get(x);
    }
}
