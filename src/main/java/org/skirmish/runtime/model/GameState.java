package org.skirmish.runtime.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import org.skirmish.runtime.GameConstants;
import org.skirmish.runtime.MatchSettings;
import org.skirmish.runtime.abilities.AbilityRegistry;
import org.skirmish.runtime.spi.AbilityCategory;
import org.skirmish.runtime.spi.AbilityContext;
import org.skirmish.runtime.spi.ActionKind;
import org.skirmish.runtime.view.AgentView;
import org.skirmish.runtime.view.EnemyUnitView;
import org.skirmish.runtime.view.FactionView;
import org.skirmish.runtime.view.GameStateSnapshot;
import org.skirmish.runtime.view.TileRecord;
import org.skirmish.runtime.view.TileView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The authoritative state of one match: map, factions, turn order, phase and event log.
 * <p>
 * All structural changes (placing, moving and removing entities) go through this class so that
 * tile occupancy and entity positions always agree. The state is not thread-safe; it is only
 * ever written by the turn orchestrator between decision calls.
 * <p>
 * A round ends when the last slot of the turn order has acted. {@link #advanceTurn()} then
 * increments the turn number and runs the end-of-round effects in this order: resource
 * generation, building turn abilities, construction completion, unit reset, removal of
 * destroyed entities and a full visibility recompute.
 */
public class GameState {

    private static final Logger LOG = LoggerFactory.getLogger(GameState.class);

    // Attempts to find a free 3x3 plains area for a new faction
    private static final int MAX_SPAWN_ATTEMPTS = 100;

    private final String gameId;
    private final GameMap map;
    private final AbilityRegistry abilityRegistry;
    private final MatchSettings settings;
    private final Random random;
    private final Map<String, Faction> factions = new LinkedHashMap<>();
    private final List<String> turnOrder = new ArrayList<>();
    private final List<VictoryCondition> victoryConditions;
    private final Deque<GameEvent> eventLog = new ArrayDeque<>();
    private GamePhase phase = GamePhase.SETUP;
    private int currentPlayerIndex;
    private int turnNumber;
    private BalanceSettings balance;
    private String winner;
    private long nextEntityId = 1;

    /**
     * Creates a match on an explicit map.
     *
     * @param gameId The match id.
     * @param map The map, owned by this state from now on.
     * @param abilityRegistry The ability catalog shared by all entities.
     * @param settings Match settings.
     * @param random Random source for starting positions.
     */
    public GameState(String gameId, GameMap map, AbilityRegistry abilityRegistry, MatchSettings settings, Random random) {
        this.gameId = gameId;
        this.map = map;
        this.abilityRegistry = abilityRegistry;
        this.settings = settings;
        this.random = random;
        this.balance = settings.getBalance();
        this.victoryConditions = List.copyOf(settings.getVictoryConditions());
    }

    /**
     * Creates a match on a generated map. The configured seed drives both map generation and
     * starting positions.
     *
     * @param gameId The match id.
     * @param abilityRegistry The ability catalog.
     * @param settings Match settings.
     * @return The new state in phase {@link GamePhase#SETUP}.
     */
    public static GameState create(String gameId, AbilityRegistry abilityRegistry, MatchSettings settings) {
        Random random = new Random(settings.getSeed());
        GameMap map = GameMap.generate(settings.getMapWidth(), settings.getMapHeight(), random);
        return new GameState(gameId, map, abilityRegistry, settings, random);
    }

    // ---- accessors ----

    public String getGameId() {
        return gameId;
    }

    public GameMap getMap() {
        return map;
    }

    public AbilityRegistry getAbilityRegistry() {
        return abilityRegistry;
    }

    public MatchSettings getSettings() {
        return settings;
    }

    public GamePhase getPhase() {
        return phase;
    }

    public int getTurnNumber() {
        return turnNumber;
    }

    public int getCurrentPlayerIndex() {
        return currentPlayerIndex;
    }

    public List<String> getTurnOrder() {
        return Collections.unmodifiableList(turnOrder);
    }

    public BalanceSettings getBalance() {
        return balance;
    }

    public List<VictoryCondition> getVictoryConditions() {
        return victoryConditions;
    }

    /**
     * @return The winner once the match has ended with one, otherwise empty.
     */
    public Optional<String> getWinner() {
        return Optional.ofNullable(winner);
    }

    public List<GameEvent> getEventLog() {
        return List.copyOf(eventLog);
    }

    /**
     * @return The agent whose slot is active, or empty outside {@link GamePhase#PLAYING}.
     */
    public Optional<String> getCurrentPlayer() {
        if (phase != GamePhase.PLAYING || turnOrder.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(turnOrder.get(currentPlayerIndex));
    }

    /**
     * @param prefix Entity kind, e.g. {@code "unit"}.
     * @return A match-unique id such as {@code unit-7}.
     */
    public String nextEntityId(String prefix) {
        return prefix + "-" + nextEntityId++;
    }

    // ---- factions ----

    public Optional<Faction> getFaction(String agentId) {
        return Optional.ofNullable(factions.get(agentId));
    }

    public Map<String, Faction> getFactions() {
        return Collections.unmodifiableMap(factions);
    }

    /**
     * @return Factions in turn order.
     */
    public List<Faction> getFactionsInTurnOrder() {
        List<Faction> ordered = new ArrayList<>(turnOrder.size());
        for (String agentId : turnOrder) {
            ordered.add(factions.get(agentId));
        }
        return ordered;
    }

    /**
     * @return Every unit of every faction, in turn order.
     */
    public List<Unit> getAllUnits() {
        List<Unit> units = new ArrayList<>();
        for (String agentId : turnOrder) {
            units.addAll(factions.get(agentId).getUnits());
        }
        return units;
    }

    public boolean isFactionAlive(String agentId) {
        Faction faction = factions.get(agentId);
        return faction != null && faction.isAlive();
    }

    /**
     * Adds a faction and places its starting units.
     *
     * @param faction The faction to add.
     * @return {@code false} if the match is full, the agent already joined or no starting
     *         position could be found.
     * @throws IllegalStateException outside {@link GamePhase#SETUP}.
     */
    public boolean addFaction(Faction faction) {
        return addFaction(faction, true);
    }

    /**
     * Adds a faction, optionally with its starting units.
     *
     * @param faction The faction to add.
     * @param withStartingUnits Whether to place a Town Center, an Explorer and a Settler.
     * @return {@code false} if the match is full, the agent already joined or no starting
     *         position could be found.
     * @throws IllegalStateException outside {@link GamePhase#SETUP}.
     */
    public boolean addFaction(Faction faction, boolean withStartingUnits) {
        if (phase != GamePhase.SETUP) {
            throw new IllegalStateException("Factions can only join during SETUP, phase is " + phase);
        }
        String agentId = faction.getOwnerId();
        if (factions.size() >= settings.getMaxPlayers()) {
            LOG.warn("Match {} is full, rejecting faction of agent {}", gameId, agentId);
            return false;
        }
        if (factions.containsKey(agentId)) {
            LOG.warn("Agent {} already has a faction in match {}", agentId, gameId);
            return false;
        }
        Optional<int[]> start = withStartingUnits ? findStartingPosition() : Optional.empty();
        if (withStartingUnits && start.isEmpty()) {
            LOG.warn("No free starting position for agent {}", agentId);
            return false;
        }
        faction.setResources(settings.getStartingResources());
        factions.put(agentId, faction);
        turnOrder.add(agentId);
        start.ifPresent(position -> placeStartingUnits(faction, position[0], position[1]));
        logEvent(GameEvent.FACTION_ADDED, Map.of("agent_id", agentId, "faction_name", faction.getName()));
        LOG.info("Faction '{}' of agent {} joined match {}", faction.getName(), agentId, gameId);
        return true;
    }

    private Optional<int[]> findStartingPosition() {
        // Random probing first, a full scan as fallback
        for (int attempt = 0; attempt < MAX_SPAWN_ATTEMPTS; attempt++) {
            int x = 1 + random.nextInt(Math.max(1, map.getWidth() - 2));
            int y = 1 + random.nextInt(Math.max(1, map.getHeight() - 2));
            if (isFreePlainsArea(x, y)) {
                return Optional.of(new int[]{x, y});
            }
        }
        for (int y = 1; y < map.getHeight() - 1; y++) {
            for (int x = 1; x < map.getWidth() - 1; x++) {
                if (isFreePlainsArea(x, y)) {
                    return Optional.of(new int[]{x, y});
                }
            }
        }
        return Optional.empty();
    }

    private boolean isFreePlainsArea(int centerX, int centerY) {
        for (int dy = -1; dy <= 1; dy++) {
            for (int dx = -1; dx <= 1; dx++) {
                Tile tile = map.getTile(centerX + dx, centerY + dy);
                if (tile == null || tile.getTerrain() != Terrain.PLAINS || tile.isOccupied()) {
                    return false;
                }
            }
        }
        return true;
    }

    private void placeStartingUnits(Faction faction, int x, int y) {
        String agentId = faction.getOwnerId();
        Building townCenter = settings.getBuildingTemplates().get(BuildingType.TOWN_CENTER)
                .toDesign("Town Center")
                .instantiate(nextEntityId("building"), agentId, x, y, true);
        placeBuilding(faction, townCenter);

        Unit explorer = new Unit(nextEntityId("unit"), "Explorer", UnitType.SUPPORT, agentId, x + 1, y + 1,
                new UnitStats(30, 30, 5, 3, 3, 1, 5), Set.of());
        spawnUnit(faction, explorer);

        Unit settler = new Unit(nextEntityId("unit"), "Settler", UnitType.WORKER, agentId, x - 1, y + 1,
                new UnitStats(25, 25, 3, 2, 2, 1, 3), Set.of("build", "gather"));
        spawnUnit(faction, settler);
    }

    // ---- entity placement ----

    /**
     * Adds a unit to its faction and onto the map at the unit's position.
     *
     * @param faction The owning faction.
     * @param unit The unit, positioned on a free passable tile.
     * @return {@code false} if the tile is unavailable or the faction is at its unit cap.
     */
    public boolean spawnUnit(Faction faction, Unit unit) {
        Tile tile = map.getTile(unit.getX(), unit.getY());
        if (tile == null || !tile.canPlaceUnit()) {
            return false;
        }
        if (!faction.addUnit(unit)) {
            return false;
        }
        tile.placeUnit(unit.getId());
        return true;
    }

    /**
     * Adds a building to its faction and onto the map at the building's position.
     *
     * @param faction The owning faction.
     * @param building The building, positioned on a free buildable tile.
     * @return {@code false} if the tile is unavailable or the faction is at its building cap.
     */
    public boolean placeBuilding(Faction faction, Building building) {
        Tile tile = map.getTile(building.getX(), building.getY());
        if (tile == null || !tile.canPlaceBuilding()) {
            return false;
        }
        if (!faction.addBuilding(building)) {
            return false;
        }
        tile.placeBuilding(building.getId());
        return true;
    }

    /**
     * Moves a unit and marks it as moved, which also ends fortification.
     *
     * @param unit The unit to move.
     * @param x Target column.
     * @param y Target row.
     * @throws IllegalStateException if the target tile cannot take the unit.
     */
    public void moveUnit(Unit unit, int x, int y) {
        Tile target = map.getTile(x, y);
        if (target == null) {
            throw new IllegalStateException("Move target (" + x + ", " + y + ") is outside the map");
        }
        target.placeUnit(unit.getId());
        Tile source = map.getTile(unit.getX(), unit.getY());
        if (source != null && unit.getId().equals(source.getUnitId())) {
            source.clearUnit();
        }
        unit.setPosition(x, y);
        unit.markMoved();
    }

    /**
     * Removes a unit from its faction and its tile.
     *
     * @param unit The unit to remove.
     */
    public void removeUnit(Unit unit) {
        Faction faction = factions.get(unit.getOwnerId());
        if (faction == null || faction.removeUnit(unit.getId()).isEmpty()) {
            return;
        }
        Tile tile = map.getTile(unit.getX(), unit.getY());
        if (tile != null && unit.getId().equals(tile.getUnitId())) {
            tile.clearUnit();
        }
        logEvent(GameEvent.UNIT_DESTROYED, Map.of("unit_id", unit.getId(), "owner_id", unit.getOwnerId()));
        LOG.debug("Unit {} of agent {} removed", unit.getId(), unit.getOwnerId());
    }

    /**
     * Removes a building from its faction and its tile.
     *
     * @param building The building to remove.
     */
    public void removeBuilding(Building building) {
        Faction faction = factions.get(building.getOwnerId());
        if (faction == null || faction.removeBuilding(building.getId()).isEmpty()) {
            return;
        }
        Tile tile = map.getTile(building.getX(), building.getY());
        if (tile != null && building.getId().equals(tile.getBuildingId())) {
            tile.clearBuilding();
        }
        logEvent(GameEvent.BUILDING_DESTROYED,
                Map.of("building_id", building.getId(), "owner_id", building.getOwnerId()));
        LOG.debug("Building {} of agent {} removed", building.getId(), building.getOwnerId());
    }

    /**
     * Removes every dead unit and destroyed building from the match.
     *
     * @return The number of entities removed.
     */
    public int purgeDestroyed() {
        int removed = 0;
        for (Faction faction : getFactionsInTurnOrder()) {
            for (Unit unit : List.copyOf(faction.getUnits())) {
                if (unit.isDestroyed()) {
                    removeUnit(unit);
                    removed++;
                }
            }
            for (Building building : List.copyOf(faction.getBuildings())) {
                if (building.isDestroyed()) {
                    removeBuilding(building);
                    removed++;
                }
            }
        }
        return removed;
    }

    public Optional<Unit> findUnit(String unitId) {
        for (Faction faction : factions.values()) {
            Optional<Unit> unit = faction.getUnit(unitId);
            if (unit.isPresent()) {
                return unit;
            }
        }
        return Optional.empty();
    }

    public Optional<Building> findBuilding(String buildingId) {
        for (Faction faction : factions.values()) {
            Optional<Building> building = faction.getBuilding(buildingId);
            if (building.isPresent()) {
                return building;
            }
        }
        return Optional.empty();
    }

    // ---- phases and turns ----

    /**
     * Moves the match to a later phase. Entering {@link GamePhase#PLAYING} resets the current
     * player and computes the initial visibility.
     *
     * @param next The new phase.
     * @throws IllegalStateException when going backwards.
     */
    public void setPhase(GamePhase next) {
        if (!phase.canTransitionTo(next)) {
            throw new IllegalStateException("Cannot go back from " + phase + " to " + next);
        }
        if (next == phase) {
            return;
        }
        GamePhase previous = phase;
        phase = next;
        if (next == GamePhase.PLAYING) {
            currentPlayerIndex = 0;
            recomputeVisibility();
        }
        logEvent(GameEvent.PHASE_CHANGED, Map.of("from", previous.name(), "to", next.name()));
        LOG.info("Match {} moved from {} to {}", gameId, previous, next);
    }

    /**
     * Applies balance adjustments. Only allowed before play begins.
     *
     * @param adjustments Snake_case setting name to value.
     * @throws IllegalStateException once the match is playing.
     */
    public void applyBalanceAdjustments(Map<String, Double> adjustments) {
        if (phase != GamePhase.SETUP && phase != GamePhase.BALANCING) {
            throw new IllegalStateException("Balance can only be adjusted before play, phase is " + phase);
        }
        balance = balance.withAdjustments(adjustments);
        LOG.info("Balance settings of match {} adjusted: {}", gameId, balance);
    }

    /**
     * Passes the turn to the next slot. After the last slot the turn number increases and the
     * end-of-round effects run.
     *
     * @return {@code true} if a new round started.
     */
    public boolean advanceTurn() {
        if (phase != GamePhase.PLAYING || turnOrder.isEmpty()) {
            return false;
        }
        currentPlayerIndex++;
        if (currentPlayerIndex < turnOrder.size()) {
            return false;
        }
        currentPlayerIndex = 0;
        turnNumber++;
        processEndOfRound();
        return true;
    }

    private void processEndOfRound() {
        List<Faction> ordered = getFactionsInTurnOrder();
        for (Faction faction : ordered) {
            generateResources(faction);
        }
        for (Faction faction : ordered) {
            for (Building building : List.copyOf(faction.getBuildings())) {
                if (building.isOperational()) {
                    abilityRegistry.executeAbilities(building.getAbilityIds(),
                            new AbilityContext(building, ActionKind.END_TURN, this));
                }
            }
        }
        for (Faction faction : ordered) {
            for (Building building : faction.getBuildings()) {
                if (!building.isConstructionComplete() && !building.isDestroyed()) {
                    building.completeConstruction();
                }
            }
            for (Unit unit : faction.getUnits()) {
                unit.resetForNewRound();
            }
        }
        int removed = purgeDestroyed();
        recomputeVisibility();
        logEvent(GameEvent.ROUND_COMPLETED, Map.of("turn_number", turnNumber, "entities_removed", removed));
        LOG.info("Match {} completed round {}", gameId, turnNumber);
    }

    private void generateResources(Faction faction) {
        EnumMap<ResourceType, Integer> income = ResourceType.emptyMap();
        for (Building building : faction.getBuildings()) {
            EnumMap<ResourceType, Integer> generated = building.generateResources();
            if (generated.isEmpty()) {
                continue;
            }
            AbilityContext context = new AbilityContext(building, ActionKind.GENERATE_RESOURCES, this)
                    .setResources(ResourceType.scale(generated, balance.resourceGenerationRate()));
            abilityRegistry.executeAbilities(building.getAbilityIds(), context);
            context.getResources().forEach((type, amount) -> income.merge(type, amount, Integer::sum));
        }
        if (!income.isEmpty()) {
            faction.addResources(income);
            LOG.debug("Agent {} generated {}", faction.getOwnerId(), income);
        }
    }

    // ---- visibility ----

    /**
     * Clears all current visibility and reveals the tiles around every living unit.
     * Exploration is cumulative and never cleared.
     */
    public void recomputeVisibility() {
        map.clearVisibility();
        for (Faction faction : getFactionsInTurnOrder()) {
            for (Unit unit : faction.getUnits()) {
                if (!unit.isAlive()) {
                    continue;
                }
                int sight = getEffectiveSightRange(unit);
                for (Tile tile : map.getTilesWithin(unit.getX(), unit.getY(), sight)) {
                    tile.reveal(faction.getOwnerId());
                }
            }
        }
    }

    /**
     * Sight range after the {@code blinded} status effect and the unit's observe abilities.
     *
     * @param unit The observing unit.
     * @return The effective sight range, never negative.
     */
    public int getEffectiveSightRange(Unit unit) {
        int sight = unit.getStats().getSightRange();
        if (unit.hasStatusEffect(GameConstants.STATUS_BLINDED)) {
            sight /= 2;
        }
        AbilityContext context = new AbilityContext(unit, ActionKind.OBSERVE, this).setWorkingSightRange(sight);
        abilityRegistry.executeAbilities(unit.getAbilityIds(), context);
        return Math.max(0, context.getWorkingSightRange());
    }

    public boolean isVisibleTo(String agentId, int x, int y) {
        Tile tile = map.getTile(x, y);
        return tile != null && tile.isVisibleTo(agentId);
    }

    // ---- victory ----

    /**
     * Evaluates the active victory conditions and ends the match when one is met.
     * Elimination is checked first, then the resource threshold, then the turn limit.
     *
     * @return The winner, if the match ended with one.
     */
    public Optional<String> checkVictoryConditions() {
        if (phase == GamePhase.ENDED) {
            return getWinner();
        }
        if (phase != GamePhase.PLAYING) {
            return Optional.empty();
        }
        List<Faction> alive = new ArrayList<>();
        for (Faction faction : getFactionsInTurnOrder()) {
            if (faction.isAlive()) {
                alive.add(faction);
            }
        }
        if (victoryConditions.contains(VictoryCondition.ELIMINATION) && alive.size() <= 1) {
            endMatch(alive.isEmpty() ? null : alive.get(0).getOwnerId(), VictoryCondition.ELIMINATION);
            return getWinner();
        }
        if (victoryConditions.contains(VictoryCondition.RESOURCE)) {
            Faction richest = null;
            for (Faction faction : alive) {
                if (faction.getTotalResources() >= settings.getResourceVictoryThreshold()
                        && (richest == null || faction.getTotalResources() > richest.getTotalResources())) {
                    richest = faction;
                }
            }
            if (richest != null) {
                endMatch(richest.getOwnerId(), VictoryCondition.RESOURCE);
                return getWinner();
            }
        }
        if (victoryConditions.contains(VictoryCondition.TIME_LIMIT) && turnNumber >= settings.getMaxTurns()) {
            Faction strongest = null;
            for (Faction faction : alive) {
                if (strongest == null || faction.getMilitaryStrength() > strongest.getMilitaryStrength()) {
                    strongest = faction;
                }
            }
            endMatch(strongest == null ? null : strongest.getOwnerId(), VictoryCondition.TIME_LIMIT);
            return getWinner();
        }
        return Optional.empty();
    }

    private void endMatch(String winnerId, VictoryCondition condition) {
        this.winner = winnerId;
        setPhase(GamePhase.ENDED);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("winner", winnerId);
        data.put("condition", condition.name());
        data.put("turn_number", turnNumber);
        logEvent(GameEvent.GAME_ENDED, data);
        if (winnerId != null) {
            LOG.info("Match {} ended on turn {}: {} won by {}", gameId, turnNumber, winnerId, condition);
        } else {
            LOG.info("Match {} ended on turn {} without a winner ({})", gameId, turnNumber, condition);
        }
    }

    // ---- views and snapshots ----

    /**
     * Builds the fog-of-war filtered view for one agent. The result shares no mutable state
     * with the match.
     *
     * @param agentId The observing agent.
     * @return The agent's view.
     * @throws IllegalArgumentException if the agent has no faction.
     */
    public AgentView getAgentView(String agentId) {
        Faction own = factions.get(agentId);
        if (own == null) {
            throw new IllegalArgumentException("Agent " + agentId + " has no faction in match " + gameId);
        }
        List<List<TileView>> rows = new ArrayList<>(map.getHeight());
        for (int y = 0; y < map.getHeight(); y++) {
            List<TileView> row = new ArrayList<>(map.getWidth());
            for (int x = 0; x < map.getWidth(); x++) {
                row.add(TileView.of(map.getTile(x, y), agentId));
            }
            rows.add(row);
        }
        Map<String, List<EnemyUnitView>> enemies = new LinkedHashMap<>();
        for (Faction faction : getFactionsInTurnOrder()) {
            if (faction.getOwnerId().equals(agentId)) {
                continue;
            }
            List<EnemyUnitView> seen = new ArrayList<>();
            for (Unit unit : faction.getUnits()) {
                if (unit.isAlive() && isVisibleTo(agentId, unit.getX(), unit.getY())) {
                    seen.add(EnemyUnitView.of(unit));
                }
            }
            if (!seen.isEmpty()) {
                enemies.put(faction.getOwnerId(), seen);
            }
        }
        Map<String, String> catalog = new LinkedHashMap<>(abilityRegistry.describe(AbilityCategory.UNIT));
        catalog.putAll(abilityRegistry.describe(AbilityCategory.BUILDING));
        String current = getCurrentPlayer().orElse(null);
        return new AgentView(gameId, turnNumber, phase, current, agentId.equals(current),
                FactionView.of(own), rows, enemies, victoryConditions, balance, catalog);
    }

    /**
     * @return A complete, immutable copy of the match for serialization.
     */
    public GameStateSnapshot snapshot() {
        List<List<TileRecord>> grid = new ArrayList<>(map.getHeight());
        for (int y = 0; y < map.getHeight(); y++) {
            List<TileRecord> row = new ArrayList<>(map.getWidth());
            for (int x = 0; x < map.getWidth(); x++) {
                row.add(TileRecord.of(map.getTile(x, y)));
            }
            grid.add(row);
        }
        Map<String, FactionView> factionViews = new LinkedHashMap<>();
        for (Faction faction : getFactionsInTurnOrder()) {
            factionViews.put(faction.getOwnerId(), FactionView.of(faction));
        }
        return new GameStateSnapshot(gameId, turnNumber, phase, currentPlayerIndex, map.getWidth(), map.getHeight(),
                grid, factionViews, turnOrder, balance, victoryConditions, getEventLog(), winner);
    }

    // ---- events ----

    /**
     * Appends an event, dropping the oldest once the configured log size is exceeded.
     *
     * @param type Event type.
     * @param data Event payload.
     */
    public void logEvent(String type, Map<String, Object> data) {
        eventLog.addLast(new GameEvent(type, System.currentTimeMillis(), turnNumber, data));
        while (eventLog.size() > settings.getEventLogSize()) {
            eventLog.removeFirst();
        }
    }

    // ---- invariants ----

    /**
     * Checks the structural invariants: every entity sits on the tile that references it, every
     * occupied tile references a live entity of the match, every entity is owned by its
     * faction's agent and no resource is negative.
     *
     * @throws IllegalStateException on the first violation found.
     */
    public void verifyInvariants() {
        Map<String, Entity> byId = new LinkedHashMap<>();
        for (Faction faction : factions.values()) {
            for (Unit unit : faction.getUnits()) {
                checkOwnership(faction, unit);
                Tile tile = map.getTile(unit.getX(), unit.getY());
                if (tile == null || !unit.getId().equals(tile.getUnitId())) {
                    throw new IllegalStateException("Unit " + unit.getId() + " is not on its tile");
                }
                byId.put(unit.getId(), unit);
            }
            for (Building building : faction.getBuildings()) {
                checkOwnership(faction, building);
                Tile tile = map.getTile(building.getX(), building.getY());
                if (tile == null || !building.getId().equals(tile.getBuildingId())) {
                    throw new IllegalStateException("Building " + building.getId() + " is not on its tile");
                }
                byId.put(building.getId(), building);
            }
            for (Map.Entry<ResourceType, Integer> resource : faction.getResources().entrySet()) {
                if (resource.getValue() < 0) {
                    throw new IllegalStateException("Agent " + faction.getOwnerId() + " has negative " + resource.getKey());
                }
            }
        }
        for (int y = 0; y < map.getHeight(); y++) {
            for (int x = 0; x < map.getWidth(); x++) {
                Tile tile = map.getTile(x, y);
                if (tile.getUnitId() != null && tile.getBuildingId() != null) {
                    throw new IllegalStateException("Tile (" + x + ", " + y + ") holds a unit and a building");
                }
                String occupant = tile.getUnitId() != null ? tile.getUnitId() : tile.getBuildingId();
                if (occupant == null) {
                    continue;
                }
                Entity entity = byId.get(occupant);
                if (entity == null || entity.getX() != x || entity.getY() != y) {
                    throw new IllegalStateException("Tile (" + x + ", " + y + ") references stale entity " + occupant);
                }
            }
        }
    }

    private static void checkOwnership(Faction faction, Entity entity) {
        if (!faction.getOwnerId().equals(entity.getOwnerId())) {
            throw new IllegalStateException("Entity " + entity.getId() + " is listed by faction of "
                    + faction.getOwnerId() + " but owned by " + entity.getOwnerId());
        }
    }
}
