package org.skirmish.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.skirmish.runtime.GameConstants;

/**
 * A player's side: resources, units, buildings and custom designs.
 * <p>
 * Units and buildings added here must be owned by this faction's agent. Removing an entity
 * from the faction does not touch the map; use {@link GameState} to keep both in sync.
 */
public class Faction {

    private final String factionId;
    private final String ownerId;
    private final String name;
    private final FactionTheme theme;
    private final EnumMap<ResourceType, Integer> resources = ResourceType.emptyMap();
    private final List<Unit> units = new ArrayList<>();
    private final List<Building> buildings = new ArrayList<>();
    private final Map<String, UnitDesign> unitDesigns = new LinkedHashMap<>();
    private final Map<String, BuildingDesign> buildingDesigns = new LinkedHashMap<>();
    private int unitsCreated;
    private int unitsLost;
    private int buildingsConstructed;
    private final EnumMap<ResourceType, Integer> resourcesGathered = ResourceType.emptyMap();
    private final Set<String> allies = new LinkedHashSet<>();
    private final Set<String> enemies = new LinkedHashSet<>();

    public Faction(String factionId, String ownerId, String name, FactionTheme theme) {
        this.factionId = factionId;
        this.ownerId = ownerId;
        this.name = name;
        this.theme = theme != null ? theme : FactionTheme.of(name);
        for (ResourceType type : ResourceType.values()) {
            resources.put(type, 0);
            resourcesGathered.put(type, 0);
        }
    }

    public String getFactionId() {
        return factionId;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public String getName() {
        return name;
    }

    public FactionTheme getTheme() {
        return theme;
    }

    // ---- resources ----

    public int getResource(ResourceType type) {
        return resources.getOrDefault(type, 0);
    }

    public Map<ResourceType, Integer> getResources() {
        return Collections.unmodifiableMap(resources);
    }

    /**
     * Overwrites the stockpile, e.g. with the configured starting resources.
     *
     * @param amounts New amounts; kinds not listed become zero.
     */
    public void setResources(Map<ResourceType, Integer> amounts) {
        for (ResourceType type : ResourceType.values()) {
            int amount = amounts.getOrDefault(type, 0);
            if (amount < 0) {
                throw new IllegalArgumentException("Resource amount must not be negative: " + type + "=" + amount);
            }
            resources.put(type, amount);
        }
    }

    /**
     * @param costs Required amounts.
     * @return {@code true} if every amount is covered.
     */
    public boolean canAfford(Map<ResourceType, Integer> costs) {
        for (Map.Entry<ResourceType, Integer> cost : costs.entrySet()) {
            if (getResource(cost.getKey()) < cost.getValue()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Deducts all costs or nothing.
     *
     * @param costs Amounts to deduct, non-negative.
     * @return {@code false} without any change if the faction cannot afford the costs.
     * @throws IllegalArgumentException if any cost is negative.
     */
    public boolean spendResources(Map<ResourceType, Integer> costs) {
        for (Map.Entry<ResourceType, Integer> cost : costs.entrySet()) {
            if (cost.getValue() < 0) {
                throw new IllegalArgumentException("Negative cost for " + cost.getKey() + ": " + cost.getValue());
            }
        }
        if (!canAfford(costs)) {
            return false;
        }
        for (Map.Entry<ResourceType, Integer> cost : costs.entrySet()) {
            int remaining = getResource(cost.getKey()) - cost.getValue();
            if (remaining < 0) {
                throw new IllegalStateException("Resource " + cost.getKey() + " went negative after spend");
            }
            resources.put(cost.getKey(), remaining);
        }
        return true;
    }

    /**
     * Adds income and counts it as gathered.
     *
     * @param amounts Income per kind.
     */
    public void addResources(Map<ResourceType, Integer> amounts) {
        for (Map.Entry<ResourceType, Integer> entry : amounts.entrySet()) {
            int amount = Math.max(0, entry.getValue());
            resources.merge(entry.getKey(), amount, Integer::sum);
            resourcesGathered.merge(entry.getKey(), amount, Integer::sum);
        }
    }

    /**
     * Returns previously spent resources. Refunds are not counted as gathered.
     *
     * @param amounts Amounts to return.
     */
    public void refundResources(Map<ResourceType, Integer> amounts) {
        for (Map.Entry<ResourceType, Integer> entry : amounts.entrySet()) {
            resources.merge(entry.getKey(), Math.max(0, entry.getValue()), Integer::sum);
        }
    }

    public Map<ResourceType, Integer> getResourcesGathered() {
        return Collections.unmodifiableMap(resourcesGathered);
    }

    /**
     * @return Per-round generation of all operational buildings, before multipliers.
     */
    public EnumMap<ResourceType, Integer> getResourceIncome() {
        EnumMap<ResourceType, Integer> income = ResourceType.emptyMap();
        for (ResourceType type : ResourceType.values()) {
            income.put(type, 0);
        }
        for (Building building : buildings) {
            building.generateResources().forEach((type, amount) -> income.merge(type, amount, Integer::sum));
        }
        return income;
    }

    // ---- units ----

    /**
     * @param unit A unit owned by this faction's agent.
     * @return {@code false} if the unit cap is reached.
     * @throws IllegalArgumentException if the unit belongs to another agent.
     */
    public boolean addUnit(Unit unit) {
        requireOwned(unit);
        if (units.size() >= GameConstants.MAX_UNITS_PER_FACTION) {
            return false;
        }
        unit.setFactionId(factionId);
        units.add(unit);
        unitsCreated++;
        return true;
    }

    /**
     * @param unitId The unit to remove.
     * @return The removed unit, counted as lost.
     */
    public Optional<Unit> removeUnit(String unitId) {
        for (int i = 0; i < units.size(); i++) {
            if (units.get(i).getId().equals(unitId)) {
                unitsLost++;
                return Optional.of(units.remove(i));
            }
        }
        return Optional.empty();
    }

    public Optional<Unit> getUnit(String unitId) {
        for (Unit unit : units) {
            if (unit.getId().equals(unitId)) {
                return Optional.of(unit);
            }
        }
        return Optional.empty();
    }

    public List<Unit> getUnits() {
        return Collections.unmodifiableList(units);
    }

    public boolean hasUnitCapacity() {
        return units.size() < GameConstants.MAX_UNITS_PER_FACTION;
    }

    // ---- buildings ----

    /**
     * @param building A building owned by this faction's agent.
     * @return {@code false} if the building cap is reached.
     * @throws IllegalArgumentException if the building belongs to another agent.
     */
    public boolean addBuilding(Building building) {
        requireOwned(building);
        if (buildings.size() >= GameConstants.MAX_BUILDINGS_PER_FACTION) {
            return false;
        }
        building.setFactionId(factionId);
        buildings.add(building);
        buildingsConstructed++;
        return true;
    }

    public Optional<Building> removeBuilding(String buildingId) {
        for (int i = 0; i < buildings.size(); i++) {
            if (buildings.get(i).getId().equals(buildingId)) {
                return Optional.of(buildings.remove(i));
            }
        }
        return Optional.empty();
    }

    public Optional<Building> getBuilding(String buildingId) {
        for (Building building : buildings) {
            if (building.getId().equals(buildingId)) {
                return Optional.of(building);
            }
        }
        return Optional.empty();
    }

    public List<Building> getBuildings() {
        return Collections.unmodifiableList(buildings);
    }

    public boolean hasBuildingCapacity() {
        return buildings.size() < GameConstants.MAX_BUILDINGS_PER_FACTION;
    }

    private void requireOwned(Entity entity) {
        if (!ownerId.equals(entity.getOwnerId())) {
            throw new IllegalArgumentException("Entity " + entity.getId() + " is owned by "
                    + entity.getOwnerId() + ", not by " + ownerId);
        }
    }

    // ---- designs ----

    /**
     * @param design The design to add.
     * @return {@code false} if a unit design with that name already exists.
     */
    public boolean addUnitDesign(UnitDesign design) {
        return unitDesigns.putIfAbsent(design.name(), design) == null;
    }

    public Optional<UnitDesign> getUnitDesign(String name) {
        return Optional.ofNullable(unitDesigns.get(name));
    }

    public Map<String, UnitDesign> getUnitDesigns() {
        return Collections.unmodifiableMap(unitDesigns);
    }

    /**
     * @param design The design to add.
     * @return {@code false} if a building design with that name already exists.
     */
    public boolean addBuildingDesign(BuildingDesign design) {
        return buildingDesigns.putIfAbsent(design.name(), design) == null;
    }

    public Optional<BuildingDesign> getBuildingDesign(String name) {
        return Optional.ofNullable(buildingDesigns.get(name));
    }

    public Map<String, BuildingDesign> getBuildingDesigns() {
        return Collections.unmodifiableMap(buildingDesigns);
    }

    // ---- counters and relations ----

    public int getUnitsCreated() {
        return unitsCreated;
    }

    public int getUnitsLost() {
        return unitsLost;
    }

    public int getBuildingsConstructed() {
        return buildingsConstructed;
    }

    public Set<String> getAllies() {
        return Collections.unmodifiableSet(allies);
    }

    public Set<String> getEnemies() {
        return Collections.unmodifiableSet(enemies);
    }

    public void addAlly(String agentId) {
        enemies.remove(agentId);
        allies.add(agentId);
    }

    public void addEnemy(String agentId) {
        allies.remove(agentId);
        enemies.add(agentId);
    }

    /**
     * @return {@code true} while the faction has at least one unit or building.
     */
    public boolean isAlive() {
        return !units.isEmpty() || !buildings.isEmpty();
    }

    /**
     * Sum of {@code attack + defense + health} over living units.
     *
     * @return The military strength score used for turn-limit victories.
     */
    public int getMilitaryStrength() {
        int strength = 0;
        for (Unit unit : units) {
            if (unit.isAlive()) {
                strength += unit.getStats().getAttack() + unit.getStats().getDefense() + unit.getHealth();
            }
        }
        return strength;
    }

    /**
     * @return Sum of all resources in stock.
     */
    public int getTotalResources() {
        return ResourceType.total(resources);
    }
}
