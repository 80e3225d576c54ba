package org.skirmish.runtime.view;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.skirmish.runtime.model.Building;
import org.skirmish.runtime.model.BuildingDesign;
import org.skirmish.runtime.model.Faction;
import org.skirmish.runtime.model.FactionTheme;
import org.skirmish.runtime.model.ResourceType;
import org.skirmish.runtime.model.Unit;
import org.skirmish.runtime.model.UnitDesign;

/**
 * Complete, immutable copy of a faction.
 */
public record FactionView(String factionId, String ownerId, String name, FactionTheme theme,
                          Map<ResourceType, Integer> resources, List<UnitView> units, List<BuildingView> buildings,
                          Map<String, UnitDesign> customUnitDesigns, Map<String, BuildingDesign> customBuildingDesigns,
                          int unitsCreated, int unitsLost, int buildingsConstructed,
                          Map<ResourceType, Integer> resourcesGathered, List<String> allies, List<String> enemies) {

    public FactionView {
        resources = ResourceType.immutableCopyOf(resources);
        units = List.copyOf(units);
        buildings = List.copyOf(buildings);
        customUnitDesigns = Collections.unmodifiableMap(new LinkedHashMap<>(customUnitDesigns));
        customBuildingDesigns = Collections.unmodifiableMap(new LinkedHashMap<>(customBuildingDesigns));
        resourcesGathered = ResourceType.immutableCopyOf(resourcesGathered);
        allies = List.copyOf(allies);
        enemies = List.copyOf(enemies);
    }

    public static FactionView of(Faction faction) {
        List<UnitView> units = new ArrayList<>();
        for (Unit unit : faction.getUnits()) {
            units.add(UnitView.of(unit));
        }
        List<BuildingView> buildings = new ArrayList<>();
        for (Building building : faction.getBuildings()) {
            buildings.add(BuildingView.of(building));
        }
        return new FactionView(faction.getFactionId(), faction.getOwnerId(), faction.getName(), faction.getTheme(),
                faction.getResources(), units, buildings, faction.getUnitDesigns(), faction.getBuildingDesigns(),
                faction.getUnitsCreated(), faction.getUnitsLost(), faction.getBuildingsConstructed(),
                faction.getResourcesGathered(), List.copyOf(faction.getAllies()), List.copyOf(faction.getEnemies()));
    }
}
