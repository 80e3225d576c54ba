package org.skirmish.runtime.actions;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import org.skirmish.runtime.abilities.AbilityExecutionResult;
import org.skirmish.runtime.model.Building;
import org.skirmish.runtime.model.BuildingDesign;
import org.skirmish.runtime.model.BuildingType;
import org.skirmish.runtime.model.Faction;
import org.skirmish.runtime.model.GameState;
import org.skirmish.runtime.model.ResourceType;
import org.skirmish.runtime.model.Tile;
import org.skirmish.runtime.model.Unit;
import org.skirmish.runtime.spi.AbilityContext;
import org.skirmish.runtime.spi.ActionKind;
import org.skirmish.runtime.spi.ActionResult;

/**
 * {@code build_structure}: places a new building next to a builder unit.
 * Parameters: {@code builder_id}, {@code x}, {@code y}, and either {@code building_design}
 * (name of a custom design) or {@code building_type} (template defaults).
 * <p>
 * The builder must hold an applicable {@code build} ability and stand within one tile of the
 * target. New buildings are under construction until the end of the current round.
 */
public class BuildStructureProcessor extends AbstractActionProcessor {

    @Override
    protected ActionResult doProcess(ActionParameters params, Faction faction, GameState state)
            throws ActionValidationException {
        Unit builder = requireOwnUnit(faction, params.requireString("builder_id"));
        int x = params.requireInt("x");
        int y = params.requireInt("y");
        BuildingDesign design = resolveDesign(params, faction, state);

        if (!builder.isAlive()) {
            throw new ActionValidationException("Builder " + builder.getId() + " is dead");
        }
        if (builder.distanceTo(x, y) > 1) {
            throw new ActionValidationException("Target position is not adjacent to the builder");
        }
        Tile tile = state.getMap().getTile(x, y);
        if (tile == null) {
            throw new ActionValidationException("Invalid target position");
        }
        if (!tile.canPlaceBuilding()) {
            throw new ActionValidationException("Cannot build on (" + x + ", " + y + ")");
        }
        if (!faction.hasBuildingCapacity()) {
            throw new ActionValidationException("Building limit reached");
        }
        AbilityExecutionResult abilities = state.getAbilityRegistry().executeAbilities(builder.getAbilityIds(),
                new AbilityContext(builder, ActionKind.BUILD, state));
        if (!abilities.wasApplied("build")) {
            throw new ActionValidationException("Unit " + builder.getId() + " cannot build");
        }

        EnumMap<ResourceType, Integer> cost =
                ResourceType.scale(design.creationCost(), state.getBalance().buildingCostMultiplier());
        if (!faction.spendResources(cost)) {
            throw new ActionValidationException("Insufficient resources: need " + cost
                    + ", have " + faction.getResources());
        }
        Building building = design.instantiate(state.nextEntityId("building"), faction.getOwnerId(), x, y, false);
        if (!state.placeBuilding(faction, building)) {
            faction.refundResources(cost);
            throw new IllegalStateException("Building placement failed after validation at (" + x + ", " + y + ")");
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("building_id", building.getId());
        details.put("building_type", building.getType().getId());
        details.put("position", Map.of("x", x, "y", y));
        details.put("cost", cost);
        details.put("construction_complete", building.isConstructionComplete());
        return ActionResult.ok(details);
    }

    private static BuildingDesign resolveDesign(ActionParameters params, Faction faction, GameState state)
            throws ActionValidationException {
        String designName = params.optionalString("building_design");
        if (designName != null) {
            return faction.getBuildingDesign(designName)
                    .orElseThrow(() -> new ActionValidationException("Building design '" + designName + "' not found"));
        }
        BuildingType type;
        try {
            type = BuildingType.fromId(params.requireString("building_type"));
        } catch (IllegalArgumentException e) {
            throw new ActionValidationException(e.getMessage());
        }
        return state.getSettings().getBuildingTemplates().get(type).toDesign(type.getId());
    }
}
