package org.skirmish.runtime.actions;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import org.skirmish.runtime.GameConstants;
import org.skirmish.runtime.abilities.AbilityExecutionResult;
import org.skirmish.runtime.model.Building;
import org.skirmish.runtime.model.Faction;
import org.skirmish.runtime.model.GameState;
import org.skirmish.runtime.model.ResourceType;
import org.skirmish.runtime.model.Tile;
import org.skirmish.runtime.model.Unit;
import org.skirmish.runtime.model.UnitDesign;
import org.skirmish.runtime.spi.AbilityContext;
import org.skirmish.runtime.spi.ActionKind;
import org.skirmish.runtime.spi.ActionResult;

/**
 * {@code create_unit}: produces units from a custom design at an own building.
 * Parameters: {@code building_id}, {@code unit_design} (design name), optional
 * {@code quantity} (default 1, at most the faction unit cap).
 * <p>
 * The full cost is paid up front. Units are placed on free passable tiles around the
 * building; the cost of every unit that found no tile, or hit the faction's unit cap, is
 * refunded exactly.
 */
public class CreateUnitProcessor extends AbstractActionProcessor {

    @Override
    protected ActionResult doProcess(ActionParameters params, Faction faction, GameState state)
            throws ActionValidationException {
        String buildingId = params.requireString("building_id");
        String designName = params.requireString("unit_design");
        int quantity = params.optionalInt("quantity", 1);
        if (quantity < 1) {
            throw new ActionValidationException("Quantity must be at least 1");
        }
        if (quantity > GameConstants.MAX_UNITS_PER_FACTION) {
            throw new ActionValidationException("Quantity must not exceed " + GameConstants.MAX_UNITS_PER_FACTION);
        }

        Building building = faction.getBuilding(buildingId)
                .orElseThrow(() -> new ActionValidationException("Building " + buildingId + " not found"));
        if (!building.isConstructionComplete()) {
            throw new ActionValidationException("Building " + buildingId + " is not complete");
        }
        UnitDesign design = faction.getUnitDesign(designName)
                .orElseThrow(() -> new ActionValidationException("Unit design '" + designName + "' not found"));
        if (!building.canProduce(design.category())) {
            throw new ActionValidationException("Building " + buildingId + " cannot produce "
                    + design.category().getId() + " units");
        }

        EnumMap<ResourceType, Integer> perUnit =
                ResourceType.scale(design.creationCost(), state.getBalance().unitCostMultiplier());
        EnumMap<ResourceType, Integer> total;
        try {
            total = ResourceType.times(perUnit, quantity);
        } catch (ArithmeticException e) {
            throw new ActionValidationException("Total cost of " + quantity + " units overflows");
        }
        if (!faction.spendResources(total)) {
            throw new ActionValidationException("Insufficient resources: need " + total
                    + ", have " + faction.getResources());
        }

        List<String> created = new ArrayList<>();
        for (Tile tile : state.getMap().getNeighbours(building.getX(), building.getY())) {
            if (created.size() == quantity || !faction.hasUnitCapacity()) {
                break;
            }
            if (!tile.canPlaceUnit()) {
                continue;
            }
            Unit unit = new Unit(state.nextEntityId("unit"), design.name(), design.category(), faction.getOwnerId(),
                    tile.getX(), tile.getY(), design.stats().toUnitStats(), new LinkedHashSet<>(design.abilities()),
                    perUnit, design.upkeepCost());
            if (state.spawnUnit(faction, unit)) {
                created.add(unit.getId());
            }
        }

        int missing = quantity - created.size();
        EnumMap<ResourceType, Integer> refund = ResourceType.times(perUnit, missing);
        if (missing > 0) {
            faction.refundResources(refund);
            log.debug("Agent {} placed {} of {} units, refunded {}", faction.getOwnerId(), created.size(), quantity, refund);
        }

        AbilityExecutionResult abilities = state.getAbilityRegistry().executeAbilities(building.getAbilityIds(),
                new AbilityContext(building, ActionKind.CREATE_UNIT, state));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("units_created", created.size());
        details.put("unit_ids", created);
        details.put("cost_per_unit", perUnit);
        details.put("total_cost", ResourceType.times(perUnit, created.size()));
        details.put("refunded", refund);
        details.put("abilities_applied", abilities.applied());
        return ActionResult.ok(details);
    }
}
