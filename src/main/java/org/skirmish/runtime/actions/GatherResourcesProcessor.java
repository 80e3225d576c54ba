package org.skirmish.runtime.actions;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import org.skirmish.runtime.abilities.AbilityExecutionResult;
import org.skirmish.runtime.model.Faction;
import org.skirmish.runtime.model.GameState;
import org.skirmish.runtime.model.ResourceType;
import org.skirmish.runtime.model.Tile;
import org.skirmish.runtime.model.Unit;
import org.skirmish.runtime.spi.AbilityContext;
import org.skirmish.runtime.spi.ActionKind;
import org.skirmish.runtime.spi.ActionResult;

/**
 * {@code gather_resources}: a unit extracts resources from a node on or next to its tile.
 * Parameters: {@code unit_id}, {@code x}, {@code y}.
 * <p>
 * The base yield comes from the match settings; gather abilities raise the requested amount,
 * but a node never yields more than it holds. Each unit gathers at most once per turn.
 */
public class GatherResourcesProcessor extends AbstractActionProcessor {

    @Override
    protected ActionResult doProcess(ActionParameters params, Faction faction, GameState state)
            throws ActionValidationException {
        Unit unit = requireOwnUnit(faction, params.requireString("unit_id"));
        int x = params.requireInt("x");
        int y = params.requireInt("y");

        if (!unit.canGather()) {
            throw new ActionValidationException("Unit cannot gather this turn");
        }
        Tile tile = state.getMap().getTile(x, y);
        if (tile == null) {
            throw new ActionValidationException("Invalid target position");
        }
        if (unit.distanceTo(x, y) > 1) {
            throw new ActionValidationException("Resource node is not adjacent to the unit");
        }
        if (!tile.hasResourceNode()) {
            throw new ActionValidationException("No resources at (" + x + ", " + y + ")");
        }

        ResourceType type = tile.getResourceType();
        EnumMap<ResourceType, Integer> requested = ResourceType.emptyMap();
        requested.put(type, state.getSettings().getGatherYield());
        AbilityContext context = new AbilityContext(unit, ActionKind.GATHER, state).setResources(requested);
        AbilityExecutionResult abilities = state.getAbilityRegistry().executeAbilities(unit.getAbilityIds(), context);

        int extracted = tile.extractResource(context.getResources().getOrDefault(type, 0));
        EnumMap<ResourceType, Integer> gathered = ResourceType.emptyMap();
        gathered.put(type, extracted);
        faction.addResources(gathered);
        unit.markGathered();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("unit_id", unit.getId());
        details.put("resource", type.getId());
        details.put("gathered", extracted);
        details.put("remaining", tile.getResourceAmount());
        details.put("abilities_applied", abilities.applied());
        return ActionResult.ok(details);
    }
}
