package org.skirmish.runtime.actions;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.skirmish.runtime.model.BuildingDesign;
import org.skirmish.runtime.model.BuildingType;
import org.skirmish.runtime.model.Faction;
import org.skirmish.runtime.model.GamePhase;
import org.skirmish.runtime.model.GameState;
import org.skirmish.runtime.model.UnitType;
import org.skirmish.runtime.spi.AbilityCategory;
import org.skirmish.runtime.spi.ActionResult;

/**
 * {@code design_building}: registers a named building design, merged with the template of its
 * type. Parameters: {@code building_name}, {@code building_type}, optional {@code description},
 * {@code health}, {@code produces_units}, {@code resource_generation}, {@code abilities} and
 * {@code creation_cost}.
 */
public class DesignBuildingProcessor extends AbstractActionProcessor {

    private static final Set<GamePhase> DESIGN_PHASES = EnumSet.of(GamePhase.SETUP, GamePhase.BALANCING);

    @Override
    protected Set<GamePhase> allowedPhases() {
        return DESIGN_PHASES;
    }

    @Override
    protected ActionResult doProcess(ActionParameters params, Faction faction, GameState state)
            throws ActionValidationException {
        String name = params.requireString("building_name");
        Set<UnitType> produces = null;
        BuildingType type;
        try {
            type = BuildingType.fromId(params.requireString("building_type"));
            if (params.has("produces_units")) {
                produces = EnumSet.noneOf(UnitType.class);
                for (String category : params.stringList("produces_units")) {
                    produces.add(UnitType.fromId(category));
                }
            }
        } catch (IllegalArgumentException e) {
            throw new ActionValidationException(e.getMessage());
        }
        List<String> abilities = params.stringList("abilities");
        for (String ability : abilities) {
            if (state.getAbilityRegistry().getCategory(ability).filter(c -> c == AbilityCategory.BUILDING).isEmpty()) {
                throw new ActionValidationException("Unknown building ability '" + ability + "'");
            }
        }

        BuildingDesign design;
        try {
            design = state.getSettings().getBuildingTemplates().merge(
                    name,
                    params.optionalString("description"),
                    type,
                    params.optionalInteger("health"),
                    produces,
                    params.optionalResources("resource_generation"),
                    new LinkedHashSet<>(abilities),
                    params.optionalResources("creation_cost"));
        } catch (IllegalArgumentException e) {
            throw new ActionValidationException("Invalid building design: " + e.getMessage());
        }
        if (!faction.addBuildingDesign(design)) {
            throw new ActionValidationException("Building design '" + name + "' already exists");
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("building_design", design.name());
        details.put("building_type", type.getId());
        details.put("abilities", List.copyOf(design.abilities()));
        return ActionResult.ok(details);
    }
}
