package org.skirmish.runtime.actions;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.skirmish.runtime.model.Faction;
import org.skirmish.runtime.model.GamePhase;
import org.skirmish.runtime.model.GameState;
import org.skirmish.runtime.model.UnitDesign;
import org.skirmish.runtime.model.UnitType;
import org.skirmish.runtime.spi.AbilityCategory;
import org.skirmish.runtime.spi.ActionResult;

/**
 * {@code design_unit}: registers a named unit design for the faction before play begins.
 * Parameters: {@code unit_name}, {@code unit_category}, {@code stats} ({@code health},
 * {@code attack}, {@code defense}, {@code movement_speed}, optional {@code attack_range} and
 * {@code sight_range}), optional {@code abilities}, {@code creation_cost},
 * {@code upkeep_cost} and {@code description}.
 */
public class DesignUnitProcessor extends AbstractActionProcessor {

    private static final Set<GamePhase> DESIGN_PHASES = EnumSet.of(GamePhase.SETUP, GamePhase.BALANCING);

    @Override
    protected Set<GamePhase> allowedPhases() {
        return DESIGN_PHASES;
    }

    @Override
    protected ActionResult doProcess(ActionParameters params, Faction faction, GameState state)
            throws ActionValidationException {
        String name = params.requireString("unit_name");
        UnitType category;
        try {
            category = UnitType.fromId(params.requireString("unit_category"));
        } catch (IllegalArgumentException e) {
            throw new ActionValidationException(e.getMessage());
        }
        Map<String, Object> rawStats = params.optionalMap("stats");
        if (rawStats == null) {
            throw new ActionValidationException("Missing parameter 'stats'");
        }
        ActionParameters stats = new ActionParameters(rawStats);
        List<String> abilities = params.stringList("abilities");
        for (String ability : abilities) {
            if (state.getAbilityRegistry().getCategory(ability).filter(c -> c == AbilityCategory.UNIT).isEmpty()) {
                throw new ActionValidationException("Unknown unit ability '" + ability + "'");
            }
        }

        UnitDesign design;
        try {
            design = new UnitDesign(name, params.optionalString("description"), category,
                    new UnitDesign.StatBlock(
                            stats.requireInt("health"),
                            stats.requireInt("attack"),
                            stats.requireInt("defense"),
                            stats.requireInt("movement_speed"),
                            stats.optionalInt("attack_range", 1),
                            stats.optionalInt("sight_range", 3)),
                    abilities,
                    params.optionalResources("creation_cost"),
                    params.optionalResources("upkeep_cost"));
        } catch (IllegalArgumentException e) {
            throw new ActionValidationException("Invalid unit design: " + e.getMessage());
        }
        if (!faction.addUnitDesign(design)) {
            throw new ActionValidationException("Unit design '" + name + "' already exists");
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("unit_design", design.name());
        details.put("unit_category", category.getId());
        details.put("abilities", design.abilities());
        return ActionResult.ok(details);
    }
}
