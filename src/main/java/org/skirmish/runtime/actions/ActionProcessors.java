package org.skirmish.runtime.actions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.skirmish.runtime.spi.IActionProcessor;

/**
 * Action type keys and the default processor set.
 */
public final class ActionProcessors {

    public static final String MOVE_UNIT = "move_unit";
    public static final String ATTACK_UNIT = "attack_unit";
    public static final String CREATE_UNIT = "create_unit";
    public static final String BUILD_STRUCTURE = "build_structure";
    public static final String FORTIFY_UNIT = "fortify_unit";
    public static final String HEAL_UNIT = "heal_unit";
    public static final String GATHER_RESOURCES = "gather_resources";
    public static final String DESIGN_UNIT = "design_unit";
    public static final String DESIGN_BUILDING = "design_building";

    private ActionProcessors() {
    }

    /**
     * @return A new map of every built-in processor keyed by action type.
     */
    public static Map<String, IActionProcessor> defaults() {
        Map<String, IActionProcessor> processors = new LinkedHashMap<>();
        processors.put(MOVE_UNIT, new MoveUnitProcessor());
        processors.put(ATTACK_UNIT, new AttackUnitProcessor());
        processors.put(CREATE_UNIT, new CreateUnitProcessor());
        processors.put(BUILD_STRUCTURE, new BuildStructureProcessor());
        processors.put(FORTIFY_UNIT, new FortifyUnitProcessor());
        processors.put(HEAL_UNIT, new HealUnitProcessor());
        processors.put(GATHER_RESOURCES, new GatherResourcesProcessor());
        processors.put(DESIGN_UNIT, new DesignUnitProcessor());
        processors.put(DESIGN_BUILDING, new DesignBuildingProcessor());
        return Collections.unmodifiableMap(processors);
    }
}
