package org.skirmish.runtime.abilities;

import org.skirmish.runtime.model.Building;
import org.skirmish.runtime.model.Unit;
import org.skirmish.runtime.spi.AbilityContext;
import org.skirmish.runtime.spi.AbilityType;
import org.skirmish.runtime.spi.IAbility;

/**
 * Base class holding the descriptive fields of an ability.
 */
public abstract class AbstractAbility implements IAbility {

    private final String name;
    private final String description;
    private final AbilityType type;

    protected AbstractAbility(String name, String description, AbilityType type) {
        this.name = name;
        this.description = description;
        this.type = type;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public AbilityType getType() {
        return type;
    }

    /**
     * @param context The execution context.
     * @return The owner as a unit, or {@code null} if the owner is not a unit.
     */
    protected static Unit ownerUnit(AbilityContext context) {
        return context.getOwner() instanceof Unit unit ? unit : null;
    }

    /**
     * @param context The execution context.
     * @return The owner as an operational building, or {@code null} otherwise.
     */
    protected static Building operationalBuilding(AbilityContext context) {
        if (context.getOwner() instanceof Building building && building.isOperational()) {
            return building;
        }
        return null;
    }

    /**
     * Reads an optional number from the ability options.
     */
    protected static double doubleOption(com.typesafe.config.Config options, String path, double defaultValue) {
        return options.hasPath(path) ? options.getDouble(path) : defaultValue;
    }

    protected static int intOption(com.typesafe.config.Config options, String path, int defaultValue) {
        return options.hasPath(path) ? options.getInt(path) : defaultValue;
    }
}
