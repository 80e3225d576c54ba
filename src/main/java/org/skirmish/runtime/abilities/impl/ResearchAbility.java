package org.skirmish.runtime.abilities.impl;

import java.util.Map;

import org.skirmish.runtime.abilities.AbstractAbility;
import org.skirmish.runtime.spi.AbilityContext;
import org.skirmish.runtime.spi.AbilityType;
import org.skirmish.runtime.spi.ActionKind;

/**
 * Reports that the building can research technologies.
 */
public class ResearchAbility extends AbstractAbility {

    private final double researchSpeed;

    public ResearchAbility(com.typesafe.config.Config options) {
        this(doubleOption(options, "researchSpeed", 1.0));
    }

    public ResearchAbility(double researchSpeed) {
        super("Research", "Can research technologies (speed: " + researchSpeed + "x)", AbilityType.ACTIVE);
        this.researchSpeed = researchSpeed;
    }

    @Override
    public boolean canApply(AbilityContext context) {
        return context.getActionKind() == ActionKind.RESEARCH && operationalBuilding(context) != null;
    }

    @Override
    public Map<String, Object> apply(AbilityContext context) {
        return Map.of("can_research", true, "research_speed", researchSpeed);
    }
}
