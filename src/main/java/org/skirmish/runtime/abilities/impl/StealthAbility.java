package org.skirmish.runtime.abilities.impl;

import java.util.Map;

import org.skirmish.runtime.abilities.AbstractAbility;
import org.skirmish.runtime.spi.AbilityContext;
import org.skirmish.runtime.spi.AbilityType;
import org.skirmish.runtime.spi.ActionKind;

/**
 * Reports that the unit moves unseen. Visibility is only ever computed from the observer's
 * side, so this ability has no effect on what other factions see.
 */
public class StealthAbility extends AbstractAbility {

    private final int detectionPenalty;

    public StealthAbility(com.typesafe.config.Config options) {
        this(intOption(options, "detectionPenalty", 2));
    }

    public StealthAbility(int detectionPenalty) {
        super("Stealth", "Harder to detect; enemies need to be " + detectionPenalty + " tiles closer",
                AbilityType.PASSIVE);
        this.detectionPenalty = detectionPenalty;
    }

    @Override
    public boolean canApply(AbilityContext context) {
        return context.getActionKind() == ActionKind.OBSERVE && ownerUnit(context) != null;
    }

    @Override
    public Map<String, Object> apply(AbilityContext context) {
        return Map.of("stealth_active", true, "detection_penalty", detectionPenalty);
    }
}
