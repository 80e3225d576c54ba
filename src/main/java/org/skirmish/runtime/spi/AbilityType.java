package org.skirmish.runtime.spi;

/**
 * When an ability is meant to trigger. Informational: the registry decides applicability
 * through {@link IAbility#canApply(AbilityContext)} alone.
 */
public enum AbilityType {
    PASSIVE,
    ON_ATTACK,
    ON_DEFEND,
    ON_MOVE,
    ON_TURN,
    ACTIVE
}
