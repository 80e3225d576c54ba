package org.skirmish.runtime.spi;

import java.util.Map;

/**
 * A named effect that modifies combat, economy or visibility outcomes.
 * <p>
 * Abilities are stateless once constructed and are shared by every entity that lists their
 * id. They communicate with the engine only through the {@link AbilityContext}: working
 * values are changed in place, and the returned map describes what happened.
 * </p>
 * <p>
 * Implementations loaded from configuration must provide a public constructor with signature:
 * {@code (com.typesafe.config.Config options)}
 * </p>
 */
public interface IAbility {

    String getName();

    String getDescription();

    AbilityType getType();

    /**
     * @param context The execution context.
     * @return {@code true} if this ability applies in the given situation.
     */
    boolean canApply(AbilityContext context);

    /**
     * Applies the effect. Only called after {@link #canApply(AbilityContext)} returned {@code true}.
     *
     * @param context The execution context, mutated in place.
     * @return A description of the effect, keyed by snake_case names.
     */
    Map<String, Object> apply(AbilityContext context);
}
