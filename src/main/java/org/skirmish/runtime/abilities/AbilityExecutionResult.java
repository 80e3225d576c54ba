package org.skirmish.runtime.abilities;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What happened during one {@link AbilityRegistry#executeAbilities} call.
 *
 * @param applied Ids whose effect was applied, in execution order.
 * @param failed Ids whose {@code canApply} or {@code apply} threw, with the error message.
 * @param effects Effect description per applied id.
 */
public record AbilityExecutionResult(List<String> applied, Map<String, String> failed,
                                     Map<String, Map<String, Object>> effects) {

    private static final AbilityExecutionResult EMPTY = new AbilityExecutionResult(List.of(), Map.of(), Map.of());

    public AbilityExecutionResult {
        applied = List.copyOf(applied);
        failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
        effects = Collections.unmodifiableMap(new LinkedHashMap<>(effects));
    }

    public static AbilityExecutionResult empty() {
        return EMPTY;
    }

    public boolean wasApplied(String abilityId) {
        return applied.contains(abilityId);
    }

    /**
     * @param abilityId An applied ability.
     * @return Its effect map, empty if the ability was not applied.
     */
    public Map<String, Object> effectOf(String abilityId) {
        return effects.getOrDefault(abilityId, Map.of());
    }
}
