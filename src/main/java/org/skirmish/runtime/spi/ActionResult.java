package org.skirmish.runtime.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one processed action.
 *
 * @param success Whether the action changed the game as requested.
 * @param error Failure reason, {@code null} on success.
 * @param critical Whether the failure must end the agent's turn.
 * @param details Action-specific fields such as {@code damage_dealt} or {@code units_created}.
 */
public record ActionResult(boolean success, String error, boolean critical, Map<String, Object> details) {

    public ActionResult {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static ActionResult ok(Map<String, Object> details) {
        return new ActionResult(true, null, false, details);
    }

    public static ActionResult ok() {
        return new ActionResult(true, null, false, Map.of());
    }

    public static ActionResult failure(String error) {
        return new ActionResult(false, error, false, Map.of());
    }

    public static ActionResult critical(String error) {
        return new ActionResult(false, error, true, Map.of());
    }

    /**
     * @param key A detail key.
     * @return The detail value, or {@code null}.
     */
    public Object get(String key) {
        return details.get(key);
    }
}
