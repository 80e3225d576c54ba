package org.skirmish.runtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of the match event log.
 *
 * @param type Event type such as {@code unit_destroyed}.
 * @param timestamp Wall-clock time in epoch milliseconds.
 * @param turn Turn number when the event happened.
 * @param data Event-specific payload.
 */
public record GameEvent(String type, long timestamp, int turn, Map<String, Object> data) {

    public static final String FACTION_ADDED = "faction_added";
    public static final String PHASE_CHANGED = "phase_changed";
    public static final String UNIT_DESTROYED = "unit_destroyed";
    public static final String BUILDING_DESTROYED = "building_destroyed";
    public static final String ROUND_COMPLETED = "round_completed";
    public static final String GAME_ENDED = "game_ended";

    public GameEvent {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
