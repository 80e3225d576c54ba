package org.skirmish.runtime.view;

import java.util.Locale;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;

/**
 * Renders snapshots and agent views as JSON with snake_case keys and lower-case enum values.
 */
public final class GameStateSerializer {

    private static final Gson GSON = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .registerTypeHierarchyAdapter(Enum.class,
                    (JsonSerializer<Enum<?>>) (src, type, context) ->
                            new JsonPrimitive(src.name().toLowerCase(Locale.ROOT)))
            .serializeNulls()
            .setPrettyPrinting()
            .create();

    private GameStateSerializer() {
    }

    public static String toJson(GameStateSnapshot snapshot) {
        return GSON.toJson(snapshot);
    }

    public static String toJson(AgentView view) {
        return GSON.toJson(view);
    }

    /**
     * @return The shared Gson instance, for callers that serialize other engine records.
     */
    public static Gson gson() {
        return GSON;
    }
}
