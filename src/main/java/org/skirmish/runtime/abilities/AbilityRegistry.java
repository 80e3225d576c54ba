package org.skirmish.runtime.abilities;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.skirmish.runtime.spi.AbilityCategory;
import org.skirmish.runtime.spi.AbilityContext;
import org.skirmish.runtime.spi.IAbility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigFactory;

/**
 * Immutable catalog of abilities keyed by string id.
 * <p>
 * Entities reference abilities by id only. {@link #executeAbilities(Collection, AbilityContext)}
 * runs the requested ids in registration order, never in the order the entity lists them,
 * so the outcome of stacked modifiers is the same for every entity. Ids that are not
 * registered are skipped silently.
 * <p>
 * A registry is built once, either with a {@link Builder} or from the {@code abilities}
 * configuration list, and injected into the match.
 */
public final class AbilityRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(AbilityRegistry.class);

    /**
     * A registered ability with its category.
     */
    public record Entry(String id, IAbility ability, AbilityCategory category) {
    }

    private final Map<String, Entry> entries;

    private AbilityRegistry(Map<String, Entry> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads the registry from a list of ability blocks, each with {@code id}, {@code category},
     * {@code className} and an optional {@code options} block passed to the constructor.
     *
     * @param abilityConfigs The configured abilities in registration order.
     * @return The registry.
     * @throws IllegalStateException if a class cannot be instantiated.
     */
    public static AbilityRegistry fromConfig(List<? extends com.typesafe.config.Config> abilityConfigs) {
        Builder builder = builder();
        for (com.typesafe.config.Config abilityConfig : abilityConfigs) {
            String id = abilityConfig.getString("id");
            AbilityCategory category = AbilityCategory.fromId(abilityConfig.getString("category"));
            IAbility ability = createAbility(abilityConfig);
            builder.register(id, ability, category);
            LOG.debug("Registered ability '{}' ({}) as {}", id, category, ability.getClass().getSimpleName());
        }
        AbilityRegistry registry = builder.build();
        LOG.info("Loaded {} abilities", registry.size());
        return registry;
    }

    /**
     * @return The registry configured under {@code skirmish.abilities} in {@code reference.conf}.
     */
    public static AbilityRegistry createDefault() {
        return fromConfig(ConfigFactory.load().getConfig("skirmish").getConfigList("abilities"));
    }

    private static IAbility createAbility(com.typesafe.config.Config abilityConfig) {
        String className = abilityConfig.getString("className");
        com.typesafe.config.Config options = abilityConfig.hasPath("options")
                ? abilityConfig.getConfig("options")
                : ConfigFactory.empty();
        try {
            Class<?> clazz = Class.forName(className);
            Constructor<?> constructor = clazz.getConstructor(com.typesafe.config.Config.class);
            return (IAbility) constructor.newInstance(options);
        } catch (ReflectiveOperationException | ClassCastException e) {
            throw new IllegalStateException("Failed to instantiate ability class: " + className, e);
        }
    }

    /**
     * Executes every id in {@code abilityIds} that is registered and applicable, in
     * registration order. An ability that throws is recorded as failed and the others still
     * run.
     *
     * @param abilityIds The ids held by the acting entity.
     * @param context The shared context; working values are modified in place.
     * @return The applied and failed ids with their effects.
     */
    public AbilityExecutionResult executeAbilities(Collection<String> abilityIds, AbilityContext context) {
        if (abilityIds == null || abilityIds.isEmpty()) {
            return AbilityExecutionResult.empty();
        }
        List<String> applied = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        Map<String, Map<String, Object>> effects = new LinkedHashMap<>();
        for (Entry entry : entries.values()) {
            if (!abilityIds.contains(entry.id())) {
                continue;
            }
            try {
                if (entry.ability().canApply(context)) {
                    Map<String, Object> effect = entry.ability().apply(context);
                    applied.add(entry.id());
                    effects.put(entry.id(), effect != null ? effect : Map.of());
                }
            } catch (RuntimeException e) {
                LOG.warn("Ability '{}' failed for {} during {}: {}",
                        entry.id(), context.getOwner() != null ? context.getOwner().getId() : null,
                        context.getActionKind(), e.getMessage());
                failed.put(entry.id(), String.valueOf(e.getMessage()));
            }
        }
        return new AbilityExecutionResult(applied, failed, effects);
    }

    public Optional<IAbility> get(String id) {
        Entry entry = entries.get(id);
        return entry != null ? Optional.of(entry.ability()) : Optional.empty();
    }

    public Optional<AbilityCategory> getCategory(String id) {
        Entry entry = entries.get(id);
        return entry != null ? Optional.of(entry.category()) : Optional.empty();
    }

    public boolean contains(String id) {
        return entries.containsKey(id);
    }

    public int size() {
        return entries.size();
    }

    /**
     * @return All ids in registration order.
     */
    public List<String> listAbilityIds() {
        return List.copyOf(entries.keySet());
    }

    /**
     * @param category The category to list.
     * @return The ids of that category in registration order.
     */
    public List<String> listAbilityIds(AbilityCategory category) {
        List<String> ids = new ArrayList<>();
        for (Entry entry : entries.values()) {
            if (entry.category() == category) {
                ids.add(entry.id());
            }
        }
        return ids;
    }

    /**
     * Describes the catalog to decision makers.
     *
     * @param category The category to describe.
     * @return Id to description, in registration order.
     */
    public Map<String, String> describe(AbilityCategory category) {
        Map<String, String> descriptions = new LinkedHashMap<>();
        for (Entry entry : entries.values()) {
            if (entry.category() == category) {
                descriptions.put(entry.id(), entry.ability().getDescription());
            }
        }
        return descriptions;
    }

    /**
     * Collects abilities before the registry is frozen.
     */
    public static final class Builder {

        private final Map<String, Entry> entries = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * @throws IllegalArgumentException if the id is blank or already registered.
         */
        public Builder register(String id, IAbility ability, AbilityCategory category) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Ability id must not be blank");
            }
            if (entries.containsKey(id)) {
                throw new IllegalArgumentException("Ability '" + id + "' is already registered");
            }
            entries.put(id, new Entry(id, ability, category));
            return this;
        }

        public AbilityRegistry build() {
            return new AbilityRegistry(entries);
        }
    }
}
