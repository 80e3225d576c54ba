package org.skirmish.runtime.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default properties per {@link BuildingType}, loaded from the {@code skirmish.buildings}
 * configuration block.
 * <p>
 * Agent designs only override what they specify; everything else comes from the template, and
 * the template's inherent abilities are always kept.
 */
public final class BuildingTemplates {

    private static final Logger LOG = LoggerFactory.getLogger(BuildingTemplates.class);

    /**
     * Defaults for one building type.
     */
    public record Template(BuildingType type, String description, int health, Set<UnitType> producesUnits,
                           Map<ResourceType, Integer> resourceGeneration, List<String> suggestedAbilities,
                           Set<String> inherentAbilities, Map<ResourceType, Integer> defaultCost) {

        public Template {
            producesUnits = producesUnits.isEmpty()
                    ? Collections.unmodifiableSet(EnumSet.noneOf(UnitType.class))
                    : Collections.unmodifiableSet(EnumSet.copyOf(producesUnits));
            resourceGeneration = ResourceType.immutableCopyOf(resourceGeneration);
            suggestedAbilities = List.copyOf(suggestedAbilities);
            inherentAbilities = Collections.unmodifiableSet(new LinkedHashSet<>(inherentAbilities));
            defaultCost = ResourceType.immutableCopyOf(defaultCost);
        }

        /**
         * @param name The design name.
         * @return A design with every property taken from this template.
         */
        public BuildingDesign toDesign(String name) {
            return new BuildingDesign(name, description, type, health, producesUnits, resourceGeneration,
                    Set.of(), inherentAbilities, defaultCost);
        }
    }

    private final Map<BuildingType, Template> templates;

    private BuildingTemplates(Map<BuildingType, Template> templates) {
        this.templates = Collections.unmodifiableMap(templates);
    }

    /**
     * Loads the templates.
     *
     * @param config The {@code buildings} configuration block, keyed by building type id.
     * @return The loaded templates.
     * @throws IllegalStateException if a building type has no template.
     */
    public static BuildingTemplates fromConfig(com.typesafe.config.Config config) {
        Map<BuildingType, Template> templates = new EnumMap<>(BuildingType.class);
        for (BuildingType type : BuildingType.values()) {
            if (!config.hasPath(type.getId())) {
                throw new IllegalStateException("Missing building template for '" + type.getId() + "'");
            }
            com.typesafe.config.Config block = config.getConfig(type.getId());
            Set<UnitType> produces = EnumSet.noneOf(UnitType.class);
            for (String category : block.getStringList("produces")) {
                produces.add(UnitType.fromId(category));
            }
            Template template = new Template(
                    type,
                    block.getString("description"),
                    block.getInt("health"),
                    produces,
                    readResources(block, "generation"),
                    block.getStringList("suggested-abilities"),
                    new LinkedHashSet<>(block.getStringList("inherent-abilities")),
                    readResources(block, "cost"));
            templates.put(type, template);
            LOG.debug("Loaded building template {}: health={}, produces={}", type.getId(), template.health(), produces);
        }
        return new BuildingTemplates(templates);
    }

    /**
     * Reads an optional resource map such as {@code cost { gold = 50 }}.
     *
     * @param config The enclosing block.
     * @param path The key of the map.
     * @return The amounts, empty when the path is absent.
     */
    public static EnumMap<ResourceType, Integer> readResources(com.typesafe.config.Config config, String path) {
        EnumMap<ResourceType, Integer> result = ResourceType.emptyMap();
        if (!config.hasPath(path)) {
            return result;
        }
        com.typesafe.config.Config block = config.getConfig(path);
        for (String key : block.root().keySet()) {
            result.put(ResourceType.fromId(key), block.getInt(key));
        }
        return result;
    }

    public Template get(BuildingType type) {
        return templates.get(type);
    }

    /**
     * Merges an agent's design with the template of its type.
     *
     * @param name Design name.
     * @param description Design description, template description when {@code null}.
     * @param type The building type.
     * @param health Health override, or {@code null}.
     * @param producesUnits Producible categories override, or {@code null}.
     * @param resourceGeneration Generation override, or {@code null}.
     * @param abilities Extra ability ids, or {@code null}.
     * @param creationCost Cost override, or {@code null}.
     * @return The merged design. Inherent abilities of the type are always included.
     */
    public BuildingDesign merge(String name, String description, BuildingType type, Integer health,
                                Set<UnitType> producesUnits, Map<ResourceType, Integer> resourceGeneration,
                                Set<String> abilities, Map<ResourceType, Integer> creationCost) {
        Template template = get(type);
        return new BuildingDesign(
                name,
                description != null ? description : template.description(),
                type,
                health != null ? health : template.health(),
                producesUnits != null ? producesUnits : template.producesUnits(),
                resourceGeneration != null ? resourceGeneration : template.resourceGeneration(),
                abilities,
                template.inherentAbilities(),
                creationCost != null ? creationCost : template.defaultCost());
    }
}
