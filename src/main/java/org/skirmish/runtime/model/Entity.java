package org.skirmish.runtime.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Common state of everything that sits on a tile and belongs to a faction.
 * <p>
 * Positions are changed by {@link GameState} only, together with tile occupancy.
 */
public abstract class Entity {

    private final String id;
    private final String name;
    private final String ownerId;
    private String factionId;
    private int x;
    private int y;
    protected final Set<String> abilityIds = new LinkedHashSet<>();
    private final EnumMap<ResourceType, Integer> creationCost;

    protected Entity(String id, String name, String ownerId, int x, int y,
                     Set<String> abilityIds, Map<ResourceType, Integer> creationCost) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Entity id must not be blank");
        }
        this.id = id;
        this.name = name;
        this.ownerId = ownerId;
        this.x = x;
        this.y = y;
        if (abilityIds != null) {
            this.abilityIds.addAll(abilityIds);
        }
        this.creationCost = ResourceType.copyOf(creationCost);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /**
     * @return The id of the agent controlling this entity.
     */
    public String getOwnerId() {
        return ownerId;
    }

    public String getFactionId() {
        return factionId;
    }

    void setFactionId(String factionId) {
        this.factionId = factionId;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    void setPosition(int x, int y) {
        this.x = x;
        this.y = y;
    }

    /**
     * @param otherX Column.
     * @param otherY Row.
     * @return Manhattan distance from this entity to the position.
     */
    public int distanceTo(int otherX, int otherY) {
        return Math.abs(x - otherX) + Math.abs(y - otherY);
    }

    public int distanceTo(Entity other) {
        return distanceTo(other.getX(), other.getY());
    }

    /**
     * @return The ability ids in insertion order, read-only.
     */
    public Set<String> getAbilityIds() {
        return Collections.unmodifiableSet(abilityIds);
    }

    public boolean hasAbility(String abilityId) {
        return abilityIds.contains(abilityId);
    }

    public void addAbility(String abilityId) {
        abilityIds.add(abilityId);
    }

    public Map<ResourceType, Integer> getCreationCost() {
        return Collections.unmodifiableMap(creationCost);
    }

    public abstract int getHealth();

    public abstract int getMaxHealth();

    /**
     * @return The defense value used when this entity is attacked, before modifiers.
     */
    public abstract int getDefense();

    /**
     * Reduces health, clamping at zero.
     *
     * @param damage The damage, non-negative.
     * @return The health actually lost.
     */
    public abstract int takeDamage(int damage);

    /**
     * @return {@code true} once health has reached zero.
     */
    public abstract boolean isDestroyed();
}
