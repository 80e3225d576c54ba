package org.skirmish.runtime.spi;

import java.util.EnumMap;

import org.skirmish.runtime.model.Entity;
import org.skirmish.runtime.model.GameState;
import org.skirmish.runtime.model.ResourceType;

/**
 * Input and output channel between the engine and abilities.
 * <p>
 * The caller seeds the working values, runs the abilities through the registry and reads the
 * working values back. Optional fields ({@code target}, {@code gameState}, {@code resources})
 * may be {@code null} and every ability checks them itself.
 */
public class AbilityContext {

    private final Entity owner;
    private final ActionKind actionKind;
    private final GameState gameState;
    private Entity target;
    private int workingDamage;
    private int workingDefense;
    private int workingSightRange;
    private int distance;
    private int turnNumber;
    private EnumMap<ResourceType, Integer> resources;

    /**
     * @param owner The entity whose abilities run.
     * @param actionKind What triggered the execution.
     * @param gameState The match, or {@code null} outside a match.
     */
    public AbilityContext(Entity owner, ActionKind actionKind, GameState gameState) {
        this.owner = owner;
        this.actionKind = actionKind;
        this.gameState = gameState;
        this.turnNumber = gameState != null ? gameState.getTurnNumber() : 0;
    }

    public Entity getOwner() {
        return owner;
    }

    public ActionKind getActionKind() {
        return actionKind;
    }

    public GameState getGameState() {
        return gameState;
    }

    public Entity getTarget() {
        return target;
    }

    public AbilityContext setTarget(Entity target) {
        this.target = target;
        return this;
    }

    public int getWorkingDamage() {
        return workingDamage;
    }

    public AbilityContext setWorkingDamage(int workingDamage) {
        this.workingDamage = workingDamage;
        return this;
    }

    public int getWorkingDefense() {
        return workingDefense;
    }

    public AbilityContext setWorkingDefense(int workingDefense) {
        this.workingDefense = workingDefense;
        return this;
    }

    public int getWorkingSightRange() {
        return workingSightRange;
    }

    public AbilityContext setWorkingSightRange(int workingSightRange) {
        this.workingSightRange = workingSightRange;
        return this;
    }

    public int getDistance() {
        return distance;
    }

    public AbilityContext setDistance(int distance) {
        this.distance = distance;
        return this;
    }

    public int getTurnNumber() {
        return turnNumber;
    }

    public AbilityContext setTurnNumber(int turnNumber) {
        this.turnNumber = turnNumber;
        return this;
    }

    /**
     * @return The mutable working copy of resource amounts, or {@code null}.
     */
    public EnumMap<ResourceType, Integer> getResources() {
        return resources;
    }

    /**
     * Stores a working copy of the given amounts; abilities modify the copy in place.
     *
     * @param resources The amounts, or {@code null} to clear.
     * @return This context.
     */
    public AbilityContext setResources(java.util.Map<ResourceType, Integer> resources) {
        this.resources = resources == null ? null : ResourceType.copyOf(resources);
        return this;
    }
}
