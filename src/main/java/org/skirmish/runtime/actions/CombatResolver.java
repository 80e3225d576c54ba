package org.skirmish.runtime.actions;

import java.util.ArrayList;
import java.util.List;

import org.skirmish.runtime.GameConstants;
import org.skirmish.runtime.abilities.AbilityExecutionResult;
import org.skirmish.runtime.model.Entity;
import org.skirmish.runtime.model.GameState;
import org.skirmish.runtime.model.Unit;
import org.skirmish.runtime.spi.AbilityContext;
import org.skirmish.runtime.spi.ActionKind;

/**
 * Resolves a single attack.
 * <p>
 * Base damage is the attacker's attack, base defense the target's defense (multiplied when
 * the target is fortified). The attacker's abilities run first, then the target's, and the
 * working values carry over between the two passes. The combat damage multiplier scales the
 * resulting damage, and every hit deals at least {@link GameConstants#MINIMUM_DAMAGE}.
 */
public final class CombatResolver {

    /**
     * Outcome of an attack.
     *
     * @param success Whether the attack happened.
     * @param error Why it did not happen, {@code null} on success.
     * @param damageDealt Damage of the hit after defense, at least the minimum damage.
     * @param healthLost Health the target actually lost, at most its remaining health.
     * @param targetDestroyed Whether the target reached zero health.
     * @param targetRemainingHealth Target health after the hit.
     * @param attackerLeveledUp Whether the attacker gained a veterancy level.
     * @param abilitiesApplied Ids applied by attacker and target, attacker first.
     */
    public record CombatOutcome(boolean success, String error, int damageDealt, int healthLost,
                                boolean targetDestroyed, int targetRemainingHealth, boolean attackerLeveledUp,
                                List<String> abilitiesApplied) {

        public CombatOutcome {
            abilitiesApplied = List.copyOf(abilitiesApplied);
        }

        static CombatOutcome failed(String error) {
            return new CombatOutcome(false, error, 0, 0, false, 0, false, List.of());
        }
    }

    private CombatResolver() {
    }

    /**
     * @param attacker The attacking unit.
     * @param target The attacked unit or building.
     * @param state The match, used for abilities and balance.
     * @return The outcome; on failure nothing was changed.
     */
    public static CombatOutcome attack(Unit attacker, Entity target, GameState state) {
        if (!attacker.canAttack()) {
            return CombatOutcome.failed("Attacker cannot attack (already attacked or dead)");
        }
        if (target.isDestroyed()) {
            return CombatOutcome.failed("Target is already destroyed");
        }
        if (attacker.distanceTo(target) > attacker.getStats().getAttackRange()) {
            return CombatOutcome.failed("Target out of range");
        }

        int baseDefense = target.getDefense();
        if (target instanceof Unit unit && unit.isFortified()) {
            baseDefense = (int) (baseDefense * GameConstants.FORTIFY_DEFENSE_MULTIPLIER);
        }
        AbilityContext context = new AbilityContext(attacker, ActionKind.ATTACK, state)
                .setTarget(target)
                .setWorkingDamage(attacker.getStats().getAttack())
                .setWorkingDefense(baseDefense)
                .setDistance(attacker.distanceTo(target));

        AbilityExecutionResult attackAbilities =
                state.getAbilityRegistry().executeAbilities(attacker.getAbilityIds(), context);
        AbilityContext defendContext = new AbilityContext(target, ActionKind.DEFEND, state)
                .setTarget(attacker)
                .setWorkingDamage(context.getWorkingDamage())
                .setWorkingDefense(context.getWorkingDefense())
                .setDistance(context.getDistance());
        AbilityExecutionResult defendAbilities =
                state.getAbilityRegistry().executeAbilities(target.getAbilityIds(), defendContext);

        int damage = (int) (defendContext.getWorkingDamage() * state.getBalance().combatDamageMultiplier());
        int finalDamage = Math.max(GameConstants.MINIMUM_DAMAGE, damage - defendContext.getWorkingDefense());
        int healthLost = target.takeDamage(finalDamage);

        attacker.markAttacked();
        boolean leveledUp = attacker.gainExperience(GameConstants.EXPERIENCE_PER_ATTACK);

        List<String> applied = new ArrayList<>(attackAbilities.applied());
        applied.addAll(defendAbilities.applied());
        return new CombatOutcome(true, null, finalDamage, healthLost, target.isDestroyed(), target.getHealth(),
                leveledUp, applied);
    }
}
