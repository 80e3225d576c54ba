package org.skirmish.runtime.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Set;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.skirmish.runtime.GameConstants;
import org.skirmish.test.utils.MatchTestUtils;

@Tag("unit")
class UnitTest {

    private static Unit unit(UnitStats stats) {
        return new Unit("unit-1", "Spearman", UnitType.INFANTRY, "agent-a", 2, 2, stats, Set.of());
    }

    @Test
    void statsOutsideCapsAreRejected() {
        assertThatThrownBy(() -> new UnitStats(100, 101, 10, 5, 3, 1, 3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("max_health");
        assertThatThrownBy(() -> new UnitStats(50, 50, 51, 5, 3, 1, 3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("attack");
        assertThatThrownBy(() -> new UnitStats(50, 50, 10, 31, 3, 1, 3))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new UnitStats(50, 50, 10, 5, 11, 1, 3))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new UnitStats(50, 50, 10, 5, 3, 0, 3))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new UnitStats(50, 50, 10, 5, 3, 1, 11))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void healthIsClampedBetweenZeroAndMax() {
        UnitStats stats = new UnitStats(80, 60, 10, 5, 3, 1, 3);
        assertThat(stats.getHealth()).isEqualTo(60);

        stats.setHealth(-20);
        assertThat(stats.getHealth()).isZero();

        stats.setHealth(1000);
        assertThat(stats.getHealth()).isEqualTo(60);
    }

    @Test
    void damageNeverDropsHealthBelowZero() {
        Unit unit = unit(new UnitStats(20, 20, 10, 5, 3, 1, 3));

        int dealt = unit.takeDamage(35);

        assertThat(dealt).isEqualTo(20);
        assertThat(unit.getHealth()).isZero();
        assertThat(unit.isAlive()).isFalse();
        assertThat(unit.canAttack()).isFalse();
        assertThat(unit.canMove()).isFalse();
    }

    @Test
    void deadUnitsCannotBeHealed() {
        Unit unit = unit(new UnitStats(0, 20, 10, 5, 3, 1, 3));

        assertThat(unit.heal(10)).isZero();
        assertThat(unit.getHealth()).isZero();
    }

    @Test
    void healingStopsAtMaxHealth() {
        Unit unit = unit(new UnitStats(15, 20, 10, 5, 3, 1, 3));

        assertThat(unit.heal(10)).isEqualTo(5);
        assertThat(unit.getHealth()).isEqualTo(20);
    }

    @Test
    void experienceThresholdGrantsOneLevelWithCappedBonuses() {
        Unit unit = unit(new UnitStats(98, 98, 49, 30, 3, 1, 3));

        boolean leveled = false;
        for (int i = 0; i < GameConstants.EXPERIENCE_PER_LEVEL / GameConstants.EXPERIENCE_PER_ATTACK; i++) {
            leveled = unit.gainExperience(GameConstants.EXPERIENCE_PER_ATTACK);
        }

        assertThat(leveled).isTrue();
        assertThat(unit.getVeterancyLevel()).isEqualTo(1);
        assertThat(unit.getMaxHealth()).isEqualTo(GameConstants.MAX_UNIT_HEALTH);
        assertThat(unit.getStats().getAttack()).isEqualTo(GameConstants.MAX_UNIT_ATTACK);
        assertThat(unit.getStats().getDefense()).isEqualTo(GameConstants.MAX_UNIT_DEFENSE);
    }

    @Test
    void fortificationSurvivesRoundResetAndEndsOnMove() {
        GameState state = MatchTestUtils.newState();
        Faction faction = MatchTestUtils.addFaction(state, "agent-a");
        Unit unit = unit(new UnitStats(20, 20, 10, 5, 3, 1, 3));
        state.spawnUnit(faction, unit);

        assertThat(unit.fortify()).isTrue();
        unit.resetForNewRound();
        assertThat(unit.isFortified()).isTrue();

        state.moveUnit(unit, 3, 2);
        assertThat(unit.isFortified()).isFalse();
        assertThat(unit.hasMoved()).isTrue();
        assertThat(unit.fortify()).isFalse();
    }

    @Test
    void statusEffectsExpireAfterTheirDuration() {
        Unit unit = unit(new UnitStats(20, 20, 10, 5, 3, 1, 3));
        unit.addStatusEffect(GameConstants.STATUS_BLINDED, 2);

        unit.resetForNewRound();
        assertThat(unit.hasStatusEffect(GameConstants.STATUS_BLINDED)).isTrue();

        unit.resetForNewRound();
        assertThat(unit.hasStatusEffect(GameConstants.STATUS_BLINDED)).isFalse();
    }
}
