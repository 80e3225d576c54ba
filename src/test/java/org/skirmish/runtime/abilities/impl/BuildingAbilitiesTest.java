package org.skirmish.runtime.abilities.impl;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.skirmish.runtime.model.Building;
import org.skirmish.runtime.model.BuildingType;
import org.skirmish.runtime.model.Faction;
import org.skirmish.runtime.model.GameState;
import org.skirmish.runtime.model.ResourceType;
import org.skirmish.runtime.model.Unit;
import org.skirmish.runtime.model.UnitStats;
import org.skirmish.runtime.spi.AbilityContext;
import org.skirmish.runtime.spi.ActionKind;
import org.skirmish.test.utils.MatchTestUtils;

@Tag("unit")
class BuildingAbilitiesTest {

    private GameState state;

    @BeforeEach
    void setUp() {
        state = MatchTestUtils.newState();
        MatchTestUtils.addFaction(state, "agent-a");
        MatchTestUtils.addFaction(state, "agent-b");
        MatchTestUtils.startPlaying(state);
    }

    @Test
    void wallAddsArmorWhileDefending() {
        WallAbility wall = new WallAbility(10);
        Building barrier = MatchTestUtils.placeBuilding(state, "agent-a", BuildingType.WALL, 3, 3);
        AbilityContext context = new AbilityContext(barrier, ActionKind.DEFEND, state).setWorkingDefense(0);

        assertThat(wall.canApply(context)).isTrue();
        wall.apply(context);

        assertThat(context.getWorkingDefense()).isEqualTo(10);
        assertThat(barrier.getInherentAbilities()).containsExactly("wall");
        assertThat(barrier.removeAbility("wall")).isFalse();
    }

    @Test
    void resourceBonusRaisesGeneration() {
        ResourceBonusAbility bonus = new ResourceBonusAbility(1.5);
        Building mine = MatchTestUtils.placeBuilding(state, "agent-a", BuildingType.MINE, 3, 3);
        AbilityContext context = new AbilityContext(mine, ActionKind.GENERATE_RESOURCES, state)
                .setResources(Map.of(ResourceType.GOLD, 10, ResourceType.STONE, 8));

        bonus.apply(context);

        assertThat(context.getResources())
                .containsEntry(ResourceType.GOLD, 15)
                .containsEntry(ResourceType.STONE, 12);
    }

    @Test
    void unfinishedBuildingsDoNotUseAbilities() {
        Faction faction = state.getFaction("agent-a").orElseThrow();
        Building tower = state.getSettings().getBuildingTemplates().get(BuildingType.TOWER)
                .toDesign("Watchtower")
                .instantiate(state.nextEntityId("building"), "agent-a", 3, 3, false);
        state.placeBuilding(faction, tower);

        assertThat(new AutoAttackAbility(15, 3).canApply(new AbilityContext(tower, ActionKind.END_TURN, state)))
                .isFalse();
        assertThat(new ResearchAbility(1.0).canApply(new AbilityContext(tower, ActionKind.RESEARCH, state)))
                .isFalse();
    }

    @Test
    void autoAttackRespectsFortificationAndMinimumDamage() {
        AutoAttackAbility autoAttack = new AutoAttackAbility(15, 3);
        Building tower = MatchTestUtils.placeBuilding(state, "agent-a", BuildingType.TOWER, 3, 3);
        Unit bulwark = MatchTestUtils.spawnUnit(state, "agent-b", 4, 3, new UnitStats(50, 50, 5, 12, 2, 1, 3));
        bulwark.fortify();

        Map<String, Object> effect = autoAttack.apply(new AbilityContext(tower, ActionKind.END_TURN, state));

        assertThat(effect).containsEntry("target_id", bulwark.getId()).containsEntry("damage", 1);
        assertThat(bulwark.getHealth()).isEqualTo(49);
    }

    @Test
    void autoAttackWithoutEnemiesInRangeDoesNothing() {
        AutoAttackAbility autoAttack = new AutoAttackAbility(15, 3);
        Building tower = MatchTestUtils.placeBuilding(state, "agent-a", BuildingType.TOWER, 3, 3);
        Unit own = MatchTestUtils.spawnUnit(state, "agent-a", 4, 3, 10, 5, 1);

        Map<String, Object> effect = autoAttack.apply(new AbilityContext(tower, ActionKind.END_TURN, state));

        assertThat(effect).containsEntry("damage", 0);
        assertThat(own.getHealth()).isEqualTo(50);
    }

    @Test
    void healAuraRestoresFriendlyUnitsNearby() {
        HealAuraAbility aura = new HealAuraAbility(10, 2);
        Building temple = MatchTestUtils.placeBuilding(state, "agent-a", BuildingType.TOWN_CENTER, 3, 3);
        Unit near = MatchTestUtils.spawnUnit(state, "agent-a", 4, 4, new UnitStats(30, 50, 5, 5, 2, 1, 3));
        Unit far = MatchTestUtils.spawnUnit(state, "agent-a", 8, 8, new UnitStats(30, 50, 5, 5, 2, 1, 3));
        Unit enemy = MatchTestUtils.spawnUnit(state, "agent-b", 3, 4, new UnitStats(30, 50, 5, 5, 2, 1, 3));

        aura.apply(new AbilityContext(temple, ActionKind.END_TURN, state));

        assertThat(near.getHealth()).isEqualTo(40);
        assertThat(far.getHealth()).isEqualTo(30);
        assertThat(enemy.getHealth()).isEqualTo(30);
    }

    @Test
    void productionAbilitiesOnlyReport() {
        Building barracks = MatchTestUtils.placeBuilding(state, "agent-a", BuildingType.BARRACKS, 3, 3);

        assertThat(new TrainFasterAbility(1.5).apply(new AbilityContext(barracks, ActionKind.CREATE_UNIT, state)))
                .containsEntry("training_bonus", true);
        assertThat(new ResearchAbility(1.0).canApply(new AbilityContext(barracks, ActionKind.RESEARCH, state)))
                .isTrue();
    }
}
