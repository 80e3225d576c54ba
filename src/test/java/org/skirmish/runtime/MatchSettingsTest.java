package org.skirmish.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.skirmish.runtime.model.BuildingType;
import org.skirmish.runtime.model.ResourceType;
import org.skirmish.runtime.model.UnitType;
import org.skirmish.runtime.model.VictoryCondition;
import org.skirmish.test.utils.MatchTestUtils;

@Tag("unit")
class MatchSettingsTest {

    @Test
    void defaultsComeFromReferenceConf() {
        MatchSettings settings = MatchTestUtils.defaultSettings();

        assertThat(settings.getMapWidth()).isEqualTo(20);
        assertThat(settings.getMaxPlayers()).isEqualTo(4);
        assertThat(settings.getTurnTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(settings.getMaxActionsPerTurn()).isEqualTo(5);
        assertThat(settings.getMaxTurns()).isEqualTo(10);
        assertThat(settings.getVictoryConditions())
                .containsExactly(VictoryCondition.ELIMINATION, VictoryCondition.TIME_LIMIT);
        assertThat(settings.getStartingResources())
                .containsEntry(ResourceType.GOLD, 500)
                .containsEntry(ResourceType.WOOD, 300)
                .containsEntry(ResourceType.FOOD, 200)
                .containsEntry(ResourceType.STONE, 100);
        assertThat(settings.getBalance().combatDamageMultiplier()).isEqualTo(1.0);
    }

    @Test
    void overridesKeepTheRemainingDefaults() {
        MatchSettings settings = MatchTestUtils.settings("""
                turn.timeout = 250ms
                map.width = 12
                victory.conditions = [resource]
                balance.unit-cost-multiplier = 1.5
                """);

        assertThat(settings.getTurnTimeout()).isEqualTo(Duration.ofMillis(250));
        assertThat(settings.getMapWidth()).isEqualTo(12);
        assertThat(settings.getMapHeight()).isEqualTo(20);
        assertThat(settings.getVictoryConditions()).containsExactly(VictoryCondition.RESOURCE);
        assertThat(settings.getBalance().unitCostMultiplier()).isEqualTo(1.5);
        assertThat(settings.getBalance().buildingCostMultiplier()).isEqualTo(1.0);
    }

    @Test
    void buildingTemplatesAreReadFromConfiguration() {
        MatchSettings settings = MatchTestUtils.defaultSettings();

        assertThat(settings.getBuildingTemplates().get(BuildingType.TOWN_CENTER).producesUnits())
                .containsExactly(UnitType.WORKER);
        assertThat(settings.getBuildingTemplates().get(BuildingType.TOWER).inherentAbilities())
                .containsExactly("auto_attack");
        assertThat(settings.getBuildingTemplates().get(BuildingType.FARM).resourceGeneration())
                .containsEntry(ResourceType.FOOD, 15);
    }

    @Test
    void invalidValuesAreRejected() {
        assertThatThrownBy(() -> MatchTestUtils.settings("map.width = 0"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MatchTestUtils.settings("balance.combat-damage-multiplier = 0"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MatchTestUtils.settings("victory.conditions = [domination]"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
