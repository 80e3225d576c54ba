package org.skirmish.runtime.actions;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.Map;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.skirmish.runtime.model.ResourceType;

@Tag("unit")
class ActionParametersTest {

    @Test
    void integersAreReadFromNumbersAndStrings() throws ActionValidationException {
        ActionParameters params = new ActionParameters(Map.of("a", 3, "b", 4.0, "c", " 5 ", "d", 6L));

        assertThat(params.requireInt("a")).isEqualTo(3);
        assertThat(params.requireInt("b")).isEqualTo(4);
        assertThat(params.requireInt("c")).isEqualTo(5);
        assertThat(params.requireInt("d")).isEqualTo(6);
        assertThat(params.optionalInt("missing", 1)).isEqualTo(1);
        assertThat(params.optionalInteger("missing")).isNull();
    }

    @Test
    void fractionalOrNonNumericValuesAreRejected() {
        ActionParameters params = new ActionParameters(Map.of("x", 2.5, "y", "north"));

        assertThatThrownBy(() -> params.requireInt("x"))
                .isInstanceOf(ActionValidationException.class)
                .hasMessage("Parameter 'x' must be an integer");
        assertThatThrownBy(() -> params.requireInt("y"))
                .isInstanceOf(ActionValidationException.class)
                .hasMessage("Parameter 'y' must be an integer");
        assertThatThrownBy(() -> params.requireInt("z"))
                .hasMessage("Missing parameter 'z'");
    }

    @Test
    void valuesOutsideTheIntRangeAreRejected() {
        ActionParameters params = new ActionParameters(Map.of("big", 5_000_000_000L, "huge", 1e12, "small", -3e10));

        assertThatThrownBy(() -> params.requireInt("big"))
                .isInstanceOf(ActionValidationException.class)
                .hasMessage("Parameter 'big' is out of range");
        assertThatThrownBy(() -> params.requireInt("huge"))
                .hasMessage("Parameter 'huge' is out of range");
        assertThatThrownBy(() -> params.requireInt("small"))
                .hasMessage("Parameter 'small' is out of range");
    }

    @Test
    void blankStringsCountAsMissing() {
        ActionParameters params = new ActionParameters(Map.of("unit_id", "  "));

        assertThatThrownBy(() -> params.requireString("unit_id")).hasMessage("Missing parameter 'unit_id'");
        assertThat(params.optionalString("other")).isNull();
    }

    @Test
    void listsSkipNullsAndRejectScalars() throws ActionValidationException {
        ActionParameters params = new ActionParameters(Map.of("abilities", Arrays.asList("charge", null, "fortify"),
                "scalar", "charge"));

        assertThat(params.stringList("abilities")).containsExactly("charge", "fortify");
        assertThat(params.stringList("none")).isEmpty();
        assertThatThrownBy(() -> params.stringList("scalar")).hasMessage("Parameter 'scalar' must be a list");
    }

    @Test
    void resourceMapsAreValidated() throws ActionValidationException {
        ActionParameters params = new ActionParameters(Map.of(
                "cost", Map.of("gold", 50, "wood", "20"),
                "negative", Map.of("gold", -1),
                "unknown", Map.of("mana", 5)));

        assertThat(params.optionalResources("cost"))
                .containsEntry(ResourceType.GOLD, 50)
                .containsEntry(ResourceType.WOOD, 20)
                .doesNotContainKey(ResourceType.FOOD);
        assertThat(params.optionalResources("absent")).isNull();
        assertThatThrownBy(() -> params.optionalResources("negative"))
                .hasMessage("Resource amounts must not be negative: gold");
        assertThatThrownBy(() -> params.optionalResources("unknown"))
                .isInstanceOf(ActionValidationException.class);
    }
}
