package org.modelplatform.api.backend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.modelplatform.api.exceptions.ValidationException;

@Tag("unit")
class MetaTargetTest {

    @Test
    void levelsOfTheFourValidCombinations() {
        assertThat(MetaTarget.model("m").level()).isEqualTo(MetaTarget.Level.MODEL);
        assertThat(MetaTarget.scenario("s").level()).isEqualTo(MetaTarget.Level.SCENARIO);
        assertThat(MetaTarget.modelScenario("m", "s").level()).isEqualTo(MetaTarget.Level.MODEL_SCENARIO);
        assertThat(MetaTarget.run("m", "s", 2).level()).isEqualTo(MetaTarget.Level.RUN);
    }

    @Test
    void otherCombinationsAreRejected() {
        assertThatThrownBy(() -> MetaTarget.of(null, null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageStartingWith("Invalid arguments. Valid combinations are:");
        assertThatThrownBy(() -> MetaTarget.of("m", null, 1)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> MetaTarget.of(null, "s", 1)).isInstanceOf(ValidationException.class);
    }

    @Test
    void ancestorsAreOrderedCoarseToFine() {
        assertThat(MetaTarget.run("m", "s", 3).withAncestors()).containsExactly(
                MetaTarget.model("m"),
                MetaTarget.scenario("s"),
                MetaTarget.modelScenario("m", "s"),
                MetaTarget.run("m", "s", 3));
        assertThat(MetaTarget.scenario("s").withAncestors()).containsExactly(MetaTarget.scenario("s"));
    }
}
