package org.modelplatform.core;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.modelplatform.core.ScenarioDiff.ParameterDiff;
import org.modelplatform.core.ScenarioDiff.Presence;
import org.modelplatform.core.ScenarioDiff.Row;
import org.modelplatform.core.input.ElementInput;
import org.modelplatform.core.input.FieldInput;
import org.modelplatform.junit.extensions.logging.LogWatchExtension;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ScenarioDiffTest {

    private Platform platform;

    @BeforeEach
    void setUp() {
        platform = Platform.create("memory", ConfigFactory.empty());
    }

    @AfterEach
    void tearDown() {
        platform.close();
    }

    private Scenario base() {
        Scenario s = Scenario.createNew(platform, "m", "base", "diff test");
        s.transact("data", () -> {
            s.initSet("i");
            s.addSet("i", ElementInput.keys("a", "b", "c"));
            s.initPar("p", List.of("i"));
            s.addPar("p", ElementInput.keys("a", "b"), FieldInput.each(List.of(1.0, 2.0)), FieldInput.of("kg"),
                    FieldInput.none());
            s.initScalar("f", 90.0, "USD", null);
        });
        return s;
    }

    @Test
    void identicalScenariosHaveNoDifferences() {
        Scenario a = base();
        Scenario b = a.clone("m", "same", "copy", false);

        List<ParameterDiff> diff = ScenarioDiff.diff(a, b);

        assertThat(diff).extracting(ParameterDiff::name).containsExactly("f", "p");
        assertThat(diff).noneMatch(ParameterDiff::hasDifferences);
        assertThat(diff.get(0).rows()).containsExactly(
                new Row(List.of(), 90.0, "USD", 90.0, "USD", Presence.BOTH));
    }

    @Test
    void changedAndOneSidedRowsAreReportedInKeyOrder() {
        Scenario a = base();
        Scenario b = a.clone("m", "changed", "copy", false);
        b.transact("edit", () -> {
            b.removePar("p", ElementInput.key("a"));
            b.addPar("p", ElementInput.key("b"), 2.5, "kg");
            b.addPar("p", ElementInput.key("c"), 3.0, "kg");
        });

        ParameterDiff p = ScenarioDiff.diff(a, b).get(1);

        assertThat(p.indexNames()).containsExactly("i");
        assertThat(p.hasDifferences()).isTrue();
        assertThat(p.rows()).containsExactly(
                new Row(List.of("a"), 1.0, "kg", null, null, Presence.LEFT_ONLY),
                new Row(List.of("b"), 2.0, "kg", 2.5, "kg", Presence.BOTH),
                new Row(List.of("c"), null, null, 3.0, "kg", Presence.RIGHT_ONLY));
    }

    @Test
    void parametersOfOnlyOneScenarioComeLast() {
        Scenario a = base();
        Scenario b = a.clone("m", "extended", "copy", false);
        b.transact("extra", () -> {
            b.initPar("added", List.of("i"));
            b.addPar("added", ElementInput.key("c"), 4.0, "t");
        });

        List<ParameterDiff> diff = ScenarioDiff.diff(a, b);

        assertThat(diff).extracting(ParameterDiff::name).containsExactly("f", "p", "added");
        assertThat(diff.get(2).rows()).singleElement()
                .extracting(Row::presence).isEqualTo(Presence.RIGHT_ONLY);
    }

    @Test
    void filtersNarrowBothSides() {
        Scenario a = base();
        Scenario b = a.clone("m", "filtered", "copy", false);
        b.transact("edit", () -> b.addPar("p", ElementInput.key("a"), 5.0, "kg"));

        List<ParameterDiff> diff = ScenarioDiff.diff(a, b, Map.of("i", List.of("b")));

        assertThat(diff).extracting(ParameterDiff::name).containsExactly("p");
        assertThat(diff.get(0).hasDifferences()).isFalse();
        assertThat(diff.get(0).rows()).extracting(Row::key).containsExactly(List.of("b"));
    }
}
