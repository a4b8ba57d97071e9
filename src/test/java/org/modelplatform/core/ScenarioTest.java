package org.modelplatform.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.mock;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.modelplatform.api.backend.IBackend;
import org.modelplatform.api.backend.ScenarioInfo;
import org.modelplatform.api.backend.TimeSeriesRow;
import org.modelplatform.api.exceptions.CheckoutRequiredException;
import org.modelplatform.api.exceptions.ItemNotFoundException;
import org.modelplatform.api.exceptions.PreconditionException;
import org.modelplatform.api.exceptions.SessionLockedException;
import org.modelplatform.api.exceptions.SolutionPresentException;
import org.modelplatform.api.exceptions.UnsupportedBackendOperationException;
import org.modelplatform.api.exceptions.ValidationException;
import org.modelplatform.api.item.IndexSetData;
import org.modelplatform.api.item.ItemData;
import org.modelplatform.api.item.ItemRow;
import org.modelplatform.api.item.ItemType;
import org.modelplatform.api.item.ScalarData;
import org.modelplatform.api.item.TableData;
import org.modelplatform.core.input.ElementInput;
import org.modelplatform.core.input.FieldInput;
import org.modelplatform.junit.extensions.logging.ExpectLog;
import org.modelplatform.junit.extensions.logging.LogLevel;
import org.modelplatform.junit.extensions.logging.LogWatchExtension;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ScenarioTest {

    private static final List<String> PLANTS = List.of("seattle", "san-diego");
    private static final List<String> MARKETS = List.of("new-york", "chicago", "topeka");

    private Platform platform;

    @BeforeEach
    void setUp() {
        platform = Platform.create("memory", ConfigFactory.empty());
    }

    @AfterEach
    void tearDown() {
        platform.close();
    }

    /**
     * Builds and commits a small transport model: plants, markets and distances between them.
     */
    private Scenario transport() {
        Scenario s = Scenario.createNew(platform, "transport", "standard", "test model");
        s.transact("initial data", () -> {
            s.initSet("i");
            s.addSet("i", ElementInput.keys(PLANTS));
            s.initSet("j");
            s.addSet("j", ElementInput.keys(MARKETS));
            s.initPar("a", List.of("i"));
            s.addPar("a", ElementInput.keys("seattle", "san-diego"), FieldInput.each(List.of(350, 600)),
                    FieldInput.of("cases"), FieldInput.none());
            s.initPar("d", List.of("i", "j"));
            s.addPar("d", ElementInput.keys(List.of(
                            List.of("seattle", "new-york"), List.of("seattle", "chicago"),
                            List.of("san-diego", "new-york"), List.of("san-diego", "topeka"))),
                    FieldInput.each(List.of(2.5, 1.7, 2.5, 1.4)), FieldInput.of("km"), FieldInput.none());
            s.initScalar("f", 90.0, "USD/km", "freight");
            s.initVar("x", List.of("i", "j"));
            s.initEqu("supply", List.of("i"));
            s.addTimeseries(List.of(new TimeSeriesRow("World", "Cost", "USD", "Year", 2010, 100.0),
                    new TimeSeriesRow("World", "Cost", "USD", "Year", 2030, 150.0)));
            s.addTimeseries(List.of(new TimeSeriesRow("World", "Population", "million", "Year", 2010, 7.0)),
                    true, null, null);
        });
        return s;
    }

    private static void solve(Scenario s) {
        s.transact("solution", () -> {
            s.storeSolution("x", List.of(ItemRow.ofSolution(List.of("seattle", "new-york"), 50.0, 0.0)));
            s.storeSolution("supply", List.of(ItemRow.ofSolution(List.of("seattle"), 350.0, 0.0)));
        });
    }

    // ==================== End-to-end ====================

    @Test
    @DisplayName("Set elements come back in insertion order")
    void setElementsKeepInsertionOrder() {
        Scenario s = Scenario.createNew(platform, "m", "s", "sets");
        s.checkOut();
        s.initSet("i");
        s.addSet("i", ElementInput.keys("a", "b"));

        assertThat(((IndexSetData) s.set("i")).keys()).containsExactly("a", "b");
        assertThat(s.commit("sets")).isTrue();
        assertThat(s.version()).isGreaterThanOrEqualTo(1);
        assertThat(s.isCheckedOut()).isFalse();
        assertThat(s.commit("nothing new")).isFalse();
    }

    @Test
    void filteredParameterReturnsMatchingRow() {
        Scenario s = Scenario.createNew(platform, "m", "s", "params");
        s.checkOut();
        s.initSet("i");
        s.addSet("i", ElementInput.keys("a", "b"));
        s.initPar("p", List.of("i"));
        s.addPar("p", ElementInput.key("a"), 1.5, "km");

        TableData table = (TableData) s.par("p", Map.of("i", List.of("a")));

        assertThat(table.rows()).singleElement().satisfies(row -> {
            assertThat(row.value()).isEqualTo(1.5);
            assertThat(row.unit()).isEqualTo("km");
        });
    }

    @Test
    void unknownIndexElementWritesNothing() {
        Scenario s = Scenario.createNew(platform, "m", "s", "params");
        s.checkOut();
        s.initSet("i");
        s.addSet("i", ElementInput.keys("a", "b"));
        s.initPar("p", List.of("i"));

        assertThatThrownBy(() -> s.addPar("p", ElementInput.keys("a", "c"), FieldInput.each(List.of(1.0, 2.0)),
                FieldInput.of("km"), FieldInput.none()))
                .isInstanceOf(ValidationException.class);

        assertThat(((TableData) s.par("p")).rows()).isEmpty();
    }

    @Test
    @DisplayName("Filtering returns exactly the rows a manual scan selects")
    void randomFilterSubsetsMatchManualFiltering() {
        Scenario s = transport();
        Random random = new Random(20240601L);
        List<ItemRow> all = ((TableData) s.par("d")).rows();
        assertThat(all).hasSize(4);

        for (int round = 0; round < 50; round++) {
            Map<String, List<Object>> filters = new LinkedHashMap<>();
            List<String> plants = randomSubset(random, PLANTS);
            List<String> markets = randomSubset(random, MARKETS);
            if (!plants.isEmpty()) {
                filters.put("i", new ArrayList<>(plants));
            }
            if (!markets.isEmpty()) {
                filters.put("j", new ArrayList<>(markets));
            }

            List<ItemRow> expected = new ArrayList<>();
            for (ItemRow row : all) {
                if ((plants.isEmpty() || plants.contains(row.keyAt(0)))
                        && (markets.isEmpty() || markets.contains(row.keyAt(1)))) {
                    expected.add(row);
                }
            }

            assertThat(((TableData) s.par("d", filters)).rows()).as("filters %s", filters)
                    .containsExactlyElementsOf(expected);
        }
    }

    private static List<String> randomSubset(Random random, List<String> values) {
        List<String> subset = new ArrayList<>();
        for (String value : values) {
            if (random.nextBoolean()) {
                subset.add(value);
            }
        }
        return subset;
    }

    @Test
    void numericKeysMatchTheirStringForm() {
        Scenario s = Scenario.createNew(platform, "m", "s", "years");
        s.checkOut();
        s.initSet("year");
        s.addSet("year", ElementInput.keys(2020, 2030));
        s.initPar("demand", List.of("year"));
        s.addPar("demand", ElementInput.keys(2020, 2030), FieldInput.each(List.of(1.0, 2.0)),
                FieldInput.of("GWa"), FieldInput.none());

        TableData table = (TableData) s.par("demand", Map.of("year", List.of(2030)));

        assertThat(table.column("year")).containsExactly("2030");
    }

    // ==================== Lifecycle ====================

    @Test
    void writesNeedACheckout() {
        Scenario s = transport();

        assertThatThrownBy(() -> s.addSet("i", ElementInput.key("portland")))
                .isInstanceOf(CheckoutRequiredException.class);
    }

    @Test
    void secondHandleCannotCheckOutTheSameRun() {
        Scenario s = transport();
        Scenario other = Scenario.load(platform, "transport", "standard", s.version());
        s.checkOut();

        assertThatThrownBy(other::checkOut).isInstanceOf(SessionLockedException.class);

        s.discardChanges();
        other.checkOut();
        assertThat(other.isCheckedOut()).isTrue();
    }

    @Test
    void onlyOneVersionIsDefault() {
        Scenario first = transport();
        Scenario second = transport();
        assertThat(second.version()).isEqualTo(first.version() + 1);

        first.setAsDefault();
        second.setAsDefault();

        assertThat(first.isDefault()).isFalse();
        assertThat(second.isDefault()).isTrue();
        assertThat(platform.scenarioList()).extracting(ScenarioInfo::version).containsExactly(second.version());
        assertThat(Scenario.load(platform, "transport", "standard").version()).isEqualTo(second.version());
    }

    @Test
    void solvedScenarioRefusesFullCheckout() {
        Scenario s = transport();
        solve(s);
        assertThat(s.hasSolution()).isTrue();

        assertThatThrownBy(s::checkOut)
                .isInstanceOf(SolutionPresentException.class)
                .hasMessageContaining("use removeSolution()");

        s.checkOut(true);
        s.addTimeseries(List.of(new TimeSeriesRow("World", "Cost", "USD", "Year", 2040, 170.0)));
        s.commit("timeseries only");

        s.removeSolution();
        assertThat(s.hasSolution()).isFalse();
        assertThat(((TableData) s.var("x")).rows()).isEmpty();
        assertThatThrownBy(s::removeSolution)
                .isInstanceOf(PreconditionException.class)
                .hasMessage("This Scenario does not have a solution!");
        s.checkOut();
    }

    @Test
    void removeSolutionFromYearKeepsEarlierAndMetadataRows() {
        Scenario s = transport();
        solve(s);

        s.removeSolution(2020);

        assertThat(s.timeseries()).extracting(TimeSeriesRow::year).containsExactlyInAnyOrder(2010, 2010);
    }

    @Test
    void solutionOnlyForVariablesAndEquations() {
        Scenario s = transport();
        s.checkOut();

        assertThatThrownBy(() -> s.storeSolution("d", List.of()))
                .isInstanceOf(ItemNotFoundException.class);
    }

    // ==================== Items ====================

    @Test
    void namesAreUniqueAcrossKinds() {
        Scenario s = transport();
        s.checkOut();

        assertThatThrownBy(() -> s.initVar("a", List.of()))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> s.initPar("p", List.of("i"), List.of("i", "j")))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void itemDiscovery() {
        Scenario s = transport();

        assertThat(s.listItems(ItemType.PAR)).containsExactly("a", "d", "f");
        assertThat(s.hasItem("x")).isTrue();
        assertThat(s.hasVar("x")).isTrue();
        assertThat(s.hasPar("x")).isFalse();
        assertThat(s.hasEqu("supply")).isTrue();
        assertThat(s.hasSet("nope")).isFalse();
        assertThat(s.idxSets("d")).containsExactly("i", "j");
        assertThat(s.idxNames("d")).containsExactly("i", "j");
        assertThatThrownBy(() -> s.idxSets("nope")).isInstanceOf(ItemNotFoundException.class);
    }

    @Test
    void itemsCanBeRestrictedAndRestarted() {
        Scenario s = transport();

        Iterable<String> parameters = s.items(ItemType.PAR);
        assertThat(parameters).containsExactly("a", "d", "f");
        assertThat(parameters).containsExactly("a", "d", "f");

        assertThat(s.items(ItemType.PAR, null, "j")).containsExactly("d");
        assertThat(s.items(ItemType.PAR, Map.of("j", List.of("topeka")), null)).containsExactly("d");
        assertThat(s.items(ItemType.PAR, Map.of(), null)).containsExactly("a", "d", "f");
    }

    @Test
    void itemDataIsFilteredPerItem() {
        Scenario s = transport();

        Map<String, ItemData> data = new LinkedHashMap<>();
        for (Map.Entry<String, ItemData> entry : s.iterItemData(ItemType.PAR, Map.of("i", List.of("seattle")), null)) {
            data.put(entry.getKey(), entry.getValue());
        }

        assertThat(data).containsOnlyKeys("a", "d");
        assertThat(((TableData) data.get("a")).column("i")).containsExactly("seattle");
        assertThat(((TableData) data.get("d")).size()).isEqualTo(2);
    }

    @Test
    void scalars() {
        Scenario s = transport();

        ScalarData freight = s.scalar("f");
        assertThat(freight.value()).isEqualTo(90.0);
        assertThat(freight.unit()).isEqualTo("USD/km");

        s.transact("raise freight", () -> s.changeScalar("f", 95.0, "USD/km", null));
        assertThat(s.scalar("f").value()).isEqualTo(95.0);

        assertThatThrownBy(() -> s.scalar("a"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("is not a scalar");
    }

    @Test
    void removingSetElementsRemovesDependentParameterRows() {
        Scenario s = transport();
        s.checkOut();

        s.removeSet("j", ElementInput.key("new-york"));

        assertThat(((IndexSetData) s.set("j")).keys()).containsExactly("chicago", "topeka");
        assertThat(((TableData) s.par("d")).column("j")).containsExactly("chicago", "topeka");

        s.removePar("d", ElementInput.keys("seattle", "chicago"));
        assertThat(((TableData) s.par("d")).size()).isEqualTo(1);

        s.removePar("d");
        assertThat(s.hasPar("d")).isFalse();
        assertThatThrownBy(() -> s.removeSet("i")).isInstanceOf(ValidationException.class);
    }

    @Test
    void removalKeysMustFitTheItem() {
        Scenario s = transport();
        s.checkOut();

        assertThatThrownBy(() -> s.removeSet("i", ElementInput.none()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("are required");
        assertThatThrownBy(() -> s.removePar("d", ElementInput.keys(List.of(List.of("seattle")))))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("1-D key [seattle] invalid for 2-D item 'd'");

        assertThat(((IndexSetData) s.set("i")).keys()).containsExactlyElementsOf(PLANTS);
        assertThat(((TableData) s.par("d")).size()).isEqualTo(4);
    }

    @Test
    void setsAcceptTablesWithComments() {
        Scenario s = transport();
        s.checkOut();
        s.initSet("route", List.of("i", "j"), List.of("origin", "destination"));

        s.addSet("route", ElementInput.table(List.of(
                Map.of("origin", "seattle", "destination", "chicago", "comment", "rail"))));

        TableData routes = (TableData) s.set("route");
        assertThat(routes.indexNames()).containsExactly("origin", "destination");
        assertThat(routes.column("destination")).containsExactly("chicago");
    }

    // ==================== Clone ====================

    @Test
    @DisplayName("Cloning without solution keeps only metadata time series")
    void cloneWithoutSolution() {
        Scenario s = transport();
        solve(s);

        Scenario copy = s.clone("transport", "copy", "cloned", false);

        assertThat(copy.version()).isEqualTo(1);
        assertThat(copy.scenario()).isEqualTo("copy");
        assertThat(copy.state()).isEqualTo(SessionState.LOADED);
        assertThat(copy.hasSolution()).isFalse();
        assertThat(((TableData) copy.var("x")).rows()).isEmpty();
        assertThat(copy.par("d")).isEqualTo(s.par("d"));
        assertThat(copy.timeseries()).containsExactly(
                new TimeSeriesRow("World", "Population", "million", "Year", 2010, 7.0));
        assertThat(s.hasSolution()).isTrue();
    }

    @Test
    void cloneWithSolutionKeepsEverything() {
        Scenario s = transport();
        solve(s);

        Scenario copy = s.clone("full copy", true);

        assertThat(copy.scenario()).isEqualTo("standard");
        assertThat(copy.version()).isEqualTo(s.version() + 1);
        assertThat(copy.hasSolution()).isTrue();
        assertThat(copy.var("x")).isEqualTo(s.var("x"));
        assertThat(copy.timeseries()).hasSize(3);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*Scenario",
            messagePattern = "Overriding keepSolution=true for shiftFirstModelYear=2020")
    void shiftingFirstModelYearDropsTheSolution() {
        Scenario s = transport();
        solve(s);

        Scenario copy = s.clone(null, null, "shifted", "shifted", true, 2020);

        assertThat(copy.hasSolution()).isFalse();
        assertThat(((TableData) copy.var("x")).rows()).isEmpty();
        assertThat(copy.timeseries()).containsExactlyInAnyOrder(
                new TimeSeriesRow("World", "Cost", "USD", "Year", 2010, 100.0),
                new TimeSeriesRow("World", "Population", "million", "Year", 2010, 7.0));
    }

    @Test
    void shiftingFirstModelYearKeepsEarlierYearsWithoutSolution() {
        Scenario s = transport();

        Scenario copy = s.clone(null, null, "shifted", "shifted", false, 2020);

        assertThat(copy.timeseries()).extracting(TimeSeriesRow::variable, TimeSeriesRow::year)
                .containsExactlyInAnyOrder(
                        tuple("Cost", 2010),
                        tuple("Population", 2010));
    }

    @Test
    void cloneToAnotherEngine() {
        Scenario s = transport();
        try (Platform h2 = Platform.create("h2", ConfigFactory.empty())) {
            Scenario copy = s.clone(h2, null, null, null, false, null);

            assertThat(copy.platform()).isSameAs(h2);
            assertThat(copy.annotation()).isEmpty();
            assertThat(copy.par("d")).isEqualTo(s.par("d"));
        }
    }

    @Test
    void cloneToIncompatibleEngineIsRefused() {
        Scenario s = transport();
        Platform remote = new Platform("remote", mock(IBackend.class));

        assertThatThrownBy(() -> s.clone(remote, "transport", "remote copy", "copy", false, null))
                .isInstanceOf(UnsupportedBackendOperationException.class);
        assertThat(platform.scenarioList(false, null, "remote copy")).isEmpty();
    }

    @Test
    void urlIdentifiesScenario() {
        Scenario s = transport();

        assertThat(s).hasToString("<Scenario transport/standard#1>");
        Scenario loaded = Scenario.fromUrl("ixmp://memory/transport/standard#1", name -> platform);
        assertThat(loaded.set("i")).isEqualTo(s.set("i"));
    }
}
