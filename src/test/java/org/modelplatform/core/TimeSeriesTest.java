package org.modelplatform.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.modelplatform.api.backend.GeoRow;
import org.modelplatform.api.backend.TimeSeriesRow;
import org.modelplatform.api.exceptions.ItemNotFoundException;
import org.modelplatform.api.exceptions.PlatformReferenceException;
import org.modelplatform.api.exceptions.PreconditionException;
import org.modelplatform.api.exceptions.ValidationException;
import org.modelplatform.junit.extensions.logging.ExpectLog;
import org.modelplatform.junit.extensions.logging.LogLevel;
import org.modelplatform.junit.extensions.logging.LogWatchExtension;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class TimeSeriesTest {

    private Platform platform;

    @BeforeEach
    void setUp() {
        platform = Platform.create("memory", ConfigFactory.empty());
    }

    @AfterEach
    void tearDown() {
        platform.close();
    }

    private static TimeSeriesRow row(String region, String variable, int year, double value) {
        return new TimeSeriesRow(region, variable, "EJ/yr", "Year", year, value);
    }

    private TimeSeries committed() {
        TimeSeries ts = TimeSeries.createNew(platform, "model", "scenario", "test data");
        ts.transact("initial", () -> ts.addTimeseries(List.of(row("World", "Primary Energy", 2010, 1.0))));
        return ts;
    }

    // ==================== Lifecycle ====================

    @Test
    @DisplayName("A new run gets version 1 on its first commit and is not default until asked")
    void newRunLifecycle() {
        TimeSeries ts = TimeSeries.createNew(platform, "model", "scenario", "test data");
        assertThat(ts.state()).isEqualTo(SessionState.NEW);
        assertThat(ts.version()).isZero();

        ts.checkOut();
        assertThat(ts.state()).isEqualTo(SessionState.CHECKED_OUT);
        assertThat(ts.isCheckedOut()).isTrue();
        ts.addTimeseries(List.of(row("World", "Primary Energy", 2010, 1.0)));

        assertThat(ts.commit("first")).isTrue();
        assertThat(ts.state()).isEqualTo(SessionState.LOADED);
        assertThat(ts.version()).isEqualTo(1);
        assertThat(ts.isDefault()).isFalse();
        assertThat(ts.lastUpdate()).isNotNull();

        ts.setAsDefault();
        assertThat(ts.isDefault()).isTrue();

        TimeSeries loaded = TimeSeries.load(platform, "model", "scenario");
        assertThat(loaded.version()).isEqualTo(1);
        assertThat(loaded.annotation()).isEqualTo("test data");
        assertThat(loaded.runId()).isEqualTo(ts.runId());
        assertThat(loaded.timeseries()).containsExactly(row("World", "Primary Energy", 2010, 1.0));
    }

    @Test
    @ExpectLog(level = LogLevel.INFO, loggerPattern = ".*TimeSeries", messagePattern = "No annotation given.*")
    void missingAnnotationBecomesEmpty() {
        TimeSeries ts = TimeSeries.createNew(platform, "model", "scenario", null);

        assertThat(ts.annotation()).isEmpty();
    }

    @Test
    void discardReturnsToPreviousState() {
        TimeSeries ts = committed();
        ts.checkOut();
        ts.addTimeseries(List.of(row("World", "Primary Energy", 2020, 2.0)));

        ts.discardChanges();

        assertThat(ts.state()).isEqualTo(SessionState.LOADED);
        assertThat(ts.timeseries()).hasSize(1);
    }

    @Test
    void loadingUnknownRunFails() {
        assertThatThrownBy(() -> TimeSeries.load(platform, "nope", "nothing", 3))
                .isInstanceOf(ItemNotFoundException.class);
    }

    // ==================== Transactions ====================

    @Test
    void transactChecksOutAndCommits() {
        TimeSeries ts = committed();

        ts.transact("more data", () -> ts.addTimeseries(List.of(row("World", "Primary Energy", 2020, 2.0))));

        assertThat(ts.isCheckedOut()).isFalse();
        assertThat(TimeSeries.load(platform, "model", "scenario", 1).timeseries()).hasSize(2);
    }

    @Test
    void transactLeavesExistingCheckoutOpen() {
        TimeSeries ts = committed();
        ts.checkOut();

        ts.transact("nested", () -> ts.addTimeseries(List.of(row("World", "Primary Energy", 2020, 2.0))));

        assertThat(ts.isCheckedOut()).isTrue();
        assertThat(TimeSeries.load(platform, "model", "scenario", 1).timeseries()).hasSize(1);
        ts.commit("outer");
        assertThat(TimeSeries.load(platform, "model", "scenario", 1).timeseries()).hasSize(2);
    }

    @Test
    void transactWithFalseConditionOnlyRunsTheBody() {
        TimeSeries ts = committed();
        boolean[] ran = {false};

        ts.transact("skipped", false, false, () -> ran[0] = true);

        assertThat(ran[0]).isTrue();
        assertThat(ts.isCheckedOut()).isFalse();
    }

    @Test
    void failingTransactCommitsPartialWork() {
        TimeSeries ts = committed();

        assertThatThrownBy(() -> ts.transact("partial", () -> {
            ts.addTimeseries(List.of(row("World", "Primary Energy", 2020, 2.0)));
            throw new IllegalStateException("model run failed");
        })).isInstanceOf(IllegalStateException.class).hasMessage("model run failed");

        assertThat(ts.isCheckedOut()).isFalse();
        assertThat(ts.timeseries()).hasSize(2);
    }

    @Test
    void discardOnErrorDropsChangesAndClosesTheConnection() {
        TimeSeries ts = committed();

        assertThatThrownBy(() -> ts.transact("guarded", true, true, () -> {
            ts.addTimeseries(List.of(row("World", "Primary Energy", 2020, 2.0)));
            throw new IllegalStateException("solver crashed");
        })).isInstanceOf(IllegalStateException.class);

        platform.openDb();
        assertThat(ts.isCheckedOut()).isFalse();
        assertThat(ts.timeseries()).hasSize(1);

        ts.checkOut();
        assertThat(ts.isCheckedOut()).isTrue();
    }

    // ==================== Handle validity ====================

    @Test
    void closedPlatformDetachesHandles() {
        TimeSeries ts = committed();

        platform.close();

        assertThat(ts.state()).isEqualTo(SessionState.DETACHED);
        assertThatThrownBy(ts::timeseries).isInstanceOf(PlatformReferenceException.class)
                .hasMessageContaining("no longer valid");
    }

    @Test
    void closedHandleRejectsCalls() {
        TimeSeries ts = committed();

        ts.close();
        ts.close();

        assertThat(ts.state()).isEqualTo(SessionState.DETACHED);
        assertThatThrownBy(ts::timeseries).isInstanceOf(PreconditionException.class)
                .hasMessageEndingWith("has been closed");
    }

    // ==================== Identity ====================

    @Test
    void urlsNameTheRun() {
        TimeSeries ts = committed();

        assertThat(ts.url()).isEqualTo("model/scenario#1");
        assertThat(ts.fullUrl()).isEqualTo("ixmp://memory/model/scenario#1");
        assertThat(ts).hasToString("<TimeSeries model/scenario#1>");

        TimeSeries fromUrl = TimeSeries.fromUrl(ts.fullUrl(), name -> "memory".equals(name) ? platform : null);
        assertThat(fromUrl.version()).isEqualTo(1);
        assertThat(fromUrl.state()).isEqualTo(SessionState.LOADED);

        assertThatThrownBy(() -> TimeSeries.fromUrl("ixmp://elsewhere/model/scenario", name -> null))
                .isInstanceOf(ItemNotFoundException.class);
    }

    @Test
    void newUrlCreatesRun() {
        TimeSeries ts = TimeSeries.fromUrl("model/fresh#new", name -> platform);

        assertThat(ts.state()).isEqualTo(SessionState.NEW);
        assertThat(ts.annotation()).isEmpty();
    }

    // ==================== Data ====================

    @Test
    void yearBoundsAndSynonyms() {
        platform.addRegion("Austria", "country");
        platform.addRegionSynonym("AT", "Austria");
        TimeSeries ts = committed();

        ts.transact("regional", () -> ts.addTimeseries(List.of(
                row("AT", "GDP", 2000, 1.0), row("AT", "GDP", 2010, 2.0), row("AT", "GDP", 2050, 3.0)),
                false, 2005, 2040));

        assertThat(ts.timeseries(List.of("Austria"), null, null, null))
                .containsExactly(row("Austria", "GDP", 2010, 2.0));
    }

    @Test
    void rowsNeedRegionAndVariable() {
        TimeSeries ts = committed();
        ts.checkOut();

        assertThatThrownBy(() -> ts.addTimeseries(List.of(new TimeSeriesRow(null, "v", "u", "Year", 2010, 1.0))))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void wideFormatGroupsBySeries() {
        TimeSeries ts = committed();
        TreeMap<Integer, Double> values = new TreeMap<>(Map.of(2020, 2.0, 2030, 3.0));

        ts.transact("wide", () -> ts.addTimeseriesWide(
                List.of(new IamcRow("World", "Final Energy", "EJ/yr", "Year", values)), false));

        assertThat(ts.timeseriesWide(null, List.of("Final Energy"), null, null))
                .containsExactly(new IamcRow("World", "Final Energy", "EJ/yr", "Year", values));
    }

    @Test
    void removeIgnoresValuesAndUnits() {
        TimeSeries ts = committed();
        ts.checkOut();
        ts.addTimeseries(List.of(row("World", "Primary Energy", 2020, 2.0)));

        ts.removeTimeseries(List.of(new TimeSeriesRow("World", "Primary Energy", "other", "Year", 2010, 0.0)));

        assertThat(ts.timeseries()).containsExactly(row("World", "Primary Energy", 2020, 2.0));
    }

    @Test
    void geodataRoundTrip() {
        TimeSeries ts = committed();
        GeoRow area = new GeoRow("World", "Area", "Year", 2020, "148 million km2", "km2", false);
        ts.checkOut();

        ts.addGeodata(List.of(area));
        assertThat(ts.geodata()).containsExactly(area);

        ts.removeGeodata(List.of(area));
        assertThat(ts.geodata()).isEmpty();
    }

    // ==================== Meta ====================

    @Test
    void metaNeedsACommittedVersion() {
        TimeSeries ts = TimeSeries.createNew(platform, "model", "scenario", "draft");

        assertThatThrownBy(() -> ts.setMeta("source", "test")).isInstanceOf(PreconditionException.class)
                .hasMessageContaining("commit() before attaching meta data");
    }

    @Test
    void metaOfRunIncludesModelLevel() {
        TimeSeries ts = committed();
        platform.setMeta("model", null, null, Map.of("owner", "team"));

        ts.setMeta("source", "survey");
        ts.setMeta(Map.of("weight", 0.5));

        assertThat(ts.getMeta()).containsEntry("owner", "team").containsEntry("source", "survey")
                .containsEntry("weight", 0.5);
        assertThat(ts.getMeta("source")).isEqualTo("survey");

        ts.removeMeta("source");
        assertThatThrownBy(() -> ts.getMeta("source")).isInstanceOf(ItemNotFoundException.class);
    }
}
