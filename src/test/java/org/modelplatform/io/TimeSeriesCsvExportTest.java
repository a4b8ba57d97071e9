package org.modelplatform.io;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.modelplatform.api.backend.TimeSeriesRow;
import org.modelplatform.api.exceptions.ValidationException;
import org.modelplatform.core.Platform;
import org.modelplatform.core.TimeSeries;
import org.modelplatform.junit.extensions.logging.LogWatchExtension;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class TimeSeriesCsvExportTest {

    private static final String HEADER = "MODEL,SCENARIO,VERSION,VARIABLE,UNIT,REGION,META,SUBANNUAL,YEAR,VALUE";

    @TempDir
    Path dir;

    private Platform platform;

    @BeforeEach
    void setUp() {
        platform = Platform.create("memory", ConfigFactory.empty());
    }

    @AfterEach
    void tearDown() {
        platform.close();
    }

    private TimeSeries run(String model, String scenario, double cost) {
        TimeSeries ts = TimeSeries.createNew(platform, model, scenario, "export test");
        ts.transact("data", () -> {
            ts.addTimeseries(List.of(new TimeSeriesRow("World", "Cost", "USD", "Year", 2010, cost),
                    new TimeSeriesRow("World", "Cost", "USD", "Year", 2020, cost + 10)));
            ts.addTimeseries(List.of(new TimeSeriesRow("World", "Population", "million", "Year", 2010, 7.0)),
                    true, null, null);
        });
        ts.setAsDefault();
        return ts;
    }

    private static List<String> lines(Path file) throws IOException {
        return Files.readAllLines(file, StandardCharsets.UTF_8);
    }

    @Test
    void writesOneLinePerValueOfTheDefaultRuns() throws IOException {
        run("energy", "baseline", 100.0);
        run("energy", "policy", 200.0);
        Path file = dir.resolve("export.csv");

        int written = platform.exportTimeseriesData(file, null, null);

        List<String> lines = lines(file);
        assertThat(written).isEqualTo(6);
        assertThat(lines).hasSize(7);
        assertThat(lines.get(0)).isEqualTo(HEADER);
        assertThat(lines).contains(
                "energy,baseline,1,Cost,USD,World,0,Year,2010,100.0",
                "energy,policy,1,Population,million,World,1,Year,2010,7.0");
    }

    @Test
    void filtersByModelVariableAndRegion() throws IOException {
        run("energy", "baseline", 100.0);
        run("transport", "baseline", 50.0);
        Path file = dir.resolve("cost.csv");

        int written = platform.exportTimeseriesData(file, true, "energy", null, List.of("Cost"), null,
                List.of("World"), false);

        assertThat(written).isEqualTo(2);
        assertThat(lines(file)).containsExactly(HEADER,
                "energy,baseline,1,Cost,USD,World,0,Year,2010,100.0",
                "energy,baseline,1,Cost,USD,World,0,Year,2020,110.0");
    }

    @Test
    void allRunsIncludesEveryVersion() throws IOException {
        run("energy", "baseline", 100.0);
        run("energy", "baseline", 300.0);
        Path defaults = dir.resolve("defaults.csv");
        Path all = dir.resolve("all.csv");

        platform.exportTimeseriesData(defaults, true, null, null, List.of("Cost"), null, null, false);
        platform.exportTimeseriesData(all, true, null, null, List.of("Cost"), null, null, true);

        assertThat(lines(defaults)).hasSize(3).allMatch(line -> !line.startsWith("energy,baseline,1,"));
        assertThat(lines(all)).hasSize(5)
                .contains("energy,baseline,1,Cost,USD,World,0,Year,2010,100.0",
                        "energy,baseline,2,Cost,USD,World,0,Year,2010,300.0");
    }

    @Test
    void allRunsCannotBeNarrowedToAModelOrScenario() {
        assertThatThrownBy(() -> platform.exportTimeseriesData(dir.resolve("x.csv"), true, "energy", null,
                null, null, null, true))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("cannot be combined with a model or scenario");
    }

    @Test
    void onlyCsvFilesAreAccepted() {
        run("energy", "baseline", 100.0);
        Path file = dir.resolve("export.xlsx");

        assertThatThrownBy(() -> platform.exportTimeseriesData(file, null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining(".csv");
        assertThat(file).doesNotExist();
    }

    @Test
    void emptyPlatformWritesOnlyTheHeader() throws IOException {
        Path file = dir.resolve("empty.csv");

        assertThat(platform.exportTimeseriesData(file, null, null)).isZero();
        assertThat(lines(file)).containsExactly(HEADER);
    }
}
