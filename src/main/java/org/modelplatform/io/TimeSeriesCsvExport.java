package org.modelplatform.io;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.modelplatform.api.backend.ScenarioInfo;
import org.modelplatform.api.backend.TimeSeriesEntry;
import org.modelplatform.api.backend.TimeSeriesRow;
import org.modelplatform.api.exceptions.ValidationException;
import org.modelplatform.core.Platform;
import org.modelplatform.core.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes time-series rows of many runs into one CSV file.
 * <p>
 * One line per stored value, with the columns of {@link #HEADER}. {@code META} is {@code 1} for
 * rows flagged as metadata and {@code 0} otherwise.
 */
public final class TimeSeriesCsvExport {

    private static final Logger log = LoggerFactory.getLogger(TimeSeriesCsvExport.class);

    public static final List<String> HEADER = List.of(
            "MODEL", "SCENARIO", "VERSION", "VARIABLE", "UNIT", "REGION", "META", "SUBANNUAL", "YEAR", "VALUE");

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader(HEADER.toArray(String[]::new))
            .setRecordSeparator('\n')
            .build();

    private final boolean defaultOnly;
    private final String model;
    private final String scenario;
    private final Collection<String> variables;
    private final Collection<String> units;
    private final Collection<String> regions;
    private final boolean allRuns;

    /**
     * @param defaultOnly only default versions; ignored with {@code allRuns}
     * @param model       model name or null for all models
     * @param scenario    scenario name or null for all scenarios
     * @param variables   variables to export, null or empty for all
     * @param units       units to export, null or empty for all
     * @param regions     regions to export, null or empty for all
     * @param allRuns     every stored version of every (model, scenario)
     * @throws ValidationException if {@code allRuns} is combined with a model or scenario
     */
    public TimeSeriesCsvExport(boolean defaultOnly, String model, String scenario, Collection<String> variables,
                               Collection<String> units, Collection<String> regions, boolean allRuns) {
        if (allRuns && (model != null || scenario != null)) {
            throw new ValidationException("Invalid arguments: exporting all runs cannot be combined with a model or "
                    + "scenario");
        }
        this.defaultOnly = defaultOnly;
        this.model = model;
        this.scenario = scenario;
        this.variables = variables;
        this.units = units;
        this.regions = regions;
        this.allRuns = allRuns;
    }

    /**
     * @param path target file, must end in {@code .csv}; an existing file is replaced
     * @return number of data lines written
     */
    public int write(Platform platform, Path path) throws IOException {
        if (!path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv")) {
            throw new ValidationException("Time series can only be exported to a .csv file, got " + path);
        }
        List<ScenarioInfo> runs = allRuns
                ? platform.scenarioList(false, null, null)
                : platform.scenarioList(defaultOnly, model, scenario);

        int lines = 0;
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, FORMAT)) {
            for (ScenarioInfo run : runs) {
                try (TimeSeries ts = TimeSeries.load(platform, run.model(), run.scenario(), run.version())) {
                    for (TimeSeriesEntry entry : ts.timeseriesEntries()) {
                        TimeSeriesRow row = entry.row();
                        if (!selected(variables, row.variable()) || !selected(units, row.unit())
                                || !selected(regions, row.region())) {
                            continue;
                        }
                        printer.printRecord(run.model(), run.scenario(), run.version(), row.variable(), row.unit(),
                                row.region(), entry.meta() ? 1 : 0, row.subannual(), row.year(), row.value());
                        lines++;
                    }
                }
            }
        }
        log.debug("Exported {} time-series rows of {} runs to {}", lines, runs.size(), path);
        return lines;
    }

    private static boolean selected(Collection<String> allowed, String value) {
        return allowed == null || allowed.isEmpty() || allowed.contains(value);
    }
}
