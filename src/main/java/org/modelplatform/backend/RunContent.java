package org.modelplatform.backend;

import java.util.LinkedHashMap;
import java.util.Map;

import org.modelplatform.api.backend.GeoRow;
import org.modelplatform.api.backend.TimeSeriesEntry;
import org.modelplatform.api.backend.TimeSeriesRow;

/**
 * Complete data of one run: items, time series, geodata and the solution flag.
 * <p>
 * {@link AbstractBackend} edits a working copy of this class while a session is checked out;
 * engines load and persist it as a whole.
 */
public final class RunContent {

    /**
     * Identity of a time-series value.
     */
    public record SeriesKey(String region, String variable, String unit, String subannual, int year) {

        public static SeriesKey of(TimeSeriesRow row) {
            return new SeriesKey(row.region(), row.variable(), row.unit(), row.subannual(), row.year());
        }
    }

    /**
     * Identity of a geodata value.
     */
    public record GeoKey(String region, String variable, String subannual, int year) {

        public static GeoKey of(GeoRow row) {
            return new GeoKey(row.region(), row.variable(), row.subannual(), row.year());
        }
    }

    private final LinkedHashMap<String, ItemState> items = new LinkedHashMap<>();
    private final LinkedHashMap<SeriesKey, TimeSeriesEntry> timeseries = new LinkedHashMap<>();
    private final LinkedHashMap<GeoKey, GeoRow> geodata = new LinkedHashMap<>();
    private boolean hasSolution;

    public Map<String, ItemState> items() {
        return items;
    }

    public Map<SeriesKey, TimeSeriesEntry> timeseries() {
        return timeseries;
    }

    public Map<GeoKey, GeoRow> geodata() {
        return geodata;
    }

    public boolean hasSolution() {
        return hasSolution;
    }

    public void setHasSolution(boolean hasSolution) {
        this.hasSolution = hasSolution;
    }

    public void putSeries(TimeSeriesEntry entry) {
        timeseries.put(SeriesKey.of(entry.row()), entry);
    }

    public void putGeo(GeoRow row) {
        geodata.put(GeoKey.of(row), row);
    }

    public RunContent copy() {
        RunContent copy = new RunContent();
        items.forEach((name, state) -> copy.items.put(name, state.copy()));
        copy.timeseries.putAll(timeseries);
        copy.geodata.putAll(geodata);
        copy.hasSolution = hasSolution;
        return copy;
    }
}
