package org.modelplatform.api.backend;

/**
 * A stored time-series value together with its metadata flag.
 * <p>
 * Rows flagged as metadata survive solution removal and are the only rows a clone without
 * solution carries over.
 */
public record TimeSeriesEntry(TimeSeriesRow row, boolean meta) {
}
