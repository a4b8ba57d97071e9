package org.modelplatform.api.backend;

import java.util.List;

/**
 * One geodata value. Unlike {@link TimeSeriesRow} the value is free text and the row carries
 * its own metadata flag. Component order follows {@link #FIELDS}.
 */
public record GeoRow(String region, String variable, String subannual, int year, String value, String unit,
                     boolean meta) {

    public static final List<String> FIELDS =
            List.of("region", "variable", "subannual", "year", "value", "unit", "meta");
}
