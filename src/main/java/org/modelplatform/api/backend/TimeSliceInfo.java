package org.modelplatform.api.backend;

import java.util.List;

/**
 * A sub-annual time slice. {@code duration} is the fraction of a year it covers.
 */
public record TimeSliceInfo(String name, String category, double duration) {

    public static final List<String> FIELDS = List.of("name", "category", "duration");

    /** Time slice every backend defines; used when no sub-annual slice is given. */
    public static final TimeSliceInfo YEAR = new TimeSliceInfo("Year", "Year", 1.0);
}
