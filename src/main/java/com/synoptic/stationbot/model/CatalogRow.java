package com.synoptic.stationbot.model;

import java.time.LocalDate;

/**
 * One aggregated row of the catalog scan: a distinct (region, station) pair together
 * with the earliest and latest date recorded for it.
 *
 * {@code minDate}/{@code maxDate} are null when every time value for the pair is null.
 */
public record CatalogRow(
        String regionId,
        String regionName,
        String stationId,
        String stationName,
        LocalDate minDate,
        LocalDate maxDate
) {
}
