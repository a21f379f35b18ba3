package com.synoptic.stationbot.model;

import java.time.LocalDate;

/**
 * A materialized per-station extract, ready to be sent.
 *
 * @param regionId      region of the station
 * @param stationId     exported station
 * @param stationName   display name of the station
 * @param intervalStart first date with data, from the catalog
 * @param intervalEnd   last date with data, from the catalog
 * @param fileName      suggested file name of the attachment
 * @param content       CSV bytes, UTF-8, header row first
 * @param rowCount      number of data rows (header excluded)
 */
public record StationExport(
        String regionId,
        String stationId,
        String stationName,
        LocalDate intervalStart,
        LocalDate intervalEnd,
        String fileName,
        byte[] content,
        int rowCount
) {
}
