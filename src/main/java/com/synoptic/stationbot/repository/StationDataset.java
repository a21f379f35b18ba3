package com.synoptic.stationbot.repository;

import com.synoptic.stationbot.model.CatalogRow;

import java.util.List;

/**
 * Read-only access to the columnar station dataset.
 *
 * <p>Implementations throw {@link DatasetUnavailableException} when the dataset
 * cannot be read or does not have the expected columns.
 */
public interface StationDataset {

    /**
     * Scans the dataset once and returns one row per distinct
     * (region id, region name, station id, station name) combination, together with
     * the minimum and maximum date recorded for it.
     */
    List<CatalogRow> scanCatalog();

    /**
     * Returns every record of the given (region, station) pair ordered by the time
     * column ascending. The table is empty when no record matches.
     */
    StationTable readStation(String regionId, String stationId);
}
