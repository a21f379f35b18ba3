package com.synoptic.stationbot.service;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.synoptic.stationbot.model.CatalogSnapshot;
import com.synoptic.stationbot.model.Region;
import com.synoptic.stationbot.model.Station;
import com.synoptic.stationbot.model.StationExport;
import com.synoptic.stationbot.model.ValidityInterval;
import com.synoptic.stationbot.repository.StationDataset;
import com.synoptic.stationbot.repository.StationTable;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Builds the CSV extract of one station.
 *
 * <p>The station and its validity interval are looked up in the live catalog; the rows
 * come from the dataset, filtered to the exact (region, station) pair and ordered by
 * time. The file is produced in memory.
 *
 * <p>An empty result is {@link Optional#empty()}. When the catalog listed the station
 * with data but the dataset returns no rows the two disagree, which is logged at ERROR
 * as a consistency fault.
 */
@Singleton
public class ExportMaterializer {

    private static final Logger log = LoggerFactory.getLogger(ExportMaterializer.class);

    private static final Pattern UNSAFE_FILE_CHARS = Pattern.compile("[^\\p{L}\\p{N}._-]+");

    private final StationDataset dataset;
    private final CatalogIndexService catalog;
    private final CsvMapper csvMapper;

    @Inject
    public ExportMaterializer(StationDataset dataset, CatalogIndexService catalog, CsvMapper csvMapper) {
        this.dataset = dataset;
        this.catalog = catalog;
        this.csvMapper = csvMapper;
    }

    /**
     * Extracts and serializes the rows of a station.
     *
     * @return the export, or empty when there is nothing to deliver
     * @throws com.synoptic.stationbot.repository.DatasetUnavailableException when the dataset cannot be read
     */
    public Optional<StationExport> materialize(String regionId, String stationId) {
        CatalogSnapshot snapshot = catalog.snapshot();
        Optional<Station> station = snapshot.station(regionId, stationId);
        if (station.isEmpty()) {
            log.warn("Export requested for unknown region={} station={} (catalog generation={})",
                    regionId, stationId, snapshot.generation());
            return Optional.empty();
        }
        ValidityInterval interval = station.get().validity();
        if (interval == null) {
            log.warn("No dated rows for region={} station={}; nothing to export", regionId, stationId);
            return Optional.empty();
        }

        long started = System.nanoTime();
        StationTable table = dataset.readStation(regionId, stationId);
        if (table.isEmpty()) {
            log.error("Consistency fault: catalog generation={} lists region={} station={} with data {}..{} "
                            + "but the dataset returned no rows",
                    snapshot.generation(), regionId, stationId, interval.start(), interval.end());
            return Optional.empty();
        }

        byte[] content = toCsv(table);
        String regionName = snapshot.region(regionId).map(Region::name).orElse(regionId);
        String fileName = fileName(regionName, station.get().name(), interval);

        log.info("Materialized region={} station={} rows={} bytes={} in {} ms",
                regionId, stationId, table.rows().size(), content.length,
                (System.nanoTime() - started) / 1_000_000);

        return Optional.of(new StationExport(
                regionId,
                stationId,
                station.get().name(),
                interval.start(),
                interval.end(),
                fileName,
                content,
                table.rows().size()));
    }

    // -----------------------------------------------------------------------
    // Private helpers
    // -----------------------------------------------------------------------

    byte[] toCsv(StationTable table) {
        CsvSchema.Builder builder = CsvSchema.builder();
        for (String column : table.columns()) {
            builder.addColumn(column);
        }
        CsvSchema schema = builder.build().withHeader();

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (SequenceWriter writer = csvMapper.writer(schema).writeValues(out)) {
            for (List<Object> row : table.rows()) {
                writer.write(row.toArray());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("CSV serialization failed", e);
        }
        return out.toByteArray();
    }

    static String fileName(String regionName, String stationName, ValidityInterval interval) {
        return sanitize(regionName) + "_" + sanitize(stationName) + "_"
                + interval.start() + "_" + interval.end() + ".csv";
    }

    static String sanitize(String part) {
        String cleaned = UNSAFE_FILE_CHARS.matcher(part.trim()).replaceAll("_");
        return cleaned.isEmpty() ? "_" : cleaned;
    }
}
