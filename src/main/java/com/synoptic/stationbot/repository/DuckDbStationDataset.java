package com.synoptic.stationbot.repository;

import com.synoptic.stationbot.model.CatalogRow;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.sql.*;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * {@link StationDataset} backed by DuckDB, which queries the Parquet (or CSV) file in
 * place without loading it into the JVM heap.
 *
 * <p>Each call opens its own in-memory DuckDB connection; DuckDB connections are not
 * safe for concurrent statements and an in-memory connection costs next to nothing to
 * open.
 *
 * <p>Column names are configurable under {@code station-bot.dataset.columns.*} so that
 * datasets with a different schema can be served without code changes.
 */
@Singleton
public class DuckDbStationDataset implements StationDataset {

    private static final Logger log = LoggerFactory.getLogger(DuckDbStationDataset.class);

    private static final String DUCKDB_URL = "jdbc:duckdb:";

    private static final DateTimeFormatter DATE_TIME_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final String datasetPath;
    private final String regionIdColumn;
    private final String regionNameColumn;
    private final String stationIdColumn;
    private final String stationNameColumn;
    private final String timeColumn;

    @Inject
    public DuckDbStationDataset(@Value("${station-bot.dataset.path}") String datasetPath,
                                @Value("${station-bot.dataset.columns.region-id:region_id}") String regionIdColumn,
                                @Value("${station-bot.dataset.columns.region-name:region_name}") String regionNameColumn,
                                @Value("${station-bot.dataset.columns.station-id:station_id}") String stationIdColumn,
                                @Value("${station-bot.dataset.columns.station-name:station_name}") String stationNameColumn,
                                @Value("${station-bot.dataset.columns.time:date}") String timeColumn) {
        this.datasetPath = datasetPath;
        this.regionIdColumn = regionIdColumn;
        this.regionNameColumn = regionNameColumn;
        this.stationIdColumn = stationIdColumn;
        this.stationNameColumn = stationNameColumn;
        this.timeColumn = timeColumn;
    }

    // -----------------------------------------------------------------------
    // Catalog scan
    // -----------------------------------------------------------------------

    /**
     * Projects the four catalog columns and aggregates min/max date per pair in a
     * single GROUP BY over the dataset.
     */
    @Override
    public List<CatalogRow> scanCatalog() {
        final String sql = """
                SELECT CAST(%1$s AS VARCHAR)            AS region_id,
                       CAST(%2$s AS VARCHAR)            AS region_name,
                       CAST(%3$s AS VARCHAR)            AS station_id,
                       CAST(%4$s AS VARCHAR)            AS station_name,
                       CAST(MIN(TRY_CAST(%5$s AS DATE)) AS VARCHAR) AS min_date,
                       CAST(MAX(TRY_CAST(%5$s AS DATE)) AS VARCHAR) AS max_date
                  FROM %6$s
                 GROUP BY 1, 2, 3, 4
                """.formatted(
                quoteIdentifier(regionIdColumn),
                quoteIdentifier(regionNameColumn),
                quoteIdentifier(stationIdColumn),
                quoteIdentifier(stationNameColumn),
                quoteIdentifier(timeColumn),
                sourceExpression());

        long started = System.nanoTime();
        List<CatalogRow> result = new ArrayList<>();
        try (Connection conn = DriverManager.getConnection(DUCKDB_URL);
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery(sql)) {

            while (rs.next()) {
                result.add(new CatalogRow(
                        rs.getString("region_id"),
                        rs.getString("region_name"),
                        rs.getString("station_id"),
                        rs.getString("station_name"),
                        parseDate(rs.getString("min_date")),
                        parseDate(rs.getString("max_date"))));
            }
        } catch (SQLException e) {
            log.error("Catalog scan failed for dataset={}", datasetPath, e);
            throw new DatasetUnavailableException("Cannot scan dataset " + datasetPath, e);
        }

        log.info("Catalog scan of {} returned {} pairs in {} ms",
                datasetPath, result.size(), (System.nanoTime() - started) / 1_000_000);
        return result;
    }

    // -----------------------------------------------------------------------
    // Station extract
    // -----------------------------------------------------------------------

    @Override
    public StationTable readStation(String regionId, String stationId) {
        final String sql = """
                SELECT *
                  FROM %1$s
                 WHERE CAST(%2$s AS VARCHAR) = ?
                   AND CAST(%3$s AS VARCHAR) = ?
                 ORDER BY %4$s ASC
                """.formatted(
                sourceExpression(),
                quoteIdentifier(regionIdColumn),
                quoteIdentifier(stationIdColumn),
                quoteIdentifier(timeColumn));

        try (Connection conn = DriverManager.getConnection(DUCKDB_URL);
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, regionId);
            ps.setString(2, stationId);
            try (ResultSet rs = ps.executeQuery()) {
                ResultSetMetaData md = rs.getMetaData();
                int columnCount = md.getColumnCount();

                List<String> columns = new ArrayList<>(columnCount);
                for (int i = 1; i <= columnCount; i++) {
                    columns.add(md.getColumnLabel(i));
                }

                List<List<Object>> rows = new ArrayList<>();
                while (rs.next()) {
                    List<Object> row = new ArrayList<>(columnCount);
                    for (int i = 1; i <= columnCount; i++) {
                        row.add(toCsvValue(rs.getObject(i)));
                    }
                    rows.add(row);
                }

                log.info("Read {} rows for region={} station={}", rows.size(), regionId, stationId);
                return new StationTable(columns, rows);
            }
        } catch (SQLException e) {
            log.error("Station read failed region={} station={} dataset={}", regionId, stationId, datasetPath, e);
            throw new DatasetUnavailableException("Cannot read station " + stationId + " from " + datasetPath, e);
        }
    }

    // -----------------------------------------------------------------------
    // Private helpers
    // -----------------------------------------------------------------------

    /**
     * Table function reading the dataset file. CSV files are sniffed by DuckDB;
     * everything else is read as Parquet (globs such as {@code data/*.parquet} work).
     */
    String sourceExpression() {
        String literal = "'" + datasetPath.replace("'", "''") + "'";
        if (datasetPath.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            return "read_csv_auto(" + literal + ")";
        }
        return "read_parquet(" + literal + ")";
    }

    static String quoteIdentifier(String name) {
        return '"' + name.replace("\"", "\"\"") + '"';
    }

    private static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return LocalDate.parse(value.trim());
    }

    private static Object toCsvValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Date d) {
            return d.toLocalDate().toString();
        }
        if (value instanceof Timestamp ts) {
            return ts.toLocalDateTime().format(DATE_TIME_FMT);
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt.format(DATE_TIME_FMT);
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toLocalDateTime().format(DATE_TIME_FMT);
        }
        if (value instanceof BigDecimal bd) {
            return bd.toPlainString();
        }
        return value.toString();
    }
}
