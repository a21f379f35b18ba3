package com.synoptic.stationbot.repository;

import com.synoptic.stationbot.model.DownloadEvent;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC-based repository for the append-only {@code download_event} table.
 *
 * <p>The quota checks ({@link #existsOnDate}, {@link #countSince}) and {@link #insert}
 * come in overloads that take a {@link Connection} so the ledger can run the
 * check and the append inside one transaction. The table is never updated or
 * deleted from.
 *
 * <p>Every statement carries a query timeout so that a locked or unreachable
 * database surfaces as an {@link SQLException} instead of a hang.
 */
@Singleton
public class DownloadEventRepository {

    private static final Logger log = LoggerFactory.getLogger(DownloadEventRepository.class);

    private final DataSource dataSource;
    private final int queryTimeoutSeconds;

    @Inject
    public DownloadEventRepository(DataSource dataSource,
                                   @Value("${station-bot.quota.query-timeout-seconds:5}") int queryTimeoutSeconds) {
        this.dataSource = dataSource;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    // -----------------------------------------------------------------------
    // Quota reads (transactional overloads)
    // -----------------------------------------------------------------------

    /**
     * Returns whether the user has at least one download dated {@code date}.
     *
     * @param conn   active JDBC connection (may be within a transaction)
     * @param userId user to check
     * @param date   event date to match
     */
    public boolean existsOnDate(Connection conn, long userId, LocalDate date) throws SQLException {
        final String sql = """
                SELECT 1
                  FROM download_event
                 WHERE user_id = ?
                   AND event_date = ?
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setQueryTimeout(queryTimeoutSeconds);
            ps.setMaxRows(1);
            ps.setLong(1, userId);
            ps.setDate(2, Date.valueOf(date));
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    /**
     * Counts the user's downloads dated on or after {@code fromInclusive}.
     *
     * @param conn          active JDBC connection (may be within a transaction)
     * @param userId        user to count
     * @param fromInclusive first event date that counts
     */
    public long countSince(Connection conn, long userId, LocalDate fromInclusive) throws SQLException {
        final String sql = """
                SELECT COUNT(*)
                  FROM download_event
                 WHERE user_id = ?
                   AND event_date >= ?
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setQueryTimeout(queryTimeoutSeconds);
            ps.setLong(1, userId);
            ps.setDate(2, Date.valueOf(fromInclusive));
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }

    // -----------------------------------------------------------------------
    // Write operations
    // -----------------------------------------------------------------------

    /**
     * Appends a download event using the provided connection (supports transactional use).
     *
     * @param conn  active JDBC connection (may be within a transaction)
     * @param event the event to persist (id and createdAt are set on return)
     * @return the saved event
     */
    public DownloadEvent insert(Connection conn, DownloadEvent event) throws SQLException {
        final String sql = """
                INSERT INTO download_event
                    (user_id, display_name, region_id, station_id, event_date, created_at)
                VALUES (?, ?, ?, ?, ?, ?)
                """;

        Instant now = Instant.now();
        try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setQueryTimeout(queryTimeoutSeconds);
            ps.setLong(1, event.getUserId());
            setNullableString(ps, 2, event.getDisplayName());
            setNullableString(ps, 3, event.getRegionId());
            ps.setString(4, event.getStationId());
            ps.setDate(5, Date.valueOf(event.getEventDate()));
            ps.setTimestamp(6, Timestamp.from(now));
            ps.executeUpdate();

            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (keys.next()) {
                    event.setId(keys.getLong(1));
                }
            }
        }
        event.setCreatedAt(now);
        log.info("Inserted download_event id={} userId={} station={} date={}",
                event.getId(), event.getUserId(), event.getStationId(), event.getEventDate());
        return event;
    }

    // -----------------------------------------------------------------------
    // Report reads
    // -----------------------------------------------------------------------

    /**
     * Returns all downloads dated {@code date}, oldest first.
     *
     * @param date event date to list
     * @return list of events (may be empty)
     */
    public List<DownloadEvent> findByDate(LocalDate date) {
        final String sql = """
                SELECT id, user_id, display_name, region_id, station_id, event_date, created_at
                  FROM download_event
                 WHERE event_date = ?
                 ORDER BY created_at, id
                """;

        List<DownloadEvent> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(queryTimeoutSeconds);
            ps.setDate(1, Date.valueOf(date));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Error in findByDate date={}", date, e);
            throw new RuntimeException("DB error in findByDate", e);
        }
        return result;
    }

    /**
     * Counts every download of a user, across all dates.
     */
    public long countByUser(long userId) {
        final String sql = "SELECT COUNT(*) FROM download_event WHERE user_id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(queryTimeoutSeconds);
            ps.setLong(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            log.error("Error in countByUser userId={}", userId, e);
            throw new RuntimeException("DB error in countByUser", e);
        }
    }

    /**
     * Returns the distinct station ids a user has downloaded, ascending.
     */
    public List<String> findDistinctStationsByUser(long userId) {
        final String sql = """
                SELECT DISTINCT station_id
                  FROM download_event
                 WHERE user_id = ?
                 ORDER BY station_id
                """;

        List<String> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(queryTimeoutSeconds);
            ps.setLong(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(rs.getString(1));
                }
            }
        } catch (SQLException e) {
            log.error("Error in findDistinctStationsByUser userId={}", userId, e);
            throw new RuntimeException("DB error in findDistinctStationsByUser", e);
        }
        return result;
    }

    /**
     * Counts distinct users that have downloaded at least once.
     */
    public long countDistinctUsers() {
        final String sql = "SELECT COUNT(DISTINCT user_id) FROM download_event";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(queryTimeoutSeconds);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException e) {
            log.error("Error in countDistinctUsers", e);
            throw new RuntimeException("DB error in countDistinctUsers", e);
        }
    }

    // -----------------------------------------------------------------------
    // DataSource accessor — used by the ledger for transactional control
    // -----------------------------------------------------------------------

    /**
     * Returns the underlying {@link DataSource} so that the ledger can open a
     * transactional connection and pass it to the connection-taking overloads.
     *
     * @return the injected DataSource
     */
    public DataSource getDataSource() {
        return dataSource;
    }

    // -----------------------------------------------------------------------
    // Private helpers
    // -----------------------------------------------------------------------

    private DownloadEvent mapRow(ResultSet rs) throws SQLException {
        return DownloadEvent.builder()
                .id(rs.getLong("id"))
                .userId(rs.getLong("user_id"))
                .displayName(rs.getString("display_name"))
                .regionId(rs.getString("region_id"))
                .stationId(rs.getString("station_id"))
                .eventDate(rs.getDate("event_date").toLocalDate())
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .build();
    }

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }

    private static void setNullableString(PreparedStatement ps, int idx, String value) throws SQLException {
        if (value == null) {
            ps.setNull(idx, Types.VARCHAR);
        } else {
            ps.setString(idx, value);
        }
    }
}
