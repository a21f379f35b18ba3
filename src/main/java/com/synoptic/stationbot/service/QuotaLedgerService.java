package com.synoptic.stationbot.service;

import com.synoptic.stationbot.model.DownloadEvent;
import com.synoptic.stationbot.model.QuotaDecision;
import com.synoptic.stationbot.repository.DownloadEventRepository;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.LocalDate;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Download quota ledger.
 *
 * <p>{@link #reserveAndLog} re-checks eligibility and appends the {@link DownloadEvent}
 * as one unit:
 * <ol>
 *   <li>take the user's lock stripe (bounded wait), so same-user reservations run one
 *       at a time while other users proceed in parallel</li>
 *   <li>open a JDBC transaction, evaluate the policy, insert the event</li>
 *   <li>optionally run the delivery while the transaction is open; the insert commits
 *       only if the delivery reports success</li>
 * </ol>
 * The transaction is managed by hand on a pooled connection, the same way the rest of
 * the repository layer does it, so the commit point is explicit.
 *
 * <p>Anything that keeps the ledger from answering (lock timeout, interrupted wait,
 * {@link SQLException}) is answered with {@link QuotaDecision#DENIED}.
 */
@Singleton
public class QuotaLedgerService {

    private static final Logger log = LoggerFactory.getLogger(QuotaLedgerService.class);

    private static final int LOCK_STRIPES = 64;

    /**
     * Work run while a reservation is held open.
     */
    @FunctionalInterface
    public interface Delivery {

        /**
         * @return true when the export reached the user; false rolls the reservation back
         */
        boolean deliver();
    }

    private final DownloadEventRepository repository;
    private final QuotaPolicy policy;
    private final Duration lockTimeout;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    @Inject
    public QuotaLedgerService(DownloadEventRepository repository,
                              QuotaPolicy policy,
                              @Value("${station-bot.quota.lock-timeout:5s}") Duration lockTimeout) {
        this.repository = repository;
        this.policy = policy;
        this.lockTimeout = lockTimeout;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    // -----------------------------------------------------------------------
    // Eligibility
    // -----------------------------------------------------------------------

    /**
     * Read-only eligibility check used to gate the station pick. The answer is advisory;
     * {@link #reserveAndLog} decides again under the lock.
     *
     * @return false when the user is over quota or the ledger cannot be read
     */
    public boolean canDownload(long userId, LocalDate today) {
        try (Connection conn = repository.getDataSource().getConnection()) {
            return isEligible(conn, userId, today);
        } catch (SQLException e) {
            log.error("Quota check failed userId={} date={}; denying", userId, today, e);
            return false;
        }
    }

    // -----------------------------------------------------------------------
    // Reservation
    // -----------------------------------------------------------------------

    /**
     * Checks eligibility and records a download in one step.
     *
     * @return {@link QuotaDecision#COMMITTED} when the event was stored, otherwise
     *         {@link QuotaDecision#DENIED}
     */
    public QuotaDecision reserveAndLog(long userId, String displayName, String stationId, LocalDate today) {
        return reserveAndLog(userId, displayName, null, stationId, today, null);
    }

    /**
     * Checks eligibility, inserts the event and runs {@code delivery} before committing.
     *
     * <p>Outcomes:
     * <ul>
     *   <li>not eligible, lock timeout, ledger error: {@link QuotaDecision#DENIED},
     *       delivery not run</li>
     *   <li>delivery returns false: insert rolled back, {@link QuotaDecision#ABORTED}</li>
     *   <li>delivery throws: insert rolled back, exception propagated</li>
     *   <li>delivery returns true (or is null): {@link QuotaDecision#COMMITTED}</li>
     * </ul>
     *
     * @param regionId region of the station; stored for reporting, may be null
     * @param delivery work to run inside the reservation, may be null
     */
    public QuotaDecision reserveAndLog(long userId,
                                       String displayName,
                                       String regionId,
                                       String stationId,
                                       LocalDate today,
                                       Delivery delivery) {
        ReentrantLock lock = lockFor(userId);
        try {
            if (!lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Quota lock not acquired within {} for userId={}; denying", lockTimeout, userId);
                return QuotaDecision.DENIED;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted waiting for quota lock userId={}; denying", userId);
            return QuotaDecision.DENIED;
        }

        try {
            return reserveLocked(userId, displayName, regionId, stationId, today, delivery);
        } finally {
            lock.unlock();
        }
    }

    private QuotaDecision reserveLocked(long userId,
                                        String displayName,
                                        String regionId,
                                        String stationId,
                                        LocalDate today,
                                        Delivery delivery) {
        try (Connection conn = repository.getDataSource().getConnection()) {
            conn.setAutoCommit(false);
            try {
                if (!isEligible(conn, userId, today)) {
                    conn.rollback();
                    log.info("Download denied userId={} station={} date={}", userId, stationId, today);
                    return QuotaDecision.DENIED;
                }

                DownloadEvent event = DownloadEvent.builder()
                        .userId(userId)
                        .displayName(displayName)
                        .regionId(regionId)
                        .stationId(stationId)
                        .eventDate(today)
                        .build();
                repository.insert(conn, event);

                if (delivery != null && !delivery.deliver()) {
                    conn.rollback();
                    log.warn("Delivery did not complete userId={} station={}; reservation rolled back",
                            userId, stationId);
                    return QuotaDecision.ABORTED;
                }

                conn.commit();
                log.info("Download committed id={} userId={} station={} date={}",
                        event.getId(), userId, stationId, today);
                return QuotaDecision.COMMITTED;

            } catch (SQLException | RuntimeException e) {
                rollback(conn, userId);
                throw e;
            }
        } catch (SQLException e) {
            log.error("Quota ledger unavailable userId={} station={} date={}; denying",
                    userId, stationId, today, e);
            return QuotaDecision.DENIED;
        }
    }

    // -----------------------------------------------------------------------
    // Private helpers
    // -----------------------------------------------------------------------

    private boolean isEligible(Connection conn, long userId, LocalDate today) throws SQLException {
        boolean exempt = policy.isExempt(userId);
        if (exempt && policy.exemptBypassesMonthlyCap()) {
            return true;
        }
        if (!exempt && repository.existsOnDate(conn, userId, today)) {
            log.debug("userId={} already downloaded on {}", userId, today);
            return false;
        }
        if (policy.hasMonthlyCap()) {
            long used = repository.countSince(conn, userId, today.withDayOfMonth(1));
            if (used >= policy.monthlyCap()) {
                log.debug("userId={} reached monthly cap used={} cap={}", userId, used, policy.monthlyCap());
                return false;
            }
        }
        return true;
    }

    private ReentrantLock lockFor(long userId) {
        return locks[Math.floorMod(Long.hashCode(userId), LOCK_STRIPES)];
    }

    private static void rollback(Connection conn, long userId) {
        try {
            conn.rollback();
        } catch (SQLException rollbackEx) {
            log.error("Rollback failed for userId={}", userId, rollbackEx);
        }
    }
}
