package com.synoptic.stationbot.service;

import com.synoptic.stationbot.model.DownloadEvent;
import com.synoptic.stationbot.model.QuotaDecision;
import com.synoptic.stationbot.repository.DownloadEventRepository;
import com.synoptic.stationbot.support.LedgerDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class QuotaLedgerServiceTest {

    private static final long USER = 42L;
    private static final long EXEMPT = 7L;
    private static final LocalDate MAY_1 = LocalDate.of(2024, 5, 1);

    private DataSource dataSource;
    private DownloadEventRepository repository;

    @BeforeEach
    void setUp() {
        dataSource = LedgerDatabase.create();
        repository = new DownloadEventRepository(dataSource, 5);
    }

    private QuotaLedgerService ledger(int monthlyCap, boolean exemptBypassesMonthlyCap) {
        QuotaPolicy policy = new QuotaPolicy(monthlyCap, Set.of(EXEMPT), exemptBypassesMonthlyCap);
        return new QuotaLedgerService(repository, policy, Duration.ofSeconds(2));
    }

    // -----------------------------------------------------------------------
    // Daily rule
    // -----------------------------------------------------------------------

    @Test
    void firstDownloadOfTheDayCommits() {
        QuotaLedgerService ledger = ledger(10, true);

        assertTrue(ledger.canDownload(USER, MAY_1));
        assertEquals(QuotaDecision.COMMITTED, ledger.reserveAndLog(USER, "sara", "40754", MAY_1));

        List<DownloadEvent> events = repository.findByDate(MAY_1);
        assertEquals(1, events.size());
        assertEquals(USER, events.get(0).getUserId());
        assertEquals("sara", events.get(0).getDisplayName());
        assertEquals("40754", events.get(0).getStationId());
        assertNotNull(events.get(0).getId());
        assertNotNull(events.get(0).getCreatedAt());
    }

    @Test
    void secondDownloadOnSameDayIsDenied() {
        QuotaLedgerService ledger = ledger(10, true);
        ledger.reserveAndLog(USER, "sara", "40754", MAY_1);

        assertFalse(ledger.canDownload(USER, MAY_1));
        assertEquals(QuotaDecision.DENIED, ledger.reserveAndLog(USER, "sara", "40751", MAY_1));
        assertEquals(1L, LedgerDatabase.countEvents(dataSource));
    }

    @Test
    void nextDayIsAllowedAgain() {
        QuotaLedgerService ledger = ledger(10, true);
        ledger.reserveAndLog(USER, "sara", "40754", MAY_1);

        assertEquals(QuotaDecision.COMMITTED, ledger.reserveAndLog(USER, "sara", "40754", MAY_1.plusDays(1)));
    }

    @Test
    void otherUsersAreNotAffected() {
        QuotaLedgerService ledger = ledger(10, true);
        ledger.reserveAndLog(USER, "sara", "40754", MAY_1);

        assertEquals(QuotaDecision.COMMITTED, ledger.reserveAndLog(USER + 1, "ali", "40754", MAY_1));
    }

    // -----------------------------------------------------------------------
    // Monthly cap
    // -----------------------------------------------------------------------

    @Test
    void monthlyCapBlocksTheNextReservation() {
        QuotaLedgerService ledger = ledger(3, true);
        for (int day = 0; day < 3; day++) {
            assertEquals(QuotaDecision.COMMITTED, ledger.reserveAndLog(USER, "sara", "s" + day, MAY_1.plusDays(day)));
        }

        assertFalse(ledger.canDownload(USER, MAY_1.plusDays(3)));
        assertEquals(QuotaDecision.DENIED, ledger.reserveAndLog(USER, "sara", "s3", MAY_1.plusDays(3)));
        assertEquals(3L, LedgerDatabase.countEvents(dataSource));
    }

    @Test
    void monthlyCapResetsOnTheFirstOfTheMonth() {
        QuotaLedgerService ledger = ledger(2, true);
        ledger.reserveAndLog(USER, "sara", "a", LocalDate.of(2024, 5, 30));
        ledger.reserveAndLog(USER, "sara", "b", LocalDate.of(2024, 5, 31));

        assertEquals(QuotaDecision.COMMITTED, ledger.reserveAndLog(USER, "sara", "c", LocalDate.of(2024, 6, 1)));
    }

    @Test
    void capOfZeroMeansDailyOnly() {
        QuotaLedgerService ledger = ledger(0, true);
        for (int day = 0; day < 20; day++) {
            assertEquals(QuotaDecision.COMMITTED, ledger.reserveAndLog(USER, "sara", "s", MAY_1.plusDays(day)));
        }
    }

    // -----------------------------------------------------------------------
    // Exempt users
    // -----------------------------------------------------------------------

    @Test
    void exemptUserDownloadsSeveralStationsOnOneDay() {
        QuotaLedgerService ledger = ledger(1, true);

        assertEquals(QuotaDecision.COMMITTED, ledger.reserveAndLog(EXEMPT, "admin", "40754", MAY_1));
        assertEquals(QuotaDecision.COMMITTED, ledger.reserveAndLog(EXEMPT, "admin", "40751", MAY_1));
        assertTrue(ledger.canDownload(EXEMPT, MAY_1));
        // still logged
        assertEquals(2L, LedgerDatabase.countEvents(dataSource));
    }

    @Test
    void exemptUserStillHitsMonthlyCapWhenBypassIsOff() {
        QuotaLedgerService ledger = ledger(2, false);

        assertEquals(QuotaDecision.COMMITTED, ledger.reserveAndLog(EXEMPT, "admin", "a", MAY_1));
        assertEquals(QuotaDecision.COMMITTED, ledger.reserveAndLog(EXEMPT, "admin", "b", MAY_1));
        assertEquals(QuotaDecision.DENIED, ledger.reserveAndLog(EXEMPT, "admin", "c", MAY_1));
    }

    // -----------------------------------------------------------------------
    // Delivery inside the reservation
    // -----------------------------------------------------------------------

    @Test
    void failedDeliveryLeavesNoEvent() {
        QuotaLedgerService ledger = ledger(10, true);

        QuotaDecision decision = ledger.reserveAndLog(USER, "sara", "THR", "40754", MAY_1, () -> false);

        assertEquals(QuotaDecision.ABORTED, decision);
        assertEquals(0L, LedgerDatabase.countEvents(dataSource));
        assertTrue(ledger.canDownload(USER, MAY_1));
    }

    @Test
    void throwingDeliveryRollsBackAndPropagates() {
        QuotaLedgerService ledger = ledger(10, true);

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> ledger.reserveAndLog(USER, "sara", "THR", "40754", MAY_1, () -> {
                    throw new IllegalStateException("upload failed");
                }));

        assertEquals("upload failed", thrown.getMessage());
        assertEquals(0L, LedgerDatabase.countEvents(dataSource));
    }

    @Test
    void deliveryIsNotRunWhenDenied() {
        QuotaLedgerService ledger = ledger(10, true);
        ledger.reserveAndLog(USER, "sara", "40754", MAY_1);
        boolean[] ran = new boolean[1];

        QuotaDecision decision = ledger.reserveAndLog(USER, "sara", "THR", "40751", MAY_1, () -> {
            ran[0] = true;
            return true;
        });

        assertEquals(QuotaDecision.DENIED, decision);
        assertFalse(ran[0]);
    }

    @Test
    void successfulDeliveryStoresRegion() {
        QuotaLedgerService ledger = ledger(10, true);

        assertEquals(QuotaDecision.COMMITTED,
                ledger.reserveAndLog(USER, "sara", "THR", "40754", MAY_1, () -> true));
        assertEquals("THR", repository.findByDate(MAY_1).get(0).getRegionId());
    }

    // -----------------------------------------------------------------------
    // Concurrency and failure
    // -----------------------------------------------------------------------

    @Test
    void concurrentReservationsForOneUserCommitExactlyOnce() throws Exception {
        QuotaLedgerService ledger = ledger(10, true);
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<QuotaDecision>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                String station = "s" + i;
                results.add(pool.submit(() -> {
                    start.await();
                    return ledger.reserveAndLog(USER, "sara", station, MAY_1);
                }));
            }
            start.countDown();

            int committed = 0;
            for (Future<QuotaDecision> f : results) {
                if (f.get(10, TimeUnit.SECONDS) == QuotaDecision.COMMITTED) {
                    committed++;
                }
            }
            assertEquals(1, committed);
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1L, LedgerDatabase.countEvents(dataSource));
    }

    @Test
    void lockTimeoutIsDenied() throws Exception {
        QuotaPolicy policy = new QuotaPolicy(10, Set.of(EXEMPT), true);
        QuotaLedgerService ledger = new QuotaLedgerService(repository, policy, Duration.ofMillis(100));
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<QuotaDecision> slow = pool.submit(() -> ledger.reserveAndLog(EXEMPT, "admin", "THR", "a", MAY_1,
                    () -> {
                        holding.countDown();
                        try {
                            return release.await(5, TimeUnit.SECONDS);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            return false;
                        }
                    }));
            assertTrue(holding.await(5, TimeUnit.SECONDS));

            assertEquals(QuotaDecision.DENIED, ledger.reserveAndLog(EXEMPT, "admin", "b", MAY_1));

            release.countDown();
            assertEquals(QuotaDecision.COMMITTED, slow.get(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void unavailableLedgerFailsClosed() throws Exception {
        DataSource broken = mock(DataSource.class);
        when(broken.getConnection()).thenThrow(new SQLException("connection refused"));
        QuotaPolicy policy = new QuotaPolicy(10, Set.of(), true);
        QuotaLedgerService ledger = new QuotaLedgerService(new DownloadEventRepository(broken, 1), policy,
                Duration.ofSeconds(1));

        assertFalse(ledger.canDownload(USER, MAY_1));
        assertEquals(QuotaDecision.DENIED, ledger.reserveAndLog(USER, "sara", "40754", MAY_1));
    }
}
