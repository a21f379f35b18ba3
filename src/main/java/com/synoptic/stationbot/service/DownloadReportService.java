package com.synoptic.stationbot.service;

import com.synoptic.stationbot.model.DailyReport;
import com.synoptic.stationbot.model.DownloadEvent;
import com.synoptic.stationbot.model.UserDownloadStats;
import com.synoptic.stationbot.repository.DownloadEventRepository;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Read-only administrative views over the download ledger.
 */
@Singleton
public class DownloadReportService {

    private static final Logger log = LoggerFactory.getLogger(DownloadReportService.class);

    private final DownloadEventRepository repository;

    @Inject
    public DownloadReportService(DownloadEventRepository repository) {
        this.repository = repository;
    }

    public DailyReport dailyReport(LocalDate date) {
        List<DownloadEvent> downloads = repository.findByDate(date);
        log.debug("Daily report date={} downloads={}", date, downloads.size());
        return new DailyReport(date, downloads.size(), downloads);
    }

    /**
     * @return stats for the user, or empty when the user never downloaded anything
     */
    public Optional<UserDownloadStats> userStats(long userId) {
        long total = repository.countByUser(userId);
        if (total == 0L) {
            return Optional.empty();
        }
        return Optional.of(new UserDownloadStats(userId, total, repository.findDistinctStationsByUser(userId)));
    }

    public long distinctUsers() {
        return repository.countDistinctUsers();
    }
}
