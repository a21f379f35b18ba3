package com.synoptic.stationbot.controller;

import com.synoptic.stationbot.model.DailyReport;
import com.synoptic.stationbot.model.UserDownloadStats;
import com.synoptic.stationbot.service.DownloadReportService;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.QueryValue;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;

/**
 * Read-only download reports.
 *
 * Base path: {@code /api/reports}
 *
 * Endpoints:
 * <ul>
 *   <li>{@code GET /api/reports/daily?date=yyyy-MM-dd}  – downloads of a day (today by default)</li>
 *   <li>{@code GET /api/reports/users/{userId}}        – totals for one user</li>
 *   <li>{@code GET /api/reports/users/count}           – number of distinct downloaders</li>
 * </ul>
 */
@Controller("/api/reports")
@ExecuteOn(TaskExecutors.BLOCKING)
public class ReportController {

    private static final Logger log = LoggerFactory.getLogger(ReportController.class);

    @Inject
    private DownloadReportService reportService;

    @Inject
    private Clock clock;

    @Get("/daily")
    public DailyReport daily(@Nullable @QueryValue("date") LocalDate date) {
        LocalDate day = date != null ? date : LocalDate.now(clock);
        log.info("GET /api/reports/daily date={}", day);
        return reportService.dailyReport(day);
    }

    @Get("/users/count")
    public Map<String, Long> usersCount() {
        return Map.of("users", reportService.distinctUsers());
    }

    /**
     * Returns HTTP 404 Not Found when the user has no recorded downloads.
     */
    @Get("/users/{userId}")
    public HttpResponse<UserDownloadStats> user(@PathVariable long userId) {
        log.info("GET /api/reports/users/{}", userId);
        return reportService.userStats(userId)
                .map(HttpResponse::ok)
                .orElseGet(HttpResponse::notFound);
    }
}
