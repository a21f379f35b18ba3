package com.synoptic.stationbot.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * Response body for {@code GET /api/reports/daily}.
 */
public record DailyReport(

        @JsonProperty("date")
        LocalDate date,

        @JsonProperty("totalDownloads")
        int totalDownloads,

        @JsonProperty("downloads")
        List<DownloadEvent> downloads

) {
}
