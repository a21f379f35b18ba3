package com.synoptic.stationbot.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response body for {@code GET /api/reports/users/{userId}}.
 */
public record UserDownloadStats(

        @JsonProperty("userId")
        long userId,

        @JsonProperty("totalDownloads")
        long totalDownloads,

        /**
         * Distinct stations the user has downloaded, in ascending order.
         */
        @JsonProperty("stations")
        List<String> stations

) {
}
