package com.synoptic.stationbot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Plain Java bean representing a row in the {@code download_event} table.
 *
 * Rows are append-only: one row per delivered export, never updated or deleted.
 * All persistence is plain JDBC in
 * {@link com.synoptic.stationbot.repository.DownloadEventRepository}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DownloadEvent {

    /** Auto-generated surrogate key. */
    private Long id;

    /** Transport user identifier the quota is charged to. */
    private long userId;

    /** Display name of the user when the export was delivered. */
    private String displayName;

    /** Region of the exported station. */
    private String regionId;

    /** Exported station. */
    private String stationId;

    /** Calendar date the download counts against. */
    private LocalDate eventDate;

    /** Row creation timestamp. */
    private Instant createdAt;
}
