package com.synoptic.stationbot.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Inclusive calendar-date range for which a station has recorded data.
 */
public record ValidityInterval(LocalDate start, LocalDate end) {

    public ValidityInterval {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Interval end " + end + " is before start " + start);
        }
    }

    /**
     * Returns the smallest interval covering both this one and {@code other}.
     */
    public ValidityInterval span(ValidityInterval other) {
        LocalDate s = start.isBefore(other.start) ? start : other.start;
        LocalDate e = end.isAfter(other.end) ? end : other.end;
        return new ValidityInterval(s, e);
    }
}
