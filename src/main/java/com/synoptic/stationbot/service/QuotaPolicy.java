package com.synoptic.stationbot.service;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Download quota rules.
 *
 * <ul>
 *   <li>at most one download per calendar day</li>
 *   <li>fewer than {@code monthlyCap} downloads since the first of the month;
 *       a cap of 0 or less disables the monthly rule (daily-only policy)</li>
 *   <li>users in {@code exemptUserIds} skip the daily rule, and skip the monthly rule
 *       too when {@code exemptBypassesMonthlyCap} is set</li>
 * </ul>
 */
public record QuotaPolicy(int monthlyCap, Set<Long> exemptUserIds, boolean exemptBypassesMonthlyCap) {

    public QuotaPolicy {
        exemptUserIds = Set.copyOf(exemptUserIds);
    }

    public boolean isExempt(long userId) {
        return exemptUserIds.contains(userId);
    }

    public boolean hasMonthlyCap() {
        return monthlyCap > 0;
    }

    /**
     * Parses a comma-separated list of user ids; blanks are ignored.
     *
     * @throws NumberFormatException if an entry is not a number
     */
    public static Set<Long> parseUserIds(String csv) {
        Set<Long> ids = new LinkedHashSet<>();
        if (csv == null || csv.isBlank()) {
            return ids;
        }
        Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(Long::parseLong)
                .forEach(ids::add);
        return ids;
    }
}
