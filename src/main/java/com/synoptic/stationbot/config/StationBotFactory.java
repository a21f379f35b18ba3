package com.synoptic.stationbot.config;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.synoptic.stationbot.service.QuotaPolicy;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.ZoneId;
import java.util.Set;

/**
 * Beans built from the {@code station-bot.*} configuration.
 */
@Factory
public class StationBotFactory {

    private static final Logger log = LoggerFactory.getLogger(StationBotFactory.class);

    /**
     * Clock used for "today" in quota accounting and for debounce timestamps.
     * Defaults to the system zone.
     */
    @Singleton
    public Clock clock(@Value("${station-bot.zone-id:}") String zoneId) {
        ZoneId zone = zoneId == null || zoneId.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zoneId);
        log.info("Using clock zone {}", zone);
        return Clock.system(zone);
    }

    @Singleton
    public QuotaPolicy quotaPolicy(@Value("${station-bot.quota.monthly-cap:10}") int monthlyCap,
                                   @Value("${station-bot.quota.exempt-user-ids:}") String exemptUserIds,
                                   @Value("${station-bot.quota.exempt-bypasses-monthly-cap:true}") boolean exemptBypassesMonthlyCap) {
        Set<Long> exempt = QuotaPolicy.parseUserIds(exemptUserIds);
        QuotaPolicy policy = new QuotaPolicy(monthlyCap, exempt, exemptBypassesMonthlyCap);
        log.info("Quota policy monthlyCap={} exemptUsers={} exemptBypassesMonthlyCap={}",
                monthlyCap, exempt.size(), exemptBypassesMonthlyCap);
        return policy;
    }

    @Singleton
    public CsvMapper csvMapper() {
        return new CsvMapper();
    }
}
