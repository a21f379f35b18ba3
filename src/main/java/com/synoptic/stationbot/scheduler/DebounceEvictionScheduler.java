package com.synoptic.stationbot.scheduler;

import com.synoptic.stationbot.service.DebounceFilter;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Keeps the debounce map bounded by dropping entries older than the window.
 */
@Singleton
public class DebounceEvictionScheduler {

    private static final Logger log = LoggerFactory.getLogger(DebounceEvictionScheduler.class);

    @Inject
    private DebounceFilter debounceFilter;

    @Inject
    private Clock clock;

    @Scheduled(fixedDelay = "${station-bot.debounce-eviction-interval:30s}", initialDelay = "30s")
    public void evictStaleEntries() {
        try {
            int removed = debounceFilter.evictStale(clock.instant());
            if (removed > 0) {
                log.debug("DebounceEvictionScheduler removed {} entries", removed);
            }
        } catch (Exception e) {
            log.error("DebounceEvictionScheduler failed: {}", e.getMessage(), e);
        }
    }
}
