package com.synoptic.stationbot.scheduler;

import com.synoptic.stationbot.model.CatalogSnapshot;
import com.synoptic.stationbot.service.CatalogIndexService;
import io.micronaut.context.annotation.Requires;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically rebuilds the catalog index so that a replaced dataset file is picked up
 * without a restart.
 *
 * <p>Only created when {@code station-bot.catalog.refresh-interval} is set. A failed
 * rebuild keeps the previously published catalog.
 */
@Singleton
@Requires(property = "station-bot.catalog.refresh-interval")
public class CatalogRefreshScheduler {

    private static final Logger log = LoggerFactory.getLogger(CatalogRefreshScheduler.class);

    @Inject
    private CatalogIndexService catalogIndexService;

    @Scheduled(fixedDelay = "${station-bot.catalog.refresh-interval}",
            initialDelay = "${station-bot.catalog.refresh-interval}")
    public void refreshCatalog() {
        long before = catalogIndexService.snapshot().generation();
        log.info("CatalogRefreshScheduler starting; live generation={}", before);
        CatalogSnapshot after = catalogIndexService.rebuild();
        log.info("CatalogRefreshScheduler finished; live generation={} regions={} stations={}",
                after.generation(), after.regionCount(), after.stationCount());
    }
}
