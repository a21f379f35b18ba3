package com.synoptic.stationbot.service;

import com.synoptic.stationbot.model.CatalogRow;
import com.synoptic.stationbot.model.CatalogSnapshot;
import com.synoptic.stationbot.model.Region;
import com.synoptic.stationbot.model.Station;
import com.synoptic.stationbot.model.ValidityInterval;
import com.synoptic.stationbot.repository.StationDataset;
import io.micronaut.context.event.StartupEvent;
import io.micronaut.runtime.event.annotation.EventListener;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the live {@link CatalogSnapshot} and rebuilds it from the dataset.
 *
 * <p>Reads go through a single volatile reference and never block. A rebuild scans
 * the dataset once, builds a complete new snapshot off to the side and publishes it
 * with one reference swap; the previous snapshot stays valid for readers that still
 * hold it.
 *
 * <p>Failure handling:
 * <ul>
 *   <li>first build fails: the empty catalog is published and navigation shows
 *       "no regions available"</li>
 *   <li>a later rebuild fails: the previously published snapshot is kept</li>
 * </ul>
 * In both cases the cause is logged at ERROR; users are not told individually.
 */
@Singleton
public class CatalogIndexService {

    private static final Logger log = LoggerFactory.getLogger(CatalogIndexService.class);

    private final StationDataset dataset;
    private final Clock clock;

    private final AtomicReference<CatalogSnapshot> current = new AtomicReference<>(CatalogSnapshot.empty());
    private final AtomicLong generations = new AtomicLong();
    private final Object rebuildLock = new Object();

    @Inject
    public CatalogIndexService(StationDataset dataset, Clock clock) {
        this.dataset = dataset;
        this.clock = clock;
    }

    @EventListener
    void onStartup(StartupEvent event) {
        log.info("Building catalog index at startup");
        rebuild();
    }

    // -----------------------------------------------------------------------
    // Build
    // -----------------------------------------------------------------------

    /**
     * Scans the dataset and builds a new snapshot without publishing it.
     *
     * @return the new snapshot
     * @throws RuntimeException when the dataset cannot be read
     */
    public CatalogSnapshot build() {
        List<CatalogRow> rows = dataset.scanCatalog();
        return CatalogSnapshot.fromRows(rows, generations.incrementAndGet(), clock.instant());
    }

    /**
     * Builds a new snapshot and publishes it. Concurrent callers are serialized so
     * that generations are published in order.
     *
     * @return the snapshot that is live once the call returns
     */
    public CatalogSnapshot rebuild() {
        synchronized (rebuildLock) {
            CatalogSnapshot previous = current.get();
            try {
                CatalogSnapshot next = build();
                current.set(next);
                log.info("Published catalog generation={} regions={} stations={}",
                        next.generation(), next.regionCount(), next.stationCount());
                if (next.isEmpty()) {
                    log.warn("Catalog generation={} has no regions; dataset returned no usable rows",
                            next.generation());
                }
                return next;
            } catch (Exception e) {
                if (previous.generation() == 0L) {
                    log.error("Catalog build failed; serving an empty catalog", e);
                } else {
                    log.error("Catalog rebuild failed; keeping generation={}", previous.generation(), e);
                }
                return previous;
            }
        }
    }

    // -----------------------------------------------------------------------
    // Lookups against the live snapshot
    // -----------------------------------------------------------------------

    /**
     * Returns the live snapshot. Callers that make several lookups for one request
     * should take the snapshot once and query it, so all lookups see the same generation.
     */
    public CatalogSnapshot snapshot() {
        return current.get();
    }

    public List<Region> regions() {
        return current.get().regions();
    }

    public List<Station> stations(String regionId) {
        return current.get().stations(regionId);
    }

    public Optional<ValidityInterval> validity(String regionId, String stationId) {
        return current.get().validity(regionId, stationId);
    }
}
