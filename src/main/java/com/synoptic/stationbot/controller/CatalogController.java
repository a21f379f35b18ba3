package com.synoptic.stationbot.controller;

import com.synoptic.stationbot.model.CatalogSnapshot;
import com.synoptic.stationbot.service.CatalogIndexService;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Post;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Operational hook to rebuild the catalog after the dataset file was replaced.
 */
@Controller("/api/catalog")
public class CatalogController {

    private static final Logger log = LoggerFactory.getLogger(CatalogController.class);

    @Inject
    private CatalogIndexService catalogIndexService;

    /**
     * Rebuilds the catalog and returns the generation that is live afterwards. When the
     * rebuild fails the previous generation is returned unchanged.
     */
    @Post("/refresh")
    @ExecuteOn(TaskExecutors.BLOCKING)
    public Map<String, Object> refresh() {
        log.info("POST /api/catalog/refresh");
        CatalogSnapshot snapshot = catalogIndexService.rebuild();
        return Map.of(
                "generation", snapshot.generation(),
                "regions", snapshot.regionCount(),
                "stations", snapshot.stationCount());
    }
}
