package com.synoptic.stationbot.controller;

import com.synoptic.stationbot.model.CatalogSnapshot;
import com.synoptic.stationbot.service.CatalogIndexService;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import jakarta.inject.Inject;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness check.
 *
 * Returns {@code {"status":"UP"}} together with the live catalog generation and size,
 * so an empty catalog after a failed first build is visible from outside.
 */
@Controller("/health")
public class HealthController {

    @Inject
    private CatalogIndexService catalogIndexService;

    @Get
    public Map<String, Object> health() {
        CatalogSnapshot snapshot = catalogIndexService.snapshot();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("catalogGeneration", snapshot.generation());
        body.put("catalogBuiltAt", snapshot.builtAt().toString());
        body.put("regions", snapshot.regionCount());
        body.put("stations", snapshot.stationCount());
        return body;
    }
}
