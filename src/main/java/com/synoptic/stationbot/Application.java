package com.synoptic.stationbot;

import io.micronaut.runtime.Micronaut;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the station export bot.
 *
 * Serves a region/station catalog built from a columnar dataset through a chat menu
 * and delivers per-station CSV extracts under a per-user download quota.
 */
public class Application {

    private static final Logger log = LoggerFactory.getLogger(Application.class);

    public static void main(String[] args) {
        log.info("Starting StationBot...");
        Micronaut.run(Application.class, args);
    }
}
