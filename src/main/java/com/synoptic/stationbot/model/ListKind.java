package com.synoptic.stationbot.model;

/**
 * The two browsable list levels of the catalog.
 */
public enum ListKind {
    REGIONS,
    STATIONS
}
