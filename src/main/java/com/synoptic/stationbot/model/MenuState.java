package com.synoptic.stationbot.model;

/**
 * Screens of the browse flow.
 *
 * <ul>
 *   <li>REGION_LIST     – one page of regions; the root menu ({@code /start}) is its first
 *                         page under a greeting</li>
 *   <li>STATION_LIST    – one page of stations of a single region</li>
 *   <li>STATION_DETAIL  – a picked station and its data interval, shown just before export</li>
 * </ul>
 */
public enum MenuState {
    REGION_LIST,
    STATION_LIST,
    STATION_DETAIL
}
