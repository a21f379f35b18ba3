package com.synoptic.stationbot.model;

/**
 * Kinds of navigation token carried in menu payloads.
 *
 * <ul>
 *   <li>PAGE          – show page {@code n} of a region list or of a region's station list</li>
 *   <li>PICK_REGION   – a region was selected</li>
 *   <li>PICK_STATION  – a station was selected (terminal download action)</li>
 *   <li>BACK          – return from a station list to the region list</li>
 *   <li>ADMIN_REPORT  – administrator asked for today's download report</li>
 *   <li>NOOP          – inert button such as the page indicator</li>
 *   <li>INVALID       – unknown version, unknown tag or malformed component</li>
 * </ul>
 */
public enum TokenType {
    PAGE,
    PICK_REGION,
    PICK_STATION,
    BACK,
    ADMIN_REPORT,
    NOOP,
    INVALID
}
