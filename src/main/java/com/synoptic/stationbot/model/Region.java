package com.synoptic.stationbot.model;

/**
 * Top-level catalog grouping (a province).
 *
 * @param id   region identifier as it appears in the dataset
 * @param name display name; regions are listed in lexicographic order of this value
 */
public record Region(String id, String name) {
}
