package com.synoptic.stationbot.model;

/**
 * Leaf catalog entry. Belongs to exactly one {@link Region}.
 *
 * @param id       station identifier as it appears in the dataset
 * @param name     display name
 * @param regionId identifier of the owning region
 * @param validity date range with recorded data, or {@code null} when the dataset
 *                 holds no dated rows for this station
 */
public record Station(String id, String name, String regionId, ValidityInterval validity) {
}
