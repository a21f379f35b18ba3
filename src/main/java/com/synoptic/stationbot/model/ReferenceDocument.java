package com.synoptic.stationbot.model;

/**
 * Static document attached unchanged to every successful export.
 */
public record ReferenceDocument(String fileName, byte[] content) {
}
