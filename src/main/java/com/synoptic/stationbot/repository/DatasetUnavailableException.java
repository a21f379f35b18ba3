package com.synoptic.stationbot.repository;

/**
 * Raised when the station dataset cannot be opened, queried, or lacks a required column.
 */
public class DatasetUnavailableException extends RuntimeException {

    public DatasetUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
