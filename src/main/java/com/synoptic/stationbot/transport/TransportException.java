package com.synoptic.stationbot.transport;

/**
 * A message, file or callback answer could not be delivered.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
