package com.leo.positioning.exception;

/**
 * Thrown when a satellite position cannot be produced for the requested instant.
 */
public class PropagationException extends RuntimeException {

    private final String satelliteId;

    public PropagationException(String satelliteId, String message) {
        super(message);
        this.satelliteId = satelliteId;
    }

    public PropagationException(String satelliteId, String message, Throwable cause) {
        super(message, cause);
        this.satelliteId = satelliteId;
    }

    public String getSatelliteId() {
        return satelliteId;
    }
}
