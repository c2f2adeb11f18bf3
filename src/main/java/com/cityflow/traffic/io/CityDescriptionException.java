package com.cityflow.traffic.io;

/**
 * Malformed city description input.
 */
public final class CityDescriptionException extends IllegalArgumentException {

    public CityDescriptionException(String message) {
        super(message);
    }

    public CityDescriptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
