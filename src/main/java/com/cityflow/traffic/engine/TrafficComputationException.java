package com.cityflow.traffic.engine;

import lombok.Getter;

/**
 * Raised when a batch is aborted because one root could not be evaluated.
 */
@Getter
public final class TrafficComputationException extends RuntimeException {
    private final long city;

    public TrafficComputationException(long city, Throwable cause) {
        super("Traffic batch failed at city " + Long.toUnsignedString(city) + ". Graph is now unhealthy.", cause);
        this.city = city;
    }
}
