package com.cityflow.traffic.graph;

/**
 * Raised when id 0 is used while the graph runs in reserved-zero mode.
 */
public final class SentinelCollisionException extends CityGraphException {

    public SentinelCollisionException(String context) {
        super("City id 0 is reserved as the no-parent marker (" + context + ")");
    }
}
