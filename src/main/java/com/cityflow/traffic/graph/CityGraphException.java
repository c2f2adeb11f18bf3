package com.cityflow.traffic.graph;

/**
 * Base type for contract violations raised by the {@link CityGraph} model.
 */
public class CityGraphException extends RuntimeException {

    public CityGraphException(String message) {
        super(message);
    }
}
