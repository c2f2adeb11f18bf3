package com.cityflow.traffic.graph;

import lombok.Getter;

/**
 * Raised when a city id is looked up that was never added to the graph.
 *
 * During traversal this means a neighbour list references a city without its
 * own description, i.e. the input graph is malformed.
 */
@Getter
public final class CityNotFoundException extends CityGraphException {
    private final long city;

    public CityNotFoundException(long city) {
        super("Unknown city: " + Long.toUnsignedString(city));
        this.city = city;
    }
}
