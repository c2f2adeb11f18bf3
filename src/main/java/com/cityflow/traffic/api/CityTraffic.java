package com.cityflow.traffic.api;

import java.util.Comparator;

/**
 * Result entry of a batch: the maximum traffic seen from one city.
 *
 * Both values are unsigned 64-bit.
 */
public record CityTraffic(long city, long maxTraffic) {

    /** Ascending by unsigned city id. */
    public static final Comparator<CityTraffic> BY_CITY = (a, b) -> Long.compareUnsigned(a.city, b.city);

    @Override
    public String toString() {
        return Long.toUnsignedString(city) + ":" + Long.toUnsignedString(maxTraffic);
    }
}
