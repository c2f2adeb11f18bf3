package com.cityflow.traffic;

import java.util.Properties;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Settings of a {@link TrafficGraph}.
 *
 * <ul>
 * <li>{@code traffic.reserveZeroId}: reject city id 0, the no-parent marker of
 * the legacy input format.</li>
 * <li>{@code traffic.expectedCities}: capacity hint for graph, cache and
 * working set.</li>
 * <li>{@code traffic.traceResolution}: log every resolved directed edge at
 * TRACE.</li>
 * </ul>
 */
@Getter
@Builder
@ToString
public final class TrafficConfig {
    public static final String RESERVE_ZERO_ID = "traffic.reserveZeroId";
    public static final String EXPECTED_CITIES = "traffic.expectedCities";
    public static final String TRACE_RESOLUTION = "traffic.traceResolution";

    /** Upper bound of {@code traffic.expectedCities}; tables still grow past it. */
    public static final int MAX_EXPECTED_CITIES = 1 << 24;

    @Builder.Default
    private final boolean reserveZeroId = false;

    @Builder.Default
    private final int expectedCities = 16;

    @Builder.Default
    private final boolean traceResolution = false;

    public static TrafficConfig defaults() {
        return builder().build();
    }

    public static TrafficConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Reads the {@code traffic.*} keys. Missing keys keep their defaults.
     *
     * @throws IllegalArgumentException on malformed values.
     */
    public static TrafficConfig fromProperties(Properties props) {
        TrafficConfigBuilder b = builder();
        String reserve = props.getProperty(RESERVE_ZERO_ID);
        if (reserve != null)
            b.reserveZeroId(parseBoolean(RESERVE_ZERO_ID, reserve));
        String expected = props.getProperty(EXPECTED_CITIES);
        if (expected != null)
            b.expectedCities(parseCapacity(expected));
        String trace = props.getProperty(TRACE_RESOLUTION);
        if (trace != null)
            b.traceResolution(parseBoolean(TRACE_RESOLUTION, trace));
        return b.build();
    }

    private static boolean parseBoolean(String key, String value) {
        String v = value.trim();
        if (v.equalsIgnoreCase("true"))
            return true;
        if (v.equalsIgnoreCase("false"))
            return false;
        throw new IllegalArgumentException("Expected true/false for " + key + ": " + value);
    }

    private static int parseCapacity(String value) {
        int n;
        try {
            n = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected an integer for " + EXPECTED_CITIES + ": " + value, e);
        }
        if (n < 0 || n > MAX_EXPECTED_CITIES)
            throw new IllegalArgumentException(
                    EXPECTED_CITIES + " must be between 0 and " + MAX_EXPECTED_CITIES + ": " + n);
        return n;
    }
}
