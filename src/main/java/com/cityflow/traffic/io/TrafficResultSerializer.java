package com.cityflow.traffic.io;

import com.cityflow.traffic.api.CityTraffic;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders batch results.
 *
 * Text form: {@code 1:14,2:13,5:4}, entries in the given order, unsigned
 * decimals, no trailing separator. JSON form:
 * {@code [{"city":1,"maxTraffic":14},...]}.
 */
public final class TrafficResultSerializer {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TrafficResultSerializer() {
        // Utility class
    }

    public static String toText(List<CityTraffic> results) {
        return results.stream().map(CityTraffic::toString).collect(Collectors.joining(","));
    }

    public static String toJson(List<CityTraffic> results) {
        ArrayNode array = MAPPER.createArrayNode();
        for (CityTraffic r : results) {
            ObjectNode entry = array.addObject();
            entry.put("city", unsigned(r.city()));
            entry.put("maxTraffic", unsigned(r.maxTraffic()));
        }
        try {
            return MAPPER.writeValueAsString(array);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize traffic results", e);
        }
    }

    private static BigInteger unsigned(long value) {
        return new BigInteger(Long.toUnsignedString(value));
    }
}
