package com.cityflow.traffic.io;

import com.cityflow.traffic.graph.CityGraph;

import java.util.List;

/**
 * Reads the textual city map format into a {@link CityGraph}.
 *
 * <p>
 * One description per string:
 *
 * <pre>
 * 2:[1,3,6]
 * 13:[]
 * </pre>
 *
 * The leading id is added as a city, then every listed neighbour is appended
 * to its road list in the given order. Roads are directional; a tree needs
 * both {@code a:[..b..]} and {@code b:[..a..]}. Whitespace between tokens is
 * ignored. Ids are unsigned 64-bit decimals.
 */
public final class CityDescriptionParser {
    private CityDescriptionParser() {
        // Utility class
    }

    /**
     * Loads all descriptions and checks that every neighbour is itself a
     * described city.
     *
     * @throws CityDescriptionException on malformed syntax or a neighbour
     *                                  without its own description.
     */
    public static void load(List<String> descriptions, CityGraph graph) {
        for (String description : descriptions)
            parseInto(description, graph);
        requireClosed(graph);
    }

    /** Parses a single description into {@code graph} without validation. */
    public static void parseInto(String description, CityGraph graph) {
        if (description == null)
            throw new CityDescriptionException("Null city description");
        new Cursor(description).parse(graph);
    }

    /**
     * Fails if a road points at a city that was never added.
     */
    public static void requireClosed(CityGraph graph) {
        for (long city : graph.cities()) {
            for (long neighbour : graph.neighboursOf(city)) {
                if (!graph.contains(neighbour)) {
                    throw new CityDescriptionException("City " + Long.toUnsignedString(city)
                            + " lists undescribed neighbour " + Long.toUnsignedString(neighbour));
                }
            }
        }
    }

    private static final class Cursor {
        private final String input;
        private int pos;

        Cursor(String input) {
            this.input = input;
        }

        void parse(CityGraph graph) {
            long city = parseId();
            expect(':');
            expect('[');
            graph.addCity(city);
            skipWS();
            if (peek() == ']') {
                pos++;
            } else {
                while (true) {
                    graph.addRoad(city, parseId());
                    skipWS();
                    char c = peek();
                    pos++;
                    if (c == ']')
                        break;
                    if (c != ',')
                        throw err("Expected ',' or ']'");
                }
            }
            skipWS();
            if (pos < input.length())
                throw err("Trailing characters");
        }

        private long parseId() {
            skipWS();
            int s = pos;
            while (pos < input.length() && input.charAt(pos) >= '0' && input.charAt(pos) <= '9')
                pos++;
            if (s == pos)
                throw err("Expected city id");
            try {
                return Long.parseUnsignedLong(input.substring(s, pos));
            } catch (NumberFormatException e) {
                throw new CityDescriptionException("City id out of range in '" + input + "' at pos " + s, e);
            }
        }

        private char peek() {
            if (pos >= input.length())
                throw err("Unexpected end");
            return input.charAt(pos);
        }

        private void expect(char c) {
            skipWS();
            if (pos >= input.length() || input.charAt(pos) != c)
                throw err("Expected '" + c + "'");
            pos++;
        }

        private void skipWS() {
            while (pos < input.length() && " \t\n\r".indexOf(input.charAt(pos)) >= 0)
                pos++;
        }

        private CityDescriptionException err(String msg) {
            return new CityDescriptionException(msg + " in '" + input + "' at pos " + pos);
        }
    }
}
