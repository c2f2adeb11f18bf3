package com.cityflow.traffic.io;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;

/**
 * Loads {@link TrafficCaseDefinition} suites with Jackson.
 */
public final class TrafficCaseLoader {
    /** Suite bundled on the classpath. */
    public static final String DEFAULT_SUITE = "/traffic-cases.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TrafficCaseLoader() {
        // Utility class
    }

    public static TrafficCaseDefinition parse(String json) throws IOException {
        return normalize(MAPPER.readValue(json, TrafficCaseDefinition.class));
    }

    public static TrafficCaseDefinition parseFile(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return normalize(MAPPER.readValue(in, TrafficCaseDefinition.class));
        }
    }

    /**
     * @param resource absolute classpath resource name, e.g.
     *                 {@link #DEFAULT_SUITE}.
     */
    public static TrafficCaseDefinition parseResource(String resource) throws IOException {
        try (InputStream in = TrafficCaseLoader.class.getResourceAsStream(resource)) {
            if (in == null)
                throw new IOException("Suite resource not found: " + resource);
            return normalize(MAPPER.readValue(in, TrafficCaseDefinition.class));
        }
    }

    private static TrafficCaseDefinition normalize(TrafficCaseDefinition def) {
        if (def.getCases() == null)
            def.setCases(new ArrayList<>());
        for (TrafficCaseDefinition.CaseDef c : def.getCases()) {
            if (c.getInput() == null)
                c.setInput(new ArrayList<>());
            if (c.getExpected() == null)
                throw new IllegalArgumentException("Case '" + c.getName() + "' has no expected result");
        }
        return def;
    }
}
