package com.cityflow.traffic;

import com.cityflow.traffic.io.TrafficCaseDefinition;
import com.cityflow.traffic.io.TrafficCaseLoader;

import java.io.IOException;
import java.nio.file.Path;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Console entry point.
 *
 * <pre>
 * TrafficMain [suite.json]
 * </pre>
 *
 * Without an argument the bundled suite is run. Exits with 1 when any case
 * fails. Settings are read from {@code -Dtraffic.*} system properties.
 */
public final class TrafficMain {
    private static final Logger log = LogManager.getLogger(TrafficMain.class);

    private TrafficMain() {
    }

    public static void main(String[] args) throws IOException {
        System.exit(run(args));
    }

    static int run(String[] args) throws IOException {
        if (args.length > 1) {
            log.error("Usage: TrafficMain [suite.json]");
            return 2;
        }
        TrafficCaseDefinition suite = args.length == 1
                ? TrafficCaseLoader.parseFile(Path.of(args[0]))
                : TrafficCaseLoader.parseResource(TrafficCaseLoader.DEFAULT_SUITE);

        TrafficGraph graph = new TrafficGraph(TrafficConfig.fromSystemProperties());
        SuiteReport report = new TrafficSuiteRunner(graph).run(suite);
        return report.allPassed() ? 0 : 1;
    }
}
