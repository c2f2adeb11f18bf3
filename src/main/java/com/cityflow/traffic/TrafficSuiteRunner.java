package com.cityflow.traffic;

import com.cityflow.traffic.api.CityTraffic;
import com.cityflow.traffic.io.CityDescriptionParser;
import com.cityflow.traffic.io.TrafficCaseDefinition;
import com.cityflow.traffic.io.TrafficResultSerializer;

import java.util.ArrayList;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Runs a suite of city maps against one {@link TrafficGraph} and compares the
 * serialized results with the expected strings.
 *
 * The graph is reset after every case so cached traffic never leaks from one
 * map into the next.
 */
@Log4j2
public final class TrafficSuiteRunner {
    private final TrafficGraph graph;

    public TrafficSuiteRunner() {
        this(new TrafficGraph());
    }

    public TrafficSuiteRunner(TrafficGraph graph) {
        this.graph = graph;
    }

    public SuiteReport run(TrafficCaseDefinition suite) {
        List<SuiteReport.CaseOutcome> outcomes = new ArrayList<>();
        int index = 0;
        for (TrafficCaseDefinition.CaseDef c : suite.getCases()) {
            SuiteReport.CaseOutcome outcome = runCase(++index, c);
            outcomes.add(outcome);
            if (outcome.correct()) {
                log.info("test case #{} ---> CORRECT", index);
            } else if (outcome.error() != null) {
                log.error("test case #{} ---> ERROR ({})", index, outcome.error());
            } else {
                log.warn("test case #{} ---> WRONG (got {} but expected {})", index, outcome.actual(),
                        outcome.expected());
            }
        }
        SuiteReport report = new SuiteReport(suite.getName(), outcomes);
        log.info("Suite '{}': {} passed, {} failed", suite.getName(), report.passed(), report.failed());
        return report;
    }

    private SuiteReport.CaseOutcome runCase(int index, TrafficCaseDefinition.CaseDef c) {
        try {
            CityDescriptionParser.load(c.getInput(), graph.getGraph());
            List<CityTraffic> results = graph.computeAll();
            String actual = TrafficResultSerializer.toText(results);
            return new SuiteReport.CaseOutcome(index, c.getName(), c.getExpected(), actual, null);
        } catch (RuntimeException e) {
            log.debug("Case #{} failed", index, e);
            return new SuiteReport.CaseOutcome(index, c.getName(), c.getExpected(), null,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            graph.resetAll();
        }
    }
}
