package com.cityflow.traffic;

import java.util.List;

/**
 * Outcome of a {@link TrafficSuiteRunner} run.
 *
 * @param suiteName name of the suite, may be null.
 * @param outcomes  one entry per case, in suite order.
 */
public record SuiteReport(String suiteName, List<CaseOutcome> outcomes) {

    public SuiteReport {
        outcomes = List.copyOf(outcomes);
    }

    public long passed() {
        return outcomes.stream().filter(CaseOutcome::correct).count();
    }

    public long failed() {
        return outcomes.size() - passed();
    }

    public boolean allPassed() {
        return failed() == 0;
    }

    /**
     * @param index    1-based case number.
     * @param actual   serialized result, or null if the case threw.
     * @param error    failure message when the case threw, else null.
     */
    public record CaseOutcome(int index, String name, String expected, String actual, String error) {

        public boolean correct() {
            return error == null && expected.equals(actual);
        }
    }
}
