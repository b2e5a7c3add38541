package com.helios.sketchbook.core.consistency;

import java.util.List;

/**
 * Outcome of a consistency check: overall verdict plus the concatenated section reports.
 */
public record ConsistencyReport(boolean passed, String message, List<CheckResult> sections) {

    public ConsistencyReport {
        sections = List.copyOf(sections);
    }

    static ConsistencyReport of(List<CheckResult> sections) {
        boolean passed = sections.stream().allMatch(CheckResult::passed);
        StringBuilder message = new StringBuilder();
        for (CheckResult section : sections) {
            if (message.length() > 0) {
                message.append('\n');
            }
            message.append(section.segment());
        }
        return new ConsistencyReport(passed, message.toString(), sections);
    }

    /**
     * Result of a single sub-check.
     */
    public record CheckResult(String section, boolean passed, String segment) {

        static CheckResult of(String section, List<String> issues) {
            StringBuilder segment = new StringBuilder(section).append(":\n");
            if (issues.isEmpty()) {
                segment.append("No issues.\n");
            }
            for (String issue : issues) {
                segment.append("- ").append(issue).append('\n');
            }
            return new CheckResult(section, issues.isEmpty(), segment.toString());
        }
    }
}
