package io.quarkus.qe.ci.insights.analyze;

import io.quarkus.qe.ci.insights.insights.CountWithLinks;

/**
 * How often a job name was flaky or failed across a group of pipelines.
 * Rates are percentages of {@link #totalExecutions()}, and zero when there were no executions.
 */
public record JobReliability(
        String name,
        int totalExecutions,
        double flakinessRate,
        CountWithLinks flakyRetries,
        double failureRate,
        CountWithLinks failedExecutions) {

    public static JobReliability none(String name) {
        return new JobReliability(name, 0, 0.0, CountWithLinks.empty(), 0.0, CountWithLinks.empty());
    }
}
