package io.quarkus.qe.ci.insights.insights;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

/**
 * Latency and reliability statistics of one job name within a pipeline type.
 * Durations and time-to-feedback come from successful pipelines, reliability from all of them.
 */
@RegisterForReflection
public record JobMetrics(
        String name,
        double durationP50,
        double durationP95,
        double durationP99,
        double timeToFeedbackP50,
        double timeToFeedbackP95,
        double timeToFeedbackP99,
        List<PredecessorJob> predecessors,
        double flakinessRate,
        CountWithLinks flakyRetries,
        double failureRate,
        CountWithLinks failedExecutions,
        int totalExecutions) {

    public JobMetrics {
        predecessors = List.copyOf(predecessors);
    }
}
