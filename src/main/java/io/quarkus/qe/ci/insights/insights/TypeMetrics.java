package io.quarkus.qe.ci.insights.insights;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

/**
 * Aggregated statistics of one pipeline type.
 *
 * @param percentage share of all analyzed pipelines, 0 to 100
 * @param jobs per-job metrics, slowest time-to-feedback (p95) first
 */
@RegisterForReflection
public record TypeMetrics(
        double percentage,
        int totalPipelines,
        CountWithLinks successfulPipelines,
        CountWithLinks failedPipelines,
        double successRate,
        double durationP50,
        double durationP95,
        double durationP99,
        double timeToFeedbackP50,
        double timeToFeedbackP95,
        double timeToFeedbackP99,
        List<JobMetrics> jobs) {

    public TypeMetrics {
        jobs = List.copyOf(jobs);
    }
}
