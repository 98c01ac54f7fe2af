package io.quarkus.qe.ci.insights.pipeline;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

/**
 * One CI/CD pipeline execution as supplied by a {@link PipelineSource}.
 *
 * @param id opaque unique identifier (a GitLab GraphQL global id or a GitHub run id)
 * @param ref branch or tag that triggered the pipeline
 * @param source trigger event, e.g. "push", "schedule", "merge_request_event"
 * @param status final status, "success" or "failed"
 * @param duration total wall-clock seconds, null when the provider did not report it
 * @param stages ordered stage names, defining the implicit dependency order of jobs
 * @param jobs every job record, including superseded retries
 */
@RegisterForReflection
public record Pipeline(
        String id,
        String ref,
        String source,
        String status,
        Long duration,
        List<String> stages,
        List<Job> jobs) {

    public Pipeline {
        stages = stages == null ? List.of() : List.copyOf(stages);
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
    }

    public boolean isSuccessful() {
        return "success".equalsIgnoreCase(status);
    }

    public boolean isFailed() {
        return "failed".equalsIgnoreCase(status);
    }

    public double durationSeconds() {
        return duration == null ? 0.0 : duration;
    }
}
