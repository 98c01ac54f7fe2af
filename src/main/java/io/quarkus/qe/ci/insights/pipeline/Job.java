package io.quarkus.qe.ci.insights.pipeline;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

/**
 * A single job execution record. The same {@link #name()} appears more than once in a pipeline
 * when the job was retried; every superseded attempt has {@link #retried()} set.
 * <p />
 * {@link #needs()} is null when the job waits for all jobs of the earlier stages, an empty list when
 * it starts immediately, and otherwise the exact names of the jobs it waits for.
 */
@RegisterForReflection
public record Job(
        String id,
        String name,
        String stage,
        double duration,
        String status,
        boolean retried,
        List<String> needs) {

    public Job {
        needs = needs == null ? null : List.copyOf(needs);
    }

    public boolean isSuccess() {
        return "SUCCESS".equalsIgnoreCase(status);
    }

    public boolean hasExplicitNeeds() {
        return needs != null;
    }
}
