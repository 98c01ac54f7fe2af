package io.quarkus.qe.ci.insights.insights;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.time.Instant;
import java.util.List;

/**
 * Result of one analysis run, handed to the exporters.
 */
@RegisterForReflection
public record CIInsights(
        String provider,
        String project,
        Instant collectedAt,
        int totalPipelines,
        int totalPipelineTypes,
        List<PipelineType> pipelineTypes) {

    public CIInsights {
        pipelineTypes = List.copyOf(pipelineTypes);
    }
}
