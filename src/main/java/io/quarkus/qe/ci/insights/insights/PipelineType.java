package io.quarkus.qe.ci.insights.insights;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

/**
 * A group of pipelines running the same set of job names.
 *
 * @param label heuristic name: "Production", "Development" or "Unknown"
 * @param jobNames the shared job names, sorted
 * @param ids identifiers of the member pipelines
 */
@RegisterForReflection
public record PipelineType(
        String label,
        List<String> jobNames,
        List<String> ids,
        List<String> stages,
        List<String> refPatterns,
        List<String> sources,
        TypeMetrics metrics) {

    public PipelineType {
        jobNames = List.copyOf(jobNames);
        ids = List.copyOf(ids);
        stages = List.copyOf(stages);
        refPatterns = List.copyOf(refPatterns);
        sources = List.copyOf(sources);
    }
}
