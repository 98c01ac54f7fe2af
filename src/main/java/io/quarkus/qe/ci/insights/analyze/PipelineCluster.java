package io.quarkus.qe.ci.insights.analyze;

import io.quarkus.qe.ci.insights.pipeline.Pipeline;

import java.util.List;

/**
 * Pipelines sharing the same set of job names, with what they have in common.
 *
 * @param jobNames the shared job names, sorted and without duplicates
 * @param percentage share of all clustered pipelines, 0 to 100
 */
public record PipelineCluster(
        String label,
        List<String> jobNames,
        List<Pipeline> pipelines,
        double percentage,
        List<String> stages,
        List<String> refPatterns,
        List<String> sources) {

    public PipelineCluster {
        jobNames = List.copyOf(jobNames);
        pipelines = List.copyOf(pipelines);
        stages = List.copyOf(stages);
        refPatterns = List.copyOf(refPatterns);
        sources = List.copyOf(sources);
    }

    public int count() {
        return pipelines.size();
    }
}
