package io.quarkus.qe.ci.insights.analyze;

import io.quarkus.qe.ci.insights.insights.CIInsights;
import io.quarkus.qe.ci.insights.insights.PipelineType;
import io.quarkus.qe.ci.insights.pipeline.Pipeline;

import java.time.Instant;
import java.util.List;

/**
 * Entry point of the analytics engine. Analysis is synchronous and never modifies its input.
 */
public interface PipelineAnalyzer {

    /**
     * Cluster the pipelines into types and compute their metrics.
     *
     * @param minTypePercentage cluster inclusion threshold, 0 to 100
     * @return pipeline types, largest first
     * @throws IllegalArgumentException if the threshold is outside 0 to 100
     */
    List<PipelineType> analyze(List<Pipeline> pipelines, int minTypePercentage);

    default CIInsights collectInsights(String provider, String project, List<Pipeline> pipelines,
                                       int minTypePercentage) {
        List<PipelineType> pipelineTypes = analyze(pipelines, minTypePercentage);
        return new CIInsights(provider, project, Instant.now(), pipelines.size(), pipelineTypes.size(),
                pipelineTypes);
    }
}
