package io.quarkus.qe.ci.insights.analyze;

import io.quarkus.qe.ci.insights.pipeline.Pipeline;

import java.util.List;

public interface PipelineClusterer {

    /**
     * Group pipelines by their set of job names, drop groups below the threshold
     * and return the rest, largest first.
     *
     * @param minTypePercentage groups with a smaller share of all pipelines are dropped
     */
    List<PipelineCluster> cluster(List<Pipeline> pipelines, int minTypePercentage);

}
