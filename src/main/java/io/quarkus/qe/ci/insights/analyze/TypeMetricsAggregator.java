package io.quarkus.qe.ci.insights.analyze;

import io.quarkus.qe.ci.insights.insights.TypeMetrics;

public interface TypeMetricsAggregator {

    TypeMetrics aggregate(PipelineCluster cluster);

}
