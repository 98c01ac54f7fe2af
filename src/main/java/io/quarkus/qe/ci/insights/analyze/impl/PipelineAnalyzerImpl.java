package io.quarkus.qe.ci.insights.analyze.impl;

import io.quarkus.qe.ci.insights.analyze.PipelineAnalyzer;
import io.quarkus.qe.ci.insights.analyze.PipelineCluster;
import io.quarkus.qe.ci.insights.analyze.PipelineClusterer;
import io.quarkus.qe.ci.insights.analyze.TypeMetricsAggregator;
import io.quarkus.qe.ci.insights.insights.PipelineType;
import io.quarkus.qe.ci.insights.logger.Logger;
import io.quarkus.qe.ci.insights.pipeline.Pipeline;
import jakarta.inject.Singleton;

import java.util.List;
import java.util.Objects;

@Singleton
final class PipelineAnalyzerImpl implements PipelineAnalyzer {

    private final Logger logger;
    private final PipelineClusterer clusterer;
    private final TypeMetricsAggregator metricsAggregator;

    PipelineAnalyzerImpl(Logger logger, PipelineClusterer clusterer, TypeMetricsAggregator metricsAggregator) {
        this.logger = logger;
        this.clusterer = clusterer;
        this.metricsAggregator = metricsAggregator;
    }

    @Override
    public List<PipelineType> analyze(List<Pipeline> pipelines, int minTypePercentage) {
        if (minTypePercentage < 0 || minTypePercentage > 100) {
            throw new IllegalArgumentException(
                    "Minimum pipeline type percentage must be between 0 and 100, got " + minTypePercentage);
        }

        if (pipelines.isEmpty()) {
            logger.progress("No pipelines to analyze");
            return List.of();
        }

        logger.progress("Analyzing " + pipelines.size() + " pipelines");
        return clusterer.cluster(pipelines, minTypePercentage).stream()
                .map(this::toPipelineType)
                .toList();
    }

    private PipelineType toPipelineType(PipelineCluster cluster) {
        logger.debug("Aggregating metrics of " + cluster.label() + " pipeline type " + cluster.jobNames());
        return new PipelineType(
                cluster.label(),
                cluster.jobNames(),
                cluster.pipelines().stream().map(Pipeline::id).filter(Objects::nonNull).toList(),
                cluster.stages(),
                cluster.refPatterns(),
                cluster.sources(),
                metricsAggregator.aggregate(cluster));
    }
}
