package io.quarkus.qe.ci.insights.analyze.impl;

import io.quarkus.qe.ci.insights.analyze.PipelineCluster;
import io.quarkus.qe.ci.insights.analyze.PipelineClusterer;
import io.quarkus.qe.ci.insights.logger.Logger;
import io.quarkus.qe.ci.insights.pipeline.Job;
import io.quarkus.qe.ci.insights.pipeline.Pipeline;
import jakarta.inject.Singleton;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

@Singleton
final class JobSignatureClusterer implements PipelineClusterer {

    static final String PRODUCTION = "Production";
    static final String DEVELOPMENT = "Development";
    static final String UNKNOWN = "Unknown";

    private static final List<String> DEVELOPMENT_MARKERS = List.of("staging", "dev", "test", "qa");

    private static final Comparator<PipelineCluster> LARGEST_FIRST = Comparator
            .comparingInt(PipelineCluster::count).reversed()
            .thenComparing(cluster -> String.join("\n", cluster.jobNames()));

    private final Logger logger;

    JobSignatureClusterer(Logger logger) {
        this.logger = logger;
    }

    @Override
    public List<PipelineCluster> cluster(List<Pipeline> pipelines, int minTypePercentage) {
        Map<List<String>, List<Pipeline>> pipelinesBySignature = new LinkedHashMap<>();
        for (Pipeline pipeline : pipelines) {
            pipelinesBySignature.computeIfAbsent(signature(pipeline), ignored -> new ArrayList<>()).add(pipeline);
        }

        int total = pipelines.size();
        List<PipelineCluster> clusters = new ArrayList<>();
        pipelinesBySignature.forEach((jobNames, members) -> {
            double percentage = 100.0 * members.size() / Math.max(total, 1);
            if (percentage < minTypePercentage) {
                logger.debug("Dropping pipeline type with " + members.size() + " pipelines ("
                        + percentage + "% < " + minTypePercentage + "%)");
                return;
            }
            clusters.add(createCluster(jobNames, members, percentage));
        });

        clusters.sort(LARGEST_FIRST);
        logger.progress("Found " + pipelinesBySignature.size() + " pipeline types, kept " + clusters.size());
        return clusters;
    }

    /**
     * The sorted set of job names; retries and ordering do not change it.
     */
    static List<String> signature(Pipeline pipeline) {
        Set<String> jobNames = new TreeSet<>();
        for (Job job : pipeline.jobs()) {
            if (job.name() != null) {
                jobNames.add(job.name());
            }
        }
        return List.copyOf(jobNames);
    }

    static String label(List<String> jobNames) {
        List<String> lowerCaseNames = jobNames.stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .toList();

        if (lowerCaseNames.stream().anyMatch(name -> name.contains("prod"))) {
            return PRODUCTION;
        }
        if (lowerCaseNames.stream().anyMatch(name -> DEVELOPMENT_MARKERS.stream().anyMatch(name::contains))) {
            return DEVELOPMENT;
        }
        return UNKNOWN;
    }

    private static PipelineCluster createCluster(List<String> jobNames, List<Pipeline> members, double percentage) {
        Set<String> stages = new LinkedHashSet<>();
        Set<String> refs = new LinkedHashSet<>();
        Set<String> sources = new LinkedHashSet<>();
        for (Pipeline pipeline : members) {
            pipeline.jobs().forEach(job -> stages.add(job.stage()));
            refs.add(pipeline.ref());
            sources.add(pipeline.source());
        }
        stages.remove(null);
        refs.remove(null);
        sources.remove(null);

        return new PipelineCluster(label(jobNames), jobNames, members, percentage,
                List.copyOf(stages), List.copyOf(refs), List.copyOf(sources));
    }
}
