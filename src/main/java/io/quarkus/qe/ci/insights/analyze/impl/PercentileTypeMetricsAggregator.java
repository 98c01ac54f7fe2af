package io.quarkus.qe.ci.insights.analyze.impl;

import io.quarkus.qe.ci.insights.analyze.DependencyCycleException;
import io.quarkus.qe.ci.insights.analyze.JobDependencyResolver;
import io.quarkus.qe.ci.insights.analyze.JobReliability;
import io.quarkus.qe.ci.insights.analyze.JobReliabilityClassifier;
import io.quarkus.qe.ci.insights.analyze.JobTimeline;
import io.quarkus.qe.ci.insights.analyze.Percentiles;
import io.quarkus.qe.ci.insights.analyze.PipelineCluster;
import io.quarkus.qe.ci.insights.analyze.TypeMetricsAggregator;
import io.quarkus.qe.ci.insights.insights.CountWithLinks;
import io.quarkus.qe.ci.insights.insights.JobMetrics;
import io.quarkus.qe.ci.insights.insights.PredecessorJob;
import io.quarkus.qe.ci.insights.insights.TypeMetrics;
import io.quarkus.qe.ci.insights.links.EvidenceLinks;
import io.quarkus.qe.ci.insights.logger.Logger;
import io.quarkus.qe.ci.insights.pipeline.Job;
import io.quarkus.qe.ci.insights.pipeline.Pipeline;
import jakarta.inject.Singleton;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Computes the metrics of one pipeline type. Durations and time-to-feedback are sampled from
 * successful pipelines only, reliability from every pipeline of the type.
 */
@Singleton
final class PercentileTypeMetricsAggregator implements TypeMetricsAggregator {

    static final Comparator<JobMetrics> SLOWEST_FEEDBACK_FIRST = Comparator
            .comparingDouble(JobMetrics::timeToFeedbackP95).reversed()
            .thenComparing(JobMetrics::name);

    private static final Comparator<PredecessorJob> SLOWEST_PREDECESSOR_FIRST = Comparator
            .comparingDouble(PredecessorJob::durationP50).reversed()
            .thenComparing(PredecessorJob::name);

    private final Logger logger;
    private final JobDependencyResolver dependencyResolver;
    private final JobReliabilityClassifier reliabilityClassifier;
    private final EvidenceLinks evidenceLinks;

    PercentileTypeMetricsAggregator(Logger logger, JobDependencyResolver dependencyResolver,
                                    JobReliabilityClassifier reliabilityClassifier, EvidenceLinks evidenceLinks) {
        this.logger = logger;
        this.dependencyResolver = dependencyResolver;
        this.reliabilityClassifier = reliabilityClassifier;
        this.evidenceLinks = evidenceLinks;
    }

    @Override
    public TypeMetrics aggregate(PipelineCluster cluster) {
        List<Pipeline> successful = new ArrayList<>();
        List<Pipeline> failed = new ArrayList<>();
        for (Pipeline pipeline : cluster.pipelines()) {
            (pipeline.isSuccessful() ? successful : failed).add(pipeline);
        }

        Percentiles duration = Percentiles.of(successful.stream().map(Pipeline::durationSeconds).toList());

        List<Double> firstFeedbackTimes = new ArrayList<>();
        Map<String, JobSamples> samplesByJob = new LinkedHashMap<>();
        for (JobTimeline timeline : resolveTimelines(successful)) {
            collectSamples(timeline, samplesByJob, firstFeedbackTimes);
        }
        Percentiles timeToFeedback = Percentiles.of(firstFeedbackTimes);

        List<JobMetrics> jobs = samplesByJob.isEmpty()
                ? List.of()
                : jobMetrics(samplesByJob, reliabilityClassifier.classify(cluster.pipelines()));

        return new TypeMetrics(
                cluster.percentage(),
                cluster.count(),
                pipelineLinks(successful),
                pipelineLinks(failed),
                100.0 * successful.size() / Math.max(cluster.count(), 1),
                duration.p50(),
                duration.p95(),
                duration.p99(),
                timeToFeedback.p50(),
                timeToFeedback.p95(),
                timeToFeedback.p99(),
                jobs);
    }

    private List<JobTimeline> resolveTimelines(List<Pipeline> pipelines) {
        List<JobTimeline> timelines = new ArrayList<>(pipelines.size());
        for (Pipeline pipeline : pipelines) {
            try {
                timelines.add(dependencyResolver.resolve(pipeline));
            } catch (DependencyCycleException e) {
                logger.error(e.getMessage() + "; leaving the pipeline out of job timings");
            }
        }
        return timelines;
    }

    /**
     * Only jobs that succeeded contribute timings; the earliest of them is the pipeline's first feedback.
     */
    private static void collectSamples(JobTimeline timeline, Map<String, JobSamples> samplesByJob,
                                       List<Double> firstFeedbackTimes) {
        double firstFeedback = Double.MAX_VALUE;
        for (Job job : timeline.jobs()) {
            if (!job.isSuccess()) {
                continue;
            }
            double finishTime = timeline.finishTime(job.name());
            JobSamples samples = samplesByJob.computeIfAbsent(job.name(), ignored -> new JobSamples());
            samples.durations.add(job.duration());
            samples.finishTimes.add(finishTime);
            samples.predecessorNames.addAll(timeline.criticalPath(job.name()));
            firstFeedback = Math.min(firstFeedback, finishTime);
        }
        if (firstFeedback != Double.MAX_VALUE) {
            firstFeedbackTimes.add(firstFeedback);
        }
    }

    private static List<JobMetrics> jobMetrics(Map<String, JobSamples> samplesByJob,
                                               Map<String, JobReliability> reliabilityByJob) {
        Map<String, Percentiles> durationByJob = new LinkedHashMap<>();
        samplesByJob.forEach((name, samples) -> durationByJob.put(name, Percentiles.of(samples.durations)));

        List<JobMetrics> jobs = new ArrayList<>(samplesByJob.size());
        samplesByJob.forEach((name, samples) -> {
            Percentiles duration = durationByJob.get(name);
            Percentiles timeToFeedback = Percentiles.of(samples.finishTimes);
            JobReliability reliability = reliabilityByJob.getOrDefault(name, JobReliability.none(name));

            jobs.add(new JobMetrics(
                    name,
                    duration.p50(),
                    duration.p95(),
                    duration.p99(),
                    timeToFeedback.p50(),
                    timeToFeedback.p95(),
                    timeToFeedback.p99(),
                    predecessors(samples.predecessorNames, durationByJob),
                    reliability.flakinessRate(),
                    reliability.flakyRetries(),
                    reliability.failureRate(),
                    reliability.failedExecutions(),
                    reliability.totalExecutions()));
        });

        jobs.sort(SLOWEST_FEEDBACK_FIRST);
        return jobs;
    }

    private static List<PredecessorJob> predecessors(Set<String> names, Map<String, Percentiles> durationByJob) {
        List<PredecessorJob> predecessors = new ArrayList<>(names.size());
        for (String name : names) {
            Percentiles duration = durationByJob.get(name);
            if (duration != null) {
                predecessors.add(new PredecessorJob(name, duration.p50()));
            }
        }
        predecessors.sort(SLOWEST_PREDECESSOR_FIRST);
        return predecessors;
    }

    private CountWithLinks pipelineLinks(List<Pipeline> pipelines) {
        return new CountWithLinks(pipelines.size(), pipelines.stream()
                .map(pipeline -> evidenceLinks.pipelineLink(pipeline.id()))
                .filter(Objects::nonNull)
                .toList());
    }

    private static final class JobSamples {

        private final List<Double> durations = new ArrayList<>();
        private final List<Double> finishTimes = new ArrayList<>();
        private final Set<String> predecessorNames = new LinkedHashSet<>();
    }
}
