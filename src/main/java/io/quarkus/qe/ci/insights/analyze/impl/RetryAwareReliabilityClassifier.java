package io.quarkus.qe.ci.insights.analyze.impl;

import io.quarkus.qe.ci.insights.analyze.ExecutionOutcome;
import io.quarkus.qe.ci.insights.analyze.JobReliability;
import io.quarkus.qe.ci.insights.analyze.JobReliabilityClassifier;
import io.quarkus.qe.ci.insights.insights.CountWithLinks;
import io.quarkus.qe.ci.insights.links.EvidenceLinks;
import io.quarkus.qe.ci.insights.pipeline.Job;
import io.quarkus.qe.ci.insights.pipeline.Pipeline;
import jakarta.inject.Singleton;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Singleton
final class RetryAwareReliabilityClassifier implements JobReliabilityClassifier {

    private final EvidenceLinks evidenceLinks;

    RetryAwareReliabilityClassifier(EvidenceLinks evidenceLinks) {
        this.evidenceLinks = evidenceLinks;
    }

    @Override
    public Map<String, JobReliability> classify(Collection<Pipeline> pipelines) {
        Map<String, Tally> tallies = new LinkedHashMap<>();

        for (Pipeline pipeline : pipelines) {
            groupByName(pipeline.jobs()).forEach((name, attempts) -> {
                Tally tally = tallies.computeIfAbsent(name, ignored -> new Tally());
                tally.executions += attempts.size();

                switch (ExecutionOutcome.of(attempts)) {
                    case FLAKY -> attempts.stream()
                            .filter(Job::retried)
                            .forEach(retry -> {
                                tally.flakyRetries++;
                                addLink(tally.flakyLinks, pipeline, retry);
                            });
                    case FAILED -> {
                        tally.failures++;
                        attempts.stream()
                                .filter(job -> !job.retried())
                                .findFirst()
                                .ifPresent(last -> addLink(tally.failedLinks, pipeline, last));
                    }
                    case SUCCESS -> {
                    }
                }
            });
        }

        Map<String, JobReliability> reliability = new LinkedHashMap<>();
        tallies.forEach((name, tally) -> reliability.put(name, tally.toReliability(name)));
        return reliability;
    }

    private void addLink(List<String> links, Pipeline pipeline, Job job) {
        String link = evidenceLinks.jobLink(pipeline.id(), job.id());
        if (link != null) {
            links.add(link);
        }
    }

    static double rate(int count, int total) {
        return total > 0 ? 100.0 * count / total : 0.0;
    }

    private static Map<String, List<Job>> groupByName(List<Job> jobs) {
        Map<String, List<Job>> grouped = new LinkedHashMap<>();
        for (Job job : jobs) {
            if (job.name() == null) {
                continue;
            }
            grouped.computeIfAbsent(job.name(), ignored -> new ArrayList<>()).add(job);
        }
        return grouped;
    }

    private static final class Tally {

        private int executions;
        private int failures;
        private int flakyRetries;
        private final List<String> flakyLinks = new ArrayList<>();
        private final List<String> failedLinks = new ArrayList<>();

        private JobReliability toReliability(String name) {
            return new JobReliability(
                    name,
                    executions,
                    rate(flakyRetries, executions),
                    new CountWithLinks(flakyRetries, flakyLinks),
                    rate(failures, executions),
                    new CountWithLinks(failures, failedLinks));
        }
    }
}
