package io.quarkus.qe.ci.insights.analyze.impl;

import io.quarkus.qe.ci.insights.analyze.DependencyCycleException;
import io.quarkus.qe.ci.insights.analyze.JobDependencyResolver;
import io.quarkus.qe.ci.insights.analyze.JobTimeline;
import io.quarkus.qe.ci.insights.logger.Logger;
import io.quarkus.qe.ci.insights.pipeline.Job;
import io.quarkus.qe.ci.insights.pipeline.Pipeline;
import jakarta.inject.Singleton;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Resolves job dependencies from explicit {@code needs}, or from the pipeline stage order when a job
 * declares none, and computes finish times with a memoized depth-first traversal.
 * <p />
 * When several dependencies finish at the same latest time, the one with the smallest name
 * is recorded as the predecessor.
 */
@Singleton
final class StageOrderDependencyResolver implements JobDependencyResolver {

    private final Logger logger;

    StageOrderDependencyResolver(Logger logger) {
        this.logger = logger;
    }

    @Override
    public JobTimeline resolve(Pipeline pipeline) {
        Resolution resolution = new Resolution(pipeline);
        for (String jobName : resolution.jobsByName.keySet()) {
            resolution.finishTime(jobName);
        }
        return new JobTimeline(pipeline.id(), resolution.jobsByName, resolution.finishTimes,
                resolution.predecessors);
    }

    /**
     * A retried job appears once per attempt; the final attempt stands for the name,
     * or the last listed attempt when all of them were retried.
     */
    static Map<String, Job> finalAttemptsByName(List<Job> jobs) {
        Map<String, Job> jobsByName = new LinkedHashMap<>();
        for (Job job : jobs) {
            if (job.name() == null) {
                continue;
            }
            Job current = jobsByName.get(job.name());
            if (current == null || current.retried()) {
                jobsByName.put(job.name(), job);
            }
        }
        return jobsByName;
    }

    /**
     * Working state for one pipeline; discarded once its timeline is built.
     */
    private final class Resolution {

        private final Pipeline pipeline;
        private final Map<String, Job> jobsByName;
        private final Map<String, Integer> stageIndexByJob;
        private final Map<String, Double> finishTimes = new LinkedHashMap<>();
        private final Map<String, String> predecessors = new LinkedHashMap<>();
        private final LinkedHashSet<String> inProgress = new LinkedHashSet<>();

        private Resolution(Pipeline pipeline) {
            this.pipeline = pipeline;
            this.jobsByName = finalAttemptsByName(pipeline.jobs());
            this.stageIndexByJob = stageIndexByJob();
        }

        private Map<String, Integer> stageIndexByJob() {
            Map<String, Integer> stageIndex = new HashMap<>();
            List<String> stages = pipeline.stages();
            for (int i = stages.size() - 1; i >= 0; i--) {
                stageIndex.put(stages.get(i), i);
            }

            Map<String, Integer> result = new HashMap<>();
            for (Job job : jobsByName.values()) {
                Integer index = stageIndex.get(job.stage());
                if (index == null) {
                    logger.warn("Job '" + job.name() + "' in pipeline " + pipeline.id() + " has unknown stage '"
                            + job.stage() + "', treating it as the first stage");
                    index = 0;
                }
                result.put(job.name(), index);
            }
            return result;
        }

        private double finishTime(String jobName) {
            Double known = finishTimes.get(jobName);
            if (known != null) {
                return known;
            }

            Job job = jobsByName.get(jobName);
            if (job == null) {
                logger.debug("Pipeline " + pipeline.id() + " needs unknown job '" + jobName + "'");
                return 0.0;
            }

            if (!inProgress.add(jobName)) {
                throw new DependencyCycleException(pipeline.id(), cycleFrom(jobName));
            }

            String slowestDependency = null;
            double slowestTime = 0.0;
            for (String dependency : dependencies(job)) {
                double time = finishTime(dependency);
                if (slowestDependency == null
                        || time > slowestTime
                        || (time == slowestTime && dependency.compareTo(slowestDependency) < 0)) {
                    slowestDependency = dependency;
                    slowestTime = time;
                }
            }
            inProgress.remove(jobName);

            double finishTime = slowestTime + job.duration();
            finishTimes.put(jobName, finishTime);
            if (slowestDependency != null && slowestTime > 0.0) {
                predecessors.put(jobName, slowestDependency);
            }
            return finishTime;
        }

        private List<String> dependencies(Job job) {
            if (job.hasExplicitNeeds()) {
                return job.needs();
            }

            int stageIndex = stageIndexByJob.get(job.name());
            List<String> earlierStageJobs = new ArrayList<>();
            for (String other : jobsByName.keySet()) {
                if (stageIndexByJob.get(other) < stageIndex) {
                    earlierStageJobs.add(other);
                }
            }
            return earlierStageJobs;
        }

        private List<String> cycleFrom(String jobName) {
            List<String> cycle = new ArrayList<>();
            boolean inCycle = false;
            for (String name : inProgress) {
                inCycle |= name.equals(jobName);
                if (inCycle) {
                    cycle.add(name);
                }
            }
            cycle.add(jobName);
            return cycle;
        }
    }
}
