package io.quarkus.qe.ci.insights.analyze;

import io.quarkus.qe.ci.insights.pipeline.Job;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * When each job of one pipeline delivered its result, measured from the pipeline start,
 * and which dependency held it back the longest.
 */
public final class JobTimeline {

    private final String pipelineId;
    private final Map<String, Job> jobs;
    private final Map<String, Double> finishTimes;
    private final Map<String, String> predecessors;

    public JobTimeline(String pipelineId, Map<String, Job> jobs, Map<String, Double> finishTimes,
                       Map<String, String> predecessors) {
        this.pipelineId = pipelineId;
        this.jobs = Collections.unmodifiableMap(new LinkedHashMap<>(jobs));
        this.finishTimes = Collections.unmodifiableMap(new LinkedHashMap<>(finishTimes));
        this.predecessors = Collections.unmodifiableMap(new LinkedHashMap<>(predecessors));
    }

    public String pipelineId() {
        return pipelineId;
    }

    /**
     * The record used for each job name, in pipeline order.
     */
    public Collection<Job> jobs() {
        return jobs.values();
    }

    public Optional<Job> job(String name) {
        return Optional.ofNullable(jobs.get(name));
    }

    /**
     * Time-to-feedback of the job, zero for names that are not part of the pipeline.
     */
    public double finishTime(String name) {
        return finishTimes.getOrDefault(name, 0.0);
    }

    public Optional<String> predecessor(String name) {
        return Optional.ofNullable(predecessors.get(name));
    }

    /**
     * The chain of jobs that determined the job's time-to-feedback, earliest first, without the job itself.
     */
    public List<String> criticalPath(String name) {
        List<String> path = new ArrayList<>();
        String current = predecessors.get(name);
        while (current != null && !path.contains(current)) {
            path.add(current);
            current = predecessors.get(current);
        }
        Collections.reverse(path);
        return path;
    }

    @Override
    public String toString() {
        return "JobTimeline[pipelineId=" + pipelineId + ", finishTimes=" + finishTimes + ']';
    }
}
