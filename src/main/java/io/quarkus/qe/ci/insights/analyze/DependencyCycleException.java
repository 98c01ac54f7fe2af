package io.quarkus.qe.ci.insights.analyze;

import java.util.List;

/**
 * Thrown when the explicit {@code needs} of a pipeline's jobs form a cycle.
 */
public final class DependencyCycleException extends IllegalStateException {

    private final String pipelineId;
    private final List<String> cycle;

    public DependencyCycleException(String pipelineId, List<String> cycle) {
        super("Dependency cycle in pipeline " + pipelineId + ": " + String.join(" -> ", cycle));
        this.pipelineId = pipelineId;
        this.cycle = List.copyOf(cycle);
    }

    public String pipelineId() {
        return pipelineId;
    }

    public List<String> cycle() {
        return cycle;
    }
}
