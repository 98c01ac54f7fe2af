package io.quarkus.qe.ci.insights.analyze;

import io.quarkus.qe.ci.insights.pipeline.Pipeline;

public interface JobDependencyResolver {

    /**
     * Compute the time-to-feedback and critical predecessor of every job in the pipeline.
     *
     * @throws DependencyCycleException if explicit job needs form a cycle
     */
    JobTimeline resolve(Pipeline pipeline);

}
