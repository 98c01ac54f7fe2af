package io.quarkus.qe.ci.insights.insights;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * A job found on the critical path of another job, with its own median duration.
 */
@RegisterForReflection
public record PredecessorJob(String name, double durationP50) {
}
