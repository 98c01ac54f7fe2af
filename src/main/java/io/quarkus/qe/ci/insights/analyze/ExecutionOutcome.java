package io.quarkus.qe.ci.insights.analyze;

import io.quarkus.qe.ci.insights.pipeline.Job;

import java.util.List;

/**
 * Outcome of all attempts of one job name within one pipeline.
 */
public enum ExecutionOutcome {
    /** Ran once and succeeded */
    SUCCESS,
    /** Retried at least once, and the final attempt succeeded */
    FLAKY,
    /** The final attempt did not succeed, or there is no final attempt */
    FAILED;

    /**
     * Classify the records sharing a job name within one pipeline.
     */
    public static ExecutionOutcome of(List<Job> attempts) {
        boolean retried = attempts.stream().anyMatch(Job::retried);
        boolean finalSucceeded = attempts.stream()
                .filter(job -> !job.retried())
                .findFirst()
                .map(Job::isSuccess)
                .orElse(false);

        if (!finalSucceeded) {
            return FAILED;
        }
        return retried ? FLAKY : SUCCESS;
    }
}
