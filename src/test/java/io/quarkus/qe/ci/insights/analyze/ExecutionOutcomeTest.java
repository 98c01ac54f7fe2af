package io.quarkus.qe.ci.insights.analyze;

import io.quarkus.qe.ci.insights.pipeline.Job;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.quarkus.qe.ci.insights.PipelineFixtures.failedJob;
import static io.quarkus.qe.ci.insights.PipelineFixtures.job;
import static io.quarkus.qe.ci.insights.PipelineFixtures.retriedJob;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ExecutionOutcomeTest {

    @Test
    void testSingleSuccess() {
        assertEquals(ExecutionOutcome.SUCCESS, ExecutionOutcome.of(List.of(job("build", "build", 10))));
    }

    @Test
    void testSingleFailure() {
        assertEquals(ExecutionOutcome.FAILED, ExecutionOutcome.of(List.of(failedJob("build", "build", 10))));
    }

    @Test
    void testSuccessAfterRetry() {
        var attempts = List.of(
                retriedJob("1", "unit-test", "test", 30, "FAILED"),
                job("unit-test", "test", 35));

        assertEquals(ExecutionOutcome.FLAKY, ExecutionOutcome.of(attempts));
    }

    @Test
    void testFailureAfterRetry() {
        var attempts = List.of(
                retriedJob("1", "unit-test", "test", 30, "FAILED"),
                failedJob("unit-test", "test", 31));

        assertEquals(ExecutionOutcome.FAILED, ExecutionOutcome.of(attempts));
    }

    @Test
    void testOnlyRetriedAttempts() {
        var attempts = List.of(
                retriedJob("1", "unit-test", "test", 30, "FAILED"),
                retriedJob("2", "unit-test", "test", 30, "SUCCESS"));

        assertEquals(ExecutionOutcome.FAILED, ExecutionOutcome.of(attempts),
                "Without a final attempt the job cannot count as succeeded");
    }

    @Test
    void testStatusIsCaseInsensitive() {
        var attempt = new Job("1", "lint", "build", 4, "success", false, null);

        assertEquals(ExecutionOutcome.SUCCESS, ExecutionOutcome.of(List.of(attempt)));
    }
}
