package io.quarkus.qe.ci.insights.analyze.impl;

import io.quarkus.qe.ci.insights.TestLogger;
import io.quarkus.qe.ci.insights.analyze.DependencyCycleException;
import io.quarkus.qe.ci.insights.analyze.JobTimeline;
import io.quarkus.qe.ci.insights.pipeline.Job;
import io.quarkus.qe.ci.insights.pipeline.Pipeline;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.quarkus.qe.ci.insights.PipelineFixtures.immediateJob;
import static io.quarkus.qe.ci.insights.PipelineFixtures.job;
import static io.quarkus.qe.ci.insights.PipelineFixtures.pipeline;
import static io.quarkus.qe.ci.insights.PipelineFixtures.retriedJob;
import static org.junit.jupiter.api.Assertions.*;

class StageOrderDependencyResolverTest {

    private final StageOrderDependencyResolver resolver = new StageOrderDependencyResolver(new TestLogger());

    @Test
    void testLinearStageChain() {
        JobTimeline timeline = resolver.resolve(pipeline("p1",
                job("job1", "build", 10),
                job("job2", "test", 15),
                job("job3", "deploy", 20)));

        assertEquals(10.0, timeline.finishTime("job1"));
        assertEquals(25.0, timeline.finishTime("job2"));
        assertEquals(45.0, timeline.finishTime("job3"));

        assertEquals(Optional.empty(), timeline.predecessor("job1"));
        assertEquals(Optional.of("job2"), timeline.predecessor("job3"));
        assertEquals(List.of("job1", "job2"), timeline.criticalPath("job3"));
        assertEquals(List.of(), timeline.criticalPath("job1"));
    }

    @Test
    void testDiamondWithExplicitNeeds() {
        JobTimeline timeline = resolver.resolve(pipeline("p1",
                immediateJob("job1", "build", 5),
                job("job2", "test", 8, "job1"),
                job("job3", "test", 12, "job1"),
                job("job4", "deploy", 4, "job2", "job3")));

        assertEquals(13.0, timeline.finishTime("job2"));
        assertEquals(17.0, timeline.finishTime("job3"));
        assertEquals(21.0, timeline.finishTime("job4"));
        assertEquals(Optional.of("job3"), timeline.predecessor("job4"));
        assertEquals(List.of("job1", "job3"), timeline.criticalPath("job4"));
    }

    @Test
    void testEmptyNeedsStartImmediately() {
        JobTimeline timeline = resolver.resolve(pipeline("p1",
                job("build", "build", 100),
                job("unit-test", "test", 50),
                immediateJob("notify", "deploy", 3)));

        assertEquals(3.0, timeline.finishTime("notify"), "Empty needs must not fall back to stage order");
        assertEquals(Optional.empty(), timeline.predecessor("notify"));
    }

    @Test
    void testMissingDependencyCountsAsZero() {
        JobTimeline timeline = resolver.resolve(pipeline("p1",
                job("deploy", "deploy", 7, "ghost")));

        assertEquals(7.0, timeline.finishTime("deploy"));
        assertEquals(Optional.empty(), timeline.predecessor("deploy"));
        assertEquals(0.0, timeline.finishTime("ghost"));
    }

    @Test
    void testUnknownStageIsTreatedAsFirstStage() {
        Pipeline pipeline = new Pipeline("p1", "main", "push", "success", 100L, List.of("build", "test"),
                List.of(job("lint", "verify", 7), job("unit-test", "test", 3)));

        JobTimeline timeline = resolver.resolve(pipeline);

        assertEquals(7.0, timeline.finishTime("lint"));
        assertEquals(10.0, timeline.finishTime("unit-test"));
        assertEquals(Optional.of("lint"), timeline.predecessor("unit-test"));
    }

    @Test
    void testTieBreakPrefersSmallestName() {
        JobTimeline timeline = resolver.resolve(pipeline("p1",
                job("compile-b", "build", 10),
                job("compile-a", "build", 10),
                job("unit-test", "test", 5)));

        assertEquals(15.0, timeline.finishTime("unit-test"));
        assertEquals(Optional.of("compile-a"), timeline.predecessor("unit-test"));
    }

    @Test
    void testZeroDurationDependencyIsNotAPredecessor() {
        JobTimeline timeline = resolver.resolve(pipeline("p1",
                job("prepare", "build", 0),
                job("unit-test", "test", 5)));

        assertEquals(5.0, timeline.finishTime("unit-test"));
        assertEquals(Optional.empty(), timeline.predecessor("unit-test"));
    }

    @Test
    void testCycleIsReported() {
        Pipeline pipeline = pipeline("p1",
                job("x", "build", 1, "y"),
                job("y", "build", 1, "x"));

        DependencyCycleException exception = assertThrows(DependencyCycleException.class,
                () -> resolver.resolve(pipeline));

        assertEquals("p1", exception.pipelineId());
        assertEquals(List.of("x", "y", "x"), exception.cycle());
        assertTrue(exception.getMessage().contains("x -> y -> x"), exception.getMessage());
    }

    @Test
    void testRetriedAttemptsAreSuperseded() {
        JobTimeline timeline = resolver.resolve(pipeline("p1",
                job("build", "build", 10),
                retriedJob("old", "unit-test", "test", 100, "FAILED"),
                job("unit-test", "test", 20)));

        assertEquals(30.0, timeline.finishTime("unit-test"));
        assertEquals("unit-test-id", timeline.job("unit-test").orElseThrow().id());
        assertEquals(2, timeline.jobs().size());
    }

    @Test
    void testLastAttemptStandsWhenAllWereRetried() {
        Map<String, Job> jobs = StageOrderDependencyResolver.finalAttemptsByName(List.of(
                retriedJob("first", "unit-test", "test", 10, "FAILED"),
                retriedJob("second", "unit-test", "test", 12, "FAILED")));

        assertEquals("second", jobs.get("unit-test").id());
    }

    @Test
    void testMixedNeedsAndStages() {
        JobTimeline timeline = resolver.resolve(pipeline("p1",
                immediateJob("a", "build", 5),
                job("b", "test", 10, "a"),
                immediateJob("c", "build", 3),
                job("d", "deploy", 10, "b", "c")));

        assertEquals(25.0, timeline.finishTime("d"));
        assertEquals(List.of("a", "b"), timeline.criticalPath("d"));
    }

    @Test
    void testFinishTimeNeverBelowOwnDuration() {
        Pipeline pipeline = pipeline("p1",
                job("build", "build", 12),
                job("unit-test", "test", 30),
                job("it", "test", 45, "build"),
                job("deploy", "deploy", 8));

        JobTimeline timeline = resolver.resolve(pipeline);

        for (Job job : pipeline.jobs()) {
            assertTrue(timeline.finishTime(job.name()) >= job.duration(), job.name());
        }
        assertEquals(65.0, timeline.finishTime("deploy"));
        assertEquals(List.of("build", "it"), timeline.criticalPath("deploy"));
    }
}
