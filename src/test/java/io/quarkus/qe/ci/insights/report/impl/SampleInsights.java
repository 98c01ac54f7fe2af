package io.quarkus.qe.ci.insights.report.impl;

import io.quarkus.qe.ci.insights.insights.CIInsights;
import io.quarkus.qe.ci.insights.insights.CountWithLinks;
import io.quarkus.qe.ci.insights.insights.JobMetrics;
import io.quarkus.qe.ci.insights.insights.PipelineType;
import io.quarkus.qe.ci.insights.insights.PredecessorJob;
import io.quarkus.qe.ci.insights.insights.TypeMetrics;

import java.time.Instant;
import java.util.List;

final class SampleInsights {

    static final Instant COLLECTED_AT = Instant.parse("2026-01-10T08:30:00Z");

    private SampleInsights() {
    }

    static CIInsights empty() {
        return new CIInsights("GitLab", "group/project", COLLECTED_AT, 0, 0, List.of());
    }

    /**
     * Two pipeline types sharing the "build" job, with a flaky and a failing "unit-test".
     */
    static CIInsights twoTypes() {
        JobMetrics standardBuild = job("build", 60, 60, 0, 0);
        JobMetrics unitTest = new JobMetrics("unit-test", 120, 130, 140, 180, 190, 200,
                List.of(new PredecessorJob("build", 60)),
                12.5, CountWithLinks.of(List.of("https://gitlab.com/group/project/-/jobs/1022")),
                12.5, CountWithLinks.of(List.of("https://gitlab.com/group/project/-/jobs/1042")),
                8);
        TypeMetrics standardMetrics = new TypeMetrics(72.7, 8,
                new CountWithLinks(7, List.of("https://gitlab.com/group/project/-/pipelines/101")),
                new CountWithLinks(1, List.of("https://gitlab.com/group/project/-/pipelines/104")),
                87.5, 330, 370, 380, 61, 68, 68,
                List.of(unitTest, standardBuild));
        PipelineType standard = new PipelineType("Development", List.of("build", "unit-test"),
                List.of("101", "104"), List.of("build", "test"), List.of("main"), List.of("push"), standardMetrics);

        JobMetrics releaseBuild = job("build", 90, 90, 0, 0);
        JobMetrics deploy = job("deploy \"prod\"", 90, 300, 0, 0);
        TypeMetrics releaseMetrics = new TypeMetrics(27.3, 3,
                new CountWithLinks(3, List.of("https://gitlab.com/group/project/-/pipelines/201")),
                CountWithLinks.empty(),
                100.0, 600, 600, 600, 90, 90, 90,
                List.of(deploy, releaseBuild));
        PipelineType release = new PipelineType("Production", List.of("build", "deploy \"prod\""),
                List.of("201"), List.of("build", "deploy"), List.of("v1.1"), List.of("web"), releaseMetrics);

        return new CIInsights("GitLab", "group/project", COLLECTED_AT, 11, 2, List.of(standard, release));
    }

    private static JobMetrics job(String name, double duration, double timeToFeedback, double flakinessRate,
                                  double failureRate) {
        return new JobMetrics(name, duration, duration, duration, timeToFeedback, timeToFeedback, timeToFeedback,
                List.of(), flakinessRate, CountWithLinks.empty(), failureRate, CountWithLinks.empty(), 4);
    }
}
