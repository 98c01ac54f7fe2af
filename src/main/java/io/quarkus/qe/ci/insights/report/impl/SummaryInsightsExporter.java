package io.quarkus.qe.ci.insights.report.impl;

import io.quarkus.qe.ci.insights.configuration.AppConfig.OutputFormat;
import io.quarkus.qe.ci.insights.insights.CIInsights;
import io.quarkus.qe.ci.insights.insights.JobMetrics;
import io.quarkus.qe.ci.insights.insights.PipelineType;
import io.quarkus.qe.ci.insights.insights.PredecessorJob;
import io.quarkus.qe.ci.insights.insights.TypeMetrics;
import io.quarkus.qe.ci.insights.report.InsightsExporter;
import jakarta.inject.Singleton;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

@Singleton
final class SummaryInsightsExporter implements InsightsExporter {

    static final int TOP_JOBS = 10;

    private static final DateTimeFormatter ANALYSIS_DATE = DateTimeFormatter
            .ofPattern("yyyy-MM-dd HH:mm 'UTC'")
            .withZone(ZoneOffset.UTC);

    @Override
    public OutputFormat format() {
        return OutputFormat.SUMMARY;
    }

    @Override
    public String export(CIInsights insights, boolean pretty) {
        var resultBuilder = new StringBuilder();

        resultBuilder.append(System.lineSeparator())
                .append("=== CI Insights Report ===")
                .append(System.lineSeparator());
        printOverview(insights, resultBuilder);

        if (insights.pipelineTypes().isEmpty()) {
            resultBuilder.append(System.lineSeparator())
                    .append("No pipeline data found.")
                    .append(System.lineSeparator());
            return resultBuilder.toString();
        }

        List<PipelineType> pipelineTypes = insights.pipelineTypes();
        for (int i = 0; i < pipelineTypes.size(); i++) {
            printPipelineType(i + 1, pipelineTypes.get(i), resultBuilder);
        }

        List<JobMetrics> jobs = worstMetricsByJobName(pipelineTypes);
        printTopJobs("Slowest Jobs (P95 time to feedback)", jobs, JobMetrics::timeToFeedbackP95, resultBuilder);
        printTopJobs("Failing Jobs", jobs, JobMetrics::failureRate, resultBuilder);
        printTopJobs("Flaky Jobs", jobs, JobMetrics::flakinessRate, resultBuilder);

        resultBuilder.append(System.lineSeparator()).append("=== End of Report ===").append(System.lineSeparator());
        return resultBuilder.toString();
    }

    private static void printOverview(CIInsights insights, StringBuilder resultBuilder) {
        int jobsAnalyzed = insights.pipelineTypes().stream()
                .flatMap(pipelineType -> pipelineType.metrics().jobs().stream())
                .mapToInt(JobMetrics::totalExecutions)
                .sum();

        resultBuilder.append("  Project: ").append(insights.project() == null ? "n/a" : insights.project())
                .append(" (").append(insights.provider()).append(')').append(System.lineSeparator());
        resultBuilder.append("  Pipelines analyzed: ").append(insights.totalPipelines()).append(System.lineSeparator());
        resultBuilder.append("  Jobs analyzed: ").append(jobsAnalyzed).append(System.lineSeparator());
        resultBuilder.append("  Overall success rate: ").append(percent(overallSuccessRate(insights)))
                .append(System.lineSeparator());
        resultBuilder.append("  Pipeline types: ").append(insights.totalPipelineTypes()).append(System.lineSeparator());
        if (insights.collectedAt() != null) {
            resultBuilder.append("  Analysis date: ").append(ANALYSIS_DATE.format(insights.collectedAt()))
                    .append(System.lineSeparator());
        }
    }

    private static void printPipelineType(int index, PipelineType pipelineType, StringBuilder resultBuilder) {
        TypeMetrics metrics = pipelineType.metrics();

        resultBuilder.append(System.lineSeparator());
        resultBuilder.append("Pipeline Type #").append(index).append(" [").append(pipelineType.label()).append("] ")
                .append(percent(metrics.percentage())).append(" of pipelines").append(System.lineSeparator());
        resultBuilder.append("  Jobs: ").append(String.join(", ", pipelineType.jobNames())).append(System.lineSeparator());
        resultBuilder.append("  Stages: ").append(String.join(", ", pipelineType.stages())).append(System.lineSeparator());
        resultBuilder.append("  Refs: ").append(String.join(", ", pipelineType.refPatterns())).append(System.lineSeparator());
        resultBuilder.append("  Sources: ").append(String.join(", ", pipelineType.sources())).append(System.lineSeparator());
        resultBuilder.append("  Pipelines: ").append(metrics.totalPipelines())
                .append(" (").append(metrics.successfulPipelines().count()).append(" successful, ")
                .append(metrics.failedPipelines().count()).append(" failed, ")
                .append(percent(metrics.successRate())).append(" success)").append(System.lineSeparator());
        resultBuilder.append("  Duration: ").append(triple(metrics.durationP50(), metrics.durationP95(),
                metrics.durationP99())).append(System.lineSeparator());
        resultBuilder.append("  First feedback: ").append(triple(metrics.timeToFeedbackP50(),
                metrics.timeToFeedbackP95(), metrics.timeToFeedbackP99())).append(System.lineSeparator());

        if (!metrics.jobs().isEmpty()) {
            JobMetrics slowest = metrics.jobs().get(0);
            resultBuilder.append("  Slowest feedback: ").append(slowest.name()).append(" (")
                    .append(minutes(slowest.timeToFeedbackP95())).append(')').append(System.lineSeparator());
        }

        example(metrics).ifPresent(link -> resultBuilder.append("  Example: ").append(link)
                .append(System.lineSeparator()));
    }

    private static Optional<String> example(TypeMetrics metrics) {
        return metrics.successfulPipelines().links().stream()
                .findFirst()
                .or(() -> metrics.failedPipelines().links().stream().findFirst());
    }

    private static void printTopJobs(String title, List<JobMetrics> jobs, ToDoubleFunction<JobMetrics> metric,
                                     StringBuilder resultBuilder) {
        resultBuilder.append(System.lineSeparator());
        resultBuilder.append("Top ").append(TOP_JOBS).append(' ').append(title).append(':').append(System.lineSeparator());

        List<JobMetrics> top = jobs.stream()
                .filter(job -> metric.applyAsDouble(job) > 0.0)
                .sorted(Comparator.comparingDouble(metric).reversed().thenComparing(JobMetrics::name))
                .limit(TOP_JOBS)
                .toList();

        if (top.isEmpty()) {
            resultBuilder.append("  None").append(System.lineSeparator());
            return;
        }

        for (int i = 0; i < top.size(); i++) {
            JobMetrics job = top.get(i);
            resultBuilder.append("  ").append(i + 1).append(". ").append(job.name())
                    .append(" - feedback p95 ").append(minutes(job.timeToFeedbackP95()))
                    .append(", failures ").append(percent(job.failureRate()))
                    .append(" (").append(job.failedExecutions().count()).append(')')
                    .append(", flaky ").append(percent(job.flakinessRate()))
                    .append(" (").append(job.flakyRetries().count()).append(')')
                    .append(System.lineSeparator());
            if (!job.predecessors().isEmpty()) {
                resultBuilder.append("      └─ after: ")
                        .append(String.join(", ", job.predecessors().stream().map(PredecessorJob::name).toList()))
                        .append(System.lineSeparator());
            }
        }
    }

    /**
     * The same job name may belong to several pipeline types; keep its slowest occurrence.
     */
    static List<JobMetrics> worstMetricsByJobName(List<PipelineType> pipelineTypes) {
        Map<String, JobMetrics> jobsByName = new LinkedHashMap<>();
        for (PipelineType pipelineType : pipelineTypes) {
            for (JobMetrics job : pipelineType.metrics().jobs()) {
                jobsByName.merge(job.name(), job,
                        (existing, candidate) -> candidate.timeToFeedbackP95() > existing.timeToFeedbackP95()
                                ? candidate
                                : existing);
            }
        }
        return new ArrayList<>(jobsByName.values());
    }

    static double overallSuccessRate(CIInsights insights) {
        int successful = 0;
        int total = 0;
        for (PipelineType pipelineType : insights.pipelineTypes()) {
            successful += pipelineType.metrics().successfulPipelines().count();
            total += pipelineType.metrics().totalPipelines();
        }
        return total > 0 ? 100.0 * successful / total : 0.0;
    }

    private static String triple(double p50, double p95, double p99) {
        return "p50 " + minutes(p50) + ", p95 " + minutes(p95) + ", p99 " + minutes(p99);
    }

    private static String minutes(double seconds) {
        return String.format(Locale.ROOT, "%.1fmin", seconds / 60.0);
    }

    private static String percent(double value) {
        return String.format(Locale.ROOT, "%.1f%%", value);
    }
}
