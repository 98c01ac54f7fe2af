package io.quarkus.qe.ci.insights.report.impl;

import io.quarkus.qe.ci.insights.configuration.AppConfig.OutputFormat;
import io.quarkus.qe.ci.insights.insights.CIInsights;
import io.quarkus.qe.ci.insights.insights.JobMetrics;
import io.quarkus.qe.ci.insights.insights.PipelineType;
import io.quarkus.qe.ci.insights.insights.TypeMetrics;
import io.quarkus.qe.ci.insights.report.InsightsExporter;
import jakarta.inject.Singleton;

import java.util.Locale;

@Singleton
final class CsvInsightsExporter implements InsightsExporter {

    static final String PIPELINE_TYPE_HEADER = "Pipeline Type,Percentage,Total Pipelines,Success Rate,"
            + "Duration P50,Duration P95,Duration P99,"
            + "Time to Feedback P50,Time to Feedback P95,Time to Feedback P99";

    static final String JOB_HEADER = "Job Name,Pipeline Type,Duration P50,Duration P95,Duration P99,"
            + "Time to Feedback P50,Time to Feedback P95,Time to Feedback P99,"
            + "Flakiness Rate,Failure Rate,Total Executions";

    @Override
    public OutputFormat format() {
        return OutputFormat.CSV;
    }

    @Override
    public String export(CIInsights insights, boolean pretty) {
        var resultBuilder = new StringBuilder();

        resultBuilder.append(PIPELINE_TYPE_HEADER).append(System.lineSeparator());
        for (PipelineType pipelineType : insights.pipelineTypes()) {
            TypeMetrics metrics = pipelineType.metrics();
            resultBuilder.append(quote(pipelineType.label())).append(',')
                    .append(decimal(metrics.percentage())).append(',')
                    .append(metrics.totalPipelines()).append(',')
                    .append(decimal(metrics.successRate())).append(',')
                    .append(decimal(metrics.durationP50())).append(',')
                    .append(decimal(metrics.durationP95())).append(',')
                    .append(decimal(metrics.durationP99())).append(',')
                    .append(decimal(metrics.timeToFeedbackP50())).append(',')
                    .append(decimal(metrics.timeToFeedbackP95())).append(',')
                    .append(decimal(metrics.timeToFeedbackP99()))
                    .append(System.lineSeparator());
        }

        resultBuilder.append(System.lineSeparator());
        resultBuilder.append(JOB_HEADER).append(System.lineSeparator());
        for (PipelineType pipelineType : insights.pipelineTypes()) {
            for (JobMetrics job : pipelineType.metrics().jobs()) {
                resultBuilder.append(quote(job.name())).append(',')
                        .append(quote(pipelineType.label())).append(',')
                        .append(decimal(job.durationP50())).append(',')
                        .append(decimal(job.durationP95())).append(',')
                        .append(decimal(job.durationP99())).append(',')
                        .append(decimal(job.timeToFeedbackP50())).append(',')
                        .append(decimal(job.timeToFeedbackP95())).append(',')
                        .append(decimal(job.timeToFeedbackP99())).append(',')
                        .append(decimal(job.flakinessRate())).append(',')
                        .append(decimal(job.failureRate())).append(',')
                        .append(job.totalExecutions())
                        .append(System.lineSeparator());
            }
        }

        return resultBuilder.toString();
    }

    private static String quote(String value) {
        return '"' + (value == null ? "" : value.replace("\"", "\"\"")) + '"';
    }

    private static String decimal(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
