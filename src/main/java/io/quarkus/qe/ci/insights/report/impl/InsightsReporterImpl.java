package io.quarkus.qe.ci.insights.report.impl;

import io.quarkus.arc.All;
import io.quarkus.qe.ci.insights.configuration.AppConfig;
import io.quarkus.qe.ci.insights.configuration.AppConfig.OutputFormat;
import io.quarkus.qe.ci.insights.insights.CIInsights;
import io.quarkus.qe.ci.insights.report.InsightsExporter;
import io.quarkus.qe.ci.insights.report.InsightsReporter;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.util.List;

@Singleton
final class InsightsReporterImpl implements InsightsReporter {

    @All
    @Inject
    List<InsightsExporter> exporters;

    private OutputFormat outputFormat = OutputFormat.SUMMARY;
    private boolean pretty = false;

    void updateConfiguration(@Observes AppConfig appConfig) {
        this.outputFormat = appConfig.outputFormat() == null ? OutputFormat.SUMMARY : appConfig.outputFormat();
        this.pretty = appConfig.pretty();
    }

    @Override
    public String render(CIInsights insights) {
        return exporters.stream()
                .filter(exporter -> exporter.format() == outputFormat)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No exporter for output format " + outputFormat))
                .export(insights, pretty);
    }
}
