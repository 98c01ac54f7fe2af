package io.quarkus.qe.ci.insights.report;

import io.quarkus.qe.ci.insights.configuration.AppConfig.OutputFormat;
import io.quarkus.qe.ci.insights.insights.CIInsights;

public interface InsightsExporter {

    OutputFormat format();

    String export(CIInsights insights, boolean pretty);

}
