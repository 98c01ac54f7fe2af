package io.quarkus.qe.ci.insights.report;

import io.quarkus.qe.ci.insights.insights.CIInsights;

/**
 * Renders insights in the output format chosen for this run.
 */
public interface InsightsReporter {

    String render(CIInsights insights);

}
