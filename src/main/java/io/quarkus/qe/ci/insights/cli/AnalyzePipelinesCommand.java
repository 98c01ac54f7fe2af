package io.quarkus.qe.ci.insights.cli;

import io.quarkus.qe.ci.insights.analyze.PipelineAnalyzer;
import io.quarkus.qe.ci.insights.configuration.AppConfig;
import io.quarkus.qe.ci.insights.configuration.AppConfig.OutputFormat;
import io.quarkus.qe.ci.insights.configuration.AppConfig.Provider;
import io.quarkus.qe.ci.insights.insights.CIInsights;
import io.quarkus.qe.ci.insights.output.OutputChannel;
import io.quarkus.qe.ci.insights.pipeline.Pipeline;
import io.quarkus.qe.ci.insights.pipeline.PipelineSource;
import io.quarkus.qe.ci.insights.report.InsightsReporter;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import picocli.CommandLine;

import java.util.List;

@CommandLine.Command(name = "ci-insights", mixinStandardHelpOptions = true, description = """
        Groups CI pipelines into pipeline types by their job sets and reports duration,
        time-to-feedback, failure and flakiness metrics for every type and job.
        """)
public class AnalyzePipelinesCommand implements Runnable {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "PIPELINE_SOURCE", description = """
            Source of the pipelines to analyze.
            The 'LOCAL_FILE' source reads a JSON export of pipelines with their jobs.
            """, defaultValue = "LOCAL_FILE")
    PipelineSource pipelineSource;

    @CommandLine.Parameters(index = "1", arity = "0..1", paramLabel = "PIPELINE_SOURCE_ARGUMENT", description = """
            Argument passed to the pipeline source.
            For the 'LOCAL_FILE' source, this is the path of the JSON export.
            """, defaultValue = "pipelines.json")
    String pipelineSourceArgument;

    @CommandLine.Option(order = 1, names = { "--provider" }, description = """
            CI provider the pipelines come from, used to build evidence links.
            Valid values: ${COMPLETION-CANDIDATES}
            """, defaultValue = "GITLAB")
    Provider provider = Provider.GITLAB;

    @CommandLine.Option(order = 2, names = { "--project" }, description = """
            Project path on the provider, for example "group/project" or "owner/repo".
            Without it, evidence links are the raw pipeline and job ids.
            """)
    String project;

    @CommandLine.Option(order = 3, names = { "--base-url" }, description = """
            Base URL of the provider instance.
            Default: https://gitlab.com for GitLab, https://github.com for GitHub
            """)
    String baseUrl;

    @CommandLine.Option(order = 4, names = { "--ref" }, description = "Only analyze pipelines of this branch or tag")
    String ref;

    @CommandLine.Option(order = 5, names = { "--limit" }, description = "Maximum number of pipelines to analyze",
            defaultValue = "500")
    int limit = 500;

    @CommandLine.Option(order = 6, names = { "--min-type-percentage" }, description = """
            Pipeline types with a smaller share of all pipelines are left out of the report.
            Accepts values from 0 to 100. Default: 1
            """, defaultValue = "1")
    int minTypePercentage = 1;

    @CommandLine.Option(order = 7, names = { "--format" }, description = """
            Report format.
            Valid values: ${COMPLETION-CANDIDATES}
            """, defaultValue = "SUMMARY")
    OutputFormat format = OutputFormat.SUMMARY;

    @CommandLine.Option(order = 8, names = { "--pretty" }, description = "Pretty print the JSON report",
            defaultValue = "false")
    boolean pretty = false;

    @CommandLine.Option(order = 9, names = { "--output-file" }, description = """
            Also write the report to this file.
            Parent directories are created when missing.
            """)
    String outputFilePath;

    @CommandLine.Option(order = 10, names = { "--debug" }, description = "Log debug messages", defaultValue = "false")
    boolean debug = false;

    @Inject
    PipelineAnalyzer pipelineAnalyzer;

    @Inject
    InsightsReporter insightsReporter;

    @Inject
    OutputChannel outputChannel;

    @Inject
    ConsoleLogger consoleLogger;

    @Inject
    Event<AppConfig> appConfigEvent;

    @Override
    public void run() {
        if (minTypePercentage < 0 || minTypePercentage > 100) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "--min-type-percentage must be between 0 and 100, got " + minTypePercentage);
        }
        if (limit < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "--limit must be positive, got " + limit);
        }

        consoleLogger.setWriters(spec.commandLine().getOut(), spec.commandLine().getErr(), debug);

        String providerBaseUrl = baseUrl == null || baseUrl.isBlank() ? provider.defaultBaseUrl() : baseUrl;
        appConfigEvent.fire(new AppConfig(provider, project, providerBaseUrl, ref, limit, format, pretty,
                outputFilePath));

        List<Pipeline> pipelines = pipelineSource.load(pipelineSourceArgument);
        CIInsights insights = pipelineAnalyzer.collectInsights(provider.displayName(), project, pipelines,
                minTypePercentage);

        outputChannel.process(insightsReporter.render(insights));
    }

}
