package io.quarkus.qe.ci.insights.links.impl;

import io.quarkus.qe.ci.insights.configuration.AppConfig;
import io.quarkus.qe.ci.insights.configuration.AppConfig.Provider;
import io.quarkus.qe.ci.insights.links.EvidenceLinks;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Singleton;

@Singleton
final class ProviderEvidenceLinks implements EvidenceLinks {

    private Provider provider = Provider.GITLAB;
    private String baseUrl = Provider.GITLAB.defaultBaseUrl();
    private String project = null;

    void updateConfiguration(@Observes AppConfig appConfig) {
        configure(appConfig.provider(), appConfig.baseUrl(), appConfig.project());
    }

    void configure(Provider provider, String baseUrl, String project) {
        this.provider = provider == null ? Provider.GITLAB : provider;
        this.baseUrl = baseUrl == null || baseUrl.isBlank()
                ? this.provider.defaultBaseUrl()
                : stripTrailingSlash(baseUrl);
        this.project = project;
    }

    @Override
    public String pipelineLink(String pipelineId) {
        if (pipelineId == null) {
            return null;
        }
        if (project == null || project.isBlank()) {
            return pipelineId;
        }
        return switch (provider) {
            case GITLAB -> baseUrl + "/" + project + "/-/pipelines/" + numericId(pipelineId);
            case GITHUB -> baseUrl + "/" + project + "/actions/runs/" + numericId(pipelineId);
        };
    }

    @Override
    public String jobLink(String pipelineId, String jobId) {
        if (jobId == null) {
            return null;
        }
        if (project == null || project.isBlank()) {
            return jobId;
        }
        return switch (provider) {
            case GITLAB -> baseUrl + "/" + project + "/-/jobs/" + numericId(jobId);
            case GITHUB -> baseUrl + "/" + project + "/actions/runs/" + numericId(pipelineId)
                    + "/job/" + numericId(jobId);
        };
    }

    /**
     * GitLab global ids look like "gid://gitlab/Ci::Job/456"; the number follows the last slash.
     */
    static String numericId(String id) {
        if (id == null) {
            return "";
        }
        int lastSlash = id.lastIndexOf('/');
        return lastSlash >= 0 ? id.substring(lastSlash + 1) : id;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
