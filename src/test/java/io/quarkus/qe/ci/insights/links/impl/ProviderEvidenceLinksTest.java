package io.quarkus.qe.ci.insights.links.impl;

import io.quarkus.qe.ci.insights.configuration.AppConfig.Provider;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class ProviderEvidenceLinksTest {

    private final ProviderEvidenceLinks links = new ProviderEvidenceLinks();

    @Test
    void testGitLabLinks() {
        links.configure(Provider.GITLAB, "https://gitlab.example.com/", "group/project");

        assertEquals("https://gitlab.example.com/group/project/-/pipelines/123",
                links.pipelineLink("gid://gitlab/Ci::Pipeline/123"));
        assertEquals("https://gitlab.example.com/group/project/-/jobs/456",
                links.jobLink("gid://gitlab/Ci::Pipeline/123", "gid://gitlab/Ci::Build/456"));
    }

    @Test
    void testGitHubLinks() {
        links.configure(Provider.GITHUB, null, "owner/repo");

        assertEquals("https://github.com/owner/repo/actions/runs/99", links.pipelineLink("99"));
        assertEquals("https://github.com/owner/repo/actions/runs/99/job/7", links.jobLink("99", "7"));
    }

    @Test
    void testRawIdsWithoutProject() {
        links.configure(Provider.GITLAB, null, null);

        assertEquals("gid://gitlab/Ci::Pipeline/123", links.pipelineLink("gid://gitlab/Ci::Pipeline/123"));
        assertEquals("gid://gitlab/Ci::Build/456",
                links.jobLink("gid://gitlab/Ci::Pipeline/123", "gid://gitlab/Ci::Build/456"));
    }

    @Test
    void testNoLinkWithoutId() {
        links.configure(Provider.GITLAB, null, "group/project");
        assertNull(links.pipelineLink(null));
        assertNull(links.jobLink("gid://gitlab/Ci::Pipeline/123", null));

        links.configure(Provider.GITLAB, null, null);
        assertNull(links.jobLink("gid://gitlab/Ci::Pipeline/123", null));
    }

    @Test
    void testNumericId() {
        assertEquals("456", ProviderEvidenceLinks.numericId("gid://gitlab/Ci::Build/456"));
        assertEquals("42", ProviderEvidenceLinks.numericId("42"));
        assertEquals("", ProviderEvidenceLinks.numericId(null));
    }
}
