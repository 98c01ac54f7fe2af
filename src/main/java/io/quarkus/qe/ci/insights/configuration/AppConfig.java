package io.quarkus.qe.ci.insights.configuration;

public record AppConfig(Provider provider, String project, String baseUrl, String ref, int limit,
                        OutputFormat outputFormat, boolean pretty, String outputFilePath) {

    public enum Provider {
        GITLAB("GitLab", "https://gitlab.com"),
        GITHUB("GitHub Actions", "https://github.com");

        private final String displayName;
        private final String defaultBaseUrl;

        Provider(String displayName, String defaultBaseUrl) {
            this.displayName = displayName;
            this.defaultBaseUrl = defaultBaseUrl;
        }

        public String displayName() {
            return displayName;
        }

        public String defaultBaseUrl() {
            return defaultBaseUrl;
        }
    }

    public enum OutputFormat {
        /** Plain-text report for humans (default) */
        SUMMARY,
        /** The full insights value tree */
        JSON,
        /** Pipeline type table followed by a job table */
        CSV
    }
}
