package io.quarkus.qe.ci.insights.report.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.quarkus.qe.ci.insights.configuration.AppConfig.OutputFormat;
import io.quarkus.qe.ci.insights.insights.CIInsights;
import io.quarkus.qe.ci.insights.report.InsightsExporter;
import jakarta.inject.Singleton;

@Singleton
final class JsonInsightsExporter implements InsightsExporter {

    private final ObjectMapper objectMapper;

    JsonInsightsExporter() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.JSON;
    }

    @Override
    public String export(CIInsights insights, boolean pretty) {
        try {
            return pretty
                    ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(insights)
                    : objectMapper.writeValueAsString(insights);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize insights to JSON", e);
        }
    }
}
