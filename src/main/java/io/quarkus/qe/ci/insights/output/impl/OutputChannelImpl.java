package io.quarkus.qe.ci.insights.output.impl;

import io.quarkus.qe.ci.insights.configuration.AppConfig;
import io.quarkus.qe.ci.insights.logger.Logger;
import io.quarkus.qe.ci.insights.output.OutputChannel;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Singleton;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

@Singleton
final class OutputChannelImpl implements OutputChannel {

    private final Logger logger;
    private String outputFilePath;

    OutputChannelImpl(Logger logger) {
        this.logger = logger;
    }

    void updateConfiguration(@Observes AppConfig appConfig) {
        this.outputFilePath = appConfig.outputFilePath();
    }

    @Override
    public void process(String report) {
        logger.info(report);

        if (outputFilePath != null && !outputFilePath.isBlank()) {
            writeToFile(report);
        }
    }

    private void writeToFile(String report) {
        Path outputPath = Paths.get(outputFilePath);
        try {
            if (outputPath.getParent() != null) {
                Files.createDirectories(outputPath.getParent());
            }
            Files.writeString(outputPath, report);
            logger.progress("Report saved to: " + outputPath.toAbsolutePath());
        } catch (IOException e) {
            logger.error("Failed to write report to file: " + outputFilePath);
            throw new RuntimeException("Failed to write report to file: " + outputFilePath, e);
        }
    }

}
