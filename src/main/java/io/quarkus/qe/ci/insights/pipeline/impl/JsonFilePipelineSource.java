package io.quarkus.qe.ci.insights.pipeline.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.arc.Unremovable;
import io.quarkus.qe.ci.insights.configuration.AppConfig;
import io.quarkus.qe.ci.insights.logger.Logger;
import io.quarkus.qe.ci.insights.pipeline.Job;
import io.quarkus.qe.ci.insights.pipeline.Pipeline;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Reads pipelines from a JSON export, either a top-level array of pipelines
 * or an object with a "pipelines" array.
 */
@Unremovable
@Singleton
public class JsonFilePipelineSource {

    static final int DEFAULT_LIMIT = 500;

    private static final TypeReference<List<Pipeline>> PIPELINE_LIST = new TypeReference<>() {
    };

    @Inject
    Logger logger;

    private final ObjectMapper objectMapper;
    private String ref = null;
    private int limit = DEFAULT_LIMIT;

    JsonFilePipelineSource() {
        this.objectMapper = new ObjectMapper()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    void loadConfig(@Observes AppConfig appConfig) {
        this.ref = appConfig.ref();
        this.limit = appConfig.limit();
    }

    public List<Pipeline> load(String exportFile) {
        Path exportPath = Paths.get(exportFile);
        if (!Files.isRegularFile(exportPath)) {
            logger.error("Pipeline export not found: " + exportPath.toAbsolutePath());
            throw new RuntimeException("Pipeline export not found: " + exportPath.toAbsolutePath());
        }

        logger.progress("Loading pipelines from: " + exportPath);
        List<Pipeline> pipelines = select(read(exportPath));
        logger.progress("Loaded " + pipelines.size() + " pipelines");
        return pipelines;
    }

    private List<Pipeline> read(Path exportPath) {
        try {
            JsonNode root = objectMapper.readTree(exportPath.toFile());
            if (root == null || root.isMissingNode() || root.isNull()) {
                logger.progress("Pipeline export is empty");
                return List.of();
            }
            JsonNode pipelinesNode = root.isArray() ? root : root.path("pipelines");
            if (!pipelinesNode.isArray()) {
                throw new IOException("Expected an array of pipelines or an object with a 'pipelines' array");
            }
            return objectMapper.readerFor(PIPELINE_LIST).readValue(pipelinesNode);
        } catch (IOException e) {
            logger.error("Failed to read pipeline export " + exportPath + ": " + e.getMessage());
            throw new RuntimeException("Failed to read pipeline export: " + exportPath, e);
        }
    }

    /**
     * Keep what a provider fetch would keep: finished pipelines with a duration, optionally on one ref.
     */
    List<Pipeline> select(List<Pipeline> pipelines) {
        List<Pipeline> selected = pipelines.stream()
                .filter(this::hasId)
                .map(this::withCompleteJobs)
                .filter(pipeline -> pipeline.isSuccessful() || pipeline.isFailed())
                .filter(pipeline -> pipeline.duration() != null)
                .filter(pipeline -> ref == null || ref.equals(pipeline.ref()))
                .limit(Math.max(limit, 0))
                .toList();

        int skipped = pipelines.size() - selected.size();
        if (skipped > 0) {
            logger.debug("Skipped " + skipped + " pipelines (unfinished, without duration, other ref or over limit)");
        }
        return selected;
    }

    private boolean hasId(Pipeline pipeline) {
        if (isBlank(pipeline.id())) {
            logger.warn("Skipping pipeline without id (ref " + pipeline.ref() + ")");
            return false;
        }
        return true;
    }

    /**
     * Job records without a name or an id can neither be grouped nor linked, so they are left out.
     */
    private Pipeline withCompleteJobs(Pipeline pipeline) {
        List<Job> jobs = pipeline.jobs().stream()
                .filter(job -> {
                    if (isBlank(job.name()) || isBlank(job.id())) {
                        logger.warn("Skipping incomplete job record (id " + job.id() + ", name " + job.name()
                                + ") in pipeline " + pipeline.id());
                        return false;
                    }
                    return true;
                })
                .toList();
        if (jobs.size() == pipeline.jobs().size()) {
            return pipeline;
        }
        return new Pipeline(pipeline.id(), pipeline.ref(), pipeline.source(), pipeline.status(), pipeline.duration(),
                pipeline.stages(), jobs);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
