package io.quarkus.qe.ci.insights.pipeline;

import io.quarkus.arc.Arc;
import io.quarkus.qe.ci.insights.pipeline.impl.JsonFilePipelineSource;

import java.util.List;
import java.util.function.Function;

public enum PipelineSource {

    LOCAL_FILE(exportFile -> Arc.container()
            .select(JsonFilePipelineSource.class).get().load(exportFile));

    private final Function<String, List<Pipeline>> argumentToPipelines;

    PipelineSource(Function<String, List<Pipeline>> argumentToPipelines) {
        this.argumentToPipelines = argumentToPipelines;
    }

    /**
     * Load the terminal (success or failed) pipelines with a known duration.
     */
    public List<Pipeline> load(String argument) {
        return argumentToPipelines.apply(argument);
    }
}
