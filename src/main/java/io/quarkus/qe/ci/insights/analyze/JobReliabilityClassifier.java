package io.quarkus.qe.ci.insights.analyze;

import io.quarkus.qe.ci.insights.pipeline.Pipeline;

import java.util.Collection;
import java.util.Map;

public interface JobReliabilityClassifier {

    /**
     * Classify every job name found in the pipelines.
     *
     * @return reliability keyed by job name
     */
    Map<String, JobReliability> classify(Collection<Pipeline> pipelines);

}
