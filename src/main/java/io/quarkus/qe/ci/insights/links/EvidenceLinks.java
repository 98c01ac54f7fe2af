package io.quarkus.qe.ci.insights.links;

/**
 * Turns pipeline and job identifiers into links a reader can open.
 * A missing identifier yields no link ({@code null}).
 */
public interface EvidenceLinks {

    String pipelineLink(String pipelineId);

    String jobLink(String pipelineId, String jobId);

}
