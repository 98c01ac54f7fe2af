package io.quarkus.qe.ci.insights.output;

/**
 * Where the rendered report goes.
 */
public interface OutputChannel {

    void process(String report);

}
