package io.quarkus.qe.ci.insights.logger;

public interface Logger {

    void info(String logMessage);

    void error(String logMessage);

    /**
     * Status of a running command. Kept apart from {@link #info(String)} so that the report stays the only
     * thing printed to the standard output.
     */
    default void progress(String logMessage) {
        info(logMessage);
    }

    default void warn(String logMessage) {
        error("WARNING: " + logMessage);
    }

    default void debug(String logMessage) {

    }
}
