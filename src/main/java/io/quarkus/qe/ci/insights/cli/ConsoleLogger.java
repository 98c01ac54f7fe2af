package io.quarkus.qe.ci.insights.cli;

import io.quarkus.qe.ci.insights.logger.Logger;
import jakarta.inject.Singleton;

import java.io.PrintWriter;

@Singleton
final class ConsoleLogger implements Logger {

    private PrintWriter stdOutWriter = new PrintWriter(System.out, true);
    private PrintWriter stdErrWriter = new PrintWriter(System.err, true);
    private boolean debug = false;

    void setWriters(PrintWriter stdOutWriter, PrintWriter stdErrWriter, boolean debug) {
        if (stdOutWriter != null) {
            this.stdOutWriter = stdOutWriter;
        }
        if (stdErrWriter != null) {
            this.stdErrWriter = stdErrWriter;
        }
        this.debug = debug;
    }

    @Override
    public void info(String logMessage) {
        stdOutWriter.println(logMessage);
        stdOutWriter.flush();
    }

    @Override
    public void error(String logMessage) {
        stdErrWriter.println(logMessage);
        stdErrWriter.flush();
    }

    @Override
    public void progress(String logMessage) {
        stdErrWriter.println(logMessage);
        stdErrWriter.flush();
    }

    @Override
    public void debug(String logMessage) {
        if (debug) {
            stdErrWriter.println("DEBUG: " + logMessage);
            stdErrWriter.flush();
        }
    }
}
