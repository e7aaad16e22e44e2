package com.marketdw.etl.guard;

/**
 * Exit status of a finished command plus the tail of what it printed.
 */
public final class CommandResult {
    public final int exitCode;
    public final String outputTail;

    public CommandResult(int exitCode, String outputTail) {
        this.exitCode = exitCode;
        this.outputTail = outputTail == null ? "" : outputTail;
    }

    public boolean succeeded() {
        return exitCode == 0;
    }
}
