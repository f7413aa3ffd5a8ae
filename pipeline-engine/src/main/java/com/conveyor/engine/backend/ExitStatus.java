package com.conveyor.engine.backend;

/**
 * What the execution backend reports for one finished step.
 *
 * @param exitCode process exit code; 0 means success
 * @param output   captured log tail, may be null
 */
public record ExitStatus(int exitCode, String output) {

    public static ExitStatus ok() {
        return new ExitStatus(0, null);
    }

    public static ExitStatus of(int exitCode) {
        return new ExitStatus(exitCode, null);
    }

    public boolean success() {
        return exitCode == 0;
    }
}
