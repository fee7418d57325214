package com.appbuilder.util;

/**
 * Outcome of a finished (or abandoned) external command. {@code exitCode} is -1
 * when the command timed out or could not be launched; {@code stderr} then says why.
 */
public record CommandResult(int exitCode, String stdout, String stderr) {

    public static final int NOT_COMPLETED = -1;

    public boolean isSuccess() {
        return exitCode == 0;
    }

    /** stdout followed by stderr, the form in which build output is stored and scanned. */
    public String combinedOutput() {
        if (stderr == null || stderr.isEmpty()) return stdout;
        if (stdout == null || stdout.isEmpty()) return stderr;
        return stdout + "\n" + stderr;
    }

    public String errorOrOutput() {
        return stderr != null && !stderr.isBlank() ? stderr : stdout;
    }
}
