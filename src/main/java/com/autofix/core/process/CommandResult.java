package com.autofix.core.process;

/**
 * Captured outcome of a subprocess.
 *
 * @param exitCode   exit status, -1 if the process was killed after a timeout
 * @param stdout     standard output
 * @param stderr     standard error
 * @param durationMs wall time
 * @param timedOut   true when the timeout elapsed before the process exited
 */
public record CommandResult(int exitCode, String stdout, String stderr, long durationMs, boolean timedOut) {

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }
}
