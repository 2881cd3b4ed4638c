package com.autofix.core.model;

/**
 * Outcome of a single verification check.
 *
 * @param check      which check ran
 * @param status     pass/fail/timeout/skipped
 * @param exitCode   process exit code, -1 when the process never exited on its own
 * @param stdout     captured standard output
 * @param stderr     captured standard error
 * @param durationMs wall time in milliseconds
 */
public record CheckRun(
    CheckType check,
    CheckStatus status,
    int exitCode,
    String stdout,
    String stderr,
    long durationMs
) {

    public CheckRun {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public static CheckRun skipped(CheckType check) {
        return new CheckRun(check, CheckStatus.SKIPPED, -1, "", "", 0);
    }

    public boolean passed() {
        return status == CheckStatus.PASSED;
    }

    /**
     * First non-blank line of stderr, falling back to stdout.
     */
    public String firstErrorLine() {
        String source = stderr.isBlank() ? stdout : stderr;
        return source.lines().map(String::trim).filter(l -> !l.isEmpty()).findFirst().orElse("");
    }
}
