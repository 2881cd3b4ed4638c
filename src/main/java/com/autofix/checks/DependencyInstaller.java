package com.autofix.checks;

import com.autofix.core.error.CheckErrorCode;
import com.autofix.core.error.StageError;
import com.autofix.core.process.CommandResult;
import com.autofix.core.process.ProcessExecutionException;
import com.autofix.core.process.ProcessRunner;
import com.autofix.core.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Installs workspace dependencies with the detected package manager, in CI mode.
 */
public class DependencyInstaller {

    private static final Logger log = LoggerFactory.getLogger(DependencyInstaller.class);

    private final ProcessRunner processRunner;
    private final Duration timeout;

    public DependencyInstaller(ProcessRunner processRunner, Duration timeout) {
        this.processRunner = processRunner;
        this.timeout = timeout;
    }

    /**
     * @return the plan that was executed (possibly {@link InstallPlan#SKIP})
     */
    public Result<InstallPlan, StageError> install(Path dir) {
        InstallPlan plan = PackageManagerDetector.detect(dir);
        if (plan.skipped()) {
            log.info("No package manifest in {}, skipping dependency install", dir);
            return Result.ok(plan);
        }

        log.info("Installing dependencies: {}", String.join(" ", plan.command()));
        try {
            CommandResult result = processRunner.run(dir, plan.command(), Map.of("CI", "true"), null, timeout);
            if (result.timedOut()) {
                return Result.err(StageError.of(CheckErrorCode.INSTALL_FAILED,
                        "Dependency install timed out after " + timeout.toSeconds() + "s"));
            }
            if (result.exitCode() != 0) {
                return Result.err(StageError.of(CheckErrorCode.INSTALL_FAILED,
                        "Dependency install failed: " + truncate(result.stderr().isBlank() ? result.stdout() : result.stderr())));
            }
            return Result.ok(plan);
        } catch (ProcessExecutionException e) {
            return Result.err(StageError.of(CheckErrorCode.INSTALL_FAILED, e.getMessage(), e));
        }
    }

    private static String truncate(String s) {
        String trimmed = s.strip();
        return trimmed.length() <= 500 ? trimmed : trimmed.substring(0, 500);
    }
}
