package com.autofix.checks;

import com.autofix.core.metrics.AutofixMetrics;
import com.autofix.core.model.CheckResult;
import com.autofix.core.model.CheckRun;
import com.autofix.core.model.CheckStatus;
import com.autofix.core.model.CheckType;
import com.autofix.core.process.CommandResult;
import com.autofix.core.process.ProcessExecutionException;
import com.autofix.core.process.ProcessRunner;
import com.autofix.core.retry.Backoff;
import com.autofix.core.retry.RetryExhaustedException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs each check as a {@code <pm> run <script>} subprocess with its own timeout.
 * <p>
 * Each command is wrapped in {@link Backoff}; timeouts are never retried at this level.
 * A check whose script is missing from package.json is skipped.
 */
public class ProcessCheckRunner implements CheckRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessCheckRunner.class);

    static final Map<CheckType, Duration> DEFAULT_TIMEOUTS = Map.of(
            CheckType.LINT, Duration.ofSeconds(60),
            CheckType.TYPECHECK, Duration.ofSeconds(120),
            CheckType.TEST, Duration.ofSeconds(300)
    );

    private final ProcessRunner processRunner;
    private final Backoff backoff;
    private final Map<CheckType, Duration> timeouts;
    private final int commandRetries;
    private final ObjectMapper objectMapper;
    private final AutofixMetrics metrics;

    public ProcessCheckRunner(ProcessRunner processRunner, Backoff backoff, Map<CheckType, Duration> timeouts,
                              int commandRetries, ObjectMapper objectMapper, AutofixMetrics metrics) {
        this.processRunner = processRunner;
        this.backoff = backoff;
        this.timeouts = new EnumMap<>(CheckType.class);
        this.timeouts.putAll(DEFAULT_TIMEOUTS);
        if (timeouts != null) {
            this.timeouts.putAll(timeouts);
        }
        this.commandRetries = commandRetries;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    @Override
    public CheckResult runChecks(Path path, List<CheckType> checks, boolean failFast) {
        PackageManager pm = PackageManagerDetector.detect(path).packageManager().orElse(PackageManager.NPM);
        Optional<JsonNode> scripts = readScripts(path);

        List<CheckRun> runs = new ArrayList<>();
        boolean stop = false;
        for (CheckType check : checks) {
            if (stop) {
                runs.add(CheckRun.skipped(check));
                continue;
            }
            if (scripts.isPresent() && !scripts.get().has(check.scriptName())) {
                log.info("No '{}' script in package.json, skipping", check.scriptName());
                runs.add(CheckRun.skipped(check));
                continue;
            }

            CheckRun run = runCheck(path, pm, check);
            runs.add(run);
            if (metrics != null) {
                metrics.recordCheck(check.scriptName(), run.status().name().toLowerCase(), run.durationMs());
            }
            log.info("Check {} {} in {}ms", check.scriptName(), run.status(), run.durationMs());
            if (failFast && run.status() != CheckStatus.PASSED) {
                stop = true;
            }
        }
        return CheckResult.of(runs, 0);
    }

    CheckRun runCheck(Path path, PackageManager pm, CheckType check) {
        List<String> command = pm.runScript(check.scriptName());
        Duration timeout = timeouts.get(check);
        try {
            CommandResult result = backoff.withRetry(() -> {
                CommandResult r = processRunner.run(path, command, Map.of("CI", "true"), null, timeout);
                if (!r.succeeded()) {
                    throw new CheckCommandFailedException(check.scriptName()
                            + (r.timedOut() ? " timed out" : " exited with " + r.exitCode()), r);
                }
                return r;
            }, commandRetries, check.scriptName(), e -> e instanceof CheckCommandFailedException f
                    && !f.result().timedOut()).value();
            return toRun(check, result);
        } catch (RetryExhaustedException e) {
            if (e.getCause() instanceof CheckCommandFailedException failed) {
                return toRun(check, failed.result());
            }
            return new CheckRun(check, CheckStatus.FAILED, -1, "", messageOf(e.getCause()), 0);
        } catch (ProcessExecutionException e) {
            return new CheckRun(check, CheckStatus.FAILED, -1, "", e.getMessage(), 0);
        }
    }

    private static CheckRun toRun(CheckType check, CommandResult result) {
        CheckStatus status;
        if (result.timedOut()) {
            status = CheckStatus.TIMEOUT;
        } else {
            status = result.exitCode() == 0 ? CheckStatus.PASSED : CheckStatus.FAILED;
        }
        return new CheckRun(check, status, result.exitCode(), result.stdout(), result.stderr(), result.durationMs());
    }

    private Optional<JsonNode> readScripts(Path dir) {
        Path manifest = dir.resolve(PackageManagerDetector.MANIFEST);
        if (!Files.isRegularFile(manifest)) {
            return Optional.empty();
        }
        try {
            JsonNode scripts = objectMapper.readTree(manifest.toFile()).path("scripts");
            return scripts.isObject() ? Optional.of(scripts) : Optional.empty();
        } catch (IOException e) {
            log.warn("Could not parse {}: {}", manifest, e.getMessage());
            return Optional.empty();
        }
    }

    private static String messageOf(Throwable t) {
        if (t == null) return "unknown error";
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
