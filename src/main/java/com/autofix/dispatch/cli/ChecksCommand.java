package com.autofix.dispatch.cli;

import com.autofix.core.error.StageError;
import com.autofix.core.fix.FixOrchestratorFactory;
import com.autofix.core.model.CheckResult;
import com.autofix.core.model.CheckRun;
import com.autofix.core.result.Result;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: autofix checks &lt;path&gt;
 * <p>
 * Installs dependencies and runs the verification checks against a directory.
 */
@Command(name = "checks", mixinStandardHelpOptions = true, description = "Run verification checks in a directory")
@Component
public class ChecksCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Directory to check", defaultValue = ".")
    Path path;

    private final FixOrchestratorFactory orchestratorFactory;

    public ChecksCommand(FixOrchestratorFactory orchestratorFactory) {
        this.orchestratorFactory = orchestratorFactory;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (!Files.isDirectory(path)) {
            ConsoleOutput.error("Not a directory: " + path);
            return 2;
        }
        ConsoleOutput.info("Running checks in " + path.toAbsolutePath());

        Result<CheckResult, StageError> result = orchestratorFactory.checkStage().run(path, 1);
        if (result.isErr()) {
            ConsoleOutput.error(result.error().toString());
            return 1;
        }
        for (CheckRun run : result.value().results()) {
            ConsoleOutput.checkRun(run);
        }
        if (result.value().success()) {
            ConsoleOutput.success("Checks passed in " + result.value().totalDurationMs() + "ms");
            return 0;
        }
        ConsoleOutput.error("Checks failed.");
        return 1;
    }
}
