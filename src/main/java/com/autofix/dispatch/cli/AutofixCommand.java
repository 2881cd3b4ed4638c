package com.autofix.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command. Routes to subcommands: run, checks.
 */
@Command(
        name = "autofix",
        mixinStandardHelpOptions = true,
        version = "autofix 0.1.0",
        description = "Fixes groups of tracked issues in isolated worktrees and opens pull requests",
        subcommands = {
                RunCommand.class,
                ChecksCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AutofixCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // no subcommand given
        new CommandLine(this).usage(System.out);
    }
}
