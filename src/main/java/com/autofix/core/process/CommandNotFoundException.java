package com.autofix.core.process;

/**
 * The executable of a command could not be located.
 */
public class CommandNotFoundException extends ProcessExecutionException {

    private final String executable;

    public CommandNotFoundException(String executable, Throwable cause) {
        super("Command not found: " + executable, cause);
        this.executable = executable;
    }

    public String executable() {
        return executable;
    }
}
