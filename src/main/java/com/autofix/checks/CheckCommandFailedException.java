package com.autofix.checks;

import com.autofix.core.process.CommandResult;

/**
 * A check command exited unsuccessfully; carries the captured result.
 */
class CheckCommandFailedException extends RuntimeException {

    private final transient CommandResult result;

    CheckCommandFailedException(String message, CommandResult result) {
        super(message);
        this.result = result;
    }

    CommandResult result() {
        return result;
    }
}
