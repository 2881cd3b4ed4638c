package com.autofix.core.error;

public enum CheckErrorCode implements ErrorCode {
    INSTALL_FAILED,
    CHECKS_FAILED,
    INVALID_STATE
}
