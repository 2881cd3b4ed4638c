package com.autofix.core.interrupt;

@FunctionalInterface
public interface CleanupAction {
    void run() throws Exception;
}
