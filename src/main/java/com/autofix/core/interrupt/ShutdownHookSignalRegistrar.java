package com.autofix.core.interrupt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps SIGINT/SIGTERM onto a JVM shutdown hook.
 */
public class ShutdownHookSignalRegistrar implements SignalRegistrar {

    private static final Logger log = LoggerFactory.getLogger(ShutdownHookSignalRegistrar.class);

    @Override
    public Runnable install(Runnable handler) {
        Thread hook = new Thread(handler, "autofix-interrupt-hook");
        Runtime.getRuntime().addShutdownHook(hook);
        return () -> {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                // already shutting down; the hook is running or has run
                log.debug("Shutdown in progress, interrupt hook left in place");
            }
        };
    }
}
