package com.autofix.core.interrupt;

/**
 * Installs a handler for process termination signals.
 */
@FunctionalInterface
public interface SignalRegistrar {

    /**
     * Installs the handler.
     *
     * @param handler invoked once when a termination signal arrives
     * @return an action that restores whatever was installed before
     */
    Runnable install(Runnable handler);
}
