package com.autofix.core.retry;

/**
 * Blocking delay, injectable so tests can observe waits without sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
