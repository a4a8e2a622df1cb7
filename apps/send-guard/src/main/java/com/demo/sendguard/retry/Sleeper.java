package com.demo.sendguard.retry;

/**
 * Blocking pause between attempts. Interrupting the sleeping thread cancels the invocation.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
