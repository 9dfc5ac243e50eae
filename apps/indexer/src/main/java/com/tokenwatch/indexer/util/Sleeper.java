package com.tokenwatch.indexer.util;

/**
 * Pause hook used for backoff and pacing, replaced in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
