package com.phillippitts.speakerverify.service.model;

/**
 * Pause between load attempts. Injected so tests can observe backoff without waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = millis -> Thread.sleep(millis);

    void sleep(long millis) throws InterruptedException;
}
