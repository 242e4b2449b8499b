package com.hookintel.hook.service;

/**
 * Suspension between browser actions, used to stay under rate limits.
 * Blocks only the calling worker.
 */
@FunctionalInterface
public interface Pacer {

    /** Never waits; for tests and offline runs */
    Pacer NONE = () -> { };

    void pause() throws InterruptedException;
}
