package com.hookintel.hook.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RandomDelayPacerTest {

    @Test
    void pause_waitsAtLeastTheMinimum() throws InterruptedException {
        Pacer pacer = new RandomDelayPacer(Duration.ofMillis(20), Duration.ofMillis(40));

        long start = System.nanoTime();
        pacer.pause();
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(elapsedMs >= 20, "waited " + elapsedMs + " ms");
    }

    @Test
    void pause_invertedBoundsUseTheMinimum() throws InterruptedException {
        Pacer pacer = new RandomDelayPacer(Duration.ZERO, Duration.ofMillis(-5));

        pacer.pause();
    }

    @Test
    void pause_isInterruptible() {
        Pacer pacer = new RandomDelayPacer(Duration.ofSeconds(5), Duration.ofSeconds(5));
        Thread.currentThread().interrupt();

        assertThrows(InterruptedException.class, pacer::pause);
        assertFalse(Thread.interrupted());
    }
}
