package com.hookintel.hook.service;

import com.hookintel.hook.config.HookScraperProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Sleeps for a random duration in [minDelay, maxDelay].
 */
@Component
@Slf4j
public class RandomDelayPacer implements Pacer {

    private final long minMs;
    private final long maxMs;

    @Autowired
    public RandomDelayPacer(HookScraperProperties properties) {
        this(properties.getScrape().getMinDelay(), properties.getScrape().getMaxDelay());
    }

    public RandomDelayPacer(Duration minDelay, Duration maxDelay) {
        this.minMs = Math.max(0, minDelay.toMillis());
        this.maxMs = Math.max(this.minMs, maxDelay.toMillis());
    }

    @Override
    public void pause() throws InterruptedException {
        long delay = maxMs == minMs ? minMs : ThreadLocalRandom.current().nextLong(minMs, maxMs + 1);
        if (delay > 0) {
            log.debug("Waiting {} ms", delay);
            Thread.sleep(delay);
        }
    }
}
