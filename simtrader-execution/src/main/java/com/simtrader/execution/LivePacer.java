package com.simtrader.execution;

import java.time.Clock;
import java.time.Duration;

/**
 * Wall-clock pacing. Each sleep ends just after the next multiple of the
 * interval so cycles line up with bar boundaries, or early on shutdown.
 */
public class LivePacer implements Pacer {

    private static final long SETTLE_MILLIS = 100;

    private final ShutdownSignal shutdown;
    private final Clock clock;

    public LivePacer(ShutdownSignal shutdown) {
        this(shutdown, Clock.systemUTC());
    }

    public LivePacer(ShutdownSignal shutdown, Clock clock) {
        this.shutdown = shutdown;
        this.clock = clock;
    }

    @Override
    public void sleep(Duration interval) throws InterruptedException {
        shutdown.await(Duration.ofMillis(delay(interval)));
    }

    long delay(Duration interval) {
        long millis = interval.toMillis();
        if (millis <= 0) {
            return SETTLE_MILLIS;
        }
        long mod = clock.millis() % millis;
        return (mod == 0 ? 0 : millis - mod) + SETTLE_MILLIS;
    }
}
