package com.simtrader.execution;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ShutdownSignalTest {

    @Test
    void triggersOnceAndNotifiesListeners() throws InterruptedException {
        ShutdownSignal signal = new ShutdownSignal();
        AtomicInteger calls = new AtomicInteger();
        signal.addListener(calls::incrementAndGet);
        signal.addListener(() -> {
            throw new IllegalStateException("listener bug");
        });

        assertFalse(signal.await(Duration.ofMillis(10)));
        signal.trigger();
        signal.trigger();

        assertTrue(signal.isShutdown());
        assertTrue(signal.await(Duration.ZERO));
        assertEquals(1, calls.get());
    }

    @Test
    void lateListenerRunsImmediately() {
        ShutdownSignal signal = new ShutdownSignal();
        signal.trigger();
        AtomicInteger calls = new AtomicInteger();

        signal.addListener(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    void livePacerAlignsToInterval() {
        Clock clock = Clock.fixed(Instant.ofEpochMilli(61_500), ZoneOffset.UTC);
        LivePacer pacer = new LivePacer(new ShutdownSignal(), clock);

        assertEquals(58_600, pacer.delay(Duration.ofMinutes(1)));
        assertEquals(600, pacer.delay(Duration.ofSeconds(1)));
    }

    @Test
    void livePacerWakesOnShutdown() throws InterruptedException {
        ShutdownSignal signal = new ShutdownSignal();
        signal.trigger();
        long started = System.nanoTime();

        new LivePacer(signal).sleep(Duration.ofHours(1));

        assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(5)) < 0);
    }
}
