package com.simtrader.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot stop flag shared by the executor and every strategy it runs.
 * Strategies poll {@link #isShutdown()} between cycles or block on {@link #await(Duration)}.
 */
public class ShutdownSignal {

    private static final Logger log = LoggerFactory.getLogger(ShutdownSignal.class);

    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> listeners = new ArrayList<>();
    private volatile boolean triggered;

    /**
     * Raise the signal. Later calls are no-ops.
     */
    public void trigger() {
        List<Runnable> toRun;
        synchronized (this) {
            if (triggered) {
                return;
            }
            triggered = true;
            latch.countDown();
            toRun = List.copyOf(listeners);
        }
        log.info("Shutdown signalled");
        toRun.forEach(this::fire);
    }

    public boolean isShutdown() {
        return triggered;
    }

    /**
     * Block until the signal is raised or {@code timeout} elapses.
     *
     * @return true if the signal was raised
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Run {@code listener} when the signal is raised; immediately if it already was.
     */
    public void addListener(Runnable listener) {
        synchronized (this) {
            if (!triggered) {
                listeners.add(listener);
                return;
            }
        }
        fire(listener);
    }

    private void fire(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("Shutdown listener failed", e);
        }
    }
}
