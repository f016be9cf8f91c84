package com.simtrader.execution;

import com.simtrader.core.concurrent.EventLoop;
import com.simtrader.engine.BacktestEngine;
import com.simtrader.engine.BacktestReport;
import com.simtrader.engine.clock.RangeExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Phaser;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lock-step pacing for backtests. Each registered strategy arrives at the
 * barrier when it sleeps; once all have arrived the engine moves one tick
 * forward on the event loop, evaluates fills and stops, and releases them.
 *
 * <p>The run ends when the clock runs out, the account is stopped out, or the
 * shutdown signal is raised elsewhere. The engine is then wrapped up once.
 */
public class BacktestController implements Pacer {

    private static final Logger log = LoggerFactory.getLogger(BacktestController.class);

    private static final long PROGRESS_EVERY_SECONDS = 6 * 3600;

    private final BacktestEngine engine;
    private final EventLoop loop;
    private final ShutdownSignal shutdown;
    private final Phaser phaser;
    private final AtomicLong ticks = new AtomicLong();
    private final AtomicBoolean finished = new AtomicBoolean();

    // phase a strategy thread arrived at and is still waiting on
    private final ThreadLocal<Integer> arrived = new ThreadLocal<>();
    // parties that already arrived in the phase recorded here and leave after it
    private final Deque<Integer> leaving = new ArrayDeque<>();

    private volatile BacktestReport report;

    public BacktestController(BacktestEngine engine, EventLoop loop, ShutdownSignal shutdown) {
        this.engine = engine;
        this.loop = loop;
        this.shutdown = shutdown;
        this.phaser = new Phaser() {
            @Override
            protected boolean onAdvance(int phase, int registeredParties) {
                return advance(phase, registeredParties);
            }
        };
        shutdown.addListener(phaser::forceTermination);
    }

    @Override
    public void register() {
        phaser.register();
    }

    /**
     * A strategy that already arrived in the current phase and was interrupted
     * leaves once that phase completes, so the others still get their cycle.
     */
    @Override
    public void deregister() {
        Integer phase = arrived.get();
        arrived.remove();
        if (phaser.isTerminated()) {
            return;
        }
        synchronized (leaving) {
            if (phase != null && phase == phaser.getPhase()) {
                leaving.add(phase);
                return;
            }
        }
        phaser.arriveAndDeregister();
        releaseLeaving();
    }

    /**
     * Wait until simulated time has moved at least {@code interval} ahead, one
     * barrier cycle per tick. A zero interval waits for a single tick.
     */
    @Override
    public void sleep(Duration interval) throws InterruptedException {
        long target = engine.time() + Math.max(interval.getSeconds(), 0);
        do {
            // a previous interrupted sleep may already have arrived in this phase
            Integer pending = arrived.get();
            int phase = pending != null && pending == phaser.getPhase() ? pending : phaser.arrive();
            if (phase < 0) {
                return;
            }
            arrived.set(phase);
            phaser.awaitAdvanceInterruptibly(phase);
            arrived.remove();
            releaseLeaving();
        } while (!phaser.isTerminated() && engine.time() < target);
    }

    /**
     * Deregister the parties whose last phase has completed.
     */
    private void releaseLeaving() {
        synchronized (leaving) {
            while (!leaving.isEmpty() && leaving.peekFirst() != phaser.getPhase() && !phaser.isTerminated()) {
                leaving.pollFirst();
                phaser.arriveAndDeregister();
            }
        }
    }

    private int leavingAt(int phase) {
        synchronized (leaving) {
            return (int) leaving.stream().filter(p -> p == phase).count();
        }
    }

    /**
     * Runs on whichever strategy thread arrives last.
     *
     * @return true to end the run
     */
    private boolean advance(int phase, int parties) {
        if (parties == leavingAt(phase) || shutdown.isShutdown()) {
            finish(shutdown.isShutdown() ? "shutdown" : "all strategies stopped");
            return true;
        }
        try {
            long time = loop.invoke(engine::next).time();
            ticks.incrementAndGet();
            if (time % PROGRESS_EVERY_SECONDS == 0) {
                log.info("Backtest at {}", time);
            }
            if (loop.invoke(engine::isStoppedOut)) {
                log.warn("Account stopped out at {}", time);
                finish("stop out");
                return true;
            }
            return false;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RangeExhaustedException) {
                finish("end of range");
            } else {
                log.error("Advancing the backtest failed", e.getCause());
                finish("error");
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finish("interrupted");
            return true;
        }
    }

    /**
     * Wrap up the engine once and raise the shutdown signal. Safe to call from
     * any thread; calls after the first only return the stored report.
     */
    public Optional<BacktestReport> finish(String reason) {
        if (finished.compareAndSet(false, true)) {
            log.info("Backtest stopping ({}) after {} ticks", reason, ticks.get());
            try {
                report = loop.invoke(engine::wrapUp);
            } catch (ExecutionException e) {
                log.error("Backtest wrap-up failed", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while wrapping up the backtest");
            }
            shutdown.trigger();
        }
        return getReport();
    }

    public Optional<BacktestReport> getReport() {
        return Optional.ofNullable(report);
    }

    public long getTicks() {
        return ticks.get();
    }

    public int getParties() {
        return phaser.getRegisteredParties();
    }

    public boolean isFinished() {
        return finished.get();
    }
}
