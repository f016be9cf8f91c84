package com.simtrader.execution;

import com.simtrader.core.terminal.TerminalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Base class for interval-driven strategies: {@link #initialize} once, then
 * {@link #trade} every {@code interval} until shutdown.
 *
 * <p>A {@link TerminalException} from a single cycle is logged and the loop
 * carries on with the next one. Anything else ends the strategy.
 */
public abstract class Strategy implements StrategyRunner {

    private static final Logger log = LoggerFactory.getLogger(Strategy.class);

    private final String name;
    private final Duration interval;
    private final AtomicLong cycles = new AtomicLong();

    protected Strategy(String name, Duration interval) {
        this.name = name;
        this.interval = interval;
    }

    @Override
    public String name() {
        return name;
    }

    protected void initialize(StrategyContext context) throws Exception {
    }

    /**
     * One trading cycle.
     */
    protected abstract void trade(StrategyContext context) throws Exception;

    @Override
    public void run(StrategyContext context) throws Exception {
        initialize(context);
        log.info("Running strategy {} every {}", name, interval);
        while (!context.isShutdown()) {
            try {
                trade(context);
                cycles.incrementAndGet();
            } catch (TerminalException e) {
                log.warn("Strategy {} cycle failed: {}", name, e.getMessage());
            }
            if (context.isShutdown()) {
                break;
            }
            context.pacer().sleep(interval);
        }
        log.info("Strategy {} stopped after {} cycles", name, cycles.get());
    }

    // Getters
    public Duration getInterval() { return interval; }
    public long getCycles() { return cycles.get(); }
}
