package com.simtrader.execution;

import com.simtrader.core.concurrent.EventLoop;
import com.simtrader.core.config.SimulationConfig;
import com.simtrader.core.terminal.TradingTerminal;
import com.simtrader.execution.queue.QueueItem;
import com.simtrader.execution.queue.QueueRunReport;
import com.simtrader.execution.queue.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs strategies and their helper routines on a {@link TaskQueue} and stops
 * them all together through one {@link ShutdownSignal}.
 *
 * <p>Strategies and background routines each occupy a queue worker. Thread
 * routines run blocking work on a separate pool; a queue worker waits for the
 * result and posts it to the event loop.
 */
public class StrategyExecutor {

    private static final Logger log = LoggerFactory.getLogger(StrategyExecutor.class);

    private final TaskQueue queue;
    private final EventLoop loop;
    private final StrategyContext context;
    private final ExecutorService threadPool;

    private final List<StrategyRunner> strategies = new ArrayList<>();
    private final List<Routine> routines = new ArrayList<>();
    private final List<ThreadRoutine<?>> threadRoutines = new ArrayList<>();

    private final AtomicInteger runningStrategies = new AtomicInteger();
    private final AtomicInteger runningRoutines = new AtomicInteger();
    private final AtomicInteger runningThreadRoutines = new AtomicInteger();
    private final AtomicInteger threadCount = new AtomicInteger();

    private boolean initialized;

    private record Routine(String name, BackgroundRoutine routine, boolean mustComplete) {}

    private record ThreadRoutine<T>(String name, BlockingRoutine<T> routine, Consumer<T> onResult) {}

    public StrategyExecutor(SimulationConfig config, TradingTerminal terminal, EventLoop loop,
                            Pacer pacer, ShutdownSignal shutdown) {
        this(new TaskQueue(config.getQueue()), terminal, loop, pacer, shutdown);
    }

    public StrategyExecutor(TaskQueue queue, TradingTerminal terminal, EventLoop loop,
                            Pacer pacer, ShutdownSignal shutdown) {
        this.queue = queue;
        this.loop = loop;
        this.context = new StrategyContext(terminal, shutdown, pacer);
        this.threadPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "routine-thread-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        queue.onStopping(shutdown::trigger);
    }

    public StrategyExecutor addStrategy(StrategyRunner strategy) {
        checkNotInitialized();
        strategies.add(strategy);
        return this;
    }

    public StrategyExecutor addStrategies(Collection<? extends StrategyRunner> runners) {
        runners.forEach(this::addStrategy);
        return this;
    }

    public StrategyExecutor addRoutine(String name, BackgroundRoutine routine) {
        return addRoutine(name, routine, false);
    }

    /**
     * @param mustComplete let the routine finish even when the run times out
     */
    public StrategyExecutor addRoutine(String name, BackgroundRoutine routine, boolean mustComplete) {
        checkNotInitialized();
        routines.add(new Routine(name, routine, mustComplete));
        return this;
    }

    /**
     * Run {@code routine} on its own thread and hand its result to {@code onResult}
     * on the event loop.
     */
    public <T> StrategyExecutor addThreadRoutine(String name, BlockingRoutine<T> routine, Consumer<T> onResult) {
        checkNotInitialized();
        threadRoutines.add(new ThreadRoutine<>(name, routine, onResult));
        return this;
    }

    /**
     * Enqueue one item per registered unit. Called by {@link #execute} if not done before.
     */
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        initialized = true;
        for (StrategyRunner strategy : strategies) {
            context.pacer().register();
            queue.add(QueueItem.of("strategy:" + strategy.name(), () -> runStrategy(strategy)));
        }
        for (Routine routine : routines) {
            queue.add(QueueItem.of("routine:" + routine.name(), () -> runRoutine(routine),
                    QueueItem.DEFAULT_PRIORITY, routine.mustComplete()));
        }
        for (ThreadRoutine<?> routine : threadRoutines) {
            queue.add(QueueItem.of("thread:" + routine.name(), () -> runThreadRoutine(routine)));
        }
        log.info("Executor initialized with {} strategies, {} routines, {} thread routines",
                strategies.size(), routines.size(), threadRoutines.size());
    }

    public ExecutionReport execute() throws InterruptedException {
        return execute(null);
    }

    /**
     * Run everything registered until it all finishes or {@code timeout} elapses,
     * then raise the shutdown signal.
     *
     * @param timeout aggregate bound; null falls back to the queue's configured timeout
     */
    public ExecutionReport execute(Duration timeout) throws InterruptedException {
        initialize();
        QueueRunReport run;
        try {
            run = timeout != null ? queue.run(timeout) : queue.run();
        } finally {
            context.shutdown().trigger();
            threadPool.shutdownNow();
        }
        if (run.mustCompleteTimeouts() > 0) {
            log.error("{} must-complete units did not finish within their timeout", run.mustCompleteTimeouts());
        }
        if (!run.mustCompleteFailures().isEmpty()) {
            log.error("Must-complete units failed: {}", run.mustCompleteFailures());
        }
        return new ExecutionReport(strategies.size(), routines.size(), threadRoutines.size(), run);
    }

    /**
     * Raise the shutdown signal when the JVM is asked to exit.
     */
    public void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.warn("JVM shutdown requested, stopping strategies");
            context.shutdown().trigger();
        }, "executor-shutdown-hook"));
    }

    public void stop() {
        context.shutdown().trigger();
        queue.stop();
    }

    private void runStrategy(StrategyRunner strategy) throws Exception {
        runningStrategies.incrementAndGet();
        try {
            strategy.run(context);
        } finally {
            runningStrategies.decrementAndGet();
            context.pacer().deregister();
        }
    }

    private void runRoutine(Routine routine) throws Exception {
        runningRoutines.incrementAndGet();
        try {
            routine.routine().run(context.shutdown());
        } finally {
            runningRoutines.decrementAndGet();
        }
    }

    private <T> void runThreadRoutine(ThreadRoutine<T> routine) throws Exception {
        runningThreadRoutines.incrementAndGet();
        Callable<T> task = routine.routine()::call;
        Future<T> future = threadPool.submit(task);
        try {
            T result = future.get();
            loop.execute(() -> routine.onResult().accept(result));
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } finally {
            runningThreadRoutines.decrementAndGet();
        }
    }

    private void checkNotInitialized() {
        if (initialized) {
            throw new IllegalStateException("Executor already initialized");
        }
    }

    // Getters
    public int runningStrategies() { return runningStrategies.get(); }
    public int runningRoutines() { return runningRoutines.get(); }
    public int runningThreadRoutines() { return runningThreadRoutines.get(); }
    public int strategyCount() { return strategies.size(); }
    public int routineCount() { return routines.size(); }
    public int threadRoutineCount() { return threadRoutines.size(); }
    public ShutdownSignal getShutdown() { return context.shutdown(); }
    public TaskQueue getQueue() { return queue; }
}
