package com.simtrader.execution.queue;

import com.simtrader.core.config.ExitPolicy;
import com.simtrader.core.config.QueueMode;
import com.simtrader.core.config.SimulationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Priority work queue drained by a pool of worker threads.
 *
 * <p>{@link #run()} dispatches items until the queue is drained ({@link QueueMode#FINITE}),
 * until {@link #stop()} is called, or until the aggregate timeout elapses. When it
 * stops early, queued best-effort items are discarded and running ones are
 * interrupted. Must-complete items are still started and awaited under
 * {@link ExitPolicy#COMPLETE_PRIORITY}; {@link ExitPolicy#CANCEL} treats them like
 * the rest. A per-item timeout, when set, interrupts any single item that runs
 * too long, must-complete ones included.
 *
 * <p>A failing item is logged and counted. It never affects its siblings.
 */
public class TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(TaskQueue.class);

    private static final long POLL_MILLIS = 50;
    private static final long SETTLE_MILLIS = 10;

    private final PriorityBlockingQueue<QueueItem> queue = new PriorityBlockingQueue<>();
    private final Set<QueueItem> priorityTasks = ConcurrentHashMap.newKeySet();
    private final Set<ItemFuture> inFlight = ConcurrentHashMap.newKeySet();
    private final List<Runnable> stoppingHooks = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicInteger activeBodies = new AtomicInteger();
    private final AtomicInteger workerCount = new AtomicInteger();

    private Duration timeout;
    private Duration itemTimeout;
    private Duration cancelGrace = Duration.ofSeconds(1);
    private int maxWorkers;
    private QueueMode mode = QueueMode.FINITE;
    private ExitPolicy exitPolicy = ExitPolicy.COMPLETE_PRIORITY;

    private volatile boolean stopRequested;
    private volatile boolean cancelRequested;
    private volatile Semaphore slots;
    private volatile RunCounters counters = new RunCounters();

    public TaskQueue() {
    }

    public TaskQueue(SimulationConfig.QueueConfig config) {
        this.timeout = config.timeout();
        this.itemTimeout = config.itemTimeout();
        if (config.cancelGrace() != null) {
            this.cancelGrace = config.cancelGrace();
        }
        this.maxWorkers = config.getMaxWorkers();
        this.mode = config.getMode();
        this.exitPolicy = config.getOnExit();
    }

    /**
     * Bound the whole run (default: none).
     */
    public TaskQueue withTimeout(Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    /**
     * Bound any single item (default: none).
     */
    public TaskQueue withItemTimeout(Duration itemTimeout) {
        this.itemTimeout = itemTimeout;
        return this;
    }

    /**
     * How long to wait for interrupted bodies to return before giving up on them.
     */
    public TaskQueue withCancelGrace(Duration cancelGrace) {
        this.cancelGrace = cancelGrace;
        return this;
    }

    /**
     * Limit concurrent items; 0 starts one worker per item.
     */
    public TaskQueue withMaxWorkers(int maxWorkers) {
        if (maxWorkers < 0) {
            throw new IllegalArgumentException("maxWorkers must not be negative: " + maxWorkers);
        }
        this.maxWorkers = maxWorkers;
        return this;
    }

    public TaskQueue withMode(QueueMode mode) {
        this.mode = mode;
        return this;
    }

    public TaskQueue withExitPolicy(ExitPolicy exitPolicy) {
        this.exitPolicy = exitPolicy;
        return this;
    }

    /**
     * Callback fired once when a run stops early, before anything is cancelled.
     */
    public TaskQueue onStopping(Runnable hook) {
        stoppingHooks.add(hook);
        return this;
    }

    public QueueItem add(String name, QueueTask task) {
        return add(QueueItem.of(name, task));
    }

    public QueueItem add(String name, QueueTask task, int priority, boolean mustComplete) {
        return add(QueueItem.of(name, task, priority, mustComplete));
    }

    public QueueItem add(QueueItem item) {
        if (item.mustComplete()) {
            priorityTasks.add(item);
        }
        queue.offer(item);
        log.trace("Queued {}", item);
        return item;
    }

    public QueueRunReport run() throws InterruptedException {
        return run(timeout);
    }

    /**
     * Dispatch queued items until the queue is done, stopped, or {@code timeout} elapses.
     *
     * @param timeout aggregate bound for the run; null waits indefinitely
     */
    public QueueRunReport run(Duration timeout) throws InterruptedException {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Queue is already running");
        }
        RunCounters run = new RunCounters();
        counters = run;
        slots = maxWorkers > 0 ? new Semaphore(maxWorkers) : null;
        ExecutorService workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "task-worker-" + workerCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        ScheduledExecutorService watchdog = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "task-watchdog");
            t.setDaemon(true);
            return t;
        });

        long started = System.nanoTime();
        long deadline = timeout != null ? started + timeout.toNanos() : Long.MAX_VALUE;
        boolean timedOutQueue = false;
        log.info("Task queue started ({} items, mode {}, timeout {}, workers {})", queue.size(),
                mode, timeout, maxWorkers > 0 ? maxWorkers : "dynamic");
        try {
            while (true) {
                if (stopRequested) {
                    break;
                }
                if (System.nanoTime() >= deadline) {
                    timedOutQueue = true;
                    break;
                }
                if (mode == QueueMode.FINITE && inFlight.isEmpty() && queue.isEmpty()) {
                    break;
                }
                dispatchNext(workers, watchdog);
            }

            if (timedOutQueue || stopRequested) {
                wind(timedOutQueue ? "timeout" : "stop", workers, watchdog);
            }
            awaitInFlight();
            awaitBodies();
        } finally {
            workers.shutdownNow();
            watchdog.shutdownNow();
            stopRequested = false;
            cancelRequested = false;
            running.set(false);
        }

        QueueRunReport report = run.toReport(Duration.ofNanos(System.nanoTime() - started), timedOutQueue);
        log.info("Task queue finished in {} ms: {} completed, {} failed, {} cancelled, {} timed out, {} discarded",
                report.elapsed().toMillis(), report.completed(), report.failed(), report.cancelled(),
                report.timedOut(), report.discarded());
        return report;
    }

    /**
     * End the current run: best-effort work is dropped, must-complete work follows the exit policy.
     */
    public void stop() {
        stopRequested = true;
    }

    /**
     * End the current run and cancel everything, must-complete items included.
     */
    public void cancel() {
        cancelRequested = true;
        stopRequested = true;
    }

    /**
     * Must-complete items that have not finished yet.
     */
    public Set<QueueItem> priorityTasks() {
        return Set.copyOf(priorityTasks);
    }

    public int size() {
        return queue.size();
    }

    public int inFlight() {
        return inFlight.size();
    }

    public boolean isRunning() {
        return running.get();
    }

    private void dispatchNext(ExecutorService workers, ScheduledExecutorService watchdog) throws InterruptedException {
        Semaphore limit = slots;
        if (limit != null && !limit.tryAcquire(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
            return;
        }
        QueueItem item = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
        if (item == null) {
            if (limit != null) {
                limit.release();
            }
            return;
        }
        start(item, workers, watchdog);
    }

    private void start(QueueItem item, ExecutorService workers, ScheduledExecutorService watchdog) {
        ItemFuture future = new ItemFuture(item);
        if (itemTimeout != null) {
            future.watch = watchdog.schedule(future::expire, itemTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        inFlight.add(future);
        try {
            workers.execute(future);
            log.debug("Started {}", item);
        } catch (RejectedExecutionException e) {
            log.error("Could not start {}", item, e);
            future.cancel(false);
            Semaphore limit = slots;
            if (limit != null) {
                limit.release();
            }
        }
    }

    private void wind(String reason, ExecutorService workers, ScheduledExecutorService watchdog)
            throws InterruptedException {
        ExitPolicy policy = cancelRequested ? ExitPolicy.CANCEL : exitPolicy;
        log.info("Task queue stopping on {} ({} queued, {} running, policy {})", reason, queue.size(),
                inFlight.size(), policy);
        for (Runnable hook : stoppingHooks) {
            try {
                hook.run();
            } catch (RuntimeException e) {
                log.warn("Stopping hook failed", e);
            }
        }

        List<QueueItem> remaining = new ArrayList<>();
        queue.drainTo(remaining);
        List<QueueItem> keep = new ArrayList<>();
        for (QueueItem item : remaining) {
            if (item.mustComplete() && policy == ExitPolicy.COMPLETE_PRIORITY) {
                keep.add(item);
            } else {
                counters.discarded.incrementAndGet();
                priorityTasks.remove(item);
                log.debug("Discarded {}", item);
            }
        }

        for (ItemFuture future : inFlight) {
            if (policy == ExitPolicy.CANCEL || !future.item.mustComplete()) {
                future.cancel(true);
            }
        }

        keep.sort(null);
        for (QueueItem item : keep) {
            Semaphore limit = slots;
            if (limit != null) {
                limit.acquire();
            }
            start(item, workers, watchdog);
        }
    }

    private void awaitInFlight() throws InterruptedException {
        while (!inFlight.isEmpty()) {
            TimeUnit.MILLISECONDS.sleep(SETTLE_MILLIS);
        }
    }

    private void awaitBodies() throws InterruptedException {
        long graceEnd = System.nanoTime() + cancelGrace.toNanos();
        while (activeBodies.get() > 0 && System.nanoTime() < graceEnd) {
            TimeUnit.MILLISECONDS.sleep(SETTLE_MILLIS);
        }
        if (activeBodies.get() > 0) {
            log.warn("{} cancelled task bodies still running after {} ms", activeBodies.get(),
                    cancelGrace.toMillis());
        }
    }

    private void record(ItemFuture future) {
        QueueItem item = future.item;
        RunCounters run = counters;
        if (future.isCancelled()) {
            if (future.expired) {
                run.timedOut.incrementAndGet();
                if (item.mustComplete()) {
                    run.mustCompleteTimeouts.incrementAndGet();
                    log.error("Must-complete task {} exceeded its {} ms timeout", item.name(),
                            itemTimeout.toMillis());
                } else {
                    log.debug("Task {} timed out", item.name());
                }
            } else {
                run.cancelled.incrementAndGet();
                log.debug("Task {} cancelled", item.name());
            }
            return;
        }
        try {
            future.get();
            run.completed.incrementAndGet();
            log.debug("Task {} completed", item.name());
        } catch (ExecutionException e) {
            run.failed.incrementAndGet();
            if (item.mustComplete()) {
                run.mustCompleteFailures.add(item.name());
                log.error("Must-complete task {} failed", item.name(), e.getCause());
            } else {
                log.warn("Task {} failed: {}", item.name(), e.getCause().toString());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Tracks one dispatched item. {@code done()} fires on completion, failure
     * or cancellation; the worker slot is released only once the body returns.
     */
    private final class ItemFuture extends FutureTask<Void> {

        private final QueueItem item;
        private volatile boolean expired;
        private volatile ScheduledFuture<?> watch;

        ItemFuture(QueueItem item) {
            super(() -> {
                item.task().run();
                return null;
            });
            this.item = item;
        }

        @Override
        public void run() {
            activeBodies.incrementAndGet();
            try {
                super.run();
            } finally {
                activeBodies.decrementAndGet();
                Semaphore limit = slots;
                if (limit != null) {
                    limit.release();
                }
            }
        }

        void expire() {
            if (!isDone()) {
                expired = true;
                cancel(true);
            }
        }

        @Override
        protected void done() {
            ScheduledFuture<?> w = watch;
            if (w != null) {
                w.cancel(false);
            }
            record(this);
            if (item.mustComplete()) {
                priorityTasks.remove(item);
            }
            inFlight.remove(this);
        }
    }

    private static final class RunCounters {
        final AtomicInteger completed = new AtomicInteger();
        final AtomicInteger failed = new AtomicInteger();
        final AtomicInteger cancelled = new AtomicInteger();
        final AtomicInteger timedOut = new AtomicInteger();
        final AtomicInteger discarded = new AtomicInteger();
        final AtomicInteger mustCompleteTimeouts = new AtomicInteger();
        final List<String> mustCompleteFailures = new CopyOnWriteArrayList<>();

        QueueRunReport toReport(Duration elapsed, boolean timedOutQueue) {
            return new QueueRunReport(completed.get(), failed.get(), cancelled.get(), timedOut.get(),
                    discarded.get(), mustCompleteFailures, mustCompleteTimeouts.get(), elapsed, timedOutQueue);
        }
    }
}
