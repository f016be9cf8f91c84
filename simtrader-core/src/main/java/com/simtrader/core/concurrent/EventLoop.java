package com.simtrader.core.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Single thread that owns all mutable simulation state. Other threads hand
 * work to it and wait for the result, so state is never touched concurrently.
 */
public class EventLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventLoop.class);

    private final String name;
    private final ExecutorService executor;
    private volatile Thread loopThread;

    public EventLoop() {
        this("engine-loop");
    }

    public EventLoop(String name) {
        this.name = name;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            loopThread = t;
            return t;
        });
    }

    /**
     * Schedule a task on the loop.
     */
    public <T> CompletableFuture<T> submit(Callable<T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        executor.execute(() -> {
            try {
                future.complete(task.call());
            } catch (Throwable e) {
                future.completeExceptionally(e);
            }
        });
        return future;
    }

    /**
     * Post a task without waiting for it. Failures are logged.
     */
    public void execute(Runnable task) {
        executor.execute(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Task on {} failed", name, e);
            }
        });
    }

    /**
     * Run a task on the loop and wait for its result. Called from the loop
     * itself the task runs inline.
     *
     * @throws ExecutionException wrapping whatever the task threw
     */
    public <T> T invoke(Callable<T> task) throws InterruptedException, ExecutionException {
        if (isLoopThread()) {
            try {
                return task.call();
            } catch (Exception e) {
                throw new ExecutionException(e);
            }
        }
        return submit(task).get();
    }

    public boolean isLoopThread() {
        return Thread.currentThread() == loopThread;
    }

    /**
     * Guard for code that must only run on the loop.
     */
    public void checkLoopThread() {
        if (!isLoopThread()) {
            throw new IllegalStateException("Not on " + name + ": " + Thread.currentThread().getName());
        }
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.debug("{} stopped", name);
    }
}
