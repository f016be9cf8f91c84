package com.simtrader.core.concurrent;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class EventLoopTest {

    private EventLoop loop;

    @BeforeEach
    void setUp() {
        loop = new EventLoop("test-loop");
    }

    @AfterEach
    void tearDown() {
        loop.close();
    }

    @Test
    void invokeRunsOnLoopThread() throws Exception {
        String threadName = loop.invoke(() -> Thread.currentThread().getName());
        assertEquals("test-loop", threadName);
        assertFalse(loop.isLoopThread());
    }

    @Test
    void nestedInvokeRunsInline() throws Exception {
        int result = loop.invoke(() -> loop.invoke(() -> 21) * 2);
        assertEquals(42, result);
    }

    @Test
    void failuresSurfaceAsExecutionException() {
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> loop.invoke(() -> { throw new IllegalStateException("boom"); }));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void executePostsWork() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<Boolean> onLoop = new AtomicReference<>();
        loop.execute(() -> {
            onLoop.set(loop.isLoopThread());
            latch.countDown();
        });
        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertTrue(onLoop.get());
    }

    @Test
    void checkLoopThreadRejectsForeignThread() {
        assertThrows(IllegalStateException.class, loop::checkLoopThread);
    }
}
