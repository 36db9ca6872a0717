package com.lintmux.core.scheduler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class OrchestratorLoopTest {

    private final OrchestratorLoop loop = new OrchestratorLoop();

    @AfterEach
    void tearDown() {
        loop.shutdown();
    }

    @Test
    void runsTasksInSubmissionOrderOnOneThread() throws Exception {
        List<String> threads = Collections.synchronizedList(new ArrayList<>());
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());
        var done = new CountDownLatch(50);
        for (int i = 0; i < 50; i++) {
            final int n = i;
            loop.execute(() -> {
                order.add(n);
                threads.add(Thread.currentThread().getName());
                done.countDown();
            });
        }

        assertTrue(done.await(5, TimeUnit.SECONDS));
        for (int i = 0; i < 50; i++) {
            assertEquals(i, order.get(i));
        }
        assertTrue(threads.stream().allMatch("lintmux-loop"::equals));
    }

    @Test
    void survivesFailingTasks() throws Exception {
        var done = new CountDownLatch(1);
        loop.execute(() -> {
            throw new IllegalStateException("task bug");
        });
        loop.execute(done::countDown);

        assertTrue(done.await(5, TimeUnit.SECONDS));
    }

    @Test
    void submitExposesTheOperationResult() {
        assertEquals("ok", loop.submit(() -> CompletableFuture.completedFuture("ok")).join());

        var error = assertThrows(CompletionException.class, () -> loop.<String>submit(() -> {
            throw new IllegalArgumentException("bad");
        }).join());
        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }
}
