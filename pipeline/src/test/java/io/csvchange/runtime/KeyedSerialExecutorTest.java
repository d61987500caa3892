package io.csvchange.runtime;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

public class KeyedSerialExecutorTest {
    private final KeyedSerialExecutor<String> executor = new KeyedSerialExecutor<>(Executors.newFixedThreadPool(4));

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    void same_key_runs_one_task_at_a_time_in_submission_order() throws Exception {
        CountDownLatch firstStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean secondRan = new AtomicBoolean();
        List<Integer> order = new CopyOnWriteArrayList<>();

        CompletableFuture<Integer> first = executor.submit("stores.csv", () -> {
            firstStarted.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            order.add(1);
            return 1;
        });
        CompletableFuture<Integer> second = executor.submit("stores.csv", () -> {
            secondRan.set(true);
            order.add(2);
            return 2;
        });

        assertTrue(firstStarted.await(5, TimeUnit.SECONDS));
        Thread.sleep(100);
        assertFalse(secondRan.get());
        release.countDown();

        assertEquals(2, second.get(5, TimeUnit.SECONDS));
        assertEquals(1, first.get());
        assertEquals(List.of(1, 2), order);
    }

    @Test
    void different_keys_run_in_parallel() throws Exception {
        CountDownLatch bRunning = new CountDownLatch(1);
        CompletableFuture<Boolean> a = executor.submit("a.csv", () -> bRunning.await(5, TimeUnit.SECONDS));
        CompletableFuture<Boolean> b = executor.submit("b.csv", () -> {
            bRunning.countDown();
            return true;
        });
        assertTrue(a.get(10, TimeUnit.SECONDS));
        assertTrue(b.get(10, TimeUnit.SECONDS));
    }

    @Test
    void failed_task_does_not_block_the_next_one() throws Exception {
        CompletableFuture<String> failing = executor.submit("k", () -> {
            throw new IOException("disk gone");
        });
        CompletableFuture<String> next = executor.submit("k", () -> "ok");

        ExecutionException e = assertThrows(ExecutionException.class, () -> failing.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IOException.class, e.getCause());
        assertEquals("ok", next.get(5, TimeUnit.SECONDS));
    }

    @Test
    void finished_keys_are_forgotten() throws Exception {
        executor.submit("k", () -> 1).get(5, TimeUnit.SECONDS);
        long deadline = System.currentTimeMillis() + 5_000;
        while (executor.activeKeys() > 0 && System.currentTimeMillis() < deadline) Thread.sleep(10);
        assertEquals(0, executor.activeKeys());
    }
}
