package io.csvchange.runtime;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs tasks one at a time per key and in parallel across keys.
 * <p>
 * Each submission is chained onto the previous task for the same key; a failed task does not block the
 * ones queued behind it.
 */
public class KeyedSerialExecutor<K> implements AutoCloseable {
    private final ExecutorService pool;
    private final Map<K, CompletableFuture<?>> tails = new ConcurrentHashMap<>();

    public KeyedSerialExecutor(ExecutorService pool) {
        this.pool = pool;
    }

    public ExecutorService pool() { return pool; }

    @SuppressWarnings("unchecked")
    public <T> CompletableFuture<T> submit(K key, Callable<T> task) {
        CompletableFuture<T>[] holder = new CompletableFuture[1];
        tails.compute(key, (k, tail) -> {
            CompletableFuture<?> prev = tail == null ? CompletableFuture.completedFuture(null) : tail;
            CompletableFuture<T> next = prev.handle((v, e) -> null)
                    .thenApplyAsync(ignored -> call(task), pool);
            holder[0] = next;
            return next;
        });
        CompletableFuture<T> f = holder[0];
        f.whenComplete((v, e) -> tails.remove(key, f));
        return f;
    }

    /** Keys with queued or running work. */
    public int activeKeys() { return tails.size(); }

    private static <T> T call(Callable<T> task) {
        try {
            return task.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CompletionException(e);
        }
    }

    /** Stops accepting work and waits up to {@code timeoutMillis} for running tasks to finish. */
    public void shutdown(long timeoutMillis) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) pool.shutdownNow();
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() { shutdown(10_000); }
}
