package io.csvchange.retry;

import java.io.IOException;

public final class Retries {
    private Retries() {}

    @FunctionalInterface
    public interface IoCall<T> {
        T call() throws IOException;
    }

    /**
     * Runs {@code call} until it succeeds or {@code policy} gives up; the last failure is rethrown.
     */
    public static <T> T withRetry(RetryPolicy policy, IoCall<T> call) throws IOException {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return call.call();
            } catch (IOException e) {
                if (!policy.shouldRetry(attempt, e)) throw e;
                try {
                    Thread.sleep(policy.backoffMillis(attempt));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }
}
