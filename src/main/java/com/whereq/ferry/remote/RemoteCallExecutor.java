package com.whereq.ferry.remote;

import com.whereq.ferry.exception.RemoteCallExhaustedException;
import com.whereq.ferry.model.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Runs remote requests with bounded retries and exponential backoff.
 * Every call to a Google API goes through here.
 */
@Slf4j
public class RemoteCallExecutor {

    /**
     * Blocks the calling thread between attempts
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final RetryPolicy policy;
    private final Predicate<Throwable> retryable;
    private final Sleeper sleeper;

    public RemoteCallExecutor(RetryPolicy policy, Predicate<Throwable> retryable) {
        this(policy, retryable, duration -> Thread.sleep(duration.toMillis()));
    }

    public RemoteCallExecutor(RetryPolicy policy, Predicate<Throwable> retryable, Sleeper sleeper) {
        this.policy = policy;
        this.retryable = retryable;
        this.sleeper = sleeper;
    }

    /**
     * Execute with the configured policy
     */
    public <T> T execute(RemoteRequest<T> request) {
        return execute(request, policy.getInitialDelay(), policy.getMaxAttempts());
    }

    /**
     * Execute the request up to {@code maxAttempts} times in total. The delay before
     * each retry starts at {@code initialDelay} and doubles after every failure.
     *
     * @param request remote request, executed again on every attempt
     * @param initialDelay sleep before the first retry
     * @param maxAttempts total executions, at least 1
     * @return result of the first successful execution
     * @throws RemoteCallExhaustedException when every attempt failed with a retryable error
     */
    public <T> T execute(RemoteRequest<T> request, Duration initialDelay, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }

        Duration delay = initialDelay;
        RuntimeException lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return request.execute();
            } catch (RuntimeException e) {
                if (!retryable.test(e)) {
                    throw e;
                }
                lastError = e;
                if (attempt == maxAttempts) {
                    break;
                }

                log.warn("Remote call failed (attempt {}/{}), retrying in {}ms: {}",
                    attempt, maxAttempts, delay.toMillis(), e.getMessage());
                pause(delay);
                delay = delay.multipliedBy(2);
            }
        }

        log.error("Remote call failed after {} attempts", maxAttempts);
        throw new RemoteCallExhaustedException(maxAttempts, lastError);
    }

    private void pause(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to retry a remote call", e);
        }
    }
}
