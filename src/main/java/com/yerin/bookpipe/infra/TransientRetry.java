package com.yerin.bookpipe.infra;

import com.yerin.bookpipe.config.BookpipeProperties;
import com.yerin.bookpipe.global.exception.DependencyUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Retries a dependency call on transient errors with exponential backoff. Non-transient errors
 * propagate unchanged; exhausted retries surface as {@link DependencyUnavailableException}.
 */
@Slf4j
public class TransientRetry {

    private final String dependency;
    private final int maxAttempts;
    private final Duration baseBackoff;
    private final Duration backoffCap;
    private final Predicate<Throwable> transientError;

    public TransientRetry(String dependency, BookpipeProperties.Client policy, Predicate<Throwable> transientError) {
        this.dependency = dependency;
        this.maxAttempts = Math.max(1, policy.getMaxAttempts());
        this.baseBackoff = policy.getBaseBackoff();
        this.backoffCap = policy.getBackoffCap();
        this.transientError = transientError;
    }

    public <T> T call(String operation, Supplier<T> call) {
        RuntimeException last = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                return call.get();
            } catch (RuntimeException e) {
                if (!transientError.test(e)) {
                    throw e;
                }
                last = e;
                if (attempt + 1 < maxAttempts) {
                    Duration wait = Backoff.expJitter(attempt, baseBackoff, backoffCap, 0.2);
                    log.warn("[{}] transient error op={}, attempt={}/{}, retryIn={}ms, err={}",
                            dependency, operation, attempt + 1, maxAttempts, wait.toMillis(), e.toString());
                    sleep(wait);
                }
            }
        }
        log.error("[{}] retries exhausted op={}, attempts={}", dependency, operation, maxAttempts);
        throw new DependencyUnavailableException(dependency, last);
    }

    public void run(String operation, Runnable call) {
        call(operation, () -> {
            call.run();
            return null;
        });
    }

    private void sleep(Duration wait) {
        try {
            Thread.sleep(wait.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new DependencyUnavailableException(dependency, ie);
        }
    }
}
