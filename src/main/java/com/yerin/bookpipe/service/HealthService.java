package com.yerin.bookpipe.service;

import com.yerin.bookpipe.config.BookpipeProperties;
import com.yerin.bookpipe.domain.JobStateStore;
import com.yerin.bookpipe.domain.ObjectStore;
import com.yerin.bookpipe.dto.response.HealthResponse;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Checks both stores in parallel on every call. Nothing is cached. Both checks share one
 * deadline, so a check never takes longer than {@code bookpipe.health.timeout}.
 */
@Slf4j
@Service
public class HealthService {

    private static final int MAX_CHECK_THREADS = 4;
    private static final int MAX_PENDING_CHECKS = 8;

    private final JobStateStore stateStore;
    private final ObjectStore objectStore;
    private final BookpipeProperties properties;
    private final ThreadPoolExecutor checks;

    public HealthService(JobStateStore stateStore, ObjectStore objectStore, BookpipeProperties properties) {
        this.stateStore = stateStore;
        this.objectStore = objectStore;
        this.properties = properties;

        AtomicInteger seq = new AtomicInteger();
        this.checks = new ThreadPoolExecutor(MAX_CHECK_THREADS, MAX_CHECK_THREADS, 30, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(MAX_PENDING_CHECKS), r -> {
            Thread t = new Thread(r, "health-check-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }, new ThreadPoolExecutor.AbortPolicy());
        this.checks.allowCoreThreadTimeOut(true);
    }

    public HealthResponse check() {
        long deadline = System.nanoTime() + properties.getHealth().getTimeout().toNanos();
        Future<Boolean> state = submit("stateStore", stateStore::ping);
        Future<Boolean> objects = submit("objectStore", objectStore::ping);

        Map<String, String> components = new LinkedHashMap<>();
        components.put("stateStore", await("stateStore", state, deadline));
        components.put("objectStore", await("objectStore", objects, deadline));

        boolean up = components.values().stream().allMatch("UP"::equals);
        return new HealthResponse(up ? "UP" : "DOWN", components);
    }

    int checkThreadCount() {
        return checks.getPoolSize();
    }

    @PreDestroy
    void shutdown() {
        checks.shutdownNow();
    }

    private Future<Boolean> submit(String name, BooleanSupplier ping) {
        try {
            return checks.submit(() -> {
                try {
                    return ping.getAsBoolean();
                } catch (RuntimeException e) {
                    log.warn("[Health] {} check threw: {}", name, e.toString());
                    return false;
                }
            });
        } catch (RejectedExecutionException e) {
            // earlier checks are still hanging on this dependency
            log.warn("[Health] {} check rejected, check pool saturated", name);
            return null;
        }
    }

    private String await(String name, Future<Boolean> future, long deadlineNanos) {
        if (future == null) {
            return "DOWN";
        }
        long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
        try {
            return Boolean.TRUE.equals(future.get(remaining, TimeUnit.NANOSECONDS)) ? "UP" : "DOWN";
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Health] {} check timed out after {}", name, properties.getHealth().getTimeout());
            return "DOWN";
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return "DOWN";
        } catch (ExecutionException e) {
            log.warn("[Health] {} check failed: {}", name, e.getCause() == null ? e.toString() : e.getCause().toString());
            return "DOWN";
        }
    }
}
