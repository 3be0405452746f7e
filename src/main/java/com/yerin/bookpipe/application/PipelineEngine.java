package com.yerin.bookpipe.application;

import com.yerin.bookpipe.config.BookpipeProperties;
import com.yerin.bookpipe.domain.BookpipeMetrics;
import com.yerin.bookpipe.domain.JobRecord;
import com.yerin.bookpipe.domain.JobStateStore;
import com.yerin.bookpipe.domain.JobStatus;
import com.yerin.bookpipe.domain.Lease;
import com.yerin.bookpipe.domain.LeaseGuard;
import com.yerin.bookpipe.global.exception.AppException;
import com.yerin.bookpipe.global.exception.JobNotEligibleException;
import com.yerin.bookpipe.global.exception.LeaseHeldException;
import com.yerin.bookpipe.global.exception.StaleStateException;
import com.yerin.bookpipe.infra.Backoff;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives one leased job through the configured stages, starting at its persisted
 * {@code stageIndex}. Every stage boundary is written back before the next stage starts,
 * so a crashed worker's successor resumes at the first incomplete stage.
 */
@Slf4j
@Component
public class PipelineEngine {

    public enum Outcome { SUCCEEDED, RETRY_SCHEDULED, FAILED, ABANDONED, LEASE_LOST }

    private final JobStateStore stateStore;
    private final StageRegistry registry;
    private final AsyncTaskExecutor stageExecutor;
    private final BookpipeMetrics metrics;
    private final BookpipeProperties properties;
    private final Clock clock;

    public PipelineEngine(JobStateStore stateStore,
                          StageRegistry registry,
                          @Qualifier("stageExecutor") AsyncTaskExecutor stageExecutor,
                          BookpipeMetrics metrics,
                          BookpipeProperties properties,
                          Clock clock) {
        this.stateStore = stateStore;
        this.registry = registry;
        this.stageExecutor = stageExecutor;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @param job   a record already moved to {@code running} under {@code owner}'s lease
     * @param owner the worker holding the lease
     */
    public Outcome run(JobRecord job, String owner) {
        LeaseGuard guard = LeaseGuard.heldBy(owner);
        Duration leaseTtl = properties.getWorker().getLeaseTtl();
        JobRecord current = job;

        try {
            while (current.stageIndex() < registry.size()) {
                int index = current.stageIndex();
                PipelineStage stage = registry.get(index);

                // 스테이지마다 리스 연장 후 진입 지점 기록
                Lease lease = stateStore.acquireLease(current.id(), owner, leaseTtl);
                JobRecord entering = current.enterStage(index, stage.name(), lease, clock.instant());
                stateStore.compareAndSwapStatus(current.id(), JobStatus.RUNNING, entering, guard);
                current = entering;

                String output;
                long start = System.nanoTime();
                Future<String> future = null;
                try {
                    StageContext context = StageContext.of(current, index, stage.name());
                    String inputRef = current.intermediateRef();
                    future = stageExecutor.submit(() -> stage.execute(inputRef, context));
                    output = future.get(properties.getWorker().getStageTimeout().toMillis(), TimeUnit.MILLISECONDS);
                } catch (TimeoutException te) {
                    future.cancel(true);
                    log.warn("[Pipeline] stage timed out, abandoning jobId={}, stage={}, timeout={}",
                            current.id(), stage.name(), properties.getWorker().getStageTimeout());
                    return Outcome.ABANDONED;
                } catch (InterruptedException ie) {
                    if (future != null) {
                        future.cancel(true);
                    }
                    Thread.currentThread().interrupt();
                    log.warn("[Pipeline] worker interrupted, abandoning jobId={}, stage={}", current.id(), stage.name());
                    return Outcome.ABANDONED;
                } catch (ExecutionException ee) {
                    Throwable cause = ee.getCause() != null ? ee.getCause() : ee;
                    return handleStageFailure(current, stage, cause, owner);
                } catch (RuntimeException re) {
                    // executor rejected the stage
                    return handleStageFailure(current, stage, re, owner);
                } finally {
                    metrics.stageTimer(stage.name()).record(Duration.ofNanos(System.nanoTime() - start));
                }

                if (output == null || output.isBlank()) {
                    return handleStageFailure(current, stage,
                            new StageFailedException(stage.name(), "stage produced no artifact"), owner);
                }

                JobRecord completed = current.completeStage(output, registry.nameAt(index + 1), clock.instant());
                stateStore.compareAndSwapStatus(current.id(), JobStatus.RUNNING, completed, guard);
                current = completed;
                log.info("[Pipeline] stage done jobId={}, stage={}, artifact={}", current.id(), stage.name(), output);
            }

            JobRecord succeeded = current.succeed(clock.instant());
            stateStore.compareAndSwapStatus(current.id(), JobStatus.RUNNING, succeeded, guard);
            stateStore.releaseLease(current.id(), owner);
            metrics.incSucceeded();
            log.info("[Pipeline] SUCCEEDED jobId={}, output={}", current.id(), succeeded.outputRef());
            return Outcome.SUCCEEDED;
        } catch (StaleStateException | LeaseHeldException | JobNotEligibleException lost) {
            log.warn("[Pipeline] lease lost, stopping jobId={}, owner={}, cause={}", current.id(), owner, lost.getMessage());
            return Outcome.LEASE_LOST;
        }
    }

    private Outcome handleStageFailure(JobRecord current, PipelineStage stage, Throwable cause, String owner) {
        Instant now = clock.instant();
        int attempts = current.attemptCount() + 1;
        int maxAttempts = properties.getPipeline().maxAttemptsFor(stage.name());
        String message = describe(cause);

        if (attempts >= maxAttempts) {
            String error = "stage '" + stage.name() + "' failed after " + attempts + " attempt(s): " + message;
            stateStore.compareAndSwapStatus(current.id(), JobStatus.RUNNING,
                    current.fail(attempts, error, now), LeaseGuard.heldBy(owner));
            stateStore.releaseLease(current.id(), owner);
            metrics.incFailed();
            log.warn("[Pipeline] FAILED jobId={}, stage={}, attempts={}, err={}", current.id(), stage.name(), attempts, message);
            return Outcome.FAILED;
        }

        BookpipeProperties.Retry retry = properties.getRetry();
        Duration wait = Backoff.expJitter(attempts - 1, retry.getBaseBackoff(), retry.getBackoffCap(), retry.getJitterRatio());
        stateStore.compareAndSwapStatus(current.id(), JobStatus.RUNNING,
                current.requeue(attempts, now.plus(wait), now), LeaseGuard.heldBy(owner));
        stateStore.releaseLease(current.id(), owner);
        metrics.incRetried();
        log.info("[Pipeline] reserved retry jobId={}, stage={}, attempt={}/{}, after {} ms, err={}",
                current.id(), stage.name(), attempts, maxAttempts, wait.toMillis(), message);
        return Outcome.RETRY_SCHEDULED;
    }

    private static String describe(Throwable cause) {
        if (cause instanceof AppException app) {
            return app.getErrorCode().getCode() + " " + app.getMessage();
        }
        String msg = cause.getMessage();
        return msg == null || msg.isBlank() ? cause.getClass().getSimpleName() : msg;
    }
}
