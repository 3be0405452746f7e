package com.yerin.bookpipe.infra;

import com.yerin.bookpipe.application.PipelineEngine;
import com.yerin.bookpipe.config.BookpipeProperties;
import com.yerin.bookpipe.domain.JobRecord;
import com.yerin.bookpipe.domain.JobStateStore;
import com.yerin.bookpipe.domain.JobStatus;
import com.yerin.bookpipe.domain.Lease;
import com.yerin.bookpipe.domain.LeaseGuard;
import com.yerin.bookpipe.global.exception.JobNotEligibleException;
import com.yerin.bookpipe.global.exception.JobNotFoundException;
import com.yerin.bookpipe.global.exception.LeaseHeldException;
import com.yerin.bookpipe.global.exception.StaleStateException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.DependsOn;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Slf4j
@Component
@RequiredArgsConstructor
@DependsOn("bootstrapVerifier")
public class WorkerRunner {

    private final JobStateStore stateStore;
    private final PipelineEngine engine;
    private final BookpipeProperties properties;
    private final Clock clock;

    private ExecutorService workers;

    @PostConstruct
    void startWorkers() {
        BookpipeProperties.Worker config = properties.getWorker();
        if (!config.isEnabled()) {
            log.info("[Worker] disabled by bookpipe.worker.enabled=false");
            return;
        }

        int concurrency = config.getConcurrency();
        String base = WorkerId.consumerName();
        workers = Executors.newFixedThreadPool(concurrency);
        for (int i = 0; i < concurrency; i++) {
            final String owner = base + "-" + i;
            workers.submit(() -> {
                while (!Thread.currentThread().isInterrupted()) {
                    try {
                        if (!pollOnce(owner)) {
                            Thread.sleep(config.getPollInterval().toMillis());
                        }
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                    } catch (Exception e) {
                        log.warn("[Worker] poll loop error owner={}: {}", owner, e.toString());
                        try { Thread.sleep(config.getPollInterval().toMillis()); } catch (InterruptedException ignored) {
                            Thread.currentThread().interrupt();
                        }
                    }
                }
            });
        }
        log.info("[Worker] started {} workers, stages={}", concurrency, properties.getPipeline().getStages());
    }

    @PreDestroy
    void stopWorkers() {
        if (workers != null) {
            workers.shutdownNow();
        }
    }

    /**
     * Claims the oldest due queued job and runs it to its next resting state.
     *
     * @return {@code true} if a job was claimed
     */
    public boolean pollOnce(String owner) {
        List<String> candidates = stateStore.dueCandidates(clock.instant(), properties.getWorker().getBatchSize());
        if (candidates.isEmpty()) return false;

        for (String id : candidates) {
            Instant now = clock.instant();
            JobRecord job;
            try {
                job = stateStore.get(id);
            } catch (JobNotFoundException e) {
                continue;
            }
            if (job.status() != JobStatus.QUEUED) continue;
            if (!job.isDue(now)) {
                log.debug("[Worker] skip(not-due) jobId={}, nextAttemptAt={}", id, job.nextAttemptAt());
                continue;
            }

            Lease lease;
            try {
                lease = stateStore.acquireLease(id, owner, properties.getWorker().getLeaseTtl());
            } catch (LeaseHeldException | JobNotEligibleException | JobNotFoundException e) {
                log.debug("[Worker] lost race jobId={}, owner={}, cause={}", id, owner, e.getMessage());
                continue;
            }

            JobRecord running = job.startRunning(lease, clock.instant());
            try {
                stateStore.compareAndSwapStatus(id, JobStatus.QUEUED, running, LeaseGuard.heldBy(owner));
            } catch (StaleStateException e) {
                stateStore.releaseLease(id, owner);
                log.debug("[Worker] claim lost jobId={}, owner={}, cause={}", id, owner, e.getMessage());
                continue;
            }

            log.info("[Worker] claimed jobId={}, owner={}, stage={}, attempt={}",
                    id, owner, running.stageName(), running.attemptCount() + 1);
            PipelineEngine.Outcome outcome = engine.run(running, owner);
            log.info("[Worker] jobId={} -> {}", id, outcome);
            return true;
        }
        return false;
    }
}
