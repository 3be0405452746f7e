package com.yerin.bookpipe.infra;

import com.yerin.bookpipe.config.BookpipeProperties;
import com.yerin.bookpipe.domain.BookpipeMetrics;
import com.yerin.bookpipe.domain.JobRecord;
import com.yerin.bookpipe.domain.JobStateStore;
import com.yerin.bookpipe.domain.JobStatus;
import com.yerin.bookpipe.domain.LeaseGuard;
import com.yerin.bookpipe.global.exception.JobNotFoundException;
import com.yerin.bookpipe.global.exception.LeaseHeldException;
import com.yerin.bookpipe.global.exception.StaleStateException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Returns running jobs whose lease has expired to the queue, or fails them once the
 * stage has used up its attempts.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LeaseReaper {

    private final JobStateStore stateStore;
    private final BookpipeMetrics metrics;
    private final BookpipeProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${bookpipe.worker.reaper-interval-millis:2000}")
    public void scheduledReap() {
        if (!properties.getWorker().isEnabled()) return;
        try {
            reap();
        } catch (Exception e) {
            log.warn("[LeaseReaper] sweep failed: {}", e.toString());
        }
    }

    /** @return number of jobs reclaimed or failed */
    public int reap() {
        Instant now = clock.instant();
        List<String> expired = stateStore.expiredRunning(now, properties.getWorker().getReaperBatchSize());
        if (expired.isEmpty()) return 0;

        int handled = 0;
        for (String id : expired) {
            try {
                if (reclaim(id, now)) handled++;
            } catch (LeaseHeldException e) {
                log.debug("[LeaseReaper] lease renewed, skip jobId={}", id);
            } catch (StaleStateException | JobNotFoundException e) {
                log.debug("[LeaseReaper] state moved on, skip jobId={}, cause={}", id, e.getMessage());
            } catch (Exception e) {
                log.warn("[LeaseReaper] failed to revert jobId={}, err={}", id, e.toString());
            }
        }
        log.info("[LeaseReaper] reaped={} of expired={}", handled, expired.size());
        return handled;
    }

    private boolean reclaim(String id, Instant now) {
        if (stateStore.hasLiveLease(id)) {
            log.debug("[LeaseReaper] lease still live, skip jobId={}", id);
            return false;
        }
        JobRecord job = stateStore.get(id);
        if (job.status() != JobStatus.RUNNING) return false;

        int attempts = job.attemptCount() + 1;
        int maxAttempts = properties.getPipeline().maxAttemptsFor(job.stageName());

        if (attempts >= maxAttempts) {
            String error = "stage '" + job.stageName() + "' abandoned after " + attempts + " attempt(s): lease expired";
            stateStore.compareAndSwapStatus(id, JobStatus.RUNNING, job.fail(attempts, error, now), LeaseGuard.none());
            metrics.incFailed();
            log.warn("[LeaseReaper] FAILED jobId={}, stage={}, attempts={}", id, job.stageName(), attempts);
            return true;
        }

        BookpipeProperties.Retry retry = properties.getRetry();
        Duration wait = Backoff.expJitter(attempts - 1, retry.getBaseBackoff(), retry.getBackoffCap(), retry.getJitterRatio());
        stateStore.compareAndSwapStatus(id, JobStatus.RUNNING, job.requeue(attempts, now.plus(wait), now), LeaseGuard.none());
        metrics.incReclaimed();
        log.info("[LeaseReaper] RUNNING->QUEUED jobId={}, stage={}, attempt={}/{}, after {} ms",
                id, job.stageName(), attempts, maxAttempts, wait.toMillis());
        return true;
    }
}
