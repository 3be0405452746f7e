package com.yerin.bookpipe.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Single source of truth for job records and leases.
 * <p>
 * Every status change goes through {@link #compareAndSwapStatus}; implementations must make the
 * status check, the lease check and the write one atomic step.
 */
public interface JobStateStore {

    /** @throws com.yerin.bookpipe.global.exception.AlreadyExistsException if the id is taken */
    void create(JobRecord record);

    /** @throws com.yerin.bookpipe.global.exception.JobNotFoundException if absent */
    JobRecord get(String id);

    /**
     * @throws com.yerin.bookpipe.global.exception.StaleStateException  stored status differs, or the guarded lease was lost
     * @throws com.yerin.bookpipe.global.exception.LeaseHeldException   guard is none but a live lease exists
     * @throws com.yerin.bookpipe.global.exception.InvalidTransitionException transition not allowed by the state machine
     * @throws com.yerin.bookpipe.global.exception.JobNotFoundException if absent
     */
    void compareAndSwapStatus(String id, JobStatus expectedStatus, JobRecord next, LeaseGuard guard);

    /**
     * Acquires or, for the same owner, extends the lease.
     *
     * @throws com.yerin.bookpipe.global.exception.LeaseHeldException     another owner holds a live lease
     * @throws com.yerin.bookpipe.global.exception.JobNotEligibleException job is terminal, or running without a live lease
     * @throws com.yerin.bookpipe.global.exception.JobNotFoundException   if absent
     */
    Lease acquireLease(String id, String owner, Duration ttl);

    void releaseLease(String id, String owner);

    boolean hasLiveLease(String id);

    /** Queued job ids, oldest {@code createdAt} first, ties by id. */
    List<String> queuedCandidates(int limit);

    /**
     * Queued job ids whose {@code nextAttemptAt} is at or before {@code now}, in the same FIFO order.
     * Jobs still backing off are passed over, so they never hide due jobs queued behind them.
     */
    List<String> dueCandidates(Instant now, int limit);

    /** Running job ids whose recorded lease expiry is at or before {@code now}. */
    List<String> expiredRunning(Instant now, int limit);

    boolean ping();
}
