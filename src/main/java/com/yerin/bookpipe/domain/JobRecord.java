package com.yerin.bookpipe.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;

/**
 * Authoritative description of one submitted book and its progress through the pipeline.
 * Instances are immutable; every transition produces a new record that is written back
 * through {@link JobStateStore#compareAndSwapStatus}.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobRecord(
        String id,
        JobStatus status,
        int stageIndex,
        String stageName,
        String inputRef,
        String intermediateRef,
        String outputRef,
        String error,
        int attemptCount,
        Instant createdAt,
        Instant updatedAt,
        Instant nextAttemptAt,
        String leaseOwner,
        Instant leaseExpiresAt,
        String fileName,
        String productCode,
        String contentType,
        long sizeBytes,
        String checksum
) {

    public static JobRecord queued(String id, String inputRef, String fileName, String productCode,
                                   String contentType, long sizeBytes, String firstStage, Instant now) {
        return JobRecord.builder()
                .id(id)
                .status(JobStatus.QUEUED)
                .stageIndex(0)
                .stageName(firstStage)
                .inputRef(inputRef)
                .intermediateRef(inputRef)
                .attemptCount(0)
                .createdAt(now)
                .updatedAt(now)
                .nextAttemptAt(now)
                .fileName(fileName)
                .productCode(productCode)
                .contentType(contentType)
                .sizeBytes(sizeBytes)
                .build();
    }

    public boolean isDue(Instant now) {
        return nextAttemptAt == null || !nextAttemptAt.isAfter(now);
    }

    public JobRecord startRunning(Lease lease, Instant now) {
        return toBuilder()
                .status(JobStatus.RUNNING)
                .leaseOwner(lease.owner())
                .leaseExpiresAt(lease.expiresAt())
                .updatedAt(now)
                .build();
    }

    public JobRecord enterStage(int index, String name, Lease lease, Instant now) {
        return toBuilder()
                .stageIndex(index)
                .stageName(name)
                .leaseOwner(lease.owner())
                .leaseExpiresAt(lease.expiresAt())
                .updatedAt(now)
                .build();
    }

    /** Stage boundary: the next stage starts with a clean attempt counter. */
    public JobRecord completeStage(String artifactRef, String nextStageName, Instant now) {
        return toBuilder()
                .stageIndex(stageIndex + 1)
                .stageName(nextStageName)
                .intermediateRef(artifactRef)
                .attemptCount(0)
                .updatedAt(now)
                .build();
    }

    public JobRecord withChecksum(String sha256) {
        return toBuilder().checksum(sha256).build();
    }

    public JobRecord requeue(int attempts, Instant nextAttemptAt, Instant now) {
        return toBuilder()
                .status(JobStatus.QUEUED)
                .attemptCount(attempts)
                .nextAttemptAt(nextAttemptAt)
                .leaseOwner(null)
                .leaseExpiresAt(null)
                .updatedAt(now)
                .build();
    }

    public JobRecord fail(int attempts, String message, Instant now) {
        return toBuilder()
                .status(JobStatus.FAILED)
                .attemptCount(attempts)
                .error(message)
                .outputRef(null)
                .leaseOwner(null)
                .leaseExpiresAt(null)
                .updatedAt(now)
                .build();
    }

    public JobRecord succeed(Instant now) {
        return toBuilder()
                .status(JobStatus.SUCCEEDED)
                .outputRef(intermediateRef)
                .stageName(null)
                .error(null)
                .leaseOwner(null)
                .leaseExpiresAt(null)
                .updatedAt(now)
                .build();
    }

    public JobRecord cancel(Instant now) {
        return toBuilder()
                .status(JobStatus.CANCELLED)
                .updatedAt(now)
                .build();
    }
}
