package com.yerin.bookpipe.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.yerin.bookpipe.domain.JobRecord;
import com.yerin.bookpipe.domain.JobStatus;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
        String id,
        JobStatus status,
        Integer stageIndex,
        String stageName,
        Integer attemptCount,
        String error,
        String fileName,
        String productCode,
        Long sizeBytes,
        String outputRef,
        Instant nextAttemptAt,
        Instant createdAt,
        Instant updatedAt
) {
    public static JobStatusResponse from(JobRecord r) {
        return new JobStatusResponse(
                r.id(),
                r.status(),
                r.stageIndex(),
                r.stageName(),
                r.attemptCount(),
                r.error(),
                r.fileName(),
                r.productCode(),
                r.sizeBytes(),
                r.outputRef(),
                r.nextAttemptAt(),
                r.createdAt(),
                r.updatedAt()
        );
    }
}
