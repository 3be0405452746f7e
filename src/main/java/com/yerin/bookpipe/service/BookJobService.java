package com.yerin.bookpipe.service;

import com.yerin.bookpipe.application.ArtifactKeys;
import com.yerin.bookpipe.application.ProductCodes;
import com.yerin.bookpipe.application.StageRegistry;
import com.yerin.bookpipe.config.BookpipeProperties;
import com.yerin.bookpipe.domain.BookpipeMetrics;
import com.yerin.bookpipe.domain.JobRecord;
import com.yerin.bookpipe.domain.JobStateStore;
import com.yerin.bookpipe.domain.JobStatus;
import com.yerin.bookpipe.domain.LeaseGuard;
import com.yerin.bookpipe.domain.ObjectStore;
import com.yerin.bookpipe.dto.response.JobResultResponse;
import com.yerin.bookpipe.global.exception.AppException;
import com.yerin.bookpipe.global.exception.InvalidTransitionException;
import com.yerin.bookpipe.global.exception.LeaseHeldException;
import com.yerin.bookpipe.global.exception.StaleStateException;
import com.yerin.bookpipe.global.exception.code.BookErrorCode;
import com.yerin.bookpipe.global.exception.code.CommonErrorCode;
import com.yerin.bookpipe.infra.SourceFetcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class BookJobService {
    private final JobStateStore stateStore;
    private final ObjectStore objectStore;
    private final SourceFetcher sourceFetcher;
    private final StageRegistry stageRegistry;
    private final BookpipeMetrics metrics;
    private final BookpipeProperties properties;
    private final Clock clock;

    /**
     * Stores the upload and creates a queued job for it.
     *
     * @param productCode explicit product code; when absent it is taken from the file name
     * @return the new job id
     */
    public String submit(byte[] content, String fileName, String productCode, String contentType) {
        if (content == null || content.length == 0) {
            throw new AppException(BookErrorCode.EMPTY_INPUT);
        }
        long maxBytes = properties.getGateway().getMaxInputSize().toBytes();
        if (content.length > maxBytes) {
            throw new AppException(BookErrorCode.INPUT_TOO_LARGE
                    .withDetail("업로드 가능한 최대 크기를 초과했습니다. max=" + maxBytes + " bytes"));
        }
        String code = resolveProductCode(productCode, fileName);

        String jobId = UUID.randomUUID().toString();
        String inputKey = ArtifactKeys.inputKey(jobId, fileName);
        objectStore.put(inputKey, content, contentType);

        Instant now = clock.instant();
        JobRecord record = JobRecord.queued(jobId, inputKey, fileName, code, contentType, content.length,
                        stageRegistry.nameAt(0), now)
                .withChecksum(Checksums.sha256Hex(content));
        try {
            stateStore.create(record);
        } catch (RuntimeException e) {
            discardInput(inputKey, e);
            throw e;
        }

        metrics.incSubmitted();
        log.info("[Gateway] submitted jobId={}, file={}, productCode={}, bytes={}", jobId, fileName, code, content.length);
        return jobId;
    }

    /**
     * Downloads the source and submits it like an upload. The explicit file name wins over
     * the last segment of the URL path.
     */
    public String submitFromUrl(String sourceUrl, String fileName, String productCode) {
        SourceFetcher.FetchedSource source = sourceFetcher.fetch(sourceUrl);
        String name = fileName != null && !fileName.isBlank() ? fileName.trim() : source.fileName();
        log.info("[Gateway] submitting from url={}, file={}", sourceUrl, name);
        return submit(source.content(), name, productCode, source.contentType());
    }

    public JobRecord getStatus(String jobId) {
        return stateStore.get(jobId);
    }

    public JobResultResponse getResult(String jobId) {
        JobRecord job = requireSucceeded(jobId);
        return new JobResultResponse(job.id(), job.outputRef(), objectStore.size(job.outputRef()));
    }

    public byte[] readResultContent(String jobId) {
        JobRecord job = requireSucceeded(jobId);
        return objectStore.get(job.outputRef());
    }

    /** Only a queued job that no worker has leased can be cancelled. */
    public JobRecord cancel(String jobId) {
        JobRecord job = stateStore.get(jobId);
        if (job.status() != JobStatus.QUEUED) {
            throw new AppException(BookErrorCode.CANCEL_CONFLICT
                    .withDetail("대기 중인 작업만 취소할 수 있습니다. status=" + job.status().code()));
        }

        JobRecord cancelled = job.cancel(clock.instant());
        try {
            stateStore.compareAndSwapStatus(jobId, JobStatus.QUEUED, cancelled, LeaseGuard.none());
        } catch (LeaseHeldException e) {
            throw new AppException(BookErrorCode.CANCEL_CONFLICT.withDetail("워커가 작업을 점유 중입니다. jobId=" + jobId), e);
        } catch (StaleStateException | InvalidTransitionException e) {
            throw new AppException(BookErrorCode.CANCEL_CONFLICT.withDetail("작업 상태가 이미 변경되었습니다. jobId=" + jobId), e);
        }

        metrics.incCancelled();
        log.info("[Gateway] cancelled jobId={}", jobId);
        return cancelled;
    }

    private JobRecord requireSucceeded(String jobId) {
        JobRecord job = stateStore.get(jobId);
        switch (job.status()) {
            case SUCCEEDED -> {
                return job;
            }
            case FAILED -> throw new AppException(BookErrorCode.JOB_FAILED.withDetail(
                    job.error() == null ? BookErrorCode.JOB_FAILED.getMessage() : job.error()));
            case CANCELLED -> throw new AppException(BookErrorCode.JOB_CANCELLED);
            default -> throw new AppException(BookErrorCode.RESULT_NOT_READY.withDetail(
                    "작업이 아직 완료되지 않았습니다. status=" + job.status().code()));
        }
    }

    private static String resolveProductCode(String explicit, String fileName) {
        if (explicit != null && !explicit.isBlank()) {
            String trimmed = explicit.trim();
            if (!ProductCodes.isValid(trimmed)) {
                throw new AppException(CommonErrorCode.INVALID_PARAMETER
                        .withDetail("productCode 형식이 올바르지 않습니다. (예: 100227-01)"));
            }
            return trimmed;
        }
        return ProductCodes.fromFileName(fileName).orElse(null);
    }

    private void discardInput(String inputKey, RuntimeException cause) {
        try {
            objectStore.delete(inputKey);
        } catch (RuntimeException deleteError) {
            cause.addSuppressed(deleteError);
            log.warn("[Gateway] orphaned input left behind key={}, err={}", inputKey, deleteError.toString());
        }
    }
}
