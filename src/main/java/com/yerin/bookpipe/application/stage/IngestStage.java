package com.yerin.bookpipe.application.stage;

import com.yerin.bookpipe.application.PipelineStage;
import com.yerin.bookpipe.application.StageContext;
import com.yerin.bookpipe.application.StageFailedException;
import com.yerin.bookpipe.domain.ObjectStore;
import com.yerin.bookpipe.service.Checksums;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Confirms the uploaded object is readable, non-empty and matches the checksum taken at submission.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IngestStage implements PipelineStage {

    private final ObjectStore objectStore;

    @Override
    public String name() {
        return "ingest";
    }

    @Override
    public String execute(String inputRef, StageContext context) {
        byte[] content = objectStore.get(inputRef);
        if (content.length == 0) {
            throw new StageFailedException(name(), "input artifact is empty: " + inputRef);
        }
        String actual = Checksums.sha256Hex(content);
        if (context.checksum() != null && !context.checksum().equals(actual)) {
            throw new StageFailedException(name(),
                    "checksum mismatch for " + inputRef + ": expected=" + context.checksum() + ", actual=" + actual);
        }
        log.info("[Stage.ingest] jobId={}, bytes={}, sha256={}", context.jobId(), content.length, actual);
        return inputRef;
    }
}
