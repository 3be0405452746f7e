package com.yerin.bookpipe.application.stage;

import com.yerin.bookpipe.application.ArtifactKeys;
import com.yerin.bookpipe.application.PipelineStage;
import com.yerin.bookpipe.application.StageContext;
import com.yerin.bookpipe.domain.ObjectStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Copies the packaged document to its final, stable location.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PublishStage implements PipelineStage {

    private final ObjectStore objectStore;

    @Override
    public String name() {
        return "publish";
    }

    @Override
    public String execute(String inputRef, StageContext context) {
        String baseName = context.productCode() != null ? context.productCode() : context.jobId();
        String outputKey = ArtifactKeys.outputKey(context.jobId(), baseName);
        objectStore.copy(inputRef, outputKey);
        log.info("[Stage.publish] jobId={}, output={}", context.jobId(), outputKey);
        return outputKey;
    }
}
