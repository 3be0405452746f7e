package com.yerin.bookpipe.application.stage;

import com.yerin.bookpipe.application.PipelineStage;
import com.yerin.bookpipe.application.StageContext;
import com.yerin.bookpipe.application.StageFailedException;
import com.yerin.bookpipe.application.TextNormalizingConverter;
import com.yerin.bookpipe.domain.ObjectStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ValidateStage implements PipelineStage {

    private final ObjectStore objectStore;

    @Override
    public String name() {
        return "validate";
    }

    @Override
    public String execute(String inputRef, StageContext context) {
        byte[] content = objectStore.get(inputRef);
        String text = TextNormalizingConverter.decodeUtf8(content, name());
        if (text.isBlank()) {
            throw new StageFailedException(name(), "converted output is blank");
        }
        return inputRef;
    }
}
