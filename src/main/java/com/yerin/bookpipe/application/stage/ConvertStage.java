package com.yerin.bookpipe.application.stage;

import com.yerin.bookpipe.application.BookConverter;
import com.yerin.bookpipe.application.PipelineStage;
import com.yerin.bookpipe.application.StageContext;
import com.yerin.bookpipe.domain.ObjectStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

@Slf4j
@Component
@RequiredArgsConstructor
public class ConvertStage implements PipelineStage {

    private final ObjectStore objectStore;
    private final BookConverter converter;

    @Override
    public String name() {
        return "convert";
    }

    @Override
    public String execute(String inputRef, StageContext context) {
        byte[] source = objectStore.get(inputRef);
        String markdown = converter.convert(source, context);
        byte[] out = markdown.getBytes(StandardCharsets.UTF_8);

        String key = context.stageKey();
        objectStore.put(key, out, "text/markdown; charset=utf-8");
        log.info("[Stage.convert] jobId={}, in={}B, out={}B, key={}", context.jobId(), source.length, out.length, key);
        return key;
    }
}
