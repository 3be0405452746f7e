package com.yerin.bookpipe.application;

import com.yerin.bookpipe.config.BookpipeProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Resolves the configured stage order against the available {@link PipelineStage} beans.
 */
@Component
public class StageRegistry {
    private final List<PipelineStage> ordered;

    public StageRegistry(List<PipelineStage> stages, BookpipeProperties properties) {
        Map<String, PipelineStage> byName = stages.stream()
                .collect(Collectors.toMap(PipelineStage::name, s -> s));
        this.ordered = properties.getPipeline().getStages().stream()
                .map(String::trim)
                .map(name -> {
                    PipelineStage stage = byName.get(name);
                    if (stage == null) {
                        throw new IllegalStateException("unknown pipeline stage: " + name + ", available=" + byName.keySet());
                    }
                    return stage;
                })
                .toList();
    }

    public List<PipelineStage> stages() { return ordered; }

    public int size() { return ordered.size(); }

    public PipelineStage get(int index) { return ordered.get(index); }

    public String nameAt(int index) {
        return index < ordered.size() ? ordered.get(index).name() : null;
    }
}
