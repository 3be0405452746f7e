package com.yerin.bookpipe.application;

/**
 * One transformation step of the book pipeline: reads the artifact at {@code inputRef} and
 * returns the key of the artifact it produced (which may be the input itself).
 * Throwing any runtime exception marks the attempt as failed.
 */
public interface PipelineStage {
    String name();

    String execute(String inputRef, StageContext context);
}
