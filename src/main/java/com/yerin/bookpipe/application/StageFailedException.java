package com.yerin.bookpipe.application;

import lombok.Getter;

@Getter
public class StageFailedException extends RuntimeException {

    private final String stage;

    public StageFailedException(String stage, String message) {
        super(message);
        this.stage = stage;
    }

    public StageFailedException(String stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }
}
