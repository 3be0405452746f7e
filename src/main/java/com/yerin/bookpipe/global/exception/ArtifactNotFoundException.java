package com.yerin.bookpipe.global.exception;

import com.yerin.bookpipe.global.exception.code.BookErrorCode;

public class ArtifactNotFoundException extends AppException {

    public ArtifactNotFoundException(String key) {
        super(BookErrorCode.ARTIFACT_NOT_FOUND.withDetail("결과물을 찾을 수 없습니다. key=" + key));
    }
}
