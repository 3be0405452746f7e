package com.yerin.bookpipe.global.exception;

import com.yerin.bookpipe.global.exception.code.BookErrorCode;

public class DependencyUnavailableException extends AppException {

    public DependencyUnavailableException(String dependency, Throwable cause) {
        super(BookErrorCode.DEPENDENCY_UNAVAILABLE.withDetail(dependency + " 에 연결할 수 없습니다."), cause);
    }
}
