package com.yerin.bookpipe.global.exception;

import com.yerin.bookpipe.global.exception.code.BookErrorCode;

public class AlreadyExistsException extends AppException {

    public AlreadyExistsException(String jobId) {
        super(BookErrorCode.JOB_ALREADY_EXISTS.withDetail("이미 존재하는 작업 ID입니다. jobId=" + jobId));
    }
}
