package com.yerin.bookpipe.global.exception;

import com.yerin.bookpipe.global.exception.code.BookErrorCode;

public class JobNotFoundException extends AppException {

    public JobNotFoundException(String jobId) {
        super(BookErrorCode.JOB_NOT_FOUND.withDetail("작업을 찾을 수 없습니다. jobId=" + jobId));
    }
}
