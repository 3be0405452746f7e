package com.yerin.bookpipe.global.exception;

import com.yerin.bookpipe.global.exception.code.BookErrorCode;

public class JobNotEligibleException extends AppException {

    public JobNotEligibleException(String jobId) {
        super(BookErrorCode.JOB_NOT_ELIGIBLE.withDetail("리스를 획득할 수 없는 상태의 작업입니다. jobId=" + jobId));
    }
}
