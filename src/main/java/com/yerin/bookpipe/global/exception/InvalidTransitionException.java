package com.yerin.bookpipe.global.exception;

import com.yerin.bookpipe.domain.JobStatus;
import com.yerin.bookpipe.global.exception.code.BookErrorCode;

public class InvalidTransitionException extends AppException {

    public InvalidTransitionException(String jobId, JobStatus from, JobStatus to) {
        super(BookErrorCode.INVALID_TRANSITION.withDetail(
                "허용되지 않는 상태 전이입니다. jobId=" + jobId + ", " + from.code() + " -> " + to.code()));
    }
}
