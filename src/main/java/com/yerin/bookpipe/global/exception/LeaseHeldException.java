package com.yerin.bookpipe.global.exception;

import com.yerin.bookpipe.global.exception.code.BookErrorCode;

public class LeaseHeldException extends AppException {

    public LeaseHeldException(String jobId) {
        super(BookErrorCode.LEASE_HELD.withDetail("다른 워커가 작업을 점유 중입니다. jobId=" + jobId));
    }
}
