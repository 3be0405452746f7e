package com.yerin.bookpipe.global.exception;

import com.yerin.bookpipe.global.exception.code.BookErrorCode;

public class StaleStateException extends AppException {

    public StaleStateException(String jobId, String reason) {
        super(BookErrorCode.STALE_STATE.withDetail("작업 상태가 이미 변경되었습니다. jobId=" + jobId + ", " + reason));
    }
}
