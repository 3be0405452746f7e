package com.yerin.bookpipe.dto.response;

public record JobResultResponse(
        String jobId,
        String outputRef,
        long sizeBytes
) {
}
