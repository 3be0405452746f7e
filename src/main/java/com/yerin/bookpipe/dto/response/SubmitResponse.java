package com.yerin.bookpipe.dto.response;

public record SubmitResponse(String jobId) {
}
