package com.yerin.bookpipe.domain;

import java.time.Instant;

public record Lease(String jobId, String owner, Instant expiresAt) {
}
