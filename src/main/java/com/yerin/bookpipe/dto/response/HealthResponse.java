package com.yerin.bookpipe.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Map;

/**
 * @param status     {@code UP} when every dependency answered, otherwise {@code DOWN}
 * @param components per-dependency status, e.g. {@code stateStore -> UP}
 */
public record HealthResponse(
        String status,
        Map<String, String> components
) {
    @JsonIgnore
    public boolean isUp() {
        return "UP".equals(status);
    }
}
