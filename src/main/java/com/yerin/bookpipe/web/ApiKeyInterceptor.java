package com.yerin.bookpipe.web;

import com.yerin.bookpipe.config.BookpipeProperties;
import com.yerin.bookpipe.global.exception.AppException;
import com.yerin.bookpipe.global.exception.code.BookErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

@Slf4j
@Component
public class ApiKeyInterceptor implements HandlerInterceptor {

    private final String headerName;
    private final byte[] apiKey;

    @Autowired
    public ApiKeyInterceptor(BookpipeProperties properties) {
        this(properties.getGateway().getApiKeyHeader(), properties.getGateway().getApiKey());
    }

    public ApiKeyInterceptor(String headerName, String apiKey) {
        this.headerName = headerName;
        this.apiKey = apiKey == null ? new byte[0] : apiKey.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String presented = request.getHeader(headerName);
        if (apiKey.length > 0 && presented != null
                && MessageDigest.isEqual(apiKey, presented.getBytes(StandardCharsets.UTF_8))) {
            return true;
        }
        log.warn("[ApiKey] rejected {} {}, headerPresent={}", request.getMethod(), request.getRequestURI(), presented != null);
        throw new AppException(BookErrorCode.UNAUTHORIZED);
    }
}
