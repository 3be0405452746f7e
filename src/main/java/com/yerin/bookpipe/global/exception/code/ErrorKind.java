package com.yerin.bookpipe.global.exception.code;

public enum ErrorKind {
    UNAUTHORIZED,
    BAD_REQUEST,
    NOT_FOUND,
    CONFLICT,
    NOT_READY,
    FAILED,
    UNAVAILABLE,
    INTERNAL
}
