package com.yerin.bookpipe.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum BookErrorCode implements ErrorCode {
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, ErrorKind.UNAUTHORIZED, "API 키가 유효하지 않습니다.", "BOOK-001"),
    JOB_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorKind.NOT_FOUND, "작업을 찾을 수 없습니다.", "BOOK-002"),
    CANCEL_CONFLICT(HttpStatus.CONFLICT, ErrorKind.CONFLICT, "대기 중이며 점유되지 않은 작업만 취소할 수 있습니다.", "BOOK-003"),
    INVALID_TRANSITION(HttpStatus.CONFLICT, ErrorKind.CONFLICT, "허용되지 않는 상태 전이입니다.", "BOOK-004"),
    STALE_STATE(HttpStatus.CONFLICT, ErrorKind.CONFLICT, "작업 상태가 이미 변경되었습니다.", "BOOK-005"),
    JOB_ALREADY_EXISTS(HttpStatus.CONFLICT, ErrorKind.CONFLICT, "이미 존재하는 작업 ID입니다.", "BOOK-006"),
    LEASE_HELD(HttpStatus.CONFLICT, ErrorKind.CONFLICT, "다른 워커가 작업을 점유 중입니다.", "BOOK-007"),
    DEPENDENCY_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, ErrorKind.UNAVAILABLE, "저장소에 연결할 수 없습니다.", "BOOK-008"),
    RESULT_NOT_READY(HttpStatus.TOO_EARLY, ErrorKind.NOT_READY, "작업이 아직 완료되지 않았습니다.", "BOOK-009"),
    JOB_FAILED(HttpStatus.UNPROCESSABLE_ENTITY, ErrorKind.FAILED, "작업이 실패했습니다.", "BOOK-010"),
    JOB_NOT_ELIGIBLE(HttpStatus.CONFLICT, ErrorKind.CONFLICT, "리스를 획득할 수 없는 상태의 작업입니다.", "BOOK-011"),
    ARTIFACT_NOT_FOUND(HttpStatus.NOT_FOUND, ErrorKind.NOT_FOUND, "결과물을 찾을 수 없습니다.", "BOOK-012"),
    EMPTY_INPUT(HttpStatus.BAD_REQUEST, ErrorKind.BAD_REQUEST, "업로드된 파일이 비어 있습니다.", "BOOK-013"),
    INPUT_TOO_LARGE(HttpStatus.BAD_REQUEST, ErrorKind.BAD_REQUEST, "업로드 가능한 최대 크기를 초과했습니다.", "BOOK-014"),
    JOB_CANCELLED(HttpStatus.CONFLICT, ErrorKind.CONFLICT, "취소된 작업입니다.", "BOOK-015"),
    SOURCE_FETCH_FAILED(HttpStatus.BAD_REQUEST, ErrorKind.BAD_REQUEST, "원본 URL에서 파일을 내려받지 못했습니다.", "BOOK-016");

    private final HttpStatus httpStatus;
    private final ErrorKind kind;
    private final String message;
    private final String code;
}
