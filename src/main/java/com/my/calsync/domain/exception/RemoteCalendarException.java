package com.my.calsync.domain.exception;

/**
 * 왜: 제공자 호출 실패를 종류별로 표현해 재시도 여부와 사용자 응답을 분기하기 위함.
 */
public class RemoteCalendarException extends CalendarSyncException {

    public enum Kind {
        TRANSIENT,
        RATE_LIMITED,
        NOT_FOUND,
        CONFLICT,
        REJECTED
    }

    private final Kind kind;
    private final int statusCode;

    public RemoteCalendarException(Kind kind, int statusCode, String message) {
        super(message);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public RemoteCalendarException(Kind kind, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @return HTTP 상태 코드. 네트워크 오류처럼 응답이 없으면 0.
     */
    public int statusCode() {
        return statusCode;
    }

    @Override
    public ErrorCategory category() {
        return switch (kind) {
            case TRANSIENT, RATE_LIMITED -> ErrorCategory.RETRY_LATER;
            case NOT_FOUND -> ErrorCategory.NOT_FOUND;
            case CONFLICT -> ErrorCategory.CONFLICT;
            case REJECTED -> ErrorCategory.INVALID_REQUEST;
        };
    }
}
