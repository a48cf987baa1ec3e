package com.my.calsync.domain.exception;

/**
 * 왜: 도메인 오류 전체가 분류 정보를 함께 가지고 상위 계층으로 전파되도록 공통 부모를 둔다.
 */
public abstract class CalendarSyncException extends RuntimeException {

    protected CalendarSyncException(String message) {
        super(message);
    }

    protected CalendarSyncException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorCategory category();
}
