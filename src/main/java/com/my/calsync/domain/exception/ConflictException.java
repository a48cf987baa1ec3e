package com.my.calsync.domain.exception;

/**
 * 왜: 로컬 리비전이 원격보다 오래된 수정 요청을 호출자가 다시 읽고 재시도하도록 알리기 위함.
 */
public class ConflictException extends CalendarSyncException {
    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.CONFLICT;
    }
}
