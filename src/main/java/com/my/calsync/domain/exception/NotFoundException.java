package com.my.calsync.domain.exception;

/**
 * 왜: 대상이 없거나 요청 사용자 소유가 아닌 경우를 같은 방식으로 알려 존재 여부를 노출하지 않기 위함.
 */
public class NotFoundException extends CalendarSyncException {
    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.NOT_FOUND;
    }
}
