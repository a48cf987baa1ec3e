package com.my.calsync.domain.exception;

/**
 * 왜: 로컬 저장소 쓰기 실패를 데이터 계층 오류로 구분한다. 원격 반영은 이미 끝났을 수 있으며 다음 동기화가 복구한다.
 */
public class LocalReplicaException extends CalendarSyncException {
    public LocalReplicaException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.RETRY_LATER;
    }
}
