package com.my.calsync.domain.model;

import com.my.calsync.domain.exception.ErrorCategory;

/**
 * 왜: 소스 단위 동기화 결과(상태, 반영 건수, 오류)를 호출자에게 한 형태로 돌려주기 위함.
 */
public record SyncReport(long calendarSourceId,
                         SyncOutcome outcome,
                         int syncedCount,
                         SyncMode mode,
                         boolean restarted,
                         ErrorCategory errorCategory,
                         String error) {

    public static SyncReport succeeded(long calendarSourceId, int syncedCount, SyncMode mode, boolean restarted) {
        return new SyncReport(calendarSourceId, SyncOutcome.SUCCEEDED, syncedCount, mode, restarted, null, null);
    }

    public static SyncReport skipped(long calendarSourceId) {
        return new SyncReport(calendarSourceId, SyncOutcome.SKIPPED, 0, null, false, ErrorCategory.BUSY,
                "sync already in progress");
    }

    public static SyncReport failed(long calendarSourceId, ErrorCategory category, String error) {
        return new SyncReport(calendarSourceId, SyncOutcome.FAILED, 0, null, false, category, error);
    }
}
