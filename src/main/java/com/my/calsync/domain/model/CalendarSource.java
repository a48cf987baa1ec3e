package com.my.calsync.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 왜: 사용자에게 연결된 원격 캘린더와 그 동기화 커서/상태를 한 행으로 묶어 관리하기 위함.
 * syncCursor 가 null 이면 다음 실행은 전체 동기화다.
 */
public record CalendarSource(long id,
                             String userId,
                             String provider,
                             String externalCalendarId,
                             String name,
                             boolean primary,
                             String timeZone,
                             String syncCursor,
                             Instant lastSyncedAt,
                             SyncStatus status,
                             Instant runStartedAt,
                             String lastError) {
    public CalendarSource {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(externalCalendarId, "externalCalendarId");
        Objects.requireNonNull(status, "status");
    }

    public SyncMode nextMode() {
        return syncCursor == null ? SyncMode.FULL : SyncMode.INCREMENTAL;
    }
}
