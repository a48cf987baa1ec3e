package com.my.calsync.domain.model;

import com.my.calsync.domain.exception.ErrorCategory;

import java.util.List;

/**
 * 사용자 한 명의 전체 동기화 결과. 캘린더 목록 갱신이 실패해도 이미 연결된 소스는 동기화된다.
 */
public record UserSyncReport(String userId,
                             boolean calendarsRefreshed,
                             ErrorCategory refreshErrorCategory,
                             String refreshError,
                             List<SyncReport> sources) {

    public UserSyncReport {
        sources = List.copyOf(sources);
    }

    public static UserSyncReport refreshed(String userId, List<SyncReport> sources) {
        return new UserSyncReport(userId, true, null, null, sources);
    }

    public static UserSyncReport refreshFailed(String userId, ErrorCategory category, String error,
                                               List<SyncReport> sources) {
        return new UserSyncReport(userId, false, category, error, sources);
    }
}
