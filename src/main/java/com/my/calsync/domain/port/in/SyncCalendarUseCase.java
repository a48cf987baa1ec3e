package com.my.calsync.domain.port.in;

import com.my.calsync.domain.model.SyncReport;
import com.my.calsync.domain.model.UserSyncReport;

public interface SyncCalendarUseCase {

    /**
     * @throws com.my.calsync.domain.exception.SyncInProgressException 같은 소스가 이미 동기화 중이면
     */
    SyncReport sync(String userId, long calendarSourceId);

    /**
     * 원격 캘린더 목록을 반영한 뒤 사용자의 모든 소스를 동기화한다.
     */
    UserSyncReport syncAll(String userId);
}
