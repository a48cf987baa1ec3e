package com.my.calsync.domain.service;

import com.my.calsync.domain.exception.CalendarSyncException;
import com.my.calsync.domain.exception.ErrorCategory;
import com.my.calsync.domain.exception.NotFoundException;
import com.my.calsync.domain.exception.SyncInProgressException;
import com.my.calsync.domain.model.CalendarSource;
import com.my.calsync.domain.model.SyncReport;
import com.my.calsync.domain.model.UserSyncReport;
import com.my.calsync.domain.port.in.CalendarConnectionUseCase;
import com.my.calsync.domain.port.in.SyncCalendarUseCase;
import com.my.calsync.domain.port.out.CalendarSourceRepositoryPort;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * 왜: 사용자 소유 확인 후 소스 단위 동기화를 실행하고, 여러 소스 실행 결과를 소스별 보고로 모으기 위함.
 * 전체 동기화는 원격 캘린더 목록을 먼저 반영해 새로 추가된 캘린더도 함께 동기화한다.
 */
public class CalendarSyncService implements SyncCalendarUseCase {

    private static final Logger log = Logger.getLogger(CalendarSyncService.class);

    private final SyncEngine syncEngine;
    private final CalendarSourceRepositoryPort calendarSourceRepository;
    private final CalendarConnectionUseCase calendarConnectionUseCase;

    public CalendarSyncService(SyncEngine syncEngine,
                               CalendarSourceRepositoryPort calendarSourceRepository,
                               CalendarConnectionUseCase calendarConnectionUseCase) {
        this.syncEngine = syncEngine;
        this.calendarSourceRepository = calendarSourceRepository;
        this.calendarConnectionUseCase = calendarConnectionUseCase;
    }

    @Override
    public SyncReport sync(String userId, long calendarSourceId) {
        calendarSourceRepository.findOwned(calendarSourceId, userId)
                .orElseThrow(() -> new NotFoundException("캘린더 소스를 찾을 수 없습니다: " + calendarSourceId));
        return syncEngine.run(calendarSourceId);
    }

    /**
     * 목록 갱신 실패나 소스 하나의 실패가 나머지 소스의 동기화를 막지 않는다.
     */
    @Override
    public UserSyncReport syncAll(String userId) {
        ErrorCategory refreshErrorCategory = null;
        String refreshError = null;
        try {
            calendarConnectionUseCase.refreshCalendarList(userId);
        } catch (CalendarSyncException e) {
            log.warnf("캘린더 목록 갱신에 실패해 연결된 소스만 동기화합니다: user=%s reason=%s", userId, e.getMessage());
            refreshErrorCategory = e.category();
            refreshError = e.getMessage();
        } catch (RuntimeException e) {
            log.errorf(e, "캘린더 목록 갱신 중 예상하지 못한 오류: user=%s", userId);
            refreshErrorCategory = ErrorCategory.RETRY_LATER;
            refreshError = e.getMessage();
        }
        List<SyncReport> reports = new ArrayList<>();
        for (CalendarSource source : calendarSourceRepository.findByUser(userId)) {
            reports.add(syncQuietly(source.id()));
        }
        if (refreshErrorCategory != null) {
            return UserSyncReport.refreshFailed(userId, refreshErrorCategory, refreshError, reports);
        }
        return UserSyncReport.refreshed(userId, reports);
    }

    /**
     * @return 동기화를 시도한 소스 수
     */
    public int syncEveryone() {
        int sources = 0;
        for (String userId : calendarSourceRepository.findUsersWithSources()) {
            sources += syncAll(userId).sources().size();
        }
        return sources;
    }

    private SyncReport syncQuietly(long calendarSourceId) {
        try {
            return syncEngine.run(calendarSourceId);
        } catch (SyncInProgressException e) {
            log.debugf("이미 동기화 중인 소스를 건너뜁니다: %d", calendarSourceId);
            return SyncReport.skipped(calendarSourceId);
        } catch (CalendarSyncException e) {
            return SyncReport.failed(calendarSourceId, e.category(), e.getMessage());
        } catch (RuntimeException e) {
            return SyncReport.failed(calendarSourceId, ErrorCategory.RETRY_LATER, e.getMessage());
        }
    }
}
