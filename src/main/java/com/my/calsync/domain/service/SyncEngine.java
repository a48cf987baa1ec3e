package com.my.calsync.domain.service;

import com.my.calsync.domain.exception.AuthException;
import com.my.calsync.domain.exception.NotFoundException;
import com.my.calsync.domain.exception.RemoteCalendarException;
import com.my.calsync.domain.exception.SyncInProgressException;
import com.my.calsync.domain.model.CalendarSource;
import com.my.calsync.domain.model.EventDescriptor;
import com.my.calsync.domain.model.EventPage;
import com.my.calsync.domain.model.ExternalEvent;
import com.my.calsync.domain.model.SyncMode;
import com.my.calsync.domain.model.SyncReport;
import com.my.calsync.domain.port.out.CalendarSourceRepositoryPort;
import com.my.calsync.domain.port.out.ClockPort;
import com.my.calsync.domain.port.out.ExternalEventRepositoryPort;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 왜: 캘린더 소스 하나를 원격 상태와 맞추는 한 번의 실행(idle -> running -> idle|error)을 담당한다.
 * 커서는 모든 페이지를 소비한 뒤에만 저장하고, 실패하면 이전 커서를 그대로 둔다.
 */
public class SyncEngine {

    private static final Logger log = Logger.getLogger(SyncEngine.class);

    private final RemoteCalendarClient remoteCalendarClient;
    private final CalendarSourceRepositoryPort calendarSourceRepository;
    private final ExternalEventRepositoryPort externalEventRepository;
    private final ClockPort clockPort;
    private final Duration staleRunAfter;

    public SyncEngine(RemoteCalendarClient remoteCalendarClient,
                      CalendarSourceRepositoryPort calendarSourceRepository,
                      ExternalEventRepositoryPort externalEventRepository,
                      ClockPort clockPort,
                      Duration staleRunAfter) {
        this.remoteCalendarClient = remoteCalendarClient;
        this.calendarSourceRepository = calendarSourceRepository;
        this.externalEventRepository = externalEventRepository;
        this.clockPort = clockPort;
        this.staleRunAfter = staleRunAfter;
    }

    /**
     * @throws SyncInProgressException 같은 소스에 진행 중인 실행이 있으면 대기하지 않고 즉시
     */
    public SyncReport run(long calendarSourceId) {
        calendarSourceRepository.findById(calendarSourceId)
                .orElseThrow(() -> sourceNotFound(calendarSourceId));
        Instant startedAt = clockPort.now();
        if (!calendarSourceRepository.tryStartRun(calendarSourceId, startedAt, startedAt.minus(staleRunAfter))) {
            throw new SyncInProgressException(calendarSourceId);
        }
        RunLease lease = new RunLease(calendarSourceId, startedAt);
        MDC.put("calendarSourceId", String.valueOf(calendarSourceId));
        try {
            // 앞선 실행이 커서를 기록한 직후에 소유권을 얻었을 수 있으므로 획득 이후의 행을 기준으로 한다.
            CalendarSource source = calendarSourceRepository.findById(calendarSourceId)
                    .orElseThrow(() -> sourceNotFound(calendarSourceId));
            RunResult result = reconcile(source, lease);
            if (!calendarSourceRepository.completeRun(calendarSourceId, lease.startedAt, result.nextCursor(),
                    clockPort.now())) {
                throw superseded(lease);
            }
            log.infof("동기화 완료: mode=%s changed=%d restarted=%s cursorStored=%s",
                    result.mode(), result.changed(), result.restarted(), result.nextCursor() != null);
            return SyncReport.succeeded(calendarSourceId, result.changed(), result.mode(), result.restarted());
        } catch (SyncInProgressException e) {
            log.warnf("다른 실행이 소유권을 가져가 이번 실행 결과를 버립니다: startedAt=%s", lease.startedAt);
            throw e;
        } catch (RuntimeException e) {
            markFailed(lease, e);
            throw e;
        } finally {
            MDC.remove("calendarSourceId");
        }
    }

    private RunResult reconcile(CalendarSource source, RunLease lease) {
        SyncMode mode = source.nextMode();
        boolean restarted = false;
        int changed = 0;
        while (true) {
            String cursor = mode == SyncMode.FULL ? null : source.syncCursor();
            PassResult pass = runPass(source, cursor, lease);
            changed += pass.changed();
            if (!pass.cursorInvalid()) {
                return new RunResult(mode, restarted, changed, pass.nextCursor());
            }
            if (restarted) {
                throw new RemoteCalendarException(RemoteCalendarException.Kind.REJECTED, 410,
                        "전체 동기화로 다시 시작한 뒤에도 커서가 무효로 보고되었습니다.");
            }
            log.infof("동기화 커서가 무효화되어 전체 동기화로 다시 시작합니다: calendar=%s",
                    source.externalCalendarId());
            restarted = true;
            mode = SyncMode.FULL;
        }
    }

    private PassResult runPass(CalendarSource source, String cursor, RunLease lease) {
        boolean full = cursor == null;
        Set<String> reported = new HashSet<>();
        String pageToken = null;
        String nextCursor = null;
        int changed = 0;
        do {
            EventPage page = remoteCalendarClient.listEvents(source, cursor, pageToken);
            renew(lease);
            if (page.cursorInvalid()) {
                return new PassResult(true, null, changed);
            }
            for (EventDescriptor descriptor : page.events()) {
                if (!descriptor.deleted()) {
                    reported.add(descriptor.externalId());
                }
                if (apply(source.id(), descriptor)) {
                    changed++;
                }
            }
            pageToken = page.nextPageToken();
            nextCursor = page.nextCursor();
        } while (pageToken != null);
        if (full) {
            changed += reconcileAbsences(source.id(), reported);
        }
        return new PassResult(false, nextCursor, changed);
    }

    /**
     * @return 로컬 행이 바뀌었으면 true
     */
    private boolean apply(long calendarSourceId, EventDescriptor descriptor) {
        Optional<ExternalEvent> existing = externalEventRepository.find(calendarSourceId, descriptor.externalId());
        Instant now = clockPort.now();
        if (descriptor.deleted()) {
            return existing.filter(event -> !event.tombstoned()).isPresent()
                    && externalEventRepository.tombstone(calendarSourceId, descriptor.externalId(), now);
        }
        if (existing.isEmpty()) {
            externalEventRepository.insert(ExternalEvent.fromDescriptor(calendarSourceId, descriptor, now));
            return true;
        }
        ExternalEvent current = existing.get();
        if (!current.tombstoned() && Objects.equals(current.revisionMarker(), descriptor.revision())) {
            return false;
        }
        externalEventRepository.update(current.overwrittenBy(descriptor, now));
        return true;
    }

    /**
     * 전체 목록에 없는 행을 정리한다. 이전 실행에서 이미 tombstone 된 행은 이번에 없음이 확인되었으므로 삭제하고,
     * 살아 있던 행은 tombstone 한다.
     */
    private int reconcileAbsences(long calendarSourceId, Set<String> reported) {
        Set<String> confirmedGone = new HashSet<>(externalEventRepository.findTombstonedExternalIds(calendarSourceId));
        confirmedGone.removeAll(reported);
        if (!confirmedGone.isEmpty()) {
            int purged = externalEventRepository.purge(calendarSourceId, confirmedGone);
            log.debugf("삭제가 확인된 tombstone %d건을 정리했습니다.", purged);
        }
        Set<String> missing = new HashSet<>(externalEventRepository.findLiveExternalIds(calendarSourceId));
        missing.removeAll(reported);
        Instant now = clockPort.now();
        int tombstoned = 0;
        for (String externalId : missing) {
            if (externalEventRepository.tombstone(calendarSourceId, externalId, now)) {
                tombstoned++;
            }
        }
        return tombstoned;
    }

    /**
     * 페이지마다 시작 시각을 앞당겨 오래 걸리는 실행이 stale 로 오인되어 넘어가지 않게 하고,
     * 이미 넘어갔다면 더 이상 로컬 행을 쓰지 않고 멈춘다.
     */
    private void renew(RunLease lease) {
        Instant now = clockPort.now();
        if (!calendarSourceRepository.heartbeat(lease.calendarSourceId, lease.startedAt, now)) {
            throw superseded(lease);
        }
        lease.startedAt = now;
    }

    private void markFailed(RunLease lease, RuntimeException cause) {
        if (cause instanceof AuthException) {
            log.warnf("인증 오류로 동기화를 중단합니다: %s", cause.getMessage());
        } else {
            log.errorf(cause, "동기화 실패: %s", cause.getMessage());
        }
        try {
            if (!calendarSourceRepository.failRun(lease.calendarSourceId, lease.startedAt,
                    String.valueOf(cause.getMessage()))) {
                log.warn("다른 실행이 소유권을 가져가 실패 상태를 기록하지 않았습니다.");
            }
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
    }

    private static SyncInProgressException superseded(RunLease lease) {
        return new SyncInProgressException(lease.calendarSourceId);
    }

    private static NotFoundException sourceNotFound(long calendarSourceId) {
        return new NotFoundException("캘린더 소스를 찾을 수 없습니다: " + calendarSourceId);
    }

    /** 이 실행이 소유한 running 상태. startedAt 은 heartbeat 마다 갱신된다. */
    private static final class RunLease {
        private final long calendarSourceId;
        private Instant startedAt;

        private RunLease(long calendarSourceId, Instant startedAt) {
            this.calendarSourceId = calendarSourceId;
            this.startedAt = startedAt;
        }
    }

    private record PassResult(boolean cursorInvalid, String nextCursor, int changed) {
    }

    private record RunResult(SyncMode mode, boolean restarted, int changed, String nextCursor) {
    }
}
