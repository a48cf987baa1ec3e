package com.my.calsync.domain.service;

import com.my.calsync.domain.exception.ConflictException;
import com.my.calsync.domain.exception.LocalReplicaException;
import com.my.calsync.domain.exception.NotFoundException;
import com.my.calsync.domain.exception.RemoteCalendarException;
import com.my.calsync.domain.model.CalendarSource;
import com.my.calsync.domain.model.EventDescriptor;
import com.my.calsync.domain.model.EventDraft;
import com.my.calsync.domain.model.EventPatch;
import com.my.calsync.domain.model.ExternalEvent;
import com.my.calsync.domain.model.TimeRange;
import com.my.calsync.domain.port.in.ManageEventsUseCase;
import com.my.calsync.domain.port.out.CalendarSourceRepositoryPort;
import com.my.calsync.domain.port.out.ClockPort;
import com.my.calsync.domain.port.out.ExternalEventRepositoryPort;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * 왜: 원격이 기준 저장소이므로 원격 반영이 확인된 뒤에만 로컬 복제본을 바꿔,
 * 로컬이 원격이 거부한 상태를 갖지 않도록 하기 위함.
 */
public class EventManager implements ManageEventsUseCase {

    private static final Logger log = Logger.getLogger(EventManager.class);

    private final RemoteCalendarClient remoteCalendarClient;
    private final CalendarSourceRepositoryPort calendarSourceRepository;
    private final ExternalEventRepositoryPort externalEventRepository;
    private final ClockPort clockPort;

    public EventManager(RemoteCalendarClient remoteCalendarClient,
                        CalendarSourceRepositoryPort calendarSourceRepository,
                        ExternalEventRepositoryPort externalEventRepository,
                        ClockPort clockPort) {
        this.remoteCalendarClient = remoteCalendarClient;
        this.calendarSourceRepository = calendarSourceRepository;
        this.externalEventRepository = externalEventRepository;
        this.clockPort = clockPort;
    }

    /**
     * 로컬 삽입이 실패해도 원격 이벤트는 지우지 않는다. 다음 동기화가 같은 외부 id 로 복구한다.
     */
    @Override
    public ExternalEvent create(String userId, long calendarSourceId, EventDraft draft) {
        CalendarSource calendar = ownedSource(userId, calendarSourceId);
        EventDescriptor created = remoteCalendarClient.createEvent(calendar, draft);
        try {
            ExternalEvent inserted = externalEventRepository.insert(
                    ExternalEvent.fromDescriptor(calendar.id(), created, clockPort.now()));
            log.infof("이벤트를 생성했습니다: calendarSourceId=%d externalId=%s", calendar.id(), created.externalId());
            return inserted;
        } catch (RuntimeException e) {
            log.errorf(e, "원격 이벤트는 생성되었으나 로컬 저장에 실패했습니다. 다음 동기화에서 복구됩니다: externalId=%s",
                    created.externalId());
            throw new LocalReplicaException("로컬 이벤트 저장 실패: " + created.externalId(), e);
        }
    }

    @Override
    public ExternalEvent get(String userId, long calendarSourceId, String externalEventId) {
        CalendarSource calendar = ownedSource(userId, calendarSourceId);
        return externalEventRepository.find(calendar.id(), externalEventId)
                .filter(event -> !event.tombstoned())
                .orElseThrow(() -> eventNotFound(externalEventId));
    }

    @Override
    public ExternalEvent update(String userId, long calendarSourceId, String externalEventId, EventPatch patch) {
        CalendarSource calendar = ownedSource(userId, calendarSourceId);
        ExternalEvent current = externalEventRepository.find(calendar.id(), externalEventId)
                .filter(event -> !event.tombstoned())
                .orElseThrow(() -> eventNotFound(externalEventId));
        EventDraft draft = patch.applyTo(current);
        EventDescriptor updated;
        try {
            updated = remoteCalendarClient.updateEvent(calendar, externalEventId, draft, current.revisionMarker());
        } catch (RemoteCalendarException e) {
            if (e.kind() == RemoteCalendarException.Kind.CONFLICT) {
                log.infof("원격 리비전이 달라 수정이 거부되었습니다: externalId=%s localRevision=%s",
                        externalEventId, current.revisionMarker());
                throw new ConflictException("이벤트가 원격에서 먼저 변경되었습니다. 다시 조회한 뒤 수정하세요: "
                        + externalEventId, e);
            }
            if (e.kind() == RemoteCalendarException.Kind.NOT_FOUND) {
                throw eventNotFound(externalEventId);
            }
            throw e;
        }
        ExternalEvent patched = new ExternalEvent(current.id(), current.calendarSourceId(), externalEventId,
                draft.title(), draft.description(), draft.location(), draft.startAt(), draft.endAt(), draft.allDay(),
                updated.revision(), clockPort.now(), false);
        try {
            externalEventRepository.update(patched);
        } catch (RuntimeException e) {
            throw new LocalReplicaException("로컬 이벤트 수정 실패: " + externalEventId, e);
        }
        log.infof("이벤트를 수정했습니다: calendarSourceId=%d externalId=%s", calendar.id(), externalEventId);
        return patched;
    }

    /**
     * tombstone 된 행도 허용해 같은 삭제를 반복해도 성공하도록 한다.
     */
    @Override
    public void delete(String userId, long calendarSourceId, String externalEventId) {
        CalendarSource calendar = ownedSource(userId, calendarSourceId);
        externalEventRepository.find(calendar.id(), externalEventId)
                .orElseThrow(() -> eventNotFound(externalEventId));
        remoteCalendarClient.deleteEvent(calendar, externalEventId);
        try {
            externalEventRepository.tombstone(calendar.id(), externalEventId, clockPort.now());
        } catch (RuntimeException e) {
            throw new LocalReplicaException("로컬 이벤트 삭제 표시 실패: " + externalEventId, e);
        }
        log.infof("이벤트를 삭제했습니다: calendarSourceId=%d externalId=%s", calendar.id(), externalEventId);
    }

    @Override
    public List<ExternalEvent> list(String userId, long calendarSourceId, TimeRange range) {
        CalendarSource calendar = ownedSource(userId, calendarSourceId);
        return externalEventRepository.findLive(calendar.id(), range == null ? TimeRange.unbounded() : range);
    }

    @Override
    public List<ExternalEvent> listForUser(String userId, TimeRange range) {
        return externalEventRepository.findLiveForUser(userId, range == null ? TimeRange.unbounded() : range);
    }

    private CalendarSource ownedSource(String userId, long calendarSourceId) {
        return calendarSourceRepository.findOwned(calendarSourceId, userId)
                .orElseThrow(() -> new NotFoundException("캘린더 소스를 찾을 수 없습니다: " + calendarSourceId));
    }

    private static NotFoundException eventNotFound(String externalEventId) {
        return new NotFoundException("이벤트를 찾을 수 없습니다: " + externalEventId);
    }
}
