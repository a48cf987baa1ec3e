package com.my.calsync.domain.service;

import com.my.calsync.domain.exception.RemoteCalendarException;
import com.my.calsync.domain.model.CalendarDescriptor;
import com.my.calsync.domain.model.EventDescriptor;
import com.my.calsync.domain.model.EventDraft;
import com.my.calsync.domain.model.EventPage;
import com.my.calsync.domain.model.RemoteResult;
import com.my.calsync.domain.port.out.RemoteCalendarPort;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 메모리 안의 원격 캘린더. 커서는 변경 로그의 위치이고, 페이지 토큰은 목록 안의 오프셋이다.
 * addCalendarFor 로 등록한 토큰은 자기 캘린더만 보고, 나머지 토큰은 전부 본다.
 */
public class FakeRemoteCalendar implements RemoteCalendarPort {

    private final Map<String, CalendarDescriptor> calendars = new LinkedHashMap<>();
    private final Map<String, Map<String, EventDescriptor>> events = new LinkedHashMap<>();
    private final Map<String, Set<String>> visibleByToken = new HashMap<>();
    private final List<Change> changes = new ArrayList<>();
    private final Deque<RemoteResult<?>> scripted = new ArrayDeque<>();
    private final List<String> calls = new ArrayList<>();
    private final List<String> listedCursors = new ArrayList<>();
    private int revisions;
    private int created;
    private int pageSize = 100;
    private boolean rejectCursors;
    private boolean rejectEverything;
    private Runnable beforeListEvents = () -> { };

    public void addCalendar(String calendarId, String name, boolean primary) {
        calendars.put(calendarId, new CalendarDescriptor(calendarId, name, primary, "UTC"));
        events.computeIfAbsent(calendarId, id -> new LinkedHashMap<>());
    }

    public void addCalendarFor(String accessToken, String calendarId, String name, boolean primary) {
        addCalendar(calendarId, name, primary);
        visibleByToken.computeIfAbsent(accessToken, token -> new LinkedHashSet<>()).add(calendarId);
    }

    public EventDescriptor put(String calendarId, String externalId, String title, Instant start) {
        EventDescriptor descriptor = new EventDescriptor(externalId, title, null, null, start,
                start.plus(Duration.ofHours(1)), false, "rev-" + (++revisions), false);
        store(calendarId, descriptor);
        return descriptor;
    }

    public void remove(String calendarId, String externalId) {
        calendar(calendarId).remove(externalId);
        changes.add(new Change(calendarId, EventDescriptor.deletion(externalId)));
    }

    /**
     * 변경 로그에 남기지 않고 지운다. 전체 목록 비교로만 알 수 있다.
     */
    public void removeSilently(String calendarId, String externalId) {
        calendar(calendarId).remove(externalId);
    }

    public Optional<EventDescriptor> event(String calendarId, String externalId) {
        return Optional.ofNullable(calendar(calendarId).get(externalId));
    }

    public void pageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    public void rejectCursors(boolean rejectCursors) {
        this.rejectCursors = rejectCursors;
    }

    public void rejectEverything(boolean rejectEverything) {
        this.rejectEverything = rejectEverything;
    }

    public void beforeListEvents(Runnable hook) {
        this.beforeListEvents = hook;
    }

    public void failNext(RemoteResult<?> result) {
        scripted.add(result);
    }

    public List<String> calls() {
        return calls;
    }

    public List<String> listedCursors() {
        return listedCursors;
    }

    public long count(String operation) {
        return calls.stream().filter(operation::equals).count();
    }

    @Override
    public RemoteResult<List<CalendarDescriptor>> listCalendars(String accessToken) {
        calls.add("listCalendars");
        RemoteResult<List<CalendarDescriptor>> failure = nextFailure();
        if (failure != null) {
            return failure;
        }
        Set<String> visible = visibleByToken.get(accessToken);
        return RemoteResult.success(calendars.values().stream()
                .filter(calendar -> visible == null || visible.contains(calendar.externalId()))
                .toList());
    }

    @Override
    public RemoteResult<EventPage> listEvents(String accessToken, String calendarId, String cursor, String pageToken) {
        calls.add("listEvents");
        beforeListEvents.run();
        RemoteResult<EventPage> failure = nextFailure();
        if (failure != null) {
            return failure;
        }
        if (rejectEverything || (cursor != null && rejectCursors)) {
            return RemoteResult.success(EventPage.invalidCursor());
        }
        List<EventDescriptor> items;
        if (cursor == null) {
            items = new ArrayList<>(calendar(calendarId).values());
        } else {
            listedCursors.add(cursor);
            Map<String, EventDescriptor> latest = new LinkedHashMap<>();
            for (int i = Integer.parseInt(cursor); i < changes.size(); i++) {
                Change change = changes.get(i);
                if (change.calendarId().equals(calendarId)) {
                    latest.remove(change.descriptor().externalId());
                    latest.put(change.descriptor().externalId(), change.descriptor());
                }
            }
            items = new ArrayList<>(latest.values());
        }
        int offset = pageToken == null ? 0 : Integer.parseInt(pageToken);
        int end = Math.min(items.size(), offset + pageSize);
        boolean last = end >= items.size();
        return RemoteResult.success(new EventPage(items.subList(offset, end),
                last ? null : String.valueOf(end),
                last ? String.valueOf(changes.size()) : null,
                false));
    }

    @Override
    public RemoteResult<EventDescriptor> createEvent(String accessToken, String calendarId, EventDraft draft) {
        calls.add("createEvent");
        RemoteResult<EventDescriptor> failure = nextFailure();
        if (failure != null) {
            return failure;
        }
        EventDescriptor descriptor = fromDraft("evt-" + (++created), draft);
        store(calendarId, descriptor);
        return RemoteResult.success(descriptor);
    }

    @Override
    public RemoteResult<EventDescriptor> updateEvent(String accessToken, String calendarId, String externalId,
                                                     EventDraft draft, String expectedRevision) {
        calls.add("updateEvent");
        RemoteResult<EventDescriptor> failure = nextFailure();
        if (failure != null) {
            return failure;
        }
        EventDescriptor current = calendar(calendarId).get(externalId);
        if (current == null) {
            return RemoteResult.failed(new RemoteCalendarException(RemoteCalendarException.Kind.NOT_FOUND, 404,
                    "not found: " + externalId));
        }
        if (expectedRevision != null && !expectedRevision.equals(current.revision())) {
            return RemoteResult.failed(new RemoteCalendarException(RemoteCalendarException.Kind.CONFLICT, 412,
                    "revision mismatch: " + externalId));
        }
        EventDescriptor updated = fromDraft(externalId, draft);
        store(calendarId, updated);
        return RemoteResult.success(updated);
    }

    @Override
    public RemoteResult<Void> deleteEvent(String accessToken, String calendarId, String externalId) {
        calls.add("deleteEvent");
        RemoteResult<Void> failure = nextFailure();
        if (failure != null) {
            return failure;
        }
        if (!calendar(calendarId).containsKey(externalId)) {
            return RemoteResult.failed(new RemoteCalendarException(RemoteCalendarException.Kind.NOT_FOUND, 410,
                    "gone: " + externalId));
        }
        remove(calendarId, externalId);
        return RemoteResult.success(null);
    }

    private EventDescriptor fromDraft(String externalId, EventDraft draft) {
        return new EventDescriptor(externalId, draft.title(), draft.description(), draft.location(), draft.startAt(),
                draft.endAt(), draft.allDay(), "rev-" + (++revisions), false);
    }

    private void store(String calendarId, EventDescriptor descriptor) {
        calendar(calendarId).put(descriptor.externalId(), descriptor);
        changes.add(new Change(calendarId, descriptor));
    }

    private Map<String, EventDescriptor> calendar(String calendarId) {
        return events.computeIfAbsent(calendarId, id -> new LinkedHashMap<>());
    }

    @SuppressWarnings("unchecked")
    private <T> RemoteResult<T> nextFailure() {
        return (RemoteResult<T>) scripted.poll();
    }

    private record Change(String calendarId, EventDescriptor descriptor) {
    }
}
