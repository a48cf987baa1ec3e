package com.my.calsync.adapter.out.google;

import com.google.api.client.googleapis.json.GoogleJsonError;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.http.HttpResponseException;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.util.DateTime;
import com.google.api.services.calendar.Calendar;
import com.google.api.services.calendar.model.CalendarList;
import com.google.api.services.calendar.model.CalendarListEntry;
import com.google.api.services.calendar.model.Event;
import com.google.api.services.calendar.model.EventDateTime;
import com.google.api.services.calendar.model.Events;
import com.my.calsync.config.AppConfig;
import com.my.calsync.domain.exception.RemoteCalendarException;
import com.my.calsync.domain.model.CalendarDescriptor;
import com.my.calsync.domain.model.EventDescriptor;
import com.my.calsync.domain.model.EventDraft;
import com.my.calsync.domain.model.EventPage;
import com.my.calsync.domain.model.RemoteResult;
import com.my.calsync.domain.port.out.ClockPort;
import com.my.calsync.domain.port.out.RemoteCalendarPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 왜: Google Calendar v3 호출을 RemoteCalendarPort 계약에 맞게 감싸고, HTTP 오류를 재시도 태그로 분류하기 위함.
 * 재시도 자체는 하지 않는다. 태그를 보고 도메인의 RemoteCalendarClient 가 결정한다.
 */
@ApplicationScoped
public class GoogleCalendarAdapter implements RemoteCalendarPort {

    private static final Logger log = Logger.getLogger(GoogleCalendarAdapter.class);

    private static final Set<String> RATE_LIMIT_REASONS = Set.of("rateLimitExceeded", "userRateLimitExceeded");
    private static final String CANCELLED = "cancelled";

    private final HttpTransport httpTransport;
    private final JsonFactory jsonFactory;
    private final String applicationName;
    private final int timeoutMillis;
    private final int pageSize;
    private final ClockPort clockPort;

    @Inject
    public GoogleCalendarAdapter(HttpTransport httpTransport, JsonFactory jsonFactory, AppConfig appConfig,
                                 ClockPort clockPort) {
        this(httpTransport, jsonFactory, appConfig.google().applicationName(),
                (int) Duration.ofSeconds(appConfig.remote().timeoutSeconds()).toMillis(),
                appConfig.remote().pageSize(), clockPort);
    }

    GoogleCalendarAdapter(HttpTransport httpTransport, JsonFactory jsonFactory, String applicationName,
                          int timeoutMillis, int pageSize, ClockPort clockPort) {
        this.httpTransport = httpTransport;
        this.jsonFactory = jsonFactory;
        this.applicationName = applicationName;
        this.timeoutMillis = timeoutMillis;
        this.pageSize = pageSize;
        this.clockPort = clockPort;
    }

    @Override
    public RemoteResult<List<CalendarDescriptor>> listCalendars(String accessToken) {
        return call("calendarList.list", () -> {
            Calendar calendar = client(accessToken);
            List<CalendarDescriptor> calendars = new ArrayList<>();
            String pageToken = null;
            do {
                CalendarList page = calendar.calendarList().list().setPageToken(pageToken).execute();
                if (page.getItems() != null) {
                    for (CalendarListEntry entry : page.getItems()) {
                        String name = entry.getSummaryOverride() != null ? entry.getSummaryOverride() : entry.getSummary();
                        calendars.add(new CalendarDescriptor(entry.getId(), name,
                                Boolean.TRUE.equals(entry.getPrimary()), entry.getTimeZone()));
                    }
                }
                pageToken = page.getNextPageToken();
            } while (pageToken != null);
            return calendars;
        });
    }

    /**
     * 커서가 있는 요청에 410 이 오면 오류가 아니라 커서 무효 페이지로 돌려준다.
     */
    @Override
    public RemoteResult<EventPage> listEvents(String accessToken, String calendarId, String cursor, String pageToken) {
        try {
            Calendar.Events.List request = client(accessToken).events().list(calendarId)
                    .setSingleEvents(true)
                    .setMaxResults(pageSize)
                    .setPageToken(pageToken);
            if (cursor != null) {
                request.setSyncToken(cursor);
            }
            Events page = request.execute();
            List<EventDescriptor> events = new ArrayList<>();
            if (page.getItems() != null) {
                for (Event event : page.getItems()) {
                    EventDescriptor descriptor = toDescriptor(event);
                    if (descriptor != null) {
                        events.add(descriptor);
                    }
                }
            }
            return RemoteResult.success(new EventPage(events, page.getNextPageToken(), page.getNextSyncToken(), false));
        } catch (HttpResponseException e) {
            if (cursor != null && e.getStatusCode() == 410) {
                log.infof("동기화 커서가 만료되었습니다: calendar=%s", calendarId);
                return RemoteResult.success(EventPage.invalidCursor());
            }
            return classify("events.list", e);
        } catch (IOException e) {
            return transportFailure("events.list", e);
        }
    }

    @Override
    public RemoteResult<EventDescriptor> createEvent(String accessToken, String calendarId, EventDraft draft) {
        return call("events.insert", () -> {
            Event created = client(accessToken).events().insert(calendarId, applyDraft(new Event(), draft)).execute();
            return toDescriptor(created);
        });
    }

    @Override
    public RemoteResult<EventDescriptor> updateEvent(String accessToken, String calendarId, String externalId,
                                                     EventDraft draft, String expectedRevision) {
        try {
            Calendar calendar = client(accessToken);
            Event current = calendar.events().get(calendarId, externalId).execute();
            if (CANCELLED.equals(current.getStatus())) {
                return RemoteResult.failed(new RemoteCalendarException(RemoteCalendarException.Kind.NOT_FOUND, 404,
                        "원격 이벤트가 이미 취소되었습니다: " + externalId));
            }
            if (expectedRevision != null && !expectedRevision.equals(revisionOf(current))) {
                return RemoteResult.failed(new RemoteCalendarException(RemoteCalendarException.Kind.CONFLICT, 412,
                        "원격 리비전이 다릅니다: expected=" + expectedRevision + " actual=" + revisionOf(current)));
            }
            Calendar.Events.Update update = calendar.events().update(calendarId, externalId, applyDraft(current, draft));
            if (expectedRevision != null) {
                update.getRequestHeaders().setIfMatch(expectedRevision);
            }
            return RemoteResult.success(toDescriptor(update.execute()));
        } catch (HttpResponseException e) {
            return classify("events.update", e);
        } catch (IOException e) {
            return transportFailure("events.update", e);
        }
    }

    @Override
    public RemoteResult<Void> deleteEvent(String accessToken, String calendarId, String externalId) {
        return call("events.delete", () -> {
            client(accessToken).events().delete(calendarId, externalId).execute();
            return null;
        });
    }

    private Calendar client(String accessToken) {
        HttpRequestInitializer initializer = request -> {
            request.getHeaders().setAuthorization("Bearer " + accessToken);
            request.setConnectTimeout(timeoutMillis);
            request.setReadTimeout(timeoutMillis);
        };
        return new Calendar.Builder(httpTransport, jsonFactory, initializer)
                .setApplicationName(applicationName)
                .build();
    }

    private <T> RemoteResult<T> call(String operation, RemoteCall<T> call) {
        try {
            return RemoteResult.success(call.execute());
        } catch (HttpResponseException e) {
            return classify(operation, e);
        } catch (IOException e) {
            return transportFailure(operation, e);
        }
    }

    private <T> RemoteResult<T> classify(String operation, HttpResponseException e) {
        int status = e.getStatusCode();
        String message = operation + " 실패: HTTP " + status + " " + e.getStatusMessage();
        if (status == 401) {
            return RemoteResult.unauthorized(new RemoteCalendarException(RemoteCalendarException.Kind.REJECTED,
                    status, message, e));
        }
        if (status == 429 || (status == 403 && hasRateLimitReason(e))) {
            Duration retryAfter = retryAfter(e.getHeaders().getFirstHeaderStringValue("Retry-After"));
            log.debugf("속도 제한 응답: op=%s retryAfter=%s", operation, retryAfter);
            return RemoteResult.rateLimited(new RemoteCalendarException(RemoteCalendarException.Kind.RATE_LIMITED,
                    status, message, e), retryAfter);
        }
        if (status >= 500) {
            return RemoteResult.transientFailure(new RemoteCalendarException(RemoteCalendarException.Kind.TRANSIENT,
                    status, message, e));
        }
        RemoteCalendarException.Kind kind = switch (status) {
            case 404, 410 -> RemoteCalendarException.Kind.NOT_FOUND;
            case 409, 412 -> RemoteCalendarException.Kind.CONFLICT;
            default -> RemoteCalendarException.Kind.REJECTED;
        };
        return RemoteResult.failed(new RemoteCalendarException(kind, status, message, e));
    }

    private static <T> RemoteResult<T> transportFailure(String operation, IOException e) {
        return RemoteResult.transientFailure(new RemoteCalendarException(RemoteCalendarException.Kind.TRANSIENT, 0,
                operation + " 네트워크 오류: " + e.getMessage(), e));
    }

    private static boolean hasRateLimitReason(HttpResponseException e) {
        if (!(e instanceof GoogleJsonResponseException json) || json.getDetails() == null
                || json.getDetails().getErrors() == null) {
            return false;
        }
        for (GoogleJsonError.ErrorInfo error : json.getDetails().getErrors()) {
            if (RATE_LIMIT_REASONS.contains(error.getReason())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Retry-After 는 초 단위 숫자이거나 HTTP 날짜다. 해석할 수 없으면 null.
     */
    Duration retryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        String value = header.trim();
        try {
            return Duration.ofSeconds(Math.max(0, Long.parseLong(value)));
        } catch (NumberFormatException ignored) {
            // HTTP 날짜 형식일 수 있다.
        }
        try {
            ZonedDateTime at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
            Duration wait = Duration.between(clockPort.now(), at.toInstant());
            return wait.isNegative() ? Duration.ZERO : wait;
        } catch (DateTimeParseException e) {
            log.debugf("Retry-After 헤더를 해석할 수 없습니다: %s", value);
            return null;
        }
    }

    /**
     * 시작 시간이 없는 항목은 재조정할 수 없어 건너뛴다(null).
     */
    static EventDescriptor toDescriptor(Event event) {
        if (CANCELLED.equals(event.getStatus())) {
            return EventDescriptor.deletion(event.getId());
        }
        Instant start = instantOf(event.getStart());
        if (start == null) {
            log.debugf("시작 시간이 없는 이벤트를 건너뜁니다: id=%s", event.getId());
            return null;
        }
        Instant end = instantOf(event.getEnd());
        boolean allDay = event.getStart().getDate() != null;
        return new EventDescriptor(event.getId(), event.getSummary(), event.getDescription(), event.getLocation(),
                start, end == null ? start : end, allDay, revisionOf(event), false);
    }

    private static String revisionOf(Event event) {
        if (event.getEtag() != null) {
            return event.getEtag();
        }
        return event.getUpdated() == null ? null : event.getUpdated().toStringRfc3339();
    }

    private static Instant instantOf(EventDateTime time) {
        if (time == null) {
            return null;
        }
        DateTime value = time.getDateTime() != null ? time.getDateTime() : time.getDate();
        return value == null ? null : Instant.ofEpochMilli(value.getValue());
    }

    /**
     * 종일 이벤트의 종료일은 제공자 규칙상 배타적이므로 시작일 다음 날 이상으로 맞춘다.
     */
    static Event applyDraft(Event target, EventDraft draft) {
        target.setSummary(draft.title())
                .setDescription(draft.description())
                .setLocation(draft.location());
        if (draft.allDay()) {
            LocalDate startDate = LocalDate.ofInstant(draft.startAt(), ZoneOffset.UTC);
            LocalDate endDate = LocalDate.ofInstant(draft.endAt(), ZoneOffset.UTC);
            if (!endDate.isAfter(startDate)) {
                endDate = startDate.plusDays(1);
            }
            target.setStart(new EventDateTime().setDate(new DateTime(startDate.toString())));
            target.setEnd(new EventDateTime().setDate(new DateTime(endDate.toString())));
        } else {
            target.setStart(new EventDateTime()
                    .setDateTime(new DateTime(false, draft.startAt().toEpochMilli(), 0))
                    .setTimeZone("UTC"));
            target.setEnd(new EventDateTime()
                    .setDateTime(new DateTime(false, draft.endAt().toEpochMilli(), 0))
                    .setTimeZone("UTC"));
        }
        return target;
    }

    @FunctionalInterface
    private interface RemoteCall<T> {
        T execute() throws IOException;
    }
}
