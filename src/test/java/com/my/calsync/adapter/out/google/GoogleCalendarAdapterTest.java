package com.my.calsync.adapter.out.google;

import com.google.api.client.json.jackson2.JacksonFactory;
import com.google.api.client.util.DateTime;
import com.google.api.services.calendar.model.Event;
import com.my.calsync.domain.exception.RemoteCalendarException;
import com.my.calsync.domain.model.CalendarDescriptor;
import com.my.calsync.domain.model.EventDescriptor;
import com.my.calsync.domain.model.EventDraft;
import com.my.calsync.domain.model.EventPage;
import com.my.calsync.domain.model.RemoteResult;
import com.my.calsync.domain.service.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GoogleCalendarAdapterTest {

    private static final String TOKEN = "access-token";
    private static final String CALENDAR = "work@example.com";

    private ScriptedTransport transport;
    private MutableClock clock;
    private GoogleCalendarAdapter adapter;

    @BeforeEach
    void setUp() {
        transport = new ScriptedTransport();
        clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));
        adapter = new GoogleCalendarAdapter(transport, JacksonFactory.getDefaultInstance(), "calendar-sync-test",
                5000, 50, clock);
    }

    @Test
    void listCalendarsFollowsPagesAndPrefersOverride() {
        transport.json(200, """
                {"items":[{"id":"primary@example.com","summary":"Me","primary":true,"timeZone":"Asia/Seoul"}],
                 "nextPageToken":"p2"}
                """)
                .json(200, """
                {"items":[{"id":"team@example.com","summary":"team","summaryOverride":"Team","timeZone":"UTC"}]}
                """);

        RemoteResult<List<CalendarDescriptor>> result = adapter.listCalendars(TOKEN);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value()).containsExactly(
                new CalendarDescriptor("primary@example.com", "Me", true, "Asia/Seoul"),
                new CalendarDescriptor("team@example.com", "Team", false, "UTC"));
        assertThat(transport.requests()).hasSize(2);
        assertThat(transport.requests().get(0).getFirstHeaderValue("Authorization")).isEqualTo("Bearer " + TOKEN);
    }

    @Test
    void listEventsMapsCancelledAllDayAndTimedEvents() {
        transport.json(200, """
                {"items":[
                  {"id":"a","status":"confirmed","summary":"Standup","etag":"\\"e1\\"",
                   "start":{"dateTime":"2026-03-02T09:00:00Z"},"end":{"dateTime":"2026-03-02T09:30:00Z"}},
                  {"id":"b","status":"confirmed","summary":"Holiday","updated":"2026-02-20T10:00:00.000Z",
                   "start":{"date":"2026-03-05"},"end":{"date":"2026-03-06"}},
                  {"id":"c","status":"cancelled"},
                  {"id":"d","status":"confirmed","summary":"No start"}
                 ],
                 "nextSyncToken":"sync-2"}
                """);

        RemoteResult<EventPage> result = adapter.listEvents(TOKEN, CALENDAR, "sync-1", null);

        EventPage page = result.value();
        assertThat(page.nextCursor()).isEqualTo("sync-2");
        assertThat(page.hasNextPage()).isFalse();
        assertThat(page.events()).extracting(EventDescriptor::externalId).containsExactly("a", "b", "c");
        EventDescriptor timed = page.events().get(0);
        assertThat(timed.startAt()).isEqualTo(Instant.parse("2026-03-02T09:00:00Z"));
        assertThat(timed.revision()).isEqualTo("\"e1\"");
        assertThat(timed.allDay()).isFalse();
        EventDescriptor allDay = page.events().get(1);
        assertThat(allDay.allDay()).isTrue();
        assertThat(allDay.revision()).isNotNull();
        assertThat(page.events().get(2).deleted()).isTrue();
        assertThat(transport.requests().get(0).getUrl()).contains("syncToken=sync-1").contains("singleEvents=true");
    }

    @Test
    void goneWithCursorIsInvalidCursorPage() {
        transport.status(410, null, null);

        RemoteResult<EventPage> result = adapter.listEvents(TOKEN, CALENDAR, "stale", null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value().cursorInvalid()).isTrue();
    }

    @Test
    void goneWithoutCursorIsNotFound() {
        transport.status(410, null, null);

        RemoteResult<EventPage> result = adapter.listEvents(TOKEN, CALENDAR, null, null);

        assertThat(result.tag()).isEqualTo(RemoteResult.Tag.FAILED);
        assertThat(result.error().kind()).isEqualTo(RemoteCalendarException.Kind.NOT_FOUND);
    }

    @Test
    void tooManyRequestsCarriesRetryAfter() {
        transport.status(429, "Retry-After", "7");

        RemoteResult<EventPage> result = adapter.listEvents(TOKEN, CALENDAR, null, null);

        assertThat(result.tag()).isEqualTo(RemoteResult.Tag.RATE_LIMITED);
        assertThat(result.retryAfter()).isEqualTo(Duration.ofSeconds(7));
    }

    @Test
    void forbiddenWithRateLimitReasonIsRateLimited() {
        transport.json(403, """
                {"error":{"code":403,"message":"Rate Limit Exceeded",
                  "errors":[{"domain":"usageLimits","reason":"userRateLimitExceeded","message":"Rate Limit Exceeded"}]}}
                """);

        RemoteResult<List<CalendarDescriptor>> result = adapter.listCalendars(TOKEN);

        assertThat(result.tag()).isEqualTo(RemoteResult.Tag.RATE_LIMITED);
        assertThat(result.retryAfter()).isNull();
    }

    @Test
    void plainForbiddenIsRejected() {
        transport.json(403, """
                {"error":{"code":403,"message":"Forbidden","errors":[{"domain":"global","reason":"forbidden"}]}}
                """);

        RemoteResult<List<CalendarDescriptor>> result = adapter.listCalendars(TOKEN);

        assertThat(result.tag()).isEqualTo(RemoteResult.Tag.FAILED);
        assertThat(result.error().kind()).isEqualTo(RemoteCalendarException.Kind.REJECTED);
    }

    @Test
    void unauthorizedAndServerErrorsAreTagged() {
        transport.status(401, null, null).status(503, null, null);

        assertThat(adapter.listCalendars(TOKEN).tag()).isEqualTo(RemoteResult.Tag.UNAUTHORIZED);
        assertThat(adapter.listCalendars(TOKEN).tag()).isEqualTo(RemoteResult.Tag.TRANSIENT);
    }

    @Test
    void updateWithStaleRevisionIsConflictWithoutWrite() {
        transport.json(200, """
                {"id":"a","status":"confirmed","summary":"Standup","etag":"\\"e2\\"",
                 "start":{"dateTime":"2026-03-02T09:00:00Z"},"end":{"dateTime":"2026-03-02T09:30:00Z"}}
                """);

        RemoteResult<EventDescriptor> result = adapter.updateEvent(TOKEN, CALENDAR, "a", draft(), "\"e1\"");

        assertThat(result.error().kind()).isEqualTo(RemoteCalendarException.Kind.CONFLICT);
        assertThat(transport.methods()).containsExactly("GET");
    }

    @Test
    void updateWithMatchingRevisionSendsIfMatch() {
        transport.json(200, """
                {"id":"a","status":"confirmed","summary":"Standup","etag":"\\"e1\\"",
                 "start":{"dateTime":"2026-03-02T09:00:00Z"},"end":{"dateTime":"2026-03-02T09:30:00Z"}}
                """)
                .json(200, """
                {"id":"a","status":"confirmed","summary":"Retro","etag":"\\"e2\\"",
                 "start":{"dateTime":"2026-03-02T10:00:00Z"},"end":{"dateTime":"2026-03-02T11:00:00Z"}}
                """);

        RemoteResult<EventDescriptor> result = adapter.updateEvent(TOKEN, CALENDAR, "a", draft(), "\"e1\"");

        assertThat(result.value().revision()).isEqualTo("\"e2\"");
        assertThat(transport.methods()).containsExactly("GET", "PUT");
        assertThat(transport.requests().get(1).getFirstHeaderValue("If-Match")).isEqualTo("\"e1\"");
    }

    @Test
    void updateOfCancelledEventIsNotFound() {
        transport.json(200, """
                {"id":"a","status":"cancelled"}
                """);

        RemoteResult<EventDescriptor> result = adapter.updateEvent(TOKEN, CALENDAR, "a", draft(), null);

        assertThat(result.error().kind()).isEqualTo(RemoteCalendarException.Kind.NOT_FOUND);
    }

    @Test
    void deleteOfMissingEventIsNotFound() {
        transport.status(404, null, null).empty(204);

        assertThat(adapter.deleteEvent(TOKEN, CALENDAR, "gone").error().kind())
                .isEqualTo(RemoteCalendarException.Kind.NOT_FOUND);
        assertThat(adapter.deleteEvent(TOKEN, CALENDAR, "a").isSuccess()).isTrue();
    }

    @Test
    void retryAfterAcceptsSecondsAndHttpDates() {
        assertThat(adapter.retryAfter("12")).isEqualTo(Duration.ofSeconds(12));
        assertThat(adapter.retryAfter("Sun, 01 Mar 2026 09:00:30 GMT")).isEqualTo(Duration.ofSeconds(30));
        assertThat(adapter.retryAfter("Sun, 01 Mar 2026 08:00:00 GMT")).isEqualTo(Duration.ZERO);
        assertThat(adapter.retryAfter("soon")).isNull();
        assertThat(adapter.retryAfter(null)).isNull();
    }

    @Test
    void allDayDraftGetsExclusiveEndDate() {
        EventDraft sameDay = new EventDraft("Holiday", null, null, Instant.parse("2026-03-05T00:00:00Z"),
                Instant.parse("2026-03-05T00:00:00Z"), true);

        Event event = GoogleCalendarAdapter.applyDraft(new Event(), sameDay);

        assertThat(event.getStart().getDate()).isEqualTo(new DateTime("2026-03-05"));
        assertThat(event.getEnd().getDate()).isEqualTo(new DateTime("2026-03-06"));
        assertThat(event.getStart().getDateTime()).isNull();
    }

    private static EventDraft draft() {
        return new EventDraft("Retro", null, null, Instant.parse("2026-03-02T10:00:00Z"),
                Instant.parse("2026-03-02T11:00:00Z"), false);
    }
}
