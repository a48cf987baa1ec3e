package com.my.calsync.adapter.in.rabbitmq;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.my.calsync.domain.exception.InvalidRequestException;
import com.my.calsync.domain.model.EventDraft;
import com.my.calsync.domain.model.EventPatch;
import com.my.calsync.domain.model.TimeRange;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * 왜: 큐로 들어오는 명령 JSON 의 형식을 어댑터 경계에서 검증하고 도메인 입력으로 바꾸기 위함.
 * 시각 필드는 오프셋이 포함된 ISO-8601 문자열이다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CalendarCommand(String commandId,
                              String userId,
                              String type,
                              Long calendarSourceId,
                              String externalEventId,
                              String code,
                              String state,
                              String from,
                              String to,
                              String title,
                              String description,
                              String location,
                              String startAt,
                              String endAt,
                              Boolean allDay) {

    public CalendarCommand {
        Objects.requireNonNull(commandId, "commandId");
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(type, "type");
        if (commandId.isBlank() || userId.isBlank() || type.isBlank()) {
            throw new InvalidRequestException("명령 필드가 비어 있습니다.");
        }
    }

    public CommandType commandType() {
        try {
            return CommandType.valueOf(type);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("알 수 없는 명령 유형입니다: " + type, e);
        }
    }

    public long requireCalendarSourceId() {
        if (calendarSourceId == null) {
            throw new InvalidRequestException("calendarSourceId 가 필요합니다.");
        }
        return calendarSourceId;
    }

    public String requireExternalEventId() {
        return require(externalEventId, "externalEventId");
    }

    public String requireCode() {
        return require(code, "code");
    }

    public String requireState() {
        return require(state, "state");
    }

    public TimeRange toRange() {
        Instant start = parseInstant(from, "from");
        Instant end = parseInstant(to, "to");
        try {
            return new TimeRange(start, end);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage(), e);
        }
    }

    public EventDraft toDraft() {
        return new EventDraft(title, description, location, parseInstant(startAt, "startAt"),
                parseInstant(endAt, "endAt"), Boolean.TRUE.equals(allDay));
    }

    public EventPatch toPatch() {
        return new EventPatch(title, description, location, parseInstant(startAt, "startAt"),
                parseInstant(endAt, "endAt"), allDay);
    }

    private static String require(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new InvalidRequestException(name + " 가 필요합니다.");
        }
        return value;
    }

    private static Instant parseInstant(String value, String name) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            throw new InvalidRequestException(name + " 형식이 올바르지 않습니다: " + value, e);
        }
    }
}
