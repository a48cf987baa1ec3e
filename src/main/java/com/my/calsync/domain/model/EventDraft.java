package com.my.calsync.domain.model;

import com.my.calsync.domain.exception.InvalidRequestException;

import java.time.Instant;
import java.util.Objects;

/**
 * 왜: 생성/수정 요청으로 제공자에 보낼 이벤트 필드를 검증된 한 구조로 묶기 위함.
 */
public record EventDraft(String title,
                         String description,
                         String location,
                         Instant startAt,
                         Instant endAt,
                         boolean allDay) {
    public EventDraft {
        if (title == null || title.isBlank()) {
            throw new InvalidRequestException("이벤트 제목은 비어 있을 수 없습니다.");
        }
        if (startAt == null || endAt == null) {
            throw new InvalidRequestException("이벤트 시작/종료 시간이 필요합니다.");
        }
        boolean ordered = allDay ? !endAt.isBefore(startAt) : endAt.isAfter(startAt);
        if (!ordered) {
            throw new InvalidRequestException("이벤트 종료 시간은 시작 시간 이후여야 합니다.");
        }
    }

    public static EventDraft of(ExternalEvent event) {
        Objects.requireNonNull(event, "event");
        return new EventDraft(event.title(), event.description(), event.location(), event.startAt(), event.endAt(),
                event.allDay());
    }
}
