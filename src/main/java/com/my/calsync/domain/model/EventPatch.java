package com.my.calsync.domain.model;

import java.time.Instant;

/**
 * 왜: 부분 수정 요청을 표현한다. null 필드는 "변경 없음"을 뜻한다.
 */
public record EventPatch(String title,
                         String description,
                         String location,
                         Instant startAt,
                         Instant endAt,
                         Boolean allDay) {

    public EventDraft applyTo(ExternalEvent current) {
        return new EventDraft(
                title != null ? title : current.title(),
                description != null ? description : current.description(),
                location != null ? location : current.location(),
                startAt != null ? startAt : current.startAt(),
                endAt != null ? endAt : current.endAt(),
                allDay != null ? allDay : current.allDay()
        );
    }
}
