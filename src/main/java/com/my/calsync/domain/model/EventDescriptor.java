package com.my.calsync.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 왜: 제공자가 보고한 이벤트 한 건(또는 삭제 표시)을 재조정 로직에 넘기기 위한 중립 표현.
 * deleted 가 참이면 나머지 필드는 비어 있을 수 있다.
 */
public record EventDescriptor(String externalId,
                              String title,
                              String description,
                              String location,
                              Instant startAt,
                              Instant endAt,
                              boolean allDay,
                              String revision,
                              boolean deleted) {
    public EventDescriptor {
        Objects.requireNonNull(externalId, "externalId");
        if (!deleted) {
            Objects.requireNonNull(startAt, "startAt");
            Objects.requireNonNull(endAt, "endAt");
            title = title == null || title.isBlank() ? "Untitled Event" : title;
        }
    }

    public static EventDescriptor deletion(String externalId) {
        return new EventDescriptor(externalId, null, null, null, null, null, false, null, true);
    }
}
