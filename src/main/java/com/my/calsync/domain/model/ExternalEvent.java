package com.my.calsync.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 왜: 원격 이벤트의 로컬 복제본. 삭제는 tombstoned 플래그로 표시해 재조정과 삭제 재시도를 멱등하게 유지한다.
 */
public record ExternalEvent(long id,
                            long calendarSourceId,
                            String externalEventId,
                            String title,
                            String description,
                            String location,
                            Instant startAt,
                            Instant endAt,
                            boolean allDay,
                            String revisionMarker,
                            Instant localModifiedAt,
                            boolean tombstoned) {
    public ExternalEvent {
        Objects.requireNonNull(externalEventId, "externalEventId");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(startAt, "startAt");
        Objects.requireNonNull(endAt, "endAt");
    }

    public static ExternalEvent fromDescriptor(long calendarSourceId, EventDescriptor descriptor, Instant now) {
        return new ExternalEvent(0L, calendarSourceId, descriptor.externalId(), descriptor.title(),
                descriptor.description(), descriptor.location(), descriptor.startAt(), descriptor.endAt(),
                descriptor.allDay(), descriptor.revision(), now, false);
    }

    public ExternalEvent overwrittenBy(EventDescriptor descriptor, Instant now) {
        return new ExternalEvent(id, calendarSourceId, externalEventId, descriptor.title(), descriptor.description(),
                descriptor.location(), descriptor.startAt(), descriptor.endAt(), descriptor.allDay(),
                descriptor.revision(), now, false);
    }
}
