package com.my.calsync.domain.model;

import java.util.List;

/**
 * 왜: 이벤트 목록 한 페이지와 다음 페이지/다음 커서, 커서 무효 여부를 함께 돌려주기 위함.
 * nextCursor 는 마지막 페이지에서만 채워진다.
 */
public record EventPage(List<EventDescriptor> events,
                        String nextPageToken,
                        String nextCursor,
                        boolean cursorInvalid) {
    public EventPage {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static EventPage invalidCursor() {
        return new EventPage(List.of(), null, null, true);
    }

    public boolean hasNextPage() {
        return nextPageToken != null;
    }
}
