package com.my.calsync.domain.port.in;

import com.my.calsync.domain.model.EventDraft;
import com.my.calsync.domain.model.EventPatch;
import com.my.calsync.domain.model.ExternalEvent;
import com.my.calsync.domain.model.TimeRange;

import java.util.List;

/**
 * 왜: 원격과 로컬 양쪽에 존재해야 하는 이벤트의 CRUD 를 같은 일관성 규칙으로 다루기 위함.
 */
public interface ManageEventsUseCase {

    ExternalEvent create(String userId, long calendarSourceId, EventDraft draft);

    /**
     * 로컬 복제본에서 읽는다. tombstone 된 이벤트는 없는 것으로 본다.
     */
    ExternalEvent get(String userId, long calendarSourceId, String externalEventId);

    ExternalEvent update(String userId, long calendarSourceId, String externalEventId, EventPatch patch);

    void delete(String userId, long calendarSourceId, String externalEventId);

    List<ExternalEvent> list(String userId, long calendarSourceId, TimeRange range);

    List<ExternalEvent> listForUser(String userId, TimeRange range);
}
