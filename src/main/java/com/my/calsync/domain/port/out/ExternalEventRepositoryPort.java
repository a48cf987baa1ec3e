package com.my.calsync.domain.port.out;

import com.my.calsync.domain.model.ExternalEvent;
import com.my.calsync.domain.model.TimeRange;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface ExternalEventRepositoryPort {

    /**
     * tombstoned 행도 포함해 조회한다.
     */
    Optional<ExternalEvent> find(long calendarSourceId, String externalEventId);

    ExternalEvent insert(ExternalEvent event);

    void update(ExternalEvent event);

    boolean tombstone(long calendarSourceId, String externalEventId, Instant modifiedAt);

    Set<String> findLiveExternalIds(long calendarSourceId);

    Set<String> findTombstonedExternalIds(long calendarSourceId);

    int purge(long calendarSourceId, Collection<String> externalEventIds);

    /**
     * tombstoned 행을 제외하고 시작 시간 오름차순.
     */
    List<ExternalEvent> findLive(long calendarSourceId, TimeRange range);

    List<ExternalEvent> findLiveForUser(String userId, TimeRange range);
}
