package com.my.calsync.domain.port.out;

import com.my.calsync.domain.model.CalendarDescriptor;
import com.my.calsync.domain.model.CalendarSource;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface CalendarSourceRepositoryPort {

    Optional<CalendarSource> findById(long id);

    Optional<CalendarSource> findOwned(long id, String userId);

    List<CalendarSource> findByUser(String userId);

    List<String> findUsersWithSources();

    /**
     * (userId, externalCalendarId) 기준으로 연결하거나 이름/시간대 등을 갱신한다. 커서와 상태는 건드리지 않는다.
     */
    CalendarSource link(String userId, String provider, CalendarDescriptor descriptor);

    /**
     * 소스와 그 이벤트를 함께 삭제한다.
     */
    boolean unlink(long id, String userId);

    /**
     * running 이 아니거나 staleBefore 이전에 시작된 running 일 때만 running 으로 바꾼다.
     *
     * @return 상태를 획득했으면 true
     */
    boolean tryStartRun(long id, Instant startedAt, Instant staleBefore);

    /**
     * runStartedAt 으로 시작한 실행이 아직 소유권을 갖고 있을 때만 시작 시각을 갱신한다.
     *
     * @return 소유권이 유지되면 true
     */
    boolean heartbeat(long id, Instant runStartedAt, Instant now);

    /**
     * @return 다른 실행이 소유권을 가져가 기록하지 못했으면 false
     */
    boolean completeRun(long id, Instant runStartedAt, String nextCursor, Instant syncedAt);

    /**
     * 커서는 그대로 두고 상태만 error 로 바꾼다. 소유권이 없으면 아무것도 바꾸지 않는다.
     */
    boolean failRun(long id, Instant runStartedAt, String error);
}
