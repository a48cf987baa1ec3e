package com.my.calsync.domain.port.out;

import com.my.calsync.domain.model.CalendarDescriptor;
import com.my.calsync.domain.model.EventDescriptor;
import com.my.calsync.domain.model.EventDraft;
import com.my.calsync.domain.model.EventPage;
import com.my.calsync.domain.model.RemoteResult;

import java.util.List;

/**
 * 왜: 제공자별 캘린더 API 차이를 이 계약 뒤에 가두어 동기화/이벤트 관리가 제공자 타입에 의존하지 않도록 하기 위함.
 * 구현은 예외를 던지지 않고 모든 실패를 태그된 결과로 돌려준다.
 */
public interface RemoteCalendarPort {

    RemoteResult<List<CalendarDescriptor>> listCalendars(String accessToken);

    /**
     * @param cursor    증분 동기화 커서. null 이면 전체 목록.
     * @param pageToken 같은 목록의 다음 페이지 토큰. 첫 페이지는 null.
     */
    RemoteResult<EventPage> listEvents(String accessToken, String calendarId, String cursor, String pageToken);

    RemoteResult<EventDescriptor> createEvent(String accessToken, String calendarId, EventDraft draft);

    /**
     * @param expectedRevision 로컬이 알고 있는 리비전. 원격과 다르면 CONFLICT.
     */
    RemoteResult<EventDescriptor> updateEvent(String accessToken, String calendarId, String externalId,
                                              EventDraft draft, String expectedRevision);

    RemoteResult<Void> deleteEvent(String accessToken, String calendarId, String externalId);
}
