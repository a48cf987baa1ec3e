package com.my.calsync.domain.port.in;

import com.my.calsync.domain.model.CalendarSource;
import com.my.calsync.domain.model.ConnectedAccount;

import java.util.List;

/**
 * 왜: 제공자 계정 연결(인가, 콜백, 해제)과 캘린더 연결 관리를 하나의 진입점으로 모으기 위함.
 */
public interface CalendarConnectionUseCase {

    String authorize(String userId);

    ConnectedAccount oauthCallback(String code, String state);

    void disconnect(String userId);

    List<ConnectedAccount> connectionStatus(String userId);

    List<CalendarSource> refreshCalendarList(String userId);

    List<CalendarSource> listCalendarSources(String userId);

    CalendarSource getCalendarSource(String userId, long calendarSourceId);

    void unlinkCalendar(String userId, long calendarSourceId);
}
