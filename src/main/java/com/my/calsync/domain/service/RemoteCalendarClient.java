package com.my.calsync.domain.service;

import com.my.calsync.domain.exception.AuthException;
import com.my.calsync.domain.exception.RemoteCalendarException;
import com.my.calsync.domain.model.CalendarDescriptor;
import com.my.calsync.domain.model.CalendarSource;
import com.my.calsync.domain.model.EventDescriptor;
import com.my.calsync.domain.model.EventDraft;
import com.my.calsync.domain.model.EventPage;
import com.my.calsync.domain.model.OAuthCredential;
import com.my.calsync.domain.model.RemoteResult;
import com.my.calsync.domain.port.out.RemoteCalendarPort;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * 왜: 제공자 포트 호출마다 유효한 토큰 확보, 태그 기반 재시도, 401 재인증을 한곳에서 적용해
 * 동기화와 이벤트 관리가 같은 원격 호출 규칙을 공유하도록 하기 위함.
 */
public class RemoteCalendarClient {

    private static final Logger log = Logger.getLogger(RemoteCalendarClient.class);

    private final RemoteCalendarPort remoteCalendarPort;
    private final CredentialStore credentialStore;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public RemoteCalendarClient(RemoteCalendarPort remoteCalendarPort,
                                CredentialStore credentialStore,
                                RetryPolicy retryPolicy,
                                Sleeper sleeper) {
        this.remoteCalendarPort = remoteCalendarPort;
        this.credentialStore = credentialStore;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    public List<CalendarDescriptor> listCalendars(String userId) {
        return execute(userId, credentialStore.provider(), "listCalendars",
                remoteCalendarPort::listCalendars);
    }

    /**
     * 제공자가 커서를 거부하면 예외 대신 cursorInvalid 가 켜진 페이지를 돌려준다.
     */
    public EventPage listEvents(CalendarSource calendar, String cursor, String pageToken) {
        return execute(calendar.userId(), calendar.provider(), "listEvents",
                token -> remoteCalendarPort.listEvents(token, calendar.externalCalendarId(), cursor, pageToken));
    }

    public EventDescriptor createEvent(CalendarSource calendar, EventDraft draft) {
        return execute(calendar.userId(), calendar.provider(), "createEvent",
                token -> remoteCalendarPort.createEvent(token, calendar.externalCalendarId(), draft));
    }

    public EventDescriptor updateEvent(CalendarSource calendar, String externalId, EventDraft draft,
                                       String expectedRevision) {
        return execute(calendar.userId(), calendar.provider(), "updateEvent",
                token -> remoteCalendarPort.updateEvent(token, calendar.externalCalendarId(), externalId, draft,
                        expectedRevision));
    }

    /**
     * 이미 없는 이벤트(NOT_FOUND)는 삭제 성공으로 본다.
     */
    public void deleteEvent(CalendarSource calendar, String externalId) {
        execute(calendar.userId(), calendar.provider(), "deleteEvent",
                token -> absentAsDeleted(remoteCalendarPort.deleteEvent(token, calendar.externalCalendarId(),
                        externalId)));
    }

    private <T> T execute(String userId, String provider, String operation, Function<String, RemoteResult<T>> call) {
        OAuthCredential credential = credentialStore.getValidCredential(userId, provider);
        boolean reauthenticated = false;
        int attempt = 0;
        while (true) {
            attempt++;
            RemoteResult<T> result = call.apply(credential.accessToken());
            if (result.isSuccess()) {
                return result.value();
            }
            if (result.tag() == RemoteResult.Tag.UNAUTHORIZED) {
                if (reauthenticated) {
                    throw new AuthException(AuthException.Reason.REFRESH_FAILED,
                            "갱신한 토큰도 제공자가 거부했습니다: " + operation, result.error());
                }
                log.infof("제공자가 토큰을 거부해 갱신 후 다시 시도합니다: op=%s user=%s", operation, userId);
                credential = credentialStore.forceRefresh(userId, provider, credential.accessToken());
                reauthenticated = true;
                attempt--;
                continue;
            }
            Optional<Duration> delay = retryPolicy.delayBeforeRetry(result, attempt);
            if (delay.isEmpty()) {
                if (result.tag() == RemoteResult.Tag.TRANSIENT || result.tag() == RemoteResult.Tag.RATE_LIMITED) {
                    log.warnf("원격 호출 재시도 한도를 초과했습니다: op=%s attempts=%d", operation, attempt);
                }
                throw result.error();
            }
            log.warnf("원격 호출 실패(%s), %dms 후 재시도합니다: op=%s attempt=%d/%d", result.tag(),
                    delay.get().toMillis(), operation, attempt, retryPolicy.maxAttempts());
            pause(delay.get(), operation);
            // 대기 중 연결 해제나 만료가 있었을 수 있다.
            credential = credentialStore.getValidCredential(userId, provider);
        }
    }

    private void pause(Duration delay, String operation) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteCalendarException(RemoteCalendarException.Kind.TRANSIENT, 0,
                    "재시도 대기 중 중단되었습니다: " + operation, e);
        }
    }

    private static RemoteResult<Void> absentAsDeleted(RemoteResult<Void> result) {
        if (result.tag() == RemoteResult.Tag.FAILED
                && result.error().kind() == RemoteCalendarException.Kind.NOT_FOUND) {
            return RemoteResult.success(null);
        }
        return result;
    }
}
