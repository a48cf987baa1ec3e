package com.my.calsync.domain.service;

import com.my.calsync.domain.exception.AuthException;
import com.my.calsync.domain.exception.InvalidRequestException;
import com.my.calsync.domain.exception.NotFoundException;
import com.my.calsync.domain.model.CalendarDescriptor;
import com.my.calsync.domain.model.CalendarSource;
import com.my.calsync.domain.model.ConnectedAccount;
import com.my.calsync.domain.model.OAuthCredential;
import com.my.calsync.domain.model.TokenGrant;
import com.my.calsync.domain.port.in.CalendarConnectionUseCase;
import com.my.calsync.domain.port.out.CalendarSourceRepositoryPort;
import com.my.calsync.domain.port.out.ClockPort;
import com.my.calsync.domain.port.out.OAuthProviderPort;
import com.my.calsync.domain.port.out.OAuthStatePort;
import org.jboss.logging.Logger;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * 왜: 인가 흐름(state 발급/검증, 코드 교환)과 캘린더 연결/해제를 도메인 규칙에 맞게 조율하기 위함.
 */
public class CalendarConnectionService implements CalendarConnectionUseCase {

    private static final Logger log = Logger.getLogger(CalendarConnectionService.class);
    private static final int STATE_BYTES = 32;

    private final CredentialStore credentialStore;
    private final OAuthProviderPort oauthProvider;
    private final OAuthStatePort oauthStatePort;
    private final RemoteCalendarClient remoteCalendarClient;
    private final CalendarSourceRepositoryPort calendarSourceRepository;
    private final ClockPort clockPort;
    private final Duration stateTtl;
    private final SecureRandom random = new SecureRandom();

    public CalendarConnectionService(CredentialStore credentialStore,
                                     OAuthProviderPort oauthProvider,
                                     OAuthStatePort oauthStatePort,
                                     RemoteCalendarClient remoteCalendarClient,
                                     CalendarSourceRepositoryPort calendarSourceRepository,
                                     ClockPort clockPort,
                                     Duration stateTtl) {
        this.credentialStore = credentialStore;
        this.oauthProvider = oauthProvider;
        this.oauthStatePort = oauthStatePort;
        this.remoteCalendarClient = remoteCalendarClient;
        this.calendarSourceRepository = calendarSourceRepository;
        this.clockPort = clockPort;
        this.stateTtl = stateTtl;
    }

    @Override
    public String authorize(String userId) {
        requireUser(userId);
        byte[] bytes = new byte[STATE_BYTES];
        random.nextBytes(bytes);
        String state = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        oauthStatePort.save(state, userId, clockPort.now());
        log.infof("제공자 인가 페이지로 안내합니다: user=%s", userId);
        return oauthProvider.authorizationUrl(state);
    }

    /**
     * state 는 한 번만 쓸 수 있고 발급 후 일정 시간이 지나면 무효다.
     */
    @Override
    public ConnectedAccount oauthCallback(String code, String state) {
        if (code == null || code.isBlank() || state == null || state.isBlank()) {
            throw new AuthException(AuthException.Reason.INVALID_STATE, "인가 코드 또는 state 가 비어 있습니다.");
        }
        String userId = oauthStatePort.consume(state, clockPort.now().minus(stateTtl))
                .orElseThrow(() -> new AuthException(AuthException.Reason.INVALID_STATE,
                        "알 수 없거나 만료된 state 입니다."));
        TokenGrant tokens = oauthProvider.exchangeCode(code);
        String accountId = oauthProvider.fetchAccountId(tokens.accessToken());
        OAuthCredential stored = credentialStore.store(userId, accountId, tokens);
        return ConnectedAccount.of(stored);
    }

    @Override
    public void disconnect(String userId) {
        requireUser(userId);
        if (!credentialStore.disconnect(userId, credentialStore.provider())) {
            log.debugf("해제할 연결이 없습니다: user=%s", userId);
        }
    }

    @Override
    public List<ConnectedAccount> connectionStatus(String userId) {
        requireUser(userId);
        return credentialStore.connectedAccounts(userId);
    }

    @Override
    public List<CalendarSource> refreshCalendarList(String userId) {
        requireUser(userId);
        List<CalendarSource> linked = new ArrayList<>();
        for (CalendarDescriptor descriptor : remoteCalendarClient.listCalendars(userId)) {
            linked.add(calendarSourceRepository.link(userId, credentialStore.provider(), descriptor));
        }
        log.infof("캘린더 목록을 갱신했습니다: user=%s count=%d", userId, linked.size());
        return linked;
    }

    @Override
    public List<CalendarSource> listCalendarSources(String userId) {
        requireUser(userId);
        return calendarSourceRepository.findByUser(userId);
    }

    @Override
    public CalendarSource getCalendarSource(String userId, long calendarSourceId) {
        requireUser(userId);
        return calendarSourceRepository.findOwned(calendarSourceId, userId)
                .orElseThrow(() -> new NotFoundException("캘린더 소스를 찾을 수 없습니다: " + calendarSourceId));
    }

    @Override
    public void unlinkCalendar(String userId, long calendarSourceId) {
        requireUser(userId);
        if (!calendarSourceRepository.unlink(calendarSourceId, userId)) {
            throw new NotFoundException("캘린더 소스를 찾을 수 없습니다: " + calendarSourceId);
        }
        log.infof("캘린더 연결을 해제했습니다: user=%s calendarSourceId=%d", userId, calendarSourceId);
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new InvalidRequestException("userId가 비어 있습니다.");
        }
    }
}
