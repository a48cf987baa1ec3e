package com.my.calsync.domain.service;

import com.my.calsync.domain.exception.AuthException;
import com.my.calsync.domain.model.ConnectedAccount;
import com.my.calsync.domain.model.OAuthCredential;
import com.my.calsync.domain.model.TokenGrant;
import com.my.calsync.domain.port.out.ClockPort;
import com.my.calsync.domain.port.out.CredentialRepositoryPort;
import com.my.calsync.domain.port.out.OAuthProviderPort;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 왜: (사용자, 제공자) 별 자격 증명을 보관하고 만료 전에 갱신하되, 동시 갱신 요청을 하나로 합쳐
 * 새로 발급된 토큰이 중복 갱신으로 무효화되는 경합을 막기 위함.
 */
public class CredentialStore {

    private static final Logger log = Logger.getLogger(CredentialStore.class);

    private final CredentialRepositoryPort credentialRepository;
    private final OAuthProviderPort oauthProvider;
    private final ClockPort clockPort;
    private final Duration refreshMargin;
    private final Map<Key, CompletableFuture<OAuthCredential>> inFlight = new ConcurrentHashMap<>();

    public CredentialStore(CredentialRepositoryPort credentialRepository,
                           OAuthProviderPort oauthProvider,
                           ClockPort clockPort,
                           Duration refreshMargin) {
        this.credentialRepository = credentialRepository;
        this.oauthProvider = oauthProvider;
        this.clockPort = clockPort;
        this.refreshMargin = refreshMargin;
    }

    public String provider() {
        return oauthProvider.provider();
    }

    /**
     * 반환 시점에 만료되지 않은 자격 증명을 돌려준다. 만료가 여유 시간 안쪽이면 먼저 갱신한다.
     */
    public OAuthCredential getValidCredential(String userId, String provider) {
        OAuthCredential stored = credentialRepository.find(userId, provider)
                .orElseThrow(() -> notLinked(userId, provider));
        if (!stored.expiresWithin(clockPort.now(), refreshMargin)) {
            return stored;
        }
        return refresh(stored);
    }

    /**
     * 같은 (사용자, 제공자)에 대해 진행 중인 갱신이 있으면 그 결과를 함께 받는다.
     */
    public OAuthCredential refresh(OAuthCredential credential) {
        Key key = new Key(credential.userId(), credential.provider());
        CompletableFuture<OAuthCredential> mine = new CompletableFuture<>();
        CompletableFuture<OAuthCredential> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            log.debugf("진행 중인 토큰 갱신 결과를 기다립니다: user=%s provider=%s", key.userId(), key.provider());
            return await(existing);
        }
        try {
            OAuthCredential refreshed = doRefresh(credential);
            mine.complete(refreshed);
            return refreshed;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    /**
     * 제공자가 401 을 돌려준 경우처럼 저장된 만료 시각과 무관하게 토큰을 새로 받아야 할 때 쓴다.
     * 거부된 토큰이 이미 다른 토큰으로 바뀌어 있으면 제공자를 부르지 않고 저장된 값을 돌려준다.
     *
     * @param rejectedAccessToken 제공자가 거부한 액세스 토큰
     */
    public OAuthCredential forceRefresh(String userId, String provider, String rejectedAccessToken) {
        OAuthCredential stored = credentialRepository.find(userId, provider)
                .orElseThrow(() -> notLinked(userId, provider));
        if (!stored.accessToken().equals(rejectedAccessToken)) {
            log.debugf("거부된 토큰은 이미 교체되었습니다: user=%s provider=%s", userId, provider);
            return stored.expiresWithin(clockPort.now(), refreshMargin) ? refresh(stored) : stored;
        }
        return refresh(new OAuthCredential(stored.userId(), stored.provider(), stored.providerAccountId(),
                rejectedAccessToken, stored.refreshToken(), clockPort.now(), stored.scopes()));
    }

    public OAuthCredential store(String userId, String providerAccountId, TokenGrant tokens) {
        String provider = oauthProvider.provider();
        String refreshToken = tokens.refreshToken();
        if (refreshToken == null) {
            // 재동의 없이 콜백되면 refresh token 이 빠진다. 기존 값을 잃지 않는다.
            refreshToken = credentialRepository.find(userId, provider)
                    .map(OAuthCredential::refreshToken)
                    .orElse(null);
        }
        OAuthCredential credential = new OAuthCredential(userId, provider, providerAccountId, tokens.accessToken(),
                refreshToken, tokens.expiresAt(), tokens.scopes());
        credentialRepository.save(credential);
        log.infof("자격 증명을 저장했습니다: user=%s provider=%s account=%s", userId, provider, providerAccountId);
        return credential;
    }

    /**
     * 삭제 후 이 자격 증명을 읽는 동기화는 다음 원격 호출에서 NOT_LINKED 를 받는다.
     */
    public boolean disconnect(String userId, String provider) {
        boolean removed = credentialRepository.delete(userId, provider);
        if (removed) {
            log.infof("자격 증명 연결을 해제했습니다: user=%s provider=%s", userId, provider);
        }
        return removed;
    }

    public List<ConnectedAccount> connectedAccounts(String userId) {
        return credentialRepository.findByUser(userId).stream()
                .map(ConnectedAccount::of)
                .toList();
    }

    private OAuthCredential doRefresh(OAuthCredential requested) {
        // 앞선 갱신이 방금 끝났다면 제공자를 다시 부르지 않는다.
        OAuthCredential current = credentialRepository.find(requested.userId(), requested.provider())
                .orElseThrow(() -> notLinked(requested.userId(), requested.provider()));
        if (!current.accessToken().equals(requested.accessToken())
                && !current.expiresWithin(clockPort.now(), refreshMargin)) {
            return current;
        }
        if (!current.renewable()) {
            credentialRepository.delete(current.userId(), current.provider());
            throw new AuthException(AuthException.Reason.NOT_LINKED,
                    "refresh token 이 없는 자격 증명이 만료되었습니다. 다시 연결해야 합니다.");
        }
        TokenGrant grant;
        try {
            grant = oauthProvider.refresh(current.refreshToken());
        } catch (AuthException e) {
            if (e.reason() == AuthException.Reason.REVOKED_BY_USER) {
                credentialRepository.delete(current.userId(), current.provider());
                log.warnf("사용자가 접근 권한을 철회해 자격 증명을 삭제했습니다: user=%s provider=%s",
                        current.userId(), current.provider());
            }
            throw e;
        }
        OAuthCredential renewed = current.renewedWith(grant);
        if (credentialRepository.find(current.userId(), current.provider()).isEmpty()) {
            // 갱신 도중 연결이 해제되었다.
            throw notLinked(current.userId(), current.provider());
        }
        credentialRepository.save(renewed);
        log.infof("액세스 토큰을 갱신했습니다: user=%s provider=%s expiresAt=%s",
                renewed.userId(), renewed.provider(), renewed.expiresAt());
        return renewed;
    }

    private OAuthCredential await(CompletableFuture<OAuthCredential> future) {
        try {
            return future.join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new AuthException(AuthException.Reason.REFRESH_FAILED, "토큰 갱신 실패", cause);
        }
    }

    private static AuthException notLinked(String userId, String provider) {
        return new AuthException(AuthException.Reason.NOT_LINKED,
                "연결된 자격 증명이 없습니다: user=" + userId + " provider=" + provider);
    }

    private record Key(String userId, String provider) {
        private Key {
            Objects.requireNonNull(userId, "userId");
            Objects.requireNonNull(provider, "provider");
        }
    }
}
