package com.my.calsync.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * 왜: (사용자, 제공자) 당 하나뿐인 OAuth 자격 증명을 불변 값으로 다뤄 갱신 경합을 명확히 하기 위함.
 */
public record OAuthCredential(String userId,
                              String provider,
                              String providerAccountId,
                              String accessToken,
                              String refreshToken,
                              Instant expiresAt,
                              Set<String> scopes) {
    public OAuthCredential {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(accessToken, "accessToken");
        Objects.requireNonNull(expiresAt, "expiresAt");
        scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
    }

    public boolean renewable() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    public boolean expiresWithin(Instant now, Duration margin) {
        return !expiresAt.isAfter(now.plus(margin));
    }

    /**
     * 갱신 응답이 refresh token 을 생략하면 기존 값을 유지한다.
     */
    public OAuthCredential renewedWith(TokenGrant grant) {
        String nextRefresh = grant.refreshToken() != null ? grant.refreshToken() : refreshToken;
        Set<String> nextScopes = grant.scopes().isEmpty() ? scopes : grant.scopes();
        return new OAuthCredential(userId, provider, providerAccountId, grant.accessToken(), nextRefresh,
                grant.expiresAt(), nextScopes);
    }
}
