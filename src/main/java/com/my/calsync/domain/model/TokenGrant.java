package com.my.calsync.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * 왜: 인가 코드 교환/토큰 갱신 결과를 제공자 SDK 타입과 분리해 도메인에서 다루기 위함.
 * refreshToken 은 갱신 응답에서 생략될 수 있다.
 */
public record TokenGrant(String accessToken,
                         String refreshToken,
                         Instant expiresAt,
                         Set<String> scopes) {
    public TokenGrant {
        Objects.requireNonNull(accessToken, "accessToken");
        Objects.requireNonNull(expiresAt, "expiresAt");
        scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
    }
}
