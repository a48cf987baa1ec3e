package com.my.calsync.domain.port.out;

import com.my.calsync.domain.model.TokenGrant;

/**
 * 왜: 제공자 OAuth 엔드포인트(동의 URL, 코드 교환, 토큰 갱신)를 SDK 와 분리하기 위함.
 */
public interface OAuthProviderPort {

    String provider();

    String authorizationUrl(String state);

    /**
     * @throws com.my.calsync.domain.exception.AuthException 코드가 거부되면 INVALID_STATE, 그 외 REFRESH_FAILED
     */
    TokenGrant exchangeCode(String authorizationCode);

    /**
     * @throws com.my.calsync.domain.exception.AuthException 제공자가 토큰 철회를 알리면 REVOKED_BY_USER
     */
    TokenGrant refresh(String refreshToken);

    String fetchAccountId(String accessToken);
}
