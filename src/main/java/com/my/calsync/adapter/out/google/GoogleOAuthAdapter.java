package com.my.calsync.adapter.out.google;

import com.google.api.client.auth.oauth2.TokenResponse;
import com.google.api.client.auth.oauth2.TokenResponseException;
import com.google.api.client.googleapis.auth.oauth2.GoogleAuthorizationCodeRequestUrl;
import com.google.api.client.googleapis.auth.oauth2.GoogleAuthorizationCodeTokenRequest;
import com.google.api.client.googleapis.auth.oauth2.GoogleRefreshTokenRequest;
import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.HttpRequest;
import com.google.api.client.http.HttpResponseException;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.GenericJson;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.JsonObjectParser;
import com.my.calsync.config.AppConfig;
import com.my.calsync.domain.exception.AuthException;
import com.my.calsync.domain.exception.RemoteCalendarException;
import com.my.calsync.domain.model.TokenGrant;
import com.my.calsync.domain.port.out.ClockPort;
import com.my.calsync.domain.port.out.OAuthProviderPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 왜: 구글 OAuth 동의 URL 생성, 인가 코드 교환, 토큰 갱신을 OAuthProviderPort 로 감싸
 * 도메인이 토큰 엔드포인트 오류 코드를 몰라도 되게 하기 위함.
 */
@ApplicationScoped
public class GoogleOAuthAdapter implements OAuthProviderPort {

    private static final Logger log = Logger.getLogger(GoogleOAuthAdapter.class);

    static final String PROVIDER = "google";
    static final List<String> SCOPES = List.of(
            "https://www.googleapis.com/auth/calendar",
            "https://www.googleapis.com/auth/userinfo.email"
    );
    private static final String USERINFO_URL = "https://www.googleapis.com/oauth2/v2/userinfo";
    private static final String INVALID_GRANT = "invalid_grant";
    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final HttpTransport httpTransport;
    private final JsonFactory jsonFactory;
    private final String clientId;
    private final String clientSecret;
    private final String redirectUri;
    private final ClockPort clockPort;

    @Inject
    public GoogleOAuthAdapter(HttpTransport httpTransport, JsonFactory jsonFactory, AppConfig appConfig,
                              ClockPort clockPort) {
        this(httpTransport, jsonFactory, appConfig.google().clientId().orElse(""),
                appConfig.google().clientSecret().orElse(""), appConfig.google().redirectUri(), clockPort);
    }

    GoogleOAuthAdapter(HttpTransport httpTransport, JsonFactory jsonFactory, String clientId, String clientSecret,
                       String redirectUri, ClockPort clockPort) {
        this.httpTransport = httpTransport;
        this.jsonFactory = jsonFactory;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.redirectUri = redirectUri;
        this.clockPort = clockPort;
    }

    @Override
    public String provider() {
        return PROVIDER;
    }

    /**
     * refresh token 을 매번 받기 위해 offline 접근과 재동의를 요청한다.
     */
    @Override
    public String authorizationUrl(String state) {
        return new GoogleAuthorizationCodeRequestUrl(clientId, redirectUri, SCOPES)
                .setAccessType("offline")
                .set("prompt", "consent")
                .set("include_granted_scopes", "true")
                .setState(state)
                .build();
    }

    @Override
    public TokenGrant exchangeCode(String authorizationCode) {
        try {
            TokenResponse response = new GoogleAuthorizationCodeTokenRequest(httpTransport, jsonFactory,
                    clientId, clientSecret, authorizationCode, redirectUri).execute();
            return toGrant(response);
        } catch (TokenResponseException e) {
            if (isInvalidGrant(e)) {
                throw new AuthException(AuthException.Reason.INVALID_STATE,
                        "인가 코드가 만료되었거나 이미 사용되었습니다.", e);
            }
            throw new AuthException(AuthException.Reason.REFRESH_FAILED, "인가 코드 교환 실패: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new AuthException(AuthException.Reason.REFRESH_FAILED, "인가 코드 교환 중 네트워크 오류", e);
        }
    }

    @Override
    public TokenGrant refresh(String refreshToken) {
        try {
            TokenResponse response = new GoogleRefreshTokenRequest(httpTransport, jsonFactory, refreshToken,
                    clientId, clientSecret).execute();
            return toGrant(response);
        } catch (TokenResponseException e) {
            if (isInvalidGrant(e)) {
                throw new AuthException(AuthException.Reason.REVOKED_BY_USER,
                        "제공자가 refresh token 을 거부했습니다. 다시 연결해야 합니다.", e);
            }
            throw new AuthException(AuthException.Reason.REFRESH_FAILED, "토큰 갱신 실패: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new AuthException(AuthException.Reason.REFRESH_FAILED, "토큰 갱신 중 네트워크 오류", e);
        }
    }

    /**
     * 조회 전용 호출이라 재시도해도 안전하다.
     */
    @Override
    @Retry(maxRetries = 2, delay = 500, retryOn = RemoteCalendarException.class)
    public String fetchAccountId(String accessToken) {
        try {
            HttpRequest request = httpTransport.createRequestFactory(req -> {
                        req.getHeaders().setAuthorization("Bearer " + accessToken);
                        req.setParser(new JsonObjectParser(jsonFactory));
                    })
                    .buildGetRequest(new GenericUrl(USERINFO_URL));
            GenericJson body = request.execute().parseAs(GenericJson.class);
            Object id = body.get("id");
            if (id == null) {
                throw new AuthException(AuthException.Reason.INVALID_STATE, "사용자 정보 응답에 계정 id 가 없습니다.");
            }
            return id.toString();
        } catch (HttpResponseException e) {
            if (e.getStatusCode() >= 500) {
                throw new RemoteCalendarException(RemoteCalendarException.Kind.TRANSIENT, e.getStatusCode(),
                        "사용자 정보 조회 실패: HTTP " + e.getStatusCode(), e);
            }
            throw new AuthException(AuthException.Reason.INVALID_STATE,
                    "사용자 정보 조회가 거부되었습니다: HTTP " + e.getStatusCode(), e);
        } catch (IOException e) {
            log.warnf("사용자 정보 조회 중 네트워크 오류: %s", e.getMessage());
            throw new RemoteCalendarException(RemoteCalendarException.Kind.TRANSIENT, 0,
                    "사용자 정보 조회 중 네트워크 오류", e);
        }
    }

    private TokenGrant toGrant(TokenResponse response) {
        long expiresIn = response.getExpiresInSeconds() == null
                ? DEFAULT_EXPIRES_IN_SECONDS : response.getExpiresInSeconds();
        Set<String> scopes = response.getScope() == null
                ? new LinkedHashSet<>(SCOPES)
                : new LinkedHashSet<>(Arrays.asList(response.getScope().trim().split("\\s+")));
        return new TokenGrant(response.getAccessToken(), response.getRefreshToken(),
                clockPort.now().plusSeconds(expiresIn), scopes);
    }

    private static boolean isInvalidGrant(TokenResponseException e) {
        return e.getDetails() != null && INVALID_GRANT.equals(e.getDetails().getError());
    }
}
