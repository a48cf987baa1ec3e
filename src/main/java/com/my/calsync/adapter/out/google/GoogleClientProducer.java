package com.my.calsync.adapter.out.google;

import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.jackson2.JacksonFactory;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import java.io.IOException;
import java.security.GeneralSecurityException;

/**
 * 왜: 구글 HTTP 전송 계층과 JSON 팩토리를 한 번만 만들어 캘린더/OAuth 어댑터가 공유하고, 테스트에서 바꿔 끼우기 위함.
 * SDK 클래스는 프록시할 수 없어 Singleton 으로 둔다.
 */
@ApplicationScoped
public class GoogleClientProducer {

    @Produces
    @Singleton
    public HttpTransport httpTransport() {
        try {
            return GoogleNetHttpTransport.newTrustedTransport();
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("구글 HTTP 전송 계층 초기화 실패", e);
        }
    }

    @Produces
    @Singleton
    public JsonFactory jsonFactory() {
        return JacksonFactory.getDefaultInstance();
    }
}
