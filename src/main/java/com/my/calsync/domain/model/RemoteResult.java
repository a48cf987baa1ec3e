package com.my.calsync.domain.model;

import com.my.calsync.domain.exception.RemoteCalendarException;

import java.time.Duration;
import java.util.Objects;

/**
 * 왜: 원격 호출 결과를 태그(성공/일시 오류/속도 제한/인증 거부/최종 실패)로 표현해
 * 재시도 정책이 예외 흐름이 아닌 태그만 보고 결정되도록 하기 위함.
 */
public record RemoteResult<T>(Tag tag, T value, RemoteCalendarException error, Duration retryAfter) {

    public enum Tag {
        SUCCESS,
        TRANSIENT,
        RATE_LIMITED,
        UNAUTHORIZED,
        FAILED
    }

    public RemoteResult {
        Objects.requireNonNull(tag, "tag");
        if (tag != Tag.SUCCESS) {
            Objects.requireNonNull(error, "error");
        }
    }

    public static <T> RemoteResult<T> success(T value) {
        return new RemoteResult<>(Tag.SUCCESS, value, null, null);
    }

    public static <T> RemoteResult<T> transientFailure(RemoteCalendarException error) {
        return new RemoteResult<>(Tag.TRANSIENT, null, error, null);
    }

    /**
     * @param retryAfter 제공자가 알려준 대기 시간. 없으면 null.
     */
    public static <T> RemoteResult<T> rateLimited(RemoteCalendarException error, Duration retryAfter) {
        return new RemoteResult<>(Tag.RATE_LIMITED, null, error, retryAfter);
    }

    public static <T> RemoteResult<T> unauthorized(RemoteCalendarException error) {
        return new RemoteResult<>(Tag.UNAUTHORIZED, null, error, null);
    }

    public static <T> RemoteResult<T> failed(RemoteCalendarException error) {
        return new RemoteResult<>(Tag.FAILED, null, error, null);
    }

    public boolean isSuccess() {
        return tag == Tag.SUCCESS;
    }
}
