package com.my.calsync.domain.service;

import com.my.calsync.domain.model.RemoteResult;

import java.time.Duration;
import java.util.Optional;

/**
 * 왜: 재시도 여부와 대기 시간을 결과 태그와 시도 횟수만으로 결정하는 순수 함수로 두어 호출 흐름과 분리하기 위함.
 */
public class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts는 1 이상이어야 합니다.");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * @param attempt 방금 끝난 시도 번호(1부터)
     * @return 다시 시도할 경우 그 전에 기다릴 시간, 포기하면 empty
     */
    public Optional<Duration> delayBeforeRetry(RemoteResult<?> result, int attempt) {
        if (attempt >= maxAttempts) {
            return Optional.empty();
        }
        return switch (result.tag()) {
            case TRANSIENT -> Optional.of(backoff(attempt));
            case RATE_LIMITED -> Optional.of(result.retryAfter() != null ? result.retryAfter() : backoff(attempt));
            case SUCCESS, UNAUTHORIZED, FAILED -> Optional.empty();
        };
    }

    Duration backoff(int attempt) {
        long factor = 1L << Math.min(attempt - 1, 20);
        Duration candidate = initialBackoff.multipliedBy(factor);
        return candidate.compareTo(maxBackoff) > 0 ? maxBackoff : candidate;
    }
}
