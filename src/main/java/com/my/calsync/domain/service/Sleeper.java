package com.my.calsync.domain.service;

import java.time.Duration;

/**
 * 왜: 재시도 대기를 주입형으로 분리해 테스트에서 실제로 잠들지 않고 대기 시간을 검증하기 위함.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
