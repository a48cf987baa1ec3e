package com.my.calsync.adapter.out.clock;

import com.my.calsync.domain.port.out.ClockPort;

import java.time.Clock;
import java.time.Instant;

/**
 * 왜: 시스템 시간을 주입형으로 제공해 만료 판단과 타임스탬프 기록을 테스트에서 고정할 수 있게 하기 위함.
 */
public class SystemClockAdapter implements ClockPort {

    private final Clock clock;

    private SystemClockAdapter(Clock clock) {
        this.clock = clock;
    }

    public static SystemClockAdapter system() {
        return new SystemClockAdapter(Clock.systemUTC());
    }

    @Override
    public Instant now() {
        return clock.instant();
    }
}
