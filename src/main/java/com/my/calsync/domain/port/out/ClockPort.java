package com.my.calsync.domain.port.out;

import java.time.Instant;

/**
 * 왜: 현재 시간을 주입형으로 분리하여 만료/타임스탬프 로직을 테스트 가능하게 하기 위함.
 */
public interface ClockPort {
    Instant now();
}
