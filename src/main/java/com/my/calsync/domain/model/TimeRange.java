package com.my.calsync.domain.model;

import java.time.Instant;

/**
 * 왜: 조회 구간의 시작/종료를 한 덩어리로 검증하고 전달하기 위함. 양쪽 경계는 비워 둘 수 있다.
 */
public record TimeRange(Instant start, Instant end) {
    public TimeRange {
        if (start != null && end != null && end.isBefore(start)) {
            throw new IllegalArgumentException("종료 시간이 시작 시간보다 이를 수 없습니다.");
        }
    }

    public static TimeRange unbounded() {
        return new TimeRange(null, null);
    }

    public boolean contains(Instant instant) {
        if (start != null && instant.isBefore(start)) {
            return false;
        }
        return end == null || !instant.isAfter(end);
    }
}
