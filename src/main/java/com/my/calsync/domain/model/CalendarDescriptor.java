package com.my.calsync.domain.model;

import java.util.Objects;

/**
 * 왜: 제공자의 캘린더 목록 항목을 SDK 타입 없이 전달하기 위함.
 */
public record CalendarDescriptor(String externalId, String name, boolean primary, String timeZone) {
    public CalendarDescriptor {
        Objects.requireNonNull(externalId, "externalId");
        name = name == null || name.isBlank() ? "Unnamed Calendar" : name;
        timeZone = timeZone == null || timeZone.isBlank() ? "UTC" : timeZone;
    }
}
