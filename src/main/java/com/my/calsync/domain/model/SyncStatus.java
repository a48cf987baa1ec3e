package com.my.calsync.domain.model;

import java.util.Locale;

/**
 * 왜: 캘린더 소스별 동기화 상태 머신(idle -> running -> idle|error)을 저장 값과 함께 고정하기 위함.
 */
public enum SyncStatus {
    IDLE,
    RUNNING,
    ERROR;

    public String storageValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SyncStatus fromStorage(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
