package com.my.calsync.domain.model;

public enum SyncMode {
    FULL,
    INCREMENTAL
}
