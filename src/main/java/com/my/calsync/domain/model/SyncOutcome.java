package com.my.calsync.domain.model;

public enum SyncOutcome {
    SUCCEEDED,
    SKIPPED,
    FAILED
}
