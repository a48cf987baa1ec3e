package com.my.calsync.domain.exception;

public class SyncInProgressException extends CalendarSyncException {

    private final long calendarSourceId;

    public SyncInProgressException(long calendarSourceId) {
        super("sync already in progress: calendarSourceId=" + calendarSourceId);
        this.calendarSourceId = calendarSourceId;
    }

    public long calendarSourceId() {
        return calendarSourceId;
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.BUSY;
    }
}
