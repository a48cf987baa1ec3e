package com.my.calsync.domain.exception;

/**
 * 왜: 자격 증명 부재/갱신 실패/사용자 철회를 구분해 호출자가 재인증 안내 여부를 결정하도록 하기 위함.
 */
public class AuthException extends CalendarSyncException {

    public enum Reason {
        NOT_LINKED,
        REFRESH_FAILED,
        REVOKED_BY_USER,
        INVALID_STATE
    }

    private final Reason reason;

    public AuthException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AuthException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    @Override
    public ErrorCategory category() {
        return reason == Reason.REFRESH_FAILED ? ErrorCategory.RETRY_LATER : ErrorCategory.USER_ACTION_REQUIRED;
    }
}
