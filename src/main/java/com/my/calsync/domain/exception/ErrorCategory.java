package com.my.calsync.domain.exception;

/**
 * 왜: 호출자가 "나중에 재시도"와 "사용자 조치 필요", "잘못된 요청"을 구분할 수 있도록 오류를 분류하기 위함.
 */
public enum ErrorCategory {
    RETRY_LATER,
    USER_ACTION_REQUIRED,
    INVALID_REQUEST,
    CONFLICT,
    NOT_FOUND,
    BUSY
}
