package com.my.calsync.adapter.in.idempotency;

/**
 * 왜: 같은 commandId 로 재전달된 명령이 원격 캘린더를 두 번 바꾸지 않도록 처리 이력을 남기기 위함.
 */
public interface IdempotencyStore {

    boolean isProcessed(String commandId);

    void markProcessed(String commandId);
}
