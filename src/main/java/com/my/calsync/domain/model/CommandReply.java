package com.my.calsync.domain.model;

import com.my.calsync.domain.exception.ErrorCategory;

import java.util.Objects;

/**
 * 왜: 명령 처리 결과의 계약을 고정하여 응답 어댑터가 일관된 포맷으로 전송하도록 하기 위함.
 */
public record CommandReply(String commandId,
                           String userId,
                           boolean ok,
                           ErrorCategory errorCategory,
                           String error,
                           Object body) {
    public CommandReply {
        Objects.requireNonNull(commandId, "commandId");
        Objects.requireNonNull(userId, "userId");
        if (userId.isBlank()) {
            throw new IllegalArgumentException("userId는 비어 있을 수 없습니다.");
        }
    }

    public static CommandReply success(String commandId, String userId, Object body) {
        return new CommandReply(commandId, userId, true, null, null, body);
    }

    public static CommandReply failure(String commandId, String userId, ErrorCategory category, String error) {
        return new CommandReply(commandId, userId, false, category, error, null);
    }
}
