package com.my.calsync.adapter.out.reply;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.calsync.domain.model.CommandReply;
import com.my.calsync.domain.port.out.ReplyPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Channel;
import org.eclipse.microprofile.reactive.messaging.Emitter;

/**
 * 왜: 명령 처리 결과를 RabbitMQ 로 전달하는 기술적 구현을 분리하여 포트 계약을 지키기 위함.
 */
@ApplicationScoped
public class RabbitReplyProducer implements ReplyPort {

    private final Emitter<String> replyEmitter;
    private final ObjectMapper objectMapper;

    @Inject
    public RabbitReplyProducer(@Channel("calendar-replies") Emitter<String> replyEmitter, ObjectMapper objectMapper) {
        this.replyEmitter = replyEmitter;
        this.objectMapper = objectMapper;
    }

    @Override
    public void send(CommandReply reply) {
        try {
            replyEmitter.send(objectMapper.writeValueAsString(reply));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("응답 직렬화 실패: commandId=" + reply.commandId(), e);
        }
    }
}
