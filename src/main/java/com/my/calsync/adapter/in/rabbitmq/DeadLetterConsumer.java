package com.my.calsync.adapter.in.rabbitmq;

import io.quarkus.arc.profile.IfBuildProfile;
import io.smallrye.reactive.messaging.annotations.Blocking;
import io.smallrye.reactive.messaging.rabbitmq.IncomingRabbitMQMetadata;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * 왜: 거부된 명령의 적체를 가시화하기 위해 DLQ 를 별도로 소비해 기록한다.
 */
@IfBuildProfile("prod")
@ApplicationScoped
public class DeadLetterConsumer {

    private static final Logger log = Logger.getLogger(DeadLetterConsumer.class);

    @Incoming("calendar-commands-dlq")
    @Blocking
    public CompletionStage<Void> consume(Message<String> message) {
        Optional<Map<String, Object>> headers = message.getMetadata(IncomingRabbitMQMetadata.class)
                .map(IncomingRabbitMQMetadata::getHeaders);
        log.warnf("DLQ 명령 소비: reason=%s, queue=%s, payload=%s",
                header(headers, "x-first-death-reason"), header(headers, "x-first-death-queue"),
                message.getPayload());
        return message.ack();
    }

    private static String header(Optional<Map<String, Object>> headers, String name) {
        return headers.map(values -> String.valueOf(values.getOrDefault(name, "unknown"))).orElse("unknown");
    }
}
