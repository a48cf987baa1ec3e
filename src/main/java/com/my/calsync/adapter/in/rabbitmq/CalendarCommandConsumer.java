package com.my.calsync.adapter.in.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.calsync.adapter.in.idempotency.IdempotencyStore;
import com.my.calsync.domain.exception.CalendarSyncException;
import com.my.calsync.domain.exception.ErrorCategory;
import com.my.calsync.domain.exception.InvalidRequestException;
import com.my.calsync.domain.exception.SyncInProgressException;
import com.my.calsync.domain.model.CommandReply;
import com.my.calsync.domain.port.in.CalendarConnectionUseCase;
import com.my.calsync.domain.port.in.ManageEventsUseCase;
import com.my.calsync.domain.port.in.SyncCalendarUseCase;
import com.my.calsync.domain.port.out.ReplyPort;
import io.smallrye.mutiny.Uni;
import io.smallrye.reactive.messaging.annotations.Blocking;
import io.smallrye.reactive.messaging.rabbitmq.IncomingRabbitMQMetadata;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.reactive.messaging.Incoming;
import org.eclipse.microprofile.reactive.messaging.Message;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * 왜: RabbitMQ 명령을 연결/동기화/이벤트 유스케이스로 진입시키는 단일 경로를 제공하기 위함.
 * 도메인 오류는 실패 응답으로 돌려주고, 해석할 수 없는 메시지와 예기치 못한 오류만 nack 해 DLQ 로 보낸다.
 */
@ApplicationScoped
public class CalendarCommandConsumer {

    private static final Logger log = Logger.getLogger(CalendarCommandConsumer.class);

    private final CalendarConnectionUseCase connectionUseCase;
    private final SyncCalendarUseCase syncUseCase;
    private final ManageEventsUseCase eventsUseCase;
    private final IdempotencyStore idempotencyStore;
    private final ReplyPort replyPort;
    private final ObjectMapper objectMapper;

    @Inject
    public CalendarCommandConsumer(CalendarConnectionUseCase connectionUseCase,
                                   SyncCalendarUseCase syncUseCase,
                                   ManageEventsUseCase eventsUseCase,
                                   IdempotencyStore idempotencyStore,
                                   ReplyPort replyPort,
                                   ObjectMapper objectMapper) {
        this.connectionUseCase = connectionUseCase;
        this.syncUseCase = syncUseCase;
        this.eventsUseCase = eventsUseCase;
        this.idempotencyStore = idempotencyStore;
        this.replyPort = replyPort;
        this.objectMapper = objectMapper;
    }

    @Incoming("calendar-commands")
    @Blocking
    public Uni<Void> consume(Message<String> message) {
        return Uni.createFrom().item(() -> process(message.getPayload(), resolveCorrelationId(message)))
                .onItem().transformToUni(rejection -> Uni.createFrom().completionStage(
                        rejection == null ? message.ack() : message.nack(rejection)));
    }

    /**
     * @return 메시지를 거부해야 하면 그 원인, 정상 처리(또는 중복 건너뜀)면 null
     */
    Throwable process(String payload, Optional<String> correlationId) {
        CalendarCommand command;
        try {
            command = objectMapper.readValue(payload, CalendarCommand.class);
        } catch (IOException | InvalidRequestException e) {
            log.warnf("명령 파싱 실패로 거부합니다: %s", e.getMessage());
            return e;
        }
        MDC.put("correlationId", correlationId.orElse(command.commandId()));
        MDC.put("commandId", command.commandId());
        MDC.put("userId", command.userId());
        try {
            if (idempotencyStore.isProcessed(command.commandId())) {
                log.infof("중복 명령을 건너뜁니다: %s", command.commandId());
                return null;
            }
            CommandReply reply = execute(command);
            replyPort.send(reply);
            if (reply.ok() || !retryable(reply.errorCategory())) {
                idempotencyStore.markProcessed(command.commandId());
            }
            return null;
        } catch (RuntimeException e) {
            log.errorf(e, "명령 처리 중 예기치 못한 오류: type=%s", command.type());
            replyFailureQuietly(command, e);
            return e;
        } finally {
            MDC.remove("correlationId");
            MDC.remove("commandId");
            MDC.remove("userId");
        }
    }

    CommandReply execute(CalendarCommand command) {
        try {
            return CommandReply.success(command.commandId(), command.userId(), dispatch(command));
        } catch (SyncInProgressException e) {
            log.infof("이미 동기화 중이라 건너뜁니다: %s", e.getMessage());
            return CommandReply.failure(command.commandId(), command.userId(), e.category(), e.getMessage());
        } catch (CalendarSyncException e) {
            log.warnf("명령 처리 실패: type=%s category=%s reason=%s", command.type(), e.category(), e.getMessage());
            return CommandReply.failure(command.commandId(), command.userId(), e.category(), e.getMessage());
        }
    }

    private Object dispatch(CalendarCommand command) {
        String userId = command.userId();
        return switch (command.commandType()) {
            case AUTHORIZE -> Map.of("authorizationUrl", connectionUseCase.authorize(userId));
            case OAUTH_CALLBACK -> connectionUseCase.oauthCallback(command.requireCode(), command.requireState());
            case DISCONNECT -> {
                connectionUseCase.disconnect(userId);
                yield Map.of("disconnected", true);
            }
            case CONNECTION_STATUS -> connectionUseCase.connectionStatus(userId);
            case REFRESH_CALENDARS -> connectionUseCase.refreshCalendarList(userId);
            case LIST_CALENDARS -> connectionUseCase.listCalendarSources(userId);
            case GET_CALENDAR -> connectionUseCase.getCalendarSource(userId, command.requireCalendarSourceId());
            case UNLINK_CALENDAR -> {
                connectionUseCase.unlinkCalendar(userId, command.requireCalendarSourceId());
                yield Map.of("unlinked", command.requireCalendarSourceId());
            }
            case SYNC -> syncUseCase.sync(userId, command.requireCalendarSourceId());
            case SYNC_ALL -> syncUseCase.syncAll(userId);
            case LIST_EVENTS -> command.calendarSourceId() == null
                    ? eventsUseCase.listForUser(userId, command.toRange())
                    : eventsUseCase.list(userId, command.calendarSourceId(), command.toRange());
            case GET_EVENT -> eventsUseCase.get(userId, command.requireCalendarSourceId(),
                    command.requireExternalEventId());
            case CREATE_EVENT -> eventsUseCase.create(userId, command.requireCalendarSourceId(), command.toDraft());
            case UPDATE_EVENT -> eventsUseCase.update(userId, command.requireCalendarSourceId(),
                    command.requireExternalEventId(), command.toPatch());
            case DELETE_EVENT -> {
                eventsUseCase.delete(userId, command.requireCalendarSourceId(), command.requireExternalEventId());
                yield Map.of("deleted", command.requireExternalEventId());
            }
        };
    }

    private void replyFailureQuietly(CalendarCommand command, RuntimeException cause) {
        try {
            replyPort.send(CommandReply.failure(command.commandId(), command.userId(), ErrorCategory.RETRY_LATER,
                    "일시적인 오류로 명령을 처리하지 못했습니다."));
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
    }

    private static boolean retryable(ErrorCategory category) {
        return category == ErrorCategory.RETRY_LATER || category == ErrorCategory.BUSY;
    }

    private Optional<String> resolveCorrelationId(Message<String> message) {
        return message.getMetadata(IncomingRabbitMQMetadata.class)
                .flatMap(IncomingRabbitMQMetadata::getCorrelationId);
    }
}
