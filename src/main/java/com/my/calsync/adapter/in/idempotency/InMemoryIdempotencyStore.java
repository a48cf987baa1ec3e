package com.my.calsync.adapter.in.idempotency;

import com.my.calsync.config.AppConfig;
import com.my.calsync.domain.port.out.ClockPort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@IfBuildProperty(name = "app.idempotency.backend", stringValue = "memory")
@ApplicationScoped
public class InMemoryIdempotencyStore implements IdempotencyStore {

    private final Duration ttl;
    private final ClockPort clockPort;
    private final Map<String, Instant> processed = new ConcurrentHashMap<>();

    @Inject
    public InMemoryIdempotencyStore(AppConfig appConfig, ClockPort clockPort) {
        this(Duration.ofHours(appConfig.idempotency().ttlHours()), clockPort);
    }

    InMemoryIdempotencyStore(Duration ttl, ClockPort clockPort) {
        this.ttl = ttl;
        this.clockPort = clockPort;
    }

    @Override
    public boolean isProcessed(String commandId) {
        cleanup();
        return processed.containsKey(commandId);
    }

    @Override
    public void markProcessed(String commandId) {
        cleanup();
        processed.put(commandId, clockPort.now());
    }

    private void cleanup() {
        Instant cutoff = clockPort.now().minus(ttl);
        processed.entrySet().removeIf(entry -> entry.getValue().isBefore(cutoff));
    }
}
