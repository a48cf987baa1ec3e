package com.my.calsync.adapter.in.idempotency;

import com.my.calsync.adapter.out.persistence.SqliteSchema;
import com.my.calsync.domain.service.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SqliteIdempotencyStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void storesAndForgetsAfterTtl() {
        DataSource dataSource = SqliteSchema.dataSource(tempDir.resolve("idempotency.db"));
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));
        SqliteIdempotencyStore store = new SqliteIdempotencyStore(dataSource, Duration.ofHours(1), clock);
        store.init();

        assertThat(store.isProcessed("c-1")).isFalse();

        store.markProcessed("c-1");
        store.markProcessed("c-1");
        assertThat(store.isProcessed("c-1")).isTrue();

        clock.advance(Duration.ofMinutes(61));
        assertThat(store.isProcessed("c-1")).isFalse();
    }

    @Test
    void survivesNewInstanceOnSameFile() {
        DataSource dataSource = SqliteSchema.dataSource(tempDir.resolve("idempotency.db"));
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));
        SqliteIdempotencyStore first = new SqliteIdempotencyStore(dataSource, Duration.ofHours(1), clock);
        first.init();
        first.markProcessed("c-1");

        SqliteIdempotencyStore second = new SqliteIdempotencyStore(dataSource, Duration.ofHours(1), clock);
        second.init();

        assertThat(second.isProcessed("c-1")).isTrue();
    }
}
