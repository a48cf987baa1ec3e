package com.my.calsync.adapter.in.idempotency;

import com.my.calsync.config.AppConfig;
import com.my.calsync.domain.port.out.ClockPort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;

/**
 * 왜: 재시작 후에도 이미 처리한 명령을 기억하도록 동기화 데이터와 같은 SQLite 파일에 명령 이력을 둔다.
 */
@IfBuildProperty(name = "app.idempotency.backend", stringValue = "sqlite", enableIfMissing = true)
@ApplicationScoped
public class SqliteIdempotencyStore implements IdempotencyStore {

    private static final String TABLE_DDL = """
            CREATE TABLE IF NOT EXISTS command_log (
                command_id TEXT PRIMARY KEY,
                processed_at INTEGER NOT NULL
            )
            """;

    private static final String INSERT_SQL = "INSERT OR IGNORE INTO command_log(command_id, processed_at) VALUES (?, ?)";
    private static final String SELECT_SQL = "SELECT 1 FROM command_log WHERE command_id = ? AND processed_at >= ?";
    private static final String CLEANUP_SQL = "DELETE FROM command_log WHERE processed_at < ?";

    private final DataSource dataSource;
    private final Duration ttl;
    private final ClockPort clockPort;

    @Inject
    public SqliteIdempotencyStore(DataSource dataSource, AppConfig appConfig, ClockPort clockPort) {
        this(dataSource, Duration.ofHours(appConfig.idempotency().ttlHours()), clockPort);
    }

    SqliteIdempotencyStore(DataSource dataSource, Duration ttl, ClockPort clockPort) {
        this.dataSource = dataSource;
        this.ttl = ttl;
        this.clockPort = clockPort;
    }

    @PostConstruct
    void init() {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(TABLE_DDL);
        } catch (SQLException e) {
            throw new IllegalStateException("명령 이력 테이블 초기화 실패", e);
        }
    }

    @Override
    public boolean isProcessed(String commandId) {
        Instant cutoff = clockPort.now().minus(ttl);
        cleanup(cutoff);
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_SQL)) {
            ps.setString(1, commandId);
            ps.setLong(2, cutoff.toEpochMilli());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("명령 이력 조회 실패", e);
        }
    }

    @Override
    public void markProcessed(String commandId) {
        Instant now = clockPort.now();
        cleanup(now.minus(ttl));
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
            ps.setString(1, commandId);
            ps.setLong(2, now.toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("명령 이력 기록 실패", e);
        }
    }

    private void cleanup(Instant cutoff) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(CLEANUP_SQL)) {
            ps.setLong(1, cutoff.toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("명령 이력 정리 실패", e);
        }
    }
}
