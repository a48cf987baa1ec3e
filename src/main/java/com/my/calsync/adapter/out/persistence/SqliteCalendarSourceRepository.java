package com.my.calsync.adapter.out.persistence;

import com.my.calsync.domain.model.CalendarDescriptor;
import com.my.calsync.domain.model.CalendarSource;
import com.my.calsync.domain.model.SyncStatus;
import com.my.calsync.domain.port.out.CalendarSourceRepositoryPort;
import jakarta.enterprise.context.ApplicationScoped;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 왜: 캘린더 소스 행과 동기화 상태 전이를 SQLite 에 저장한다. running 획득은 조건부 UPDATE 한 번으로 처리해
 * 여러 프로세스가 같은 파일을 쓰더라도 소스당 실행이 하나로 유지되도록 한다.
 */
@ApplicationScoped
public class SqliteCalendarSourceRepository implements CalendarSourceRepositoryPort {

    private static final String SELECT_COLUMNS = """
            SELECT id, user_id, provider, external_calendar_id, name, is_primary, time_zone, sync_cursor,
                   last_synced_at, status, run_started_at, last_error
            FROM calendar_sources
            """;
    private static final String SELECT_BY_ID_SQL = SELECT_COLUMNS + " WHERE id = ?";
    private static final String SELECT_OWNED_SQL = SELECT_COLUMNS + " WHERE id = ? AND user_id = ?";
    private static final String SELECT_BY_USER_SQL = SELECT_COLUMNS
            + " WHERE user_id = ? ORDER BY is_primary DESC, name, id";
    private static final String SELECT_BY_EXTERNAL_SQL = SELECT_COLUMNS
            + " WHERE user_id = ? AND external_calendar_id = ?";
    private static final String SELECT_USERS_SQL = "SELECT DISTINCT user_id FROM calendar_sources ORDER BY user_id";
    private static final String LINK_SQL = """
            INSERT INTO calendar_sources(user_id, provider, external_calendar_id, name, is_primary, time_zone, status)
            VALUES (?, ?, ?, ?, ?, ?, 'idle')
            ON CONFLICT(user_id, external_calendar_id) DO UPDATE SET
                name = excluded.name,
                is_primary = excluded.is_primary,
                time_zone = excluded.time_zone
            """;
    private static final String UNLINK_SQL = "DELETE FROM calendar_sources WHERE id = ? AND user_id = ?";
    private static final String START_RUN_SQL = """
            UPDATE calendar_sources
            SET status = 'running', run_started_at = ?
            WHERE id = ? AND (status <> 'running' OR run_started_at IS NULL OR run_started_at < ?)
            """;
    private static final String COMPLETE_RUN_SQL = """
            UPDATE calendar_sources
            SET status = 'idle', sync_cursor = ?, last_synced_at = ?, run_started_at = NULL, last_error = NULL
            WHERE id = ? AND status = 'running' AND run_started_at = ?
            """;
    private static final String FAIL_RUN_SQL = """
            UPDATE calendar_sources
            SET status = 'error', run_started_at = NULL, last_error = ?
            WHERE id = ? AND status = 'running' AND run_started_at = ?
            """;
    private static final String HEARTBEAT_SQL = """
            UPDATE calendar_sources
            SET run_started_at = ?
            WHERE id = ? AND status = 'running' AND run_started_at = ?
            """;

    private final DataSource dataSource;

    public SqliteCalendarSourceRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<CalendarSource> findById(long id) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            ps.setLong(1, id);
            return single(ps);
        } catch (SQLException e) {
            throw new IllegalStateException("캘린더 소스 조회 실패", e);
        }
    }

    @Override
    public Optional<CalendarSource> findOwned(long id, String userId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_OWNED_SQL)) {
            ps.setLong(1, id);
            ps.setString(2, userId);
            return single(ps);
        } catch (SQLException e) {
            throw new IllegalStateException("캘린더 소스 조회 실패", e);
        }
    }

    @Override
    public List<CalendarSource> findByUser(String userId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_BY_USER_SQL)) {
            ps.setString(1, userId);
            List<CalendarSource> sources = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    sources.add(map(rs));
                }
            }
            return sources;
        } catch (SQLException e) {
            throw new IllegalStateException("캘린더 소스 목록 조회 실패", e);
        }
    }

    @Override
    public List<String> findUsersWithSources() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT_USERS_SQL);
             ResultSet rs = ps.executeQuery()) {
            List<String> users = new ArrayList<>();
            while (rs.next()) {
                users.add(rs.getString(1));
            }
            return users;
        } catch (SQLException e) {
            throw new IllegalStateException("사용자 목록 조회 실패", e);
        }
    }

    @Override
    public CalendarSource link(String userId, String provider, CalendarDescriptor descriptor) {
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(LINK_SQL)) {
                ps.setString(1, userId);
                ps.setString(2, provider);
                ps.setString(3, descriptor.externalId());
                ps.setString(4, descriptor.name());
                ps.setBoolean(5, descriptor.primary());
                ps.setString(6, descriptor.timeZone());
                ps.executeUpdate();
            }
            try (PreparedStatement ps = conn.prepareStatement(SELECT_BY_EXTERNAL_SQL)) {
                ps.setString(1, userId);
                ps.setString(2, descriptor.externalId());
                return single(ps).orElseThrow(() -> new IllegalStateException("연결한 캘린더 소스를 다시 읽지 못했습니다."));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("캘린더 소스 연결 실패", e);
        }
    }

    @Override
    public boolean unlink(long id, String userId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(UNLINK_SQL)) {
            ps.setLong(1, id);
            ps.setString(2, userId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IllegalStateException("캘린더 소스 삭제 실패", e);
        }
    }

    @Override
    public boolean tryStartRun(long id, Instant startedAt, Instant staleBefore) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(START_RUN_SQL)) {
            ps.setLong(1, startedAt.toEpochMilli());
            ps.setLong(2, id);
            ps.setLong(3, staleBefore.toEpochMilli());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new IllegalStateException("동기화 상태 전환 실패", e);
        }
    }

    @Override
    public boolean heartbeat(long id, Instant runStartedAt, Instant now) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(HEARTBEAT_SQL)) {
            ps.setLong(1, now.toEpochMilli());
            ps.setLong(2, id);
            ps.setLong(3, runStartedAt.toEpochMilli());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new IllegalStateException("동기화 진행 시각 갱신 실패", e);
        }
    }

    @Override
    public boolean completeRun(long id, Instant runStartedAt, String nextCursor, Instant syncedAt) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(COMPLETE_RUN_SQL)) {
            ps.setString(1, nextCursor);
            Jdbc.setInstant(ps, 2, syncedAt);
            ps.setLong(3, id);
            ps.setLong(4, runStartedAt.toEpochMilli());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new IllegalStateException("동기화 완료 기록 실패", e);
        }
    }

    @Override
    public boolean failRun(long id, Instant runStartedAt, String error) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(FAIL_RUN_SQL)) {
            ps.setString(1, error);
            ps.setLong(2, id);
            ps.setLong(3, runStartedAt.toEpochMilli());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new IllegalStateException("동기화 실패 기록 실패", e);
        }
    }

    private Optional<CalendarSource> single(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            return rs.next() ? Optional.of(map(rs)) : Optional.empty();
        }
    }

    private CalendarSource map(ResultSet rs) throws SQLException {
        return new CalendarSource(
                rs.getLong("id"),
                rs.getString("user_id"),
                rs.getString("provider"),
                rs.getString("external_calendar_id"),
                rs.getString("name"),
                rs.getBoolean("is_primary"),
                rs.getString("time_zone"),
                rs.getString("sync_cursor"),
                Jdbc.getInstant(rs, "last_synced_at"),
                SyncStatus.fromStorage(rs.getString("status")),
                Jdbc.getInstant(rs, "run_started_at"),
                rs.getString("last_error")
        );
    }
}
