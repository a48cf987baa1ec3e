package com.my.calsync.adapter.out.persistence;

import com.my.calsync.domain.model.ExternalEvent;
import com.my.calsync.domain.model.TimeRange;
import com.my.calsync.domain.port.out.ExternalEventRepositoryPort;
import jakarta.enterprise.context.ApplicationScoped;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@ApplicationScoped
public class SqliteExternalEventRepository implements ExternalEventRepositoryPort {

    private static final String SELECT_COLUMNS = """
            SELECT e.id, e.calendar_source_id, e.external_event_id, e.title, e.description, e.location, e.start_at,
                   e.end_at, e.all_day, e.revision_marker, e.local_modified_at, e.tombstoned
            FROM external_events e
            """;
    private static final String SELECT_ONE_SQL = SELECT_COLUMNS
            + " WHERE e.calendar_source_id = ? AND e.external_event_id = ?";
    private static final String INSERT_SQL = """
            INSERT INTO external_events(calendar_source_id, external_event_id, title, description, location, start_at,
                                        end_at, all_day, revision_marker, local_modified_at, tombstoned)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 0)
            """;
    private static final String UPDATE_SQL = """
            UPDATE external_events
            SET title = ?, description = ?, location = ?, start_at = ?, end_at = ?, all_day = ?,
                revision_marker = ?, local_modified_at = ?, tombstoned = ?
            WHERE calendar_source_id = ? AND external_event_id = ?
            """;
    private static final String TOMBSTONE_SQL = """
            UPDATE external_events SET tombstoned = 1, local_modified_at = ?
            WHERE calendar_source_id = ? AND external_event_id = ? AND tombstoned = 0
            """;
    private static final String SELECT_IDS_SQL =
            "SELECT external_event_id FROM external_events WHERE calendar_source_id = ? AND tombstoned = ?";
    private static final String PURGE_SQL =
            "DELETE FROM external_events WHERE calendar_source_id = ? AND external_event_id = ? AND tombstoned = 1";

    private final DataSource dataSource;

    public SqliteExternalEventRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<ExternalEvent> find(long calendarSourceId, String externalEventId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_ONE_SQL)) {
            ps.setLong(1, calendarSourceId);
            ps.setString(2, externalEventId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("이벤트 조회 실패", e);
        }
    }

    @Override
    public ExternalEvent insert(ExternalEvent event) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(INSERT_SQL, Statement.RETURN_GENERATED_KEYS)) {
            ps.setLong(1, event.calendarSourceId());
            ps.setString(2, event.externalEventId());
            ps.setString(3, event.title());
            ps.setString(4, event.description());
            ps.setString(5, event.location());
            ps.setLong(6, event.startAt().toEpochMilli());
            ps.setLong(7, event.endAt().toEpochMilli());
            ps.setBoolean(8, event.allDay());
            ps.setString(9, event.revisionMarker());
            Jdbc.setInstant(ps, 10, event.localModifiedAt());
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                long id = keys.next() ? keys.getLong(1) : 0L;
                return new ExternalEvent(id, event.calendarSourceId(), event.externalEventId(), event.title(),
                        event.description(), event.location(), event.startAt(), event.endAt(), event.allDay(),
                        event.revisionMarker(), event.localModifiedAt(), false);
            }
        } catch (SQLException e) {
            throw new IllegalStateException("이벤트 저장 실패: " + event.externalEventId(), e);
        }
    }

    @Override
    public void update(ExternalEvent event) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(UPDATE_SQL)) {
            ps.setString(1, event.title());
            ps.setString(2, event.description());
            ps.setString(3, event.location());
            ps.setLong(4, event.startAt().toEpochMilli());
            ps.setLong(5, event.endAt().toEpochMilli());
            ps.setBoolean(6, event.allDay());
            ps.setString(7, event.revisionMarker());
            Jdbc.setInstant(ps, 8, event.localModifiedAt());
            ps.setBoolean(9, event.tombstoned());
            ps.setLong(10, event.calendarSourceId());
            ps.setString(11, event.externalEventId());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("이벤트 수정 실패: " + event.externalEventId(), e);
        }
    }

    @Override
    public boolean tombstone(long calendarSourceId, String externalEventId, Instant modifiedAt) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(TOMBSTONE_SQL)) {
            ps.setLong(1, modifiedAt.toEpochMilli());
            ps.setLong(2, calendarSourceId);
            ps.setString(3, externalEventId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IllegalStateException("이벤트 삭제 표시 실패: " + externalEventId, e);
        }
    }

    @Override
    public Set<String> findLiveExternalIds(long calendarSourceId) {
        return externalIds(calendarSourceId, false);
    }

    @Override
    public Set<String> findTombstonedExternalIds(long calendarSourceId) {
        return externalIds(calendarSourceId, true);
    }

    @Override
    public int purge(long calendarSourceId, Collection<String> externalEventIds) {
        if (externalEventIds.isEmpty()) {
            return 0;
        }
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(PURGE_SQL)) {
                for (String externalEventId : externalEventIds) {
                    ps.setLong(1, calendarSourceId);
                    ps.setString(2, externalEventId);
                    ps.addBatch();
                }
                int purged = 0;
                for (int count : ps.executeBatch()) {
                    purged += Math.max(count, 0);
                }
                conn.commit();
                return purged;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IllegalStateException("tombstone 정리 실패", e);
        }
    }

    @Override
    public List<ExternalEvent> findLive(long calendarSourceId, TimeRange range) {
        StringBuilder sql = new StringBuilder(SELECT_COLUMNS)
                .append(" WHERE e.calendar_source_id = ? AND e.tombstoned = 0");
        appendRange(sql, range);
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            ps.setLong(1, calendarSourceId);
            bindRange(ps, 2, range);
            return list(ps);
        } catch (SQLException e) {
            throw new IllegalStateException("이벤트 목록 조회 실패", e);
        }
    }

    @Override
    public List<ExternalEvent> findLiveForUser(String userId, TimeRange range) {
        StringBuilder sql = new StringBuilder(SELECT_COLUMNS)
                .append(" JOIN calendar_sources s ON s.id = e.calendar_source_id")
                .append(" WHERE s.user_id = ? AND e.tombstoned = 0");
        appendRange(sql, range);
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            ps.setString(1, userId);
            bindRange(ps, 2, range);
            return list(ps);
        } catch (SQLException e) {
            throw new IllegalStateException("사용자 이벤트 목록 조회 실패", e);
        }
    }

    private Set<String> externalIds(long calendarSourceId, boolean tombstoned) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_IDS_SQL)) {
            ps.setLong(1, calendarSourceId);
            ps.setBoolean(2, tombstoned);
            Set<String> ids = new HashSet<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getString(1));
                }
            }
            return ids;
        } catch (SQLException e) {
            throw new IllegalStateException("이벤트 id 목록 조회 실패", e);
        }
    }

    private static void appendRange(StringBuilder sql, TimeRange range) {
        if (range.start() != null) {
            sql.append(" AND e.start_at >= ?");
        }
        if (range.end() != null) {
            sql.append(" AND e.start_at <= ?");
        }
        sql.append(" ORDER BY e.start_at, e.id");
    }

    private static void bindRange(PreparedStatement ps, int firstIndex, TimeRange range) throws SQLException {
        int index = firstIndex;
        if (range.start() != null) {
            ps.setLong(index++, range.start().toEpochMilli());
        }
        if (range.end() != null) {
            ps.setLong(index, range.end().toEpochMilli());
        }
    }

    private List<ExternalEvent> list(PreparedStatement ps) throws SQLException {
        List<ExternalEvent> events = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                events.add(map(rs));
            }
        }
        return events;
    }

    private ExternalEvent map(ResultSet rs) throws SQLException {
        return new ExternalEvent(
                rs.getLong("id"),
                rs.getLong("calendar_source_id"),
                rs.getString("external_event_id"),
                rs.getString("title"),
                rs.getString("description"),
                rs.getString("location"),
                Instant.ofEpochMilli(rs.getLong("start_at")),
                Instant.ofEpochMilli(rs.getLong("end_at")),
                rs.getBoolean("all_day"),
                rs.getString("revision_marker"),
                Jdbc.getInstant(rs, "local_modified_at"),
                rs.getBoolean("tombstoned")
        );
    }
}
