package com.my.calsync.adapter.out.persistence;

import com.my.calsync.domain.port.out.OAuthStatePort;
import jakarta.enterprise.context.ApplicationScoped;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

@ApplicationScoped
public class SqliteOAuthStateRepository implements OAuthStatePort {

    private static final String INSERT_SQL = "INSERT INTO oauth_states(state, user_id, created_at) VALUES (?, ?, ?)";
    private static final String SELECT_SQL = "SELECT user_id, created_at FROM oauth_states WHERE state = ?";
    private static final String DELETE_SQL = "DELETE FROM oauth_states WHERE state = ?";
    private static final String CLEANUP_SQL = "DELETE FROM oauth_states WHERE created_at < ?";

    private final DataSource dataSource;

    public SqliteOAuthStateRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void save(String state, String userId, Instant createdAt) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
            ps.setString(1, state);
            ps.setString(2, userId);
            ps.setLong(3, createdAt.toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("OAuth state 저장 실패", e);
        }
    }

    /**
     * 조회와 삭제를 한 트랜잭션으로 묶어 같은 state 가 두 번 소비되지 않게 한다.
     */
    @Override
    public Optional<String> consume(String state, Instant issuedAfter) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                Optional<String> userId = Optional.empty();
                try (PreparedStatement select = conn.prepareStatement(SELECT_SQL)) {
                    select.setString(1, state);
                    try (ResultSet rs = select.executeQuery()) {
                        if (rs.next() && !Instant.ofEpochMilli(rs.getLong("created_at")).isBefore(issuedAfter)) {
                            userId = Optional.of(rs.getString("user_id"));
                        }
                    }
                }
                try (PreparedStatement delete = conn.prepareStatement(DELETE_SQL)) {
                    delete.setString(1, state);
                    if (delete.executeUpdate() == 0) {
                        userId = Optional.empty();
                    }
                }
                try (PreparedStatement cleanup = conn.prepareStatement(CLEANUP_SQL)) {
                    cleanup.setLong(1, issuedAfter.toEpochMilli());
                    cleanup.executeUpdate();
                }
                conn.commit();
                return userId;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IllegalStateException("OAuth state 소비 실패", e);
        }
    }
}
