package com.my.calsync.adapter.out.persistence;

import com.my.calsync.domain.model.OAuthCredential;
import com.my.calsync.domain.port.out.CredentialRepositoryPort;
import jakarta.enterprise.context.ApplicationScoped;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@ApplicationScoped
public class SqliteCredentialRepository implements CredentialRepositoryPort {

    private static final String SELECT_COLUMNS =
            "SELECT user_id, provider, provider_account_id, access_token, refresh_token, expires_at, scopes "
                    + "FROM oauth_credentials";
    private static final String SELECT_ONE_SQL = SELECT_COLUMNS + " WHERE user_id = ? AND provider = ?";
    private static final String SELECT_BY_USER_SQL = SELECT_COLUMNS + " WHERE user_id = ? ORDER BY provider";
    private static final String UPSERT_SQL = """
            INSERT INTO oauth_credentials(user_id, provider, provider_account_id, access_token, refresh_token,
                                          expires_at, scopes, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(user_id, provider) DO UPDATE SET
                provider_account_id = excluded.provider_account_id,
                access_token = excluded.access_token,
                refresh_token = excluded.refresh_token,
                expires_at = excluded.expires_at,
                scopes = excluded.scopes,
                updated_at = excluded.updated_at
            """;
    private static final String DELETE_SQL = "DELETE FROM oauth_credentials WHERE user_id = ? AND provider = ?";

    private final DataSource dataSource;

    public SqliteCredentialRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<OAuthCredential> find(String userId, String provider) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_ONE_SQL)) {
            ps.setString(1, userId);
            ps.setString(2, provider);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("자격 증명 조회 실패", e);
        }
    }

    @Override
    public List<OAuthCredential> findByUser(String userId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_BY_USER_SQL)) {
            ps.setString(1, userId);
            List<OAuthCredential> credentials = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    credentials.add(map(rs));
                }
            }
            return credentials;
        } catch (SQLException e) {
            throw new IllegalStateException("자격 증명 목록 조회 실패", e);
        }
    }

    @Override
    public void save(OAuthCredential credential) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {
            ps.setString(1, credential.userId());
            ps.setString(2, credential.provider());
            ps.setString(3, credential.providerAccountId());
            ps.setString(4, credential.accessToken());
            ps.setString(5, credential.refreshToken());
            ps.setLong(6, credential.expiresAt().toEpochMilli());
            ps.setString(7, String.join(" ", credential.scopes()));
            ps.setLong(8, Instant.now().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("자격 증명 저장 실패", e);
        }
    }

    @Override
    public boolean delete(String userId, String provider) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(DELETE_SQL)) {
            ps.setString(1, userId);
            ps.setString(2, provider);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IllegalStateException("자격 증명 삭제 실패", e);
        }
    }

    private OAuthCredential map(ResultSet rs) throws SQLException {
        String scopes = rs.getString("scopes");
        Set<String> scopeSet = scopes == null || scopes.isBlank()
                ? Set.of()
                : Arrays.stream(scopes.split(" ")).collect(Collectors.toSet());
        return new OAuthCredential(
                rs.getString("user_id"),
                rs.getString("provider"),
                rs.getString("provider_account_id"),
                rs.getString("access_token"),
                rs.getString("refresh_token"),
                Instant.ofEpochMilli(rs.getLong("expires_at")),
                scopeSet
        );
    }
}
