package com.my.calsync.adapter.out.persistence;

import com.my.calsync.domain.model.OAuthCredential;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SqliteCredentialRepositoryTest {

    private static final Instant EXPIRES = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private SqliteCredentialRepository credentials;

    @BeforeEach
    void setUp() {
        DataSource dataSource = SqliteSchema.dataSource(tempDir.resolve("credentials.db"));
        SqliteSchema.apply(dataSource);
        credentials = new SqliteCredentialRepository(dataSource);
    }

    @Test
    void saveIsUpsertPerUserAndProvider() {
        credentials.save(new OAuthCredential("u1", "google", "acct", "a1", "r1", EXPIRES,
                Set.of("calendar", "email")));
        credentials.save(new OAuthCredential("u1", "google", "acct", "a2", null, EXPIRES.plusSeconds(60),
                Set.of("calendar")));

        OAuthCredential stored = credentials.find("u1", "google").orElseThrow();
        assertThat(stored.accessToken()).isEqualTo("a2");
        assertThat(stored.refreshToken()).isNull();
        assertThat(stored.renewable()).isFalse();
        assertThat(stored.expiresAt()).isEqualTo(EXPIRES.plusSeconds(60));
        assertThat(stored.scopes()).containsExactly("calendar");
        assertThat(credentials.findByUser("u1")).hasSize(1);
    }

    @Test
    void scopesSurviveRoundTrip() {
        credentials.save(new OAuthCredential("u1", "google", "acct", "a1", "r1", EXPIRES,
                Set.of("https://www.googleapis.com/auth/calendar", "openid")));

        assertThat(credentials.find("u1", "google").orElseThrow().scopes())
                .containsExactlyInAnyOrder("https://www.googleapis.com/auth/calendar", "openid");
    }

    @Test
    void deleteReportsWhetherRowExisted() {
        credentials.save(new OAuthCredential("u1", "google", "acct", "a1", "r1", EXPIRES, Set.of()));

        assertThat(credentials.delete("u1", "google")).isTrue();
        assertThat(credentials.delete("u1", "google")).isFalse();
        assertThat(credentials.find("u1", "google")).isEmpty();
    }
}
