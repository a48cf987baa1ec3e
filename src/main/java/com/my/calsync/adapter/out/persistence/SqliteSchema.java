package com.my.calsync.adapter.out.persistence;

import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * 왜: 자격 증명/캘린더/이벤트 테이블을 하나의 SQLite 파일에 두고 시작 시 멱등하게 준비하기 위함.
 */
public final class SqliteSchema {

    private static final List<String> DDL = List.of(
            """
            CREATE TABLE IF NOT EXISTS oauth_credentials (
                user_id TEXT NOT NULL,
                provider TEXT NOT NULL,
                provider_account_id TEXT,
                access_token TEXT NOT NULL,
                refresh_token TEXT,
                expires_at INTEGER NOT NULL,
                scopes TEXT NOT NULL DEFAULT '',
                updated_at INTEGER NOT NULL,
                PRIMARY KEY (user_id, provider)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS oauth_states (
                state TEXT PRIMARY KEY,
                user_id TEXT NOT NULL,
                created_at INTEGER NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS calendar_sources (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                user_id TEXT NOT NULL,
                provider TEXT NOT NULL,
                external_calendar_id TEXT NOT NULL,
                name TEXT NOT NULL,
                is_primary INTEGER NOT NULL DEFAULT 0,
                time_zone TEXT NOT NULL DEFAULT 'UTC',
                sync_cursor TEXT,
                last_synced_at INTEGER,
                status TEXT NOT NULL DEFAULT 'idle',
                run_started_at INTEGER,
                last_error TEXT,
                UNIQUE (user_id, external_calendar_id)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS external_events (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                calendar_source_id INTEGER NOT NULL REFERENCES calendar_sources(id) ON DELETE CASCADE,
                external_event_id TEXT NOT NULL,
                title TEXT NOT NULL,
                description TEXT,
                location TEXT,
                start_at INTEGER NOT NULL,
                end_at INTEGER NOT NULL,
                all_day INTEGER NOT NULL DEFAULT 0,
                revision_marker TEXT,
                local_modified_at INTEGER NOT NULL,
                tombstoned INTEGER NOT NULL DEFAULT 0,
                UNIQUE (calendar_source_id, external_event_id)
            )
            """,
            "CREATE INDEX IF NOT EXISTS ix_external_events_source_start ON external_events(calendar_source_id, start_at)"
    );

    private SqliteSchema() {
    }

    /**
     * 외래 키와 WAL 을 켠 데이터 소스를 만든다. 외래 키 설정은 연결마다 적용되어야 하므로 SQLiteConfig 로 건다.
     */
    public static SQLiteDataSource dataSource(Path sqlitePath) {
        try {
            Path parent = sqlitePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (Exception e) {
            throw new IllegalStateException("SQLite 경로 생성 실패", e);
        }
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setBusyTimeout(5000);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + sqlitePath.toAbsolutePath());
        return dataSource;
    }

    public static void apply(DataSource dataSource) {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            for (String ddl : DDL) {
                stmt.execute(ddl);
            }
        } catch (SQLException e) {
            throw new IllegalStateException("캘린더 동기화 테이블 초기화 실패", e);
        }
    }
}
