package com.my.calsync.adapter.out.persistence;

import com.my.calsync.domain.model.CalendarDescriptor;
import com.my.calsync.domain.model.CalendarSource;
import com.my.calsync.domain.model.EventDescriptor;
import com.my.calsync.domain.model.ExternalEvent;
import com.my.calsync.domain.model.SyncMode;
import com.my.calsync.domain.model.SyncStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SqliteCalendarSourceRepositoryTest {

    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

    @TempDir
    Path tempDir;

    private SqliteCalendarSourceRepository sources;
    private SqliteExternalEventRepository events;

    @BeforeEach
    void setUp() {
        DataSource dataSource = SqliteSchema.dataSource(tempDir.resolve("sources.db"));
        SqliteSchema.apply(dataSource);
        sources = new SqliteCalendarSourceRepository(dataSource);
        events = new SqliteExternalEventRepository(dataSource);
    }

    @Test
    void relinkUpdatesMetadataButKeepsCursor() {
        CalendarSource first = sources.link("u1", "google", new CalendarDescriptor("cal-1", "Work", false, "UTC"));
        sources.tryStartRun(first.id(), T0, T0.minus(Duration.ofMinutes(30)));
        sources.completeRun(first.id(), T0, "cursor-1", T0);

        CalendarSource relinked = sources.link("u1", "google",
                new CalendarDescriptor("cal-1", "Work (renamed)", true, "Asia/Seoul"));

        assertThat(relinked.id()).isEqualTo(first.id());
        assertThat(relinked.name()).isEqualTo("Work (renamed)");
        assertThat(relinked.primary()).isTrue();
        assertThat(relinked.timeZone()).isEqualTo("Asia/Seoul");
        assertThat(relinked.syncCursor()).isEqualTo("cursor-1");
        assertThat(relinked.nextMode()).isEqualTo(SyncMode.INCREMENTAL);
    }

    @Test
    void startRunIsExclusiveUntilStale() {
        CalendarSource source = sources.link("u1", "google", new CalendarDescriptor("cal-1", "Work", false, "UTC"));
        Instant staleBefore = T0.minus(Duration.ofMinutes(30));

        assertThat(sources.tryStartRun(source.id(), T0, staleBefore)).isTrue();
        assertThat(sources.tryStartRun(source.id(), T0.plusSeconds(1), staleBefore)).isFalse();
        assertThat(sources.findById(source.id()).orElseThrow().status()).isEqualTo(SyncStatus.RUNNING);

        Instant later = T0.plus(Duration.ofMinutes(31));
        assertThat(sources.tryStartRun(source.id(), later, later.minus(Duration.ofMinutes(30)))).isTrue();
        assertThat(sources.findById(source.id()).orElseThrow().runStartedAt()).isEqualTo(later);
    }

    @Test
    void failedRunKeepsCursorAndAllowsNextRun() {
        CalendarSource source = sources.link("u1", "google", new CalendarDescriptor("cal-1", "Work", false, "UTC"));
        sources.tryStartRun(source.id(), T0, T0);
        sources.completeRun(source.id(), T0, "cursor-1", T0);
        sources.tryStartRun(source.id(), T0.plusSeconds(60), T0);

        assertThat(sources.failRun(source.id(), T0.plusSeconds(60), "boom")).isTrue();

        CalendarSource failed = sources.findById(source.id()).orElseThrow();
        assertThat(failed.status()).isEqualTo(SyncStatus.ERROR);
        assertThat(failed.syncCursor()).isEqualTo("cursor-1");
        assertThat(failed.lastError()).isEqualTo("boom");
        assertThat(failed.lastSyncedAt()).isEqualTo(T0);
        assertThat(sources.tryStartRun(source.id(), T0.plusSeconds(120), T0)).isTrue();
    }

    @Test
    void runTakenOverByAnotherStartCannotCompleteOrFail() {
        CalendarSource source = sources.link("u1", "google", new CalendarDescriptor("cal-1", "Work", false, "UTC"));
        Instant takeover = T0.plus(Duration.ofMinutes(31));
        sources.tryStartRun(source.id(), T0, T0.minus(Duration.ofMinutes(30)));
        sources.tryStartRun(source.id(), takeover, takeover.minus(Duration.ofMinutes(30)));

        assertThat(sources.heartbeat(source.id(), T0, takeover)).isFalse();
        assertThat(sources.completeRun(source.id(), T0, "stale-cursor", takeover)).isFalse();
        assertThat(sources.failRun(source.id(), T0, "late failure")).isFalse();

        CalendarSource running = sources.findById(source.id()).orElseThrow();
        assertThat(running.status()).isEqualTo(SyncStatus.RUNNING);
        assertThat(running.runStartedAt()).isEqualTo(takeover);
        assertThat(running.syncCursor()).isNull();
        assertThat(running.lastError()).isNull();

        assertThat(sources.completeRun(source.id(), takeover, "cursor-2", takeover)).isTrue();
        assertThat(sources.findById(source.id()).orElseThrow().syncCursor()).isEqualTo("cursor-2");
    }

    @Test
    void heartbeatMovesStartSoRunIsNotStale() {
        CalendarSource source = sources.link("u1", "google", new CalendarDescriptor("cal-1", "Work", false, "UTC"));
        sources.tryStartRun(source.id(), T0, T0.minus(Duration.ofMinutes(30)));
        Instant beat = T0.plus(Duration.ofMinutes(20));

        assertThat(sources.heartbeat(source.id(), T0, beat)).isTrue();

        Instant later = T0.plus(Duration.ofMinutes(35));
        assertThat(sources.tryStartRun(source.id(), later, later.minus(Duration.ofMinutes(30)))).isFalse();
        assertThat(sources.completeRun(source.id(), beat, "cursor-1", later)).isTrue();
    }

    @Test
    void ownershipAndUserListing() {
        CalendarSource mine = sources.link("u1", "google", new CalendarDescriptor("cal-1", "Work", false, "UTC"));
        sources.link("u2", "google", new CalendarDescriptor("cal-1", "Shared", false, "UTC"));

        assertThat(sources.findOwned(mine.id(), "u1")).isPresent();
        assertThat(sources.findOwned(mine.id(), "u2")).isEmpty();
        assertThat(sources.findByUser("u2")).extracting(CalendarSource::name).containsExactly("Shared");
        assertThat(sources.findUsersWithSources()).containsExactly("u1", "u2");
    }

    @Test
    void unlinkCascadesToEvents() {
        CalendarSource source = sources.link("u1", "google", new CalendarDescriptor("cal-1", "Work", false, "UTC"));
        events.insert(ExternalEvent.fromDescriptor(source.id(), new EventDescriptor("a", "A", null, null, T0,
                T0.plusSeconds(600), false, "r1", false), T0));

        assertThat(sources.unlink(source.id(), "u2")).isFalse();
        assertThat(sources.unlink(source.id(), "u1")).isTrue();

        assertThat(sources.findById(source.id())).isEmpty();
        assertThat(events.find(source.id(), "a")).isEmpty();
    }
}
