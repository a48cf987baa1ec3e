package com.my.calsync.domain.service;

import com.my.calsync.adapter.out.persistence.SqliteOAuthStateRepository;
import com.my.calsync.domain.exception.AuthException;
import com.my.calsync.domain.exception.InvalidRequestException;
import com.my.calsync.domain.exception.NotFoundException;
import com.my.calsync.domain.model.CalendarSource;
import com.my.calsync.domain.model.ConnectedAccount;
import com.my.calsync.domain.model.TokenGrant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import static com.my.calsync.domain.service.SyncFixture.USER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CalendarConnectionServiceTest {

    @TempDir
    Path tempDir;

    private SyncFixture fixture;
    private CalendarConnectionService service;

    @BeforeEach
    void setUp() {
        fixture = new SyncFixture(tempDir);
        service = new CalendarConnectionService(fixture.credentialStore, fixture.oauth,
                new SqliteOAuthStateRepository(fixture.dataSource), fixture.client, fixture.sources, fixture.clock,
                Duration.ofMinutes(10));
        when(fixture.oauth.authorizationUrl(anyString()))
                .thenAnswer(invocation -> "https://accounts.example.com/auth?state=" + invocation.getArgument(0));
    }

    @Test
    void callbackWithIssuedStateStoresCredential() {
        String state = issueState();
        when(fixture.oauth.exchangeCode("code-1")).thenReturn(new TokenGrant("access-x", "refresh-x",
                fixture.clock.now().plus(Duration.ofHours(1)), Set.of("calendar")));
        when(fixture.oauth.fetchAccountId("access-x")).thenReturn("acct-42");

        ConnectedAccount account = service.oauthCallback("code-1", state);

        assertThat(account.providerAccountId()).isEqualTo("acct-42");
        assertThat(account.renewable()).isTrue();
        assertThat(fixture.credentials.find(USER, SyncFixture.PROVIDER).orElseThrow().accessToken())
                .isEqualTo("access-x");
        assertThat(service.connectionStatus(USER)).containsExactly(account);
    }

    @Test
    void stateCanBeUsedOnlyOnce() {
        String state = issueState();
        when(fixture.oauth.exchangeCode("code-1")).thenReturn(new TokenGrant("access-x", "refresh-x",
                fixture.clock.now().plus(Duration.ofHours(1)), Set.of()));
        when(fixture.oauth.fetchAccountId("access-x")).thenReturn("acct-42");
        service.oauthCallback("code-1", state);

        assertThatThrownBy(() -> service.oauthCallback("code-1", state))
                .isInstanceOf(AuthException.class)
                .extracting(e -> ((AuthException) e).reason())
                .isEqualTo(AuthException.Reason.INVALID_STATE);
    }

    @Test
    void expiredStateIsRejectedBeforeCodeExchange() {
        String state = issueState();
        fixture.clock.advance(Duration.ofMinutes(11));

        assertThatThrownBy(() -> service.oauthCallback("code-1", state))
                .isInstanceOf(AuthException.class)
                .extracting(e -> ((AuthException) e).reason())
                .isEqualTo(AuthException.Reason.INVALID_STATE);
        verify(fixture.oauth, never()).exchangeCode(anyString());
    }

    @Test
    void unknownOrBlankStateIsRejected() {
        assertThatThrownBy(() -> service.oauthCallback("code-1", "forged"))
                .isInstanceOf(AuthException.class);
        assertThatThrownBy(() -> service.oauthCallback("", "forged"))
                .isInstanceOf(AuthException.class);
        verify(fixture.oauth, never()).exchangeCode(anyString());
    }

    @Test
    void authorizeRequiresUser() {
        assertThatThrownBy(() -> service.authorize(" ")).isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void refreshCalendarListLinksEveryRemoteCalendarOnce() {
        fixture.connect(USER);
        fixture.remote.addCalendar("primary@example.com", "Me", true);
        fixture.remote.addCalendar("team@example.com", "Team", false);

        service.refreshCalendarList(USER);
        service.refreshCalendarList(USER);

        assertThat(service.listCalendarSources(USER))
                .extracting(CalendarSource::externalCalendarId)
                .containsExactlyInAnyOrder("primary@example.com", "team@example.com");
    }

    @Test
    void refreshCalendarListWithoutConnectionIsNotLinked() {
        assertThatThrownBy(() -> service.refreshCalendarList(USER))
                .isInstanceOf(AuthException.class)
                .extracting(e -> ((AuthException) e).reason())
                .isEqualTo(AuthException.Reason.NOT_LINKED);
    }

    @Test
    void getCalendarSourceChecksOwnership() {
        fixture.connect(USER);
        CalendarSource source = fixture.link(USER, "work@example.com");

        assertThat(service.getCalendarSource(USER, source.id()))
                .satisfies(found -> {
                    assertThat(found.id()).isEqualTo(source.id());
                    assertThat(found.externalCalendarId()).isEqualTo("work@example.com");
                });
        assertThatThrownBy(() -> service.getCalendarSource("user-2", source.id()))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.getCalendarSource(USER, 9999L))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void disconnectRemovesCredentialButKeepsCalendars() {
        fixture.connect(USER);
        CalendarSource source = fixture.link(USER, "work@example.com");

        service.disconnect(USER);
        service.disconnect(USER);

        assertThat(service.connectionStatus(USER)).isEmpty();
        assertThat(service.listCalendarSources(USER)).extracting(CalendarSource::id).containsExactly(source.id());
    }

    @Test
    void unlinkRemovesSourceAndItsEvents() {
        fixture.connect(USER);
        CalendarSource source = fixture.link(USER, "work@example.com");
        fixture.remote.put("work@example.com", "a", "A", Instant.parse("2026-03-02T09:00:00Z"));
        fixture.engine.run(source.id());

        service.unlinkCalendar(USER, source.id());

        assertThat(service.listCalendarSources(USER)).isEmpty();
        assertThat(fixture.events.find(source.id(), "a")).isEmpty();
        assertThatThrownBy(() -> service.unlinkCalendar(USER, source.id())).isInstanceOf(NotFoundException.class);
    }

    @Test
    void unlinkOfOtherUsersCalendarIsNotFound() {
        CalendarSource source = fixture.link(USER, "work@example.com");

        assertThatThrownBy(() -> service.unlinkCalendar("user-2", source.id()))
                .isInstanceOf(NotFoundException.class);
        assertThat(fixture.sources.findById(source.id())).isPresent();
    }

    private String issueState() {
        String url = service.authorize(USER);
        ArgumentCaptor<String> state = ArgumentCaptor.forClass(String.class);
        verify(fixture.oauth).authorizationUrl(state.capture());
        assertThat(url).endsWith(state.getValue());
        return state.getValue();
    }
}
