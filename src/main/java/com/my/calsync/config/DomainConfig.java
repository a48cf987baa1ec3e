package com.my.calsync.config;

import com.my.calsync.adapter.out.clock.SystemClockAdapter;
import com.my.calsync.adapter.out.persistence.SqliteSchema;
import com.my.calsync.domain.port.in.CalendarConnectionUseCase;
import com.my.calsync.domain.port.in.ManageEventsUseCase;
import com.my.calsync.domain.port.out.CalendarSourceRepositoryPort;
import com.my.calsync.domain.port.out.ClockPort;
import com.my.calsync.domain.port.out.CredentialRepositoryPort;
import com.my.calsync.domain.port.out.ExternalEventRepositoryPort;
import com.my.calsync.domain.port.out.OAuthProviderPort;
import com.my.calsync.domain.port.out.OAuthStatePort;
import com.my.calsync.domain.port.out.RemoteCalendarPort;
import com.my.calsync.domain.service.CalendarConnectionService;
import com.my.calsync.domain.service.CalendarSyncService;
import com.my.calsync.domain.service.CredentialStore;
import com.my.calsync.domain.service.EventManager;
import com.my.calsync.domain.service.RemoteCalendarClient;
import com.my.calsync.domain.service.RetryPolicy;
import com.my.calsync.domain.service.Sleeper;
import com.my.calsync.domain.service.SyncEngine;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.time.Duration;

/**
 * 왜: 도메인 서비스와 포트 구현을 명시적으로 연결하여 헥사고날 구조를 보장하기 위함.
 */
@ApplicationScoped
public class DomainConfig {

    @Produces
    @ApplicationScoped
    public ClockPort clockPort() {
        return SystemClockAdapter.system();
    }

    @Produces
    @Singleton
    public DataSource dataSource(AppConfig appConfig) {
        DataSource dataSource = SqliteSchema.dataSource(Path.of(appConfig.persistence().sqlitePath()));
        SqliteSchema.apply(dataSource);
        return dataSource;
    }

    @Produces
    @ApplicationScoped
    public CredentialStore credentialStore(CredentialRepositoryPort credentialRepository,
                                           OAuthProviderPort oauthProvider,
                                           ClockPort clockPort,
                                           AppConfig appConfig) {
        return new CredentialStore(credentialRepository, oauthProvider, clockPort,
                Duration.ofSeconds(appConfig.credential().refreshMarginSeconds()));
    }

    @Produces
    @ApplicationScoped
    public RemoteCalendarClient remoteCalendarClient(RemoteCalendarPort remoteCalendarPort,
                                                     CredentialStore credentialStore,
                                                     AppConfig appConfig) {
        RetryPolicy retryPolicy = new RetryPolicy(appConfig.remote().maxAttempts(),
                Duration.ofMillis(appConfig.remote().initialBackoffMillis()),
                Duration.ofMillis(appConfig.remote().maxBackoffMillis()));
        return new RemoteCalendarClient(remoteCalendarPort, credentialStore, retryPolicy, Sleeper.system());
    }

    @Produces
    @ApplicationScoped
    public SyncEngine syncEngine(RemoteCalendarClient remoteCalendarClient,
                                 CalendarSourceRepositoryPort calendarSourceRepository,
                                 ExternalEventRepositoryPort externalEventRepository,
                                 ClockPort clockPort,
                                 AppConfig appConfig) {
        return new SyncEngine(remoteCalendarClient, calendarSourceRepository, externalEventRepository, clockPort,
                Duration.ofMinutes(appConfig.sync().staleRunMinutes()));
    }

    /**
     * 스케줄러가 syncEveryone 을 쓰므로 구현 타입으로 노출한다. SyncCalendarUseCase 로도 주입된다.
     */
    @Produces
    @ApplicationScoped
    public CalendarSyncService calendarSyncService(SyncEngine syncEngine,
                                                   CalendarSourceRepositoryPort calendarSourceRepository,
                                                   CalendarConnectionUseCase calendarConnectionUseCase) {
        return new CalendarSyncService(syncEngine, calendarSourceRepository, calendarConnectionUseCase);
    }

    @Produces
    @ApplicationScoped
    public ManageEventsUseCase manageEventsUseCase(RemoteCalendarClient remoteCalendarClient,
                                                   CalendarSourceRepositoryPort calendarSourceRepository,
                                                   ExternalEventRepositoryPort externalEventRepository,
                                                   ClockPort clockPort) {
        return new EventManager(remoteCalendarClient, calendarSourceRepository, externalEventRepository, clockPort);
    }

    @Produces
    @ApplicationScoped
    public CalendarConnectionUseCase calendarConnectionUseCase(CredentialStore credentialStore,
                                                               OAuthProviderPort oauthProvider,
                                                               OAuthStatePort oauthStatePort,
                                                               RemoteCalendarClient remoteCalendarClient,
                                                               CalendarSourceRepositoryPort calendarSourceRepository,
                                                               ClockPort clockPort,
                                                               AppConfig appConfig) {
        return new CalendarConnectionService(credentialStore, oauthProvider, oauthStatePort, remoteCalendarClient,
                calendarSourceRepository, clockPort, Duration.ofMinutes(appConfig.oauth().stateTtlMinutes()));
    }
}
