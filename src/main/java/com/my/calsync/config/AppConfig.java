package com.my.calsync.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

@StaticInitSafe
@ConfigMapping(prefix = "app")
public interface AppConfig {

    GoogleConfig google();

    CredentialConfig credential();

    OAuthConfig oauth();

    RemoteConfig remote();

    SyncConfig sync();

    PersistenceConfig persistence();

    IdempotencyConfig idempotency();

    interface GoogleConfig {
        @WithName("client-id")
        Optional<String> clientId();

        @WithName("client-secret")
        Optional<String> clientSecret();

        @WithName("redirect-uri")
        @WithDefault("http://localhost:8080/oauth/google/callback")
        String redirectUri();

        @WithName("application-name")
        @WithDefault("calendar-sync-worker")
        String applicationName();
    }

    interface CredentialConfig {
        @WithName("refresh-margin-seconds")
        @WithDefault("60")
        int refreshMarginSeconds();
    }

    interface OAuthConfig {
        @WithName("state-ttl-minutes")
        @WithDefault("10")
        int stateTtlMinutes();
    }

    interface RemoteConfig {
        @WithName("max-attempts")
        @WithDefault("4")
        int maxAttempts();

        @WithName("initial-backoff-millis")
        @WithDefault("500")
        long initialBackoffMillis();

        @WithName("max-backoff-millis")
        @WithDefault("8000")
        long maxBackoffMillis();

        @WithName("timeout-seconds")
        @WithDefault("20")
        int timeoutSeconds();

        @WithName("page-size")
        @WithDefault("250")
        int pageSize();
    }

    interface SyncConfig {
        @WithName("stale-run-minutes")
        @WithDefault("30")
        int staleRunMinutes();

        @WithName("scheduler-enabled")
        @WithDefault("false")
        boolean schedulerEnabled();

        @WithName("interval-minutes")
        @WithDefault("15")
        int intervalMinutes();
    }

    interface PersistenceConfig {
        @WithName("sqlite-path")
        @WithDefault("./data/calendar-sync.db")
        String sqlitePath();
    }

    interface IdempotencyConfig {
        @WithName("backend")
        @WithDefault("sqlite")
        String backend();

        @WithName("ttl-hours")
        @WithDefault("24")
        int ttlHours();
    }
}
