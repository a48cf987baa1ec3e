package com.my.calsync.adapter.out.health;

import com.my.calsync.config.AppConfig;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

@Readiness
@ApplicationScoped
public class SyncReadinessCheck implements HealthCheck {

    private static final Logger log = Logger.getLogger(SyncReadinessCheck.class);
    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;
    private final AppConfig appConfig;

    public SyncReadinessCheck(DataSource dataSource, AppConfig appConfig) {
        this.dataSource = dataSource;
        this.appConfig = appConfig;
    }

    @Override
    public HealthCheckResponse call() {
        boolean storeOk = storeReachable();
        boolean googleConfigured = appConfig.google().clientId().filter(id -> !id.isBlank()).isPresent()
                && appConfig.google().clientSecret().filter(secret -> !secret.isBlank()).isPresent();
        return HealthCheckResponse.named("calendar-sync-readiness")
                .withData("sqlitePath", appConfig.persistence().sqlitePath())
                .withData("storeReachable", storeOk)
                .withData("googleConfigured", googleConfigured)
                .status(storeOk && googleConfigured)
                .build();
    }

    private boolean storeReachable() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            log.debugf("SQLite 연결 확인 실패: %s", e.getMessage());
            return false;
        }
    }
}
