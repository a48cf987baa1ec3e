package com.my.calsync.config;

import io.quarkus.runtime.LaunchMode;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        boolean isProd = LaunchMode.current() == LaunchMode.NORMAL;
        validateRequired("GOOGLE_CLIENT_ID", appConfig.google().clientId().orElse(null), isProd);
        validateRequired("GOOGLE_CLIENT_SECRET", appConfig.google().clientSecret().orElse(null), isProd);
        validatePositive("app.remote.max-attempts", appConfig.remote().maxAttempts());
        validatePositive("app.remote.timeout-seconds", appConfig.remote().timeoutSeconds());
        validatePositive("app.sync.stale-run-minutes", appConfig.sync().staleRunMinutes());
    }

    private void validateRequired(String name, String value, boolean strict) {
        if (value == null || value.isBlank()) {
            String message = "필수 설정이 비어 있습니다: " + name;
            if (strict) {
                throw new IllegalStateException(message);
            }
            log.warn(message);
        }
    }

    private void validatePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalStateException("설정 값은 0보다 커야 합니다: " + name + "=" + value);
        }
    }
}
