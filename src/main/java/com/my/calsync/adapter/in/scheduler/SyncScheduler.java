package com.my.calsync.adapter.in.scheduler;

import com.my.calsync.config.AppConfig;
import com.my.calsync.domain.service.CalendarSyncService;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 왜: 명령이 없어도 연결된 모든 캘린더가 주기적으로 원격과 맞춰지도록 백그라운드 동기화를 돌리기 위함.
 */
@Startup
@ApplicationScoped
public class SyncScheduler {

    private static final Logger log = Logger.getLogger(SyncScheduler.class);

    private final CalendarSyncService calendarSyncService;
    private final boolean enabled;
    private final int intervalMinutes;
    private ScheduledExecutorService executor;

    @Inject
    public SyncScheduler(CalendarSyncService calendarSyncService, AppConfig appConfig) {
        this.calendarSyncService = calendarSyncService;
        this.enabled = appConfig.sync().schedulerEnabled();
        this.intervalMinutes = appConfig.sync().intervalMinutes();
    }

    @PostConstruct
    void start() {
        if (!enabled) {
            log.info("주기 동기화가 비활성화되어 있습니다.");
            return;
        }
        AtomicInteger sequence = new AtomicInteger();
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "calendar-sync-" + sequence.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleWithFixedDelay(this::syncSafely, intervalMinutes, intervalMinutes, TimeUnit.MINUTES);
        log.infof("주기 동기화를 시작합니다: interval=%d분", intervalMinutes);
    }

    void syncSafely() {
        try {
            int sources = calendarSyncService.syncEveryone();
            log.debugf("주기 동기화 완료: sources=%d", sources);
        } catch (Exception e) {
            log.warnf(e, "주기 동기화 중 예외: %s", e.getMessage());
        }
    }

    @PreDestroy
    void stop() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }
}
