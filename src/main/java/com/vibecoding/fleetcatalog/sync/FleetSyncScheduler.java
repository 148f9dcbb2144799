package com.vibecoding.fleetcatalog.sync;

import com.vibecoding.fleetcatalog.config.FleetProviderProperties.Schedule;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * provider 별 주기 동기화 등록
 *
 * 실패한 패스는 로그만 남기고 다음 주기에 다시 실행된다.
 */
@Component
public class FleetSyncScheduler {

    private static final Logger log = LoggerFactory.getLogger(FleetSyncScheduler.class);

    private final FleetProviderRegistry registry;
    private final TaskScheduler taskScheduler;

    // provider 당 실행 중인 패스는 최대 하나
    private final ExecutorService syncExecutor;

    public FleetSyncScheduler(FleetProviderRegistry registry, TaskScheduler taskScheduler) {
        this.registry = registry;
        this.taskScheduler = taskScheduler;
        this.syncExecutor = Executors.newFixedThreadPool(Math.max(1, registry.getProviders().size()));
    }

    @EventListener(ApplicationReadyEvent.class)
    public void scheduleProviders() {
        for (FleetEntityProvider provider : registry.getProviders()) {
            Schedule schedule = registry.getSettings(provider.getId()).getSchedule();
            taskScheduler.scheduleWithFixedDelay(
                    () -> runWithTimeout(provider, schedule.getTimeout()),
                    Instant.now().plus(schedule.getInitialDelay()),
                    schedule.getFrequency());
            log.info("Scheduled {} every {} (initial delay {}, timeout {})",
                    provider.getProviderName(), schedule.getFrequency(), schedule.getInitialDelay(), schedule.getTimeout());
        }
    }

    void runWithTimeout(FleetEntityProvider provider, Duration timeout) {
        Future<?> future = syncExecutor.submit(provider::run);
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // 작업 스레드를 인터럽트하여 provider 가 결과를 내보내지 않고 중단하게 한다
            future.cancel(true);
            log.error("Sync of {} timed out after {}, cancelled", provider.getProviderName(), timeout);
        } catch (ExecutionException e) {
            // provider 가 이미 상세 로그를 남김
            log.warn("Scheduled sync of {} failed, retrying on next tick: {}",
                    provider.getProviderName(), e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Scheduled sync of {} interrupted", provider.getProviderName());
        }
    }

    @PreDestroy
    public void shutdown() {
        syncExecutor.shutdownNow();
    }
}
