package io.ainavigator.ingestion.api.service;

import io.ainavigator.ingestion.config.IngestionSettings;
import io.ainavigator.ingestion.config.NewsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives {@link NewsIngestionService} on a cron cadence plus once after startup.
 * <p>
 * A trigger that arrives while a cycle is still running is skipped, both inside this
 * process and across instances through {@link IngestionLock}. Stopping cancels the cron
 * trigger and gives the running cycle {@code shutdown-grace} to wind down.
 */
@Component
public class IngestionScheduler implements SmartLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(IngestionScheduler.class);

    private final NewsIngestionService ingestionService;
    private final IngestionLock ingestionLock;
    private final TaskScheduler taskScheduler;
    private final IngestionSettings settings;

    private final AtomicBoolean cycleRunning = new AtomicBoolean();
    private volatile boolean started;
    private volatile ScheduledFuture<?> cronFuture;
    private volatile CompletableFuture<Void> currentCycle = CompletableFuture.completedFuture(null);

    public IngestionScheduler(NewsIngestionService ingestionService,
                              IngestionLock ingestionLock,
                              @Qualifier("ingestionTaskScheduler") TaskScheduler taskScheduler,
                              NewsConfig newsConfig) {
        this.ingestionService = ingestionService;
        this.ingestionLock = ingestionLock;
        this.taskScheduler = taskScheduler;
        this.settings = newsConfig.ingestion();
    }

    @Override
    public void start() {
        ingestionService.resume();
        started = true;
        if (!settings.enableScheduling()) {
            logger.info("Scheduled ingestion disabled, manual triggers only");
            return;
        }
        cronFuture = taskScheduler.schedule(this::runGuarded, new CronTrigger(settings.cron()));
        logger.info("Scheduled ingestion with cron '{}'", settings.cron());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (settings.enableScheduling() && settings.runOnStartup()) {
            logger.info("Triggering initial ingestion cycle");
            triggerNow();
        }
    }

    /**
     * Queues a cycle without waiting for it.
     *
     * @return {@code false} if stopped or a cycle is already running
     */
    public boolean triggerNow() {
        if (!started || cycleRunning.get()) {
            return false;
        }
        taskScheduler.schedule(this::runGuarded, Instant.now());
        return true;
    }

    public boolean isCycleRunning() {
        return cycleRunning.get();
    }

    void runGuarded() {
        if (!started) {
            return;
        }
        if (!cycleRunning.compareAndSet(false, true)) {
            logger.info("Skipping ingestion trigger: previous cycle still running");
            return;
        }

        CompletableFuture<Void> cycle = new CompletableFuture<>();
        currentCycle = cycle;
        try {
            Optional<String> lease = ingestionLock.tryAcquire();
            if (lease.isEmpty()) {
                logger.info("Skipping ingestion trigger: another instance holds the ingestion lock");
                return;
            }
            try {
                ingestionService.runIngestionCycle();
            } finally {
                ingestionLock.release(lease.get());
            }
        } catch (Exception e) {
            logger.error("Scheduled ingestion failed: {}", e.getMessage(), e);
        } finally {
            cycleRunning.set(false);
            cycle.complete(null);
        }
    }

    @Override
    public void stop() {
        started = false;
        ScheduledFuture<?> future = cronFuture;
        if (future != null) {
            future.cancel(false);
        }
        ingestionService.cancel();

        long graceMs = settings.shutdownGrace().toMillis();
        try {
            currentCycle.get(graceMs, TimeUnit.MILLISECONDS);
            logger.info("Ingestion scheduler stopped");
        } catch (TimeoutException e) {
            logger.warn("Ingestion cycle still running after {}ms, abandoning it", graceMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            logger.warn("Ingestion cycle ended with error during shutdown: {}", e.getMessage());
        }
    }

    @Override
    public boolean isRunning() {
        return started;
    }
}
