package io.ainavigator.ingestion.api.service;

import io.ainavigator.ingestion.api.dto.IngestionReport;
import io.ainavigator.ingestion.config.IngestionSettings;
import io.ainavigator.ingestion.config.NewsConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionSchedulerTest {

    @Mock
    private NewsIngestionService ingestionService;

    @Mock
    private IngestionLock ingestionLock;

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<Object> cronFuture;

    private IngestionScheduler scheduler(boolean enableScheduling) {
        IngestionSettings settings = new IngestionSettings(enableScheduling, null, true,
                null, null, null, null, null, null, Duration.ofMillis(100));
        return new IngestionScheduler(ingestionService, ingestionLock, taskScheduler,
                new NewsConfig(null, settings, null, null));
    }

    @Test
    @DisplayName("Should register the three-hourly cron trigger on start")
    void shouldScheduleCronOnStart() {
        IngestionScheduler scheduler = scheduler(true);

        scheduler.start();

        verify(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        assertThat(scheduler.isRunning()).isTrue();
    }

    @Test
    @DisplayName("Should fire one run once the application is ready")
    void shouldRunOnStartup() {
        IngestionScheduler scheduler = scheduler(true);
        scheduler.start();

        scheduler.onApplicationReady();

        verify(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    @DisplayName("Disabled scheduling registers nothing but allows manual runs")
    void shouldOnlyAllowManualRunsWhenDisabled() {
        IngestionScheduler scheduler = scheduler(false);

        scheduler.start();
        scheduler.onApplicationReady();

        verify(taskScheduler, never()).schedule(any(Runnable.class), any(Trigger.class));
        verify(taskScheduler, never()).schedule(any(Runnable.class), any(Instant.class));
        assertThat(scheduler.triggerNow()).isTrue();
    }

    @Test
    @DisplayName("Manual trigger is refused before start")
    void shouldRefuseTriggerWhenStopped() {
        assertThat(scheduler(true).triggerNow()).isFalse();
        verifyNoInteractions(taskScheduler);
    }

    @Test
    @DisplayName("Should run cycle under lease and release it")
    void shouldRunCycleUnderLease() {
        IngestionScheduler scheduler = scheduler(false);
        scheduler.start();
        when(ingestionLock.tryAcquire()).thenReturn(Optional.of("token"));

        scheduler.runGuarded();

        verify(ingestionService).runIngestionCycle();
        verify(ingestionLock).release("token");
        assertThat(scheduler.isCycleRunning()).isFalse();
    }

    @Test
    @DisplayName("Should skip when another instance holds the lease")
    void shouldSkipWhenLeaseHeld() {
        IngestionScheduler scheduler = scheduler(false);
        scheduler.start();
        when(ingestionLock.tryAcquire()).thenReturn(Optional.empty());

        scheduler.runGuarded();

        verify(ingestionService, never()).runIngestionCycle();
        verify(ingestionLock, never()).release(any());
    }

    @Test
    @DisplayName("Trigger arriving during a running cycle is skipped")
    void shouldSkipOverlappingTrigger() {
        IngestionScheduler scheduler = scheduler(false);
        scheduler.start();
        when(ingestionLock.tryAcquire()).thenReturn(Optional.of("token"));
        when(ingestionService.runIngestionCycle()).thenAnswer(inv -> {
            assertThat(scheduler.isCycleRunning()).isTrue();
            assertThat(scheduler.triggerNow()).isFalse();
            scheduler.runGuarded();
            return new IngestionReport("r1", Instant.now(), 0, List.of(), 0, false);
        });

        scheduler.runGuarded();

        verify(ingestionService, times(1)).runIngestionCycle();
        verify(ingestionLock, times(1)).tryAcquire();
    }

    @Test
    @DisplayName("Failing cycle still releases lease and clears running flag")
    void shouldRecoverFromFailingCycle() {
        IngestionScheduler scheduler = scheduler(false);
        scheduler.start();
        when(ingestionLock.tryAcquire()).thenReturn(Optional.of("token"));
        when(ingestionService.runIngestionCycle()).thenThrow(new IllegalStateException("unexpected"));

        scheduler.runGuarded();

        verify(ingestionLock).release("token");
        assertThat(scheduler.isCycleRunning()).isFalse();
    }

    @Test
    @DisplayName("Stop cancels the cron trigger and the running cycle")
    void shouldCancelOnStop() {
        doReturn(cronFuture).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));
        IngestionScheduler scheduler = scheduler(true);
        scheduler.start();

        scheduler.stop();

        verify(cronFuture).cancel(false);
        verify(ingestionService).cancel();
        assertThat(scheduler.isRunning()).isFalse();

        scheduler.runGuarded();
        verify(ingestionService, never()).runIngestionCycle();
    }

    @Test
    @DisplayName("Restart after stop lifts the cancellation")
    void shouldResumeOnRestart() {
        IngestionScheduler scheduler = scheduler(false);
        scheduler.start();
        scheduler.stop();

        scheduler.start();

        verify(ingestionService).cancel();
        verify(ingestionService, times(2)).resume();
        assertThat(scheduler.triggerNow()).isTrue();
    }
}
