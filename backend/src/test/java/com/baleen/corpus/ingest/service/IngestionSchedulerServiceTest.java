package com.baleen.corpus.ingest.service;

import com.baleen.corpus.config.IngestProperties;
import com.baleen.corpus.ingest.model.IngestionJob;
import com.baleen.corpus.ingest.model.JobStatus;
import com.baleen.corpus.ingest.model.JobTotals;
import com.baleen.corpus.ingest.model.SchedulerState;
import com.baleen.corpus.ingest.model.SchedulerStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IngestionSchedulerServiceTest {
    private static final Instant NOW = Instant.parse("2025-06-12T10:00:00Z");

    private IngestionCoordinatorService coordinator;
    private IngestProperties properties;
    private IngestionSchedulerService scheduler;

    @BeforeEach
    void setUp() {
        coordinator = Mockito.mock(IngestionCoordinatorService.class);
        properties = new IngestProperties();
        scheduler = new IngestionSchedulerService(coordinator, properties, Clock.fixed(NOW, ZoneOffset.UTC), Runnable::run);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void runOnceRecordsLastJob() {
        when(coordinator.run(any())).thenReturn(job(42L));

        IngestionJob job = scheduler.runOnce();

        SchedulerStatus status = scheduler.getStatus();
        assertThat(job.id()).isEqualTo(42L);
        assertThat(status.lastJobId()).isEqualTo(42L);
        assertThat(status.state()).isEqualTo(SchedulerState.IDLE);
        assertThat(status.lastTickStartedAt()).isEqualTo(NOW);
        assertThat(status.lastTickFinishedAt()).isEqualTo(NOW);
    }

    @Test
    void stopBeforeDispatchedTickStartsCancelsIt() {
        List<Runnable> dispatched = new ArrayList<>();
        IngestionSchedulerService deferred = new IngestionSchedulerService(
            coordinator, properties, Clock.fixed(NOW, ZoneOffset.UTC), dispatched::add);
        AtomicBoolean cancelledAtStart = new AtomicBoolean(false);
        when(coordinator.run(any())).thenAnswer(invocation -> {
            BooleanSupplier cancelled = invocation.getArgument(0);
            cancelledAtStart.set(cancelled.getAsBoolean());
            return job(7L);
        });

        assertThat(deferred.tick()).isTrue();
        assertThat(deferred.stop().state()).isEqualTo(SchedulerState.CANCELLING);
        dispatched.forEach(Runnable::run);

        assertThat(cancelledAtStart).isTrue();
        assertThat(deferred.getStatus().state()).isEqualTo(SchedulerState.IDLE);
        deferred.shutdown();
    }

    @Test
    void overlappingRequestsAreRejectedOrSkipped() {
        AtomicBoolean checked = new AtomicBoolean(false);
        when(coordinator.run(any())).thenAnswer(invocation -> {
            assertThat(scheduler.getStatus().state()).isEqualTo(SchedulerState.RUNNING);
            assertThatThrownBy(() -> scheduler.runOnce()).isInstanceOf(ActiveIngestionJobException.class);
            assertThat(scheduler.tick()).isFalse();
            checked.set(true);
            return job(1L);
        });

        scheduler.runOnce();

        assertThat(checked).isTrue();
        assertThat(scheduler.getStatus().skippedTicks()).isEqualTo(1);
        when(coordinator.run(any())).thenReturn(job(2L));
        assertThat(scheduler.runOnce().id()).isEqualTo(2L);
    }

    @Test
    void stopDuringTickSignalsCancellation() {
        AtomicBoolean cancelSeen = new AtomicBoolean(false);
        when(coordinator.run(any())).thenAnswer(invocation -> {
            BooleanSupplier cancelled = invocation.getArgument(0);
            assertThat(cancelled.getAsBoolean()).isFalse();
            SchedulerStatus status = scheduler.stop();
            assertThat(status.state()).isEqualTo(SchedulerState.CANCELLING);
            cancelSeen.set(cancelled.getAsBoolean());
            return job(3L);
        });

        scheduler.runOnce();

        assertThat(cancelSeen).isTrue();
        assertThat(scheduler.getStatus().state()).isEqualTo(SchedulerState.IDLE);
    }

    @Test
    void startRunsFirstTickAndStopCancelsTimer() {
        when(coordinator.run(any())).thenReturn(job(5L));

        SchedulerStatus started = scheduler.start(Duration.ofHours(1));

        assertThat(started.timerActive()).isTrue();
        assertThat(started.intervalSeconds()).isEqualTo(3600L);
        verify(coordinator, timeout(2_000)).run(any());

        SchedulerStatus stopped = scheduler.stop();
        assertThat(stopped.timerActive()).isFalse();
    }

    @Test
    void rejectsNonPositiveInterval() {
        assertThatThrownBy(() -> scheduler.start(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> scheduler.start(Duration.ofSeconds(-5))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void disabledSchedulerDoesNotStartOnBoot() {
        properties.getScheduler().setEnabled(false);

        scheduler.startIfEnabled();

        assertThat(scheduler.getStatus().timerActive()).isFalse();
    }

    @Test
    void failedTickReleasesTheSlot() {
        when(coordinator.run(any())).thenThrow(new IllegalStateException("db down")).thenReturn(job(9L));

        assertThat(scheduler.tick()).isTrue();

        assertThat(scheduler.getStatus().state()).isEqualTo(SchedulerState.IDLE);
        assertThat(scheduler.runOnce().id()).isEqualTo(9L);
    }

    private IngestionJob job(long id) {
        return new IngestionJob(id, NOW, NOW, JobStatus.COMPLETED, "feeds=0", JobTotals.EMPTY, List.of());
    }
}
