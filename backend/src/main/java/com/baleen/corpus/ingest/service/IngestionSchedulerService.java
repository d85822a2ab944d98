package com.baleen.corpus.ingest.service;

import com.baleen.corpus.config.IngestProperties;
import com.baleen.corpus.ingest.model.IngestionJob;
import com.baleen.corpus.ingest.model.SchedulerState;
import com.baleen.corpus.ingest.model.SchedulerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives recurring ingestion ticks. At most one tick runs at a time: a timer tick that finds one in
 * progress is skipped, a manual run is rejected with {@link ActiveIngestionJobException}.
 */
@Service
public class IngestionSchedulerService {
    private static final Logger log = LoggerFactory.getLogger(IngestionSchedulerService.class);

    private final IngestionCoordinatorService coordinator;
    private final IngestProperties properties;
    private final Clock clock;
    private final Executor tickExecutor;
    private final ExecutorService ownedTickExecutor;
    private final Object lifecycleLock = new Object();
    private final AtomicBoolean tickInProgress = new AtomicBoolean(false);
    private final AtomicLong skippedTicks = new AtomicLong();

    private ScheduledExecutorService timer;
    private ScheduledFuture<?> timerTask;
    private Duration interval;
    private volatile AtomicBoolean currentCancel;
    private volatile SchedulerState state = SchedulerState.IDLE;
    private volatile Instant lastTickStartedAt;
    private volatile Instant lastTickFinishedAt;
    private volatile Long lastJobId;

    @Autowired
    public IngestionSchedulerService(IngestionCoordinatorService coordinator, IngestProperties properties, Clock clock) {
        this(coordinator, properties, clock, Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("ingest-tick");
            thread.setDaemon(true);
            return thread;
        }));
    }

    IngestionSchedulerService(
        IngestionCoordinatorService coordinator,
        IngestProperties properties,
        Clock clock,
        Executor tickExecutor
    ) {
        this.coordinator = coordinator;
        this.properties = properties;
        this.clock = clock;
        this.tickExecutor = tickExecutor;
        this.ownedTickExecutor = tickExecutor instanceof ExecutorService service ? service : null;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getScheduler().isEnabled()) {
            start(Duration.ofSeconds(properties.getScheduler().getIntervalSeconds()));
        }
    }

    @PreDestroy
    public void shutdown() {
        stop();
        if (ownedTickExecutor != null) {
            ownedTickExecutor.shutdownNow();
        }
    }

    public SchedulerStatus start(Duration requestedInterval) {
        if (requestedInterval == null || requestedInterval.isZero() || requestedInterval.isNegative()) {
            throw new IllegalArgumentException("Scheduler interval must be positive");
        }
        synchronized (lifecycleLock) {
            cancelTimer();
            interval = requestedInterval;
            timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("ingest-scheduler");
                thread.setDaemon(true);
                return thread;
            });
            long periodMs = requestedInterval.toMillis();
            timerTask = timer.scheduleAtFixedRate(this::tick, 0, periodMs, TimeUnit.MILLISECONDS);
            log.info("Ingestion scheduler started with interval {}", requestedInterval);
        }
        return getStatus();
    }

    /**
     * Cancels future ticks and asks an in-flight tick to start no further feeds. Feeds already
     * being fetched run to completion.
     */
    public SchedulerStatus stop() {
        synchronized (lifecycleLock) {
            boolean hadTimer = cancelTimer();
            AtomicBoolean cancel = currentCancel;
            if (cancel != null && tickInProgress.get()) {
                cancel.set(true);
                state = SchedulerState.CANCELLING;
                log.info("Ingestion scheduler stopping; in-flight tick cancelled");
            } else if (hadTimer) {
                log.info("Ingestion scheduler stopped");
            }
        }
        return getStatus();
    }

    public IngestionJob runOnce() {
        AtomicBoolean cancel = claimTick();
        if (cancel == null) {
            throw new ActiveIngestionJobException("An ingestion tick is already in progress (lastTickStartedAt="
                + lastTickStartedAt + ")");
        }
        return runTick(cancel);
    }

    /**
     * Timer entry point. Returns {@code false} when the tick was skipped because another is running.
     */
    public boolean tick() {
        AtomicBoolean cancel = claimTick();
        if (cancel == null) {
            long skipped = skippedTicks.incrementAndGet();
            log.warn("Skipping ingestion tick; previous tick still running (skipped={})", skipped);
            return false;
        }
        try {
            tickExecutor.execute(() -> {
                try {
                    runTick(cancel);
                } catch (RuntimeException e) {
                    log.warn("Scheduled ingestion tick failed", e);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            releaseTick();
            log.warn("Ingestion tick rejected: {}", e.getMessage());
            return false;
        }
    }

    public SchedulerStatus getStatus() {
        boolean timerActive;
        Long intervalSeconds;
        synchronized (lifecycleLock) {
            timerActive = timerTask != null && !timerTask.isCancelled();
            intervalSeconds = interval == null ? null : interval.getSeconds();
        }
        return new SchedulerStatus(
            state,
            timerActive,
            intervalSeconds,
            lastTickStartedAt,
            lastTickFinishedAt,
            lastJobId,
            skippedTicks.get()
        );
    }

    /**
     * Claims the tick slot and publishes its cancel flag atomically with respect to {@link #stop()}.
     * Returns {@code null} when another tick holds the slot.
     */
    private AtomicBoolean claimTick() {
        synchronized (lifecycleLock) {
            if (!tickInProgress.compareAndSet(false, true)) {
                return null;
            }
            AtomicBoolean cancel = new AtomicBoolean(false);
            currentCancel = cancel;
            state = SchedulerState.RUNNING;
            lastTickStartedAt = clock.instant();
            return cancel;
        }
    }

    private void releaseTick() {
        synchronized (lifecycleLock) {
            lastTickFinishedAt = clock.instant();
            currentCancel = null;
            state = SchedulerState.IDLE;
            tickInProgress.set(false);
        }
    }

    private IngestionJob runTick(AtomicBoolean cancel) {
        try {
            IngestionJob job = coordinator.run(cancel::get);
            lastJobId = job.id();
            return job;
        } finally {
            releaseTick();
        }
    }

    private boolean cancelTimer() {
        boolean hadTimer = false;
        if (timerTask != null) {
            timerTask.cancel(false);
            timerTask = null;
            hadTimer = true;
        }
        if (timer != null) {
            timer.shutdownNow();
            timer = null;
        }
        return hadTimer;
    }
}
