package com.shardfeed.feed.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.PreDestroy;
import javax.inject.Inject;
import javax.inject.Singleton;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 주기 작업 스케줄러 (health check, metrics report)
 *
 * - 단일 daemon 스레드, fixed-rate
 * - tick 예외는 로그만 남기고 다음 tick 계속 실행
 */
@Singleton
public class TickScheduler {
    private static final Logger log = LoggerFactory.getLogger(TickScheduler.class);

    private final ScheduledExecutorService scheduler;

    @Inject
    public TickScheduler() {
        this.scheduler = Executors.newScheduledThreadPool(1, r -> {
            Thread t = new Thread(r, "tick-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    public Cancellable schedule(PeriodicTask task, Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
        long millis = interval.toMillis();
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(
            () -> runTick(task),
            millis,
            millis,
            TimeUnit.MILLISECONDS
        );
        log.info("Scheduled task: name={} interval={}ms", task.name(), millis);
        return new FutureCancellable(task.name(), future);
    }

    private void runTick(PeriodicTask task) {
        try {
            task.onTick();
        } catch (Exception e) {
            log.error("Periodic task failed: name={}", task.name(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down TickScheduler");
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isShutdown() {
        return scheduler.isShutdown();
    }

    private static final class FutureCancellable implements Cancellable {
        private final String name;
        private final ScheduledFuture<?> future;

        private FutureCancellable(String name, ScheduledFuture<?> future) {
            this.name = name;
            this.future = future;
        }

        @Override
        public void cancel() {
            if (future.cancel(false)) {
                log.info("Cancelled task: name={}", name);
            }
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
