package com.shardfeed.feed.scheduler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("틱 스케줄러")
class TickSchedulerTest {

    private TickScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new TickScheduler();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    @DisplayName("주기적으로 onTick 호출, 예외가 나도 계속 실행")
    void testTicksSurviveExceptions() throws InterruptedException {
        CountDownLatch ticks = new CountDownLatch(3);
        Cancellable handle = scheduler.schedule(task("flaky", () -> {
            ticks.countDown();
            throw new IllegalStateException("tick failure");
        }), Duration.ofMillis(10));

        assertTrue(ticks.await(5, TimeUnit.SECONDS));
        handle.cancel();
        assertTrue(handle.isCancelled());
    }

    @Test
    @DisplayName("cancel 이후에는 tick 없음")
    void testCancelStopsTicks() throws InterruptedException {
        AtomicInteger count = new AtomicInteger();
        CountDownLatch first = new CountDownLatch(1);
        Cancellable handle = scheduler.schedule(task("counter", () -> {
            count.incrementAndGet();
            first.countDown();
        }), Duration.ofMillis(10));

        assertTrue(first.await(5, TimeUnit.SECONDS));
        handle.cancel();
        int afterCancel = count.get();
        Thread.sleep(100);

        // cancel 직전에 시작된 tick 하나까지는 허용
        assertTrue(count.get() <= afterCancel + 1);
    }

    @Test
    @DisplayName("0 이하 주기 거부, shutdown 후 상태")
    void testInvalidIntervalAndShutdown() {
        assertThrows(IllegalArgumentException.class, () -> scheduler.schedule(task("bad", () -> { }), Duration.ZERO));

        scheduler.shutdown();
        assertTrue(scheduler.isShutdown());
    }

    private static PeriodicTask task(String name, Runnable body) {
        return new PeriodicTask() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public void onTick() {
                body.run();
            }
        };
    }
}
