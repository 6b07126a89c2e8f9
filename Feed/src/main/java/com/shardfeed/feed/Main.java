package com.shardfeed.feed;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.shardfeed.feed.config.HealthConfig;
import com.shardfeed.feed.config.MetricsConfig;
import com.shardfeed.feed.metrics.MetricsReporter;
import com.shardfeed.feed.metrics.PrometheusHttpServer;
import com.shardfeed.feed.module.*;
import com.shardfeed.feed.scheduler.Cancellable;
import com.shardfeed.feed.scheduler.PoolHealthCheck;
import com.shardfeed.feed.scheduler.TickScheduler;
import com.shardfeed.feed.shard.ShardManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws InterruptedException {
        log.info("Initializing application...");

        Injector injector = Guice.createInjector(
                new ConfigModule(),
                new MetricsModule(),
                new StorageModule(),
                new ServiceModule(),
                new SchedulerModule()
        );

        ShardManager shardManager = injector.getInstance(ShardManager.class);
        PrometheusHttpServer prometheusServer = injector.getInstance(PrometheusHttpServer.class);
        TickScheduler tickScheduler = injector.getInstance(TickScheduler.class);
        PoolHealthCheck healthCheck = injector.getInstance(PoolHealthCheck.class);
        MetricsReporter metricsReporter = injector.getInstance(MetricsReporter.class);

        prometheusServer.start();
        Cancellable healthTick = tickScheduler.schedule(
                healthCheck, injector.getInstance(HealthConfig.class).getInterval());
        Cancellable reportTick = tickScheduler.schedule(
                metricsReporter, injector.getInstance(MetricsConfig.class).getReportInterval());

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown hook triggered");
            healthTick.cancel();
            reportTick.cancel();
            tickScheduler.shutdown();
            shardManager.close();
            prometheusServer.stop();
            stopped.countDown();
        }));

        log.info("Feed core started: partitions={}", shardManager.partitionIds());

        // 스케줄러 스레드는 daemon이므로 shutdown hook까지 main 스레드 유지
        stopped.await();
    }
}
