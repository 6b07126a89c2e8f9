package com.shardfeed.feed.metrics;

import com.shardfeed.feed.config.MetricsConfig;
import com.shardfeed.feed.shard.Partition;
import com.shardfeed.feed.shard.ShardManager;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 운영 HTTP endpoint
 *
 * GET /metrics → Prometheus 스크랩 포맷
 * GET /health  → 샤드 상태 (라우팅 가능한 파티션이 하나라도 있으면 200, 없으면 503)
 */
@Singleton
public class PrometheusHttpServer {
    private static final Logger log = LoggerFactory.getLogger(PrometheusHttpServer.class);
    private static final String METRICS_CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";
    private static final String TEXT_CONTENT_TYPE = "text/plain; charset=utf-8";

    private final PrometheusMeterRegistry registry;
    private final ShardManager shardManager;
    private final int port;
    private HttpServer server;

    @Inject
    public PrometheusHttpServer(PrometheusMeterRegistry registry, ShardManager shardManager, MetricsConfig config) {
        this.registry = registry;
        this.shardManager = shardManager;
        this.port = config.getPort();
    }

    public synchronized void start() {
        if (server != null) {
            return;
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/metrics", exchange ->
                    respond(exchange, 200, METRICS_CONTENT_TYPE, registry.scrape()));
            server.createContext("/health", exchange -> {
                HealthReport report = health();
                respond(exchange, report.httpStatus(), TEXT_CONTENT_TYPE, report.body());
            });
            server.setExecutor(null);
            server.start();

            log.info("Ops endpoint started: port={} paths=[/metrics, /health]", port);
        } catch (IOException e) {
            log.error("Failed to start ops endpoint on port {}", port, e);
            throw new UncheckedIOException("Failed to start ops endpoint", e);
        }
    }

    public synchronized void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
            log.info("Ops endpoint stopped");
        }
    }

    /**
     * 파티션별 한 줄: "partition region active|inactive 사용중/용량"
     */
    public HealthReport health() {
        List<String> lines = new ArrayList<>();
        int routable = 0;
        for (Partition partition : shardManager.partitions()) {
            if (partition.isActive()) {
                routable++;
            }
            lines.add(String.format("%s %s %s %d/%d",
                    partition.getPartitionId(), partition.getRegion(),
                    partition.isActive() ? "active" : "inactive",
                    partition.getPool().active(), partition.getPool().capacity()));
        }

        boolean up = routable > 0;
        StringBuilder body = new StringBuilder()
                .append("status=").append(up ? "UP" : "DOWN").append('\n')
                .append("partitions=").append(String.join(",", shardManager.partitionIds())).append('\n');
        lines.forEach(line -> body.append(line).append('\n'));
        return new HealthReport(up ? 200 : 503, body.toString());
    }

    private static void respond(HttpExchange exchange, int status, String contentType, String body)
            throws IOException {
        byte[] response = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, response.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(response);
        }
    }

    public record HealthReport(int httpStatus, String body) {
    }
}
