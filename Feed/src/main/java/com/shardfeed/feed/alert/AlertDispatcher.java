package com.shardfeed.feed.alert;

import com.shardfeed.feed.metrics.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 설정된 모든 채널로 fan-out
 *
 * 한 채널의 실패가 다른 채널 전달을 막지 않는다.
 */
public final class AlertDispatcher {
    private static final Logger log = LoggerFactory.getLogger(AlertDispatcher.class);

    private final List<AlertChannel> channels;
    private final MetricsCollector metrics;

    public AlertDispatcher(List<AlertChannel> channels, MetricsCollector metrics) {
        this.channels = List.copyOf(channels);
        this.metrics = metrics;
        if (this.channels.isEmpty()) {
            log.warn("AlertDispatcher created without channels, alerts will be dropped");
        }
    }

    /**
     * @return 전달에 성공한 채널 수
     */
    public int dispatch(Alert alert) {
        int delivered = 0;
        for (AlertChannel channel : channels) {
            String kind = channel.kind().name();
            try {
                channel.deliver(alert);
                metrics.recordAlert(kind, alert.severity().name());
                delivered++;
            } catch (RuntimeException e) {
                metrics.recordAlertFailure(kind);
                log.error("Alert delivery failed: channel={} source={}", kind, alert.source(), e);
            }
        }
        return delivered;
    }

    public List<AlertChannel> channels() {
        return channels;
    }
}
