package com.shardfeed.feed.alert;

import com.shardfeed.feed.core.exception.AlertDeliveryException;
import com.shardfeed.feed.metrics.MetricsCollector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("알림 fan-out")
class AlertDispatcherTest {

    private static final Alert ALERT = new Alert(Severity.WARNING, "pool-health:p1", "pool utilization 0.95",
                                                 Instant.parse("2024-05-02T00:00:00Z"));

    @Mock
    private AlertSender sender;

    private SimpleMeterRegistry registry;
    private MetricsCollector metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MetricsCollector(registry);
    }

    @Test
    @DisplayName("메일/채팅 채널은 sender로 전달")
    void testDeliversToAllChannels() {
        AlertDispatcher dispatcher = new AlertDispatcher(List.of(
            new LogAlertChannel(),
            new EmailAlertChannel(sender, "oncall@example.com"),
            new ChatAlertChannel(sender, "#oncall")
        ), metrics);

        assertEquals(3, dispatcher.dispatch(ALERT));

        verify(sender).send(eq(ChannelKind.EMAIL), eq("oncall@example.com"),
                            eq("[WARNING] pool-health:p1"), contains("pool utilization 0.95"));
        verify(sender).send(ChannelKind.CHAT, "#oncall", "[WARNING] pool-health:p1",
                            "[WARNING] pool-health:p1 pool utilization 0.95");
        assertEquals(1.0, registry.get("alerts.delivered").tag("channel", "EMAIL").counter().count(), 1e-9);
    }

    @Test
    @DisplayName("한 채널 실패가 다른 채널 전달을 막지 않음")
    void testIsolatesChannelFailure() {
        doThrow(new AlertDeliveryException("smtp down"))
                .when(sender).send(eq(ChannelKind.EMAIL), anyString(), anyString(), anyString());
        AlertDispatcher dispatcher = new AlertDispatcher(List.of(
            new EmailAlertChannel(sender, "oncall@example.com"),
            new ChatAlertChannel(sender, "#oncall")
        ), metrics);

        assertEquals(1, dispatcher.dispatch(ALERT));

        verify(sender).send(eq(ChannelKind.CHAT), anyString(), anyString(), anyString());
        assertEquals(1.0, registry.get("alerts.failed").tag("channel", "EMAIL").counter().count(), 1e-9);
    }

    @Test
    @DisplayName("채널이 없으면 아무것도 전달하지 않음")
    void testNoChannels() {
        AlertDispatcher dispatcher = new AlertDispatcher(List.of(), metrics);

        assertEquals(0, dispatcher.dispatch(ALERT));
        verify(sender, never()).send(any(), any(), any(), any());
    }
}
