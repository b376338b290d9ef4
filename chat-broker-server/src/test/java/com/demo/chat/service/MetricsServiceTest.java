package com.demo.chat.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsServiceTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MetricsService metricsService = new MetricsService(registry);

    @Test
    void tracksActiveConnections() {
        metricsService.recordWebSocketConnection("c1");
        metricsService.recordWebSocketConnection("c2");
        metricsService.recordWebSocketDisconnection("c1", "NORMAL");

        assertThat(metricsService.getActiveConnections()).isEqualTo(1);
        assertThat(registry.get("chat.connections.active").gauge().value()).isEqualTo(1.0);
        assertThat(metricsService.getCounterValue("chat.connections.opened")).isEqualTo(2.0);
    }

    @Test
    void counterValueSumsAcrossTags() {
        metricsService.recordFrameSent("NEW_MESSAGE", 3);
        metricsService.recordFrameSent("PONG", 1);
        metricsService.recordError("FORBIDDEN", "dispatcher");

        assertThat(metricsService.getCounterValue("chat.frames.sent")).isEqualTo(4.0);
        assertThat(metricsService.getCounterValue("chat.errors")).isEqualTo(1.0);
        assertThat(metricsService.getCounterValue("chat.never.recorded")).isZero();
    }
}
