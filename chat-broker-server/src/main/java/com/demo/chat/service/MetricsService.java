package com.demo.chat.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Broker metrics on top of Micrometer.
 *
 * Counters:
 * - chat.connections.opened / chat.connections.closed
 * - chat.frames.received / chat.frames.sent (tagged by type)
 * - chat.auth.attempts (tagged by outcome)
 * - chat.errors (tagged by code and component)
 *
 * Gauges:
 * - chat.connections.active
 */
@Service
@Slf4j
public class MetricsService {

    private final MeterRegistry registry;
    private final AtomicInteger activeConnections = new AtomicInteger();

    public MetricsService(MeterRegistry registry) {
        this.registry = registry;
        registry.gauge("chat.connections.active", activeConnections);
        log.info("MetricsService initialized: registry={}", registry.getClass().getSimpleName());
    }

    public void recordWebSocketConnection(String connectionId) {
        registry.counter("chat.connections.opened").increment();
        int active = activeConnections.incrementAndGet();
        log.debug("Connection opened: connectionId={}, active={}", connectionId, active);
    }

    public void recordWebSocketDisconnection(String connectionId, String reason) {
        registry.counter("chat.connections.closed", "reason", reason).increment();
        int active = activeConnections.decrementAndGet();
        log.debug("Connection closed: connectionId={}, reason={}, active={}", connectionId, reason, active);
    }

    public void recordFrameReceived(String type) {
        registry.counter("chat.frames.received", "type", type).increment();
    }

    public void recordFrameSent(String type, int recipients) {
        registry.counter("chat.frames.sent", "type", type).increment(recipients);
    }

    public void recordSendFailure(String type) {
        registry.counter("chat.frames.failed", "type", type).increment();
    }

    public void recordAuthenticationAttempt(boolean success) {
        registry.counter("chat.auth.attempts", "outcome", success ? "success" : "failure").increment();
    }

    public void recordError(String code, String component) {
        registry.counter("chat.errors", "code", code, "component", component).increment();
    }

    public void recordStaleTermination() {
        registry.counter("chat.heartbeat.terminated").increment();
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }

    /**
     * Sum of a counter across all of its tag combinations, 0 if never incremented.
     */
    public double getCounterValue(String name) {
        return registry.find(name).counters().stream()
            .mapToDouble(Counter::count)
            .sum();
    }
}
