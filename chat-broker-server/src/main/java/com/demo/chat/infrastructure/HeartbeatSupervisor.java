package com.demo.chat.infrastructure;

import com.demo.chat.domain.CloseReason;
import com.demo.chat.domain.Connection;
import com.demo.chat.service.MetricsService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Probes every connection on a fixed interval. A connection that has shown
 * no sign of life for two intervals is terminated; the rest get a ping.
 */
@Component
@Slf4j
public class HeartbeatSupervisor {

    private final ConnectionRegistry registry;
    private final ChatDispatcher dispatcher;
    private final ConnectionTransport transport;
    private final MetricsService metricsService;
    private final Clock clock;
    private final Duration interval;
    private final Duration timeout;
    private final ScheduledExecutorService heartbeatExecutor;

    public HeartbeatSupervisor(ConnectionRegistry registry,
                               ChatDispatcher dispatcher,
                               ConnectionTransport transport,
                               MetricsService metricsService,
                               Clock clock,
                               @Value("${chat.heartbeat.interval:30s}") Duration interval,
                               @Value("${chat.heartbeat.enabled:true}") boolean enabled) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.transport = transport;
        this.metricsService = metricsService;
        this.clock = clock;
        this.interval = interval;
        this.timeout = interval.multipliedBy(2);
        this.heartbeatExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "chat-heartbeat");
            thread.setDaemon(true);
            return thread;
        });

        if (enabled) {
            long periodMs = interval.toMillis();
            heartbeatExecutor.scheduleAtFixedRate(this::safeSweep, periodMs, periodMs, TimeUnit.MILLISECONDS);
            log.info("HeartbeatSupervisor started: interval={}, timeout={}", interval, timeout);
        }
    }

    private void safeSweep() {
        try {
            sweep(clock.instant());
        } catch (RuntimeException e) {
            // a failing sweep must not cancel the schedule
            log.error("Heartbeat sweep failed", e);
        }
    }

    /**
     * One supervision pass.
     *
     * @return number of connections terminated
     */
    public int sweep(Instant now) {
        int terminated = 0;
        for (Connection connection : registry.all()) {
            String connectionId = connection.getConnectionId();
            try {
                if (connection.closeIfStale(now, timeout)) {
                    log.warn("Terminating stale connection: connectionId={}, userId={}, lastLivenessAt={}",
                        connectionId, connection.getUserId(), connection.getLastLivenessAt());
                    metricsService.recordStaleTermination();
                    terminated++;
                    dispatcher.disconnect(connectionId, CloseReason.STALE);
                } else if (!connection.isClosed()) {
                    transport.ping(connectionId);
                }
            } catch (RuntimeException e) {
                // one broken connection must not end the pass for the others
                log.error("Heartbeat failed for connection: connectionId={}", connectionId, e);
                metricsService.recordError("HEARTBEAT_FAILED", "heartbeat");
            }
        }
        if (terminated > 0) {
            log.info("Heartbeat sweep: terminated={}, remaining={}", terminated, registry.count());
        }
        return terminated;
    }

    public Duration getInterval() {
        return interval;
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down HeartbeatSupervisor");
        heartbeatExecutor.shutdown();
        try {
            if (!heartbeatExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
