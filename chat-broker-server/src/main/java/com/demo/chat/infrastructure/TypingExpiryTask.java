package com.demo.chat.infrastructure;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically sweeps expired typing marks so clients see typing stop even
 * when the typer never sends {@code isTyping=false}.
 */
@Component
@Slf4j
public class TypingExpiryTask {

    private final ChatDispatcher dispatcher;
    private final Clock clock;
    private final ScheduledExecutorService sweepExecutor;

    public TypingExpiryTask(ChatDispatcher dispatcher,
                            Clock clock,
                            @Value("${chat.typing.sweep-interval:1s}") Duration sweepInterval) {
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.sweepExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "chat-typing-sweep");
            thread.setDaemon(true);
            return thread;
        });
        long periodMs = sweepInterval.toMillis();
        sweepExecutor.scheduleAtFixedRate(this::sweep, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    private void sweep() {
        try {
            dispatcher.expireTyping(clock.instant());
        } catch (RuntimeException e) {
            log.error("Typing sweep failed", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        sweepExecutor.shutdownNow();
    }
}
