package com.replyfeed.infrastructure.messaging;

import com.replyfeed.config.FeedGeneratorProperties;
import com.replyfeed.domain.model.FirehoseEvent;
import com.replyfeed.domain.service.EventProcessingException;
import com.replyfeed.domain.service.FirehoseEventHandler;
import io.github.resilience4j.core.IntervalFunction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Jetstream consumer for post commit events.
 *
 * Architecture:
 * - One dedicated thread owns the connection and calls the handler
 * - Events are handled one at a time in arrival order, never in parallel
 * - Reconnects forever with exponential backoff until the application stops
 *
 * Resume cursor:
 * - After the first handled event, reconnects resume from the last handled
 *   event's time_us; redelivered events are absorbed by the store's unique keys
 * - Before that, start a little in the past (start-margin) to cover a restart
 *
 * Per-event failures:
 * - Handler error: logged, counted, skipped (one bad event must not stall the stream)
 * - Store unavailable: the session is dropped and the event retried after backoff
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "feedgen.jetstream", name = "enabled", havingValue = "true")
public class JetstreamConsumer implements SmartLifecycle {

    private static final long STOP_TIMEOUT_MS = 5_000;

    private final JetstreamConnector connector;
    private final JetstreamMessageDecoder decoder;
    private final FirehoseEventHandler eventHandler;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final FeedGeneratorProperties.Jetstream settings;
    private final IntervalFunction backoff;

    private final CountDownLatch shutdown = new CountDownLatch(1);
    private volatile boolean running;
    private volatile Thread worker;
    private volatile JetstreamSession currentSession;

    // only touched by the worker thread
    private Long lastCursor;
    private long sessionEvents;

    public JetstreamConsumer(JetstreamConnector connector,
                             JetstreamMessageDecoder decoder,
                             FirehoseEventHandler eventHandler,
                             MeterRegistry meterRegistry,
                             Clock clock,
                             FeedGeneratorProperties properties) {
        this.connector = connector;
        this.decoder = decoder;
        this.eventHandler = eventHandler;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.settings = properties.getJetstream();
        this.backoff = IntervalFunction.ofExponentialBackoff(
                settings.getInitialBackoff(), settings.getBackoffMultiplier(), settings.getMaxBackoff());
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        worker = new Thread(this::consumeLoop, "jetstream-consumer");
        worker.start();
        log.info("Jetstream consumer started: {}", settings.getUrl());
    }

    @Override
    public void stop() {
        Thread thread;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            thread = worker;
        }

        shutdown.countDown();
        JetstreamSession session = currentSession;
        if (session != null) {
            session.close();
        }
        if (thread != null) {
            thread.interrupt();
            try {
                thread.join(STOP_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    void consumeLoop() {
        int attempt = 0;

        while (running) {
            sessionEvents = 0;
            try {
                consumeSession();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (JetstreamDisconnectedException e) {
                if (!running) {
                    break;
                }
                log.warn("Jetstream connection lost after {} events: {}", sessionEvents, e.getMessage());
            } catch (EventProcessingException e) {
                if (!running) {
                    break;
                }
                log.error("Event store unavailable, dropping Jetstream session: {}", e.getMessage(), e);
            } catch (RuntimeException e) {
                if (!running) {
                    break;
                }
                log.error("Unexpected Jetstream session failure: {}", e.getMessage(), e);
            }

            if (!running) {
                break;
            }

            attempt = sessionEvents > 0 ? 1 : attempt + 1;
            long waitMillis = backoff.apply(attempt);
            meterRegistry.counter("feedgen.jetstream.reconnects").increment();

            if (attempt >= settings.getLoudAfterAttempts()) {
                log.error("Jetstream has not recovered after {} attempts, retrying in {} ms", attempt, waitMillis);
            } else {
                log.info("Reconnecting to Jetstream in {} ms (attempt {})", waitMillis, attempt);
            }

            if (awaitShutdown(waitMillis)) {
                break;
            }
        }

        log.info("Jetstream consumer stopped");
    }

    private void consumeSession() throws InterruptedException {
        long cursor = startCursor();
        log.info("Opening Jetstream session at cursor {}", cursor);

        try (JetstreamSession session = connector.open(cursor)) {
            currentSession = session;
            if (!running) {
                return;
            }
            while (running) {
                String frame = session.poll(settings.getPollTimeout());
                if (frame != null) {
                    dispatch(frame);
                }
            }
        } finally {
            currentSession = null;
        }
    }

    void dispatch(String frame) {
        Optional<FirehoseEvent> decoded = decoder.decode(frame);
        if (decoded.isEmpty()) {
            count("skipped");
            return;
        }

        FirehoseEvent event = decoded.get();
        try {
            eventHandler.handle(event);
            count("handled");
        } catch (EventProcessingException e) {
            if (e.isStoreUnavailable()) {
                count("store_unavailable");
                throw e;
            }
            count("failed");
            log.error("Failed to process event from {} rkey={}: {}",
                    event.getAuthorDid(), event.getRecordKey(), e.getMessage(), e);
        } catch (RuntimeException e) {
            count("failed");
            log.error("Unexpected error processing event from {} rkey={}: {}",
                    event.getAuthorDid(), event.getRecordKey(), e.getMessage(), e);
        }

        sessionEvents++;
        if (event.getCursor() != null) {
            lastCursor = event.getCursor();
        }
    }

    long startCursor() {
        if (lastCursor != null) {
            return lastCursor;
        }
        Instant start = clock.instant().minus(settings.getStartMargin());
        return ChronoUnit.MICROS.between(Instant.EPOCH, start);
    }

    private boolean awaitShutdown(long millis) {
        try {
            return shutdown.await(millis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private void count(String result) {
        Counter.builder("feedgen.jetstream.events")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
