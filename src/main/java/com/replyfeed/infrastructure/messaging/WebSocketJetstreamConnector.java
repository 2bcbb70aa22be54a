package com.replyfeed.infrastructure.messaging;

import com.replyfeed.config.FeedGeneratorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Jetstream over the JDK WebSocket client.
 *
 * Flow control: one message is requested at a time, and the next one only
 * after the consumer has taken the previous frame, so a slow store slows the
 * socket down instead of growing a buffer.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "feedgen.jetstream", name = "enabled", havingValue = "true")
public class WebSocketJetstreamConnector implements JetstreamConnector {

    private final FeedGeneratorProperties.Jetstream settings;
    private final HttpClient httpClient;

    public WebSocketJetstreamConnector(FeedGeneratorProperties properties) {
        this.settings = properties.getJetstream();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(settings.getConnectTimeout())
                .build();
    }

    @Override
    public JetstreamSession open(long cursorMicros) {
        URI uri = subscribeUri(cursorMicros);
        SocketSession session = new SocketSession();

        CompletableFuture<WebSocket> pending = httpClient.newWebSocketBuilder()
                .connectTimeout(settings.getConnectTimeout())
                .buildAsync(uri, session);
        try {
            pending.get(settings.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            abandon(pending, session);
            Thread.currentThread().interrupt();
            throw new JetstreamDisconnectedException("interrupted while connecting to " + uri, e);
        } catch (ExecutionException e) {
            abandon(pending, session);
            throw new JetstreamDisconnectedException("failed to connect to " + uri, e.getCause());
        } catch (TimeoutException e) {
            abandon(pending, session);
            throw new JetstreamDisconnectedException("timed out connecting to " + uri, e);
        }

        log.info("Connected to Jetstream: {}", uri);
        return session;
    }

    /**
     * A handshake that completes after we gave up on it must not leave an open socket behind.
     */
    static void abandon(CompletableFuture<WebSocket> pending, SocketSession session) {
        session.close();
        pending.cancel(true);
        pending.thenAccept(WebSocket::abort);
    }

    URI subscribeUri(long cursorMicros) {
        String base = settings.getUrl();
        String separator = base.contains("?") ? "&" : "?";
        return URI.create(base + separator
                + "wantedCollections=" + URLEncoder.encode(settings.getCollection(), StandardCharsets.UTF_8)
                + "&cursor=" + cursorMicros);
    }

    private static final class Frame {
        private final String text;
        private final String closeReason;
        private final Throwable error;

        private Frame(String text, String closeReason, Throwable error) {
            this.text = text;
            this.closeReason = closeReason;
            this.error = error;
        }

        static Frame text(String text) {
            return new Frame(text, null, null);
        }

        static Frame closed(String reason, Throwable error) {
            return new Frame(null, reason, error);
        }
    }

    static final class SocketSession implements JetstreamSession, WebSocket.Listener {

        private final BlockingQueue<Frame> frames = new LinkedBlockingQueue<>();
        private final StringBuilder partial = new StringBuilder();
        private volatile WebSocket socket;
        private volatile boolean closed;

        @Override
        public void onOpen(WebSocket webSocket) {
            this.socket = webSocket;
            if (closed) {
                webSocket.abort();
                return;
            }
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                frames.offer(Frame.text(partial.toString()));
                partial.setLength(0);
            } else {
                webSocket.request(1);
            }
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            // compressed frames are never requested
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            frames.offer(Frame.closed("closed by server: " + statusCode + " " + reason, null));
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            frames.offer(Frame.closed("socket error: " + error.getMessage(), error));
        }

        @Override
        public String poll(Duration timeout) throws InterruptedException {
            Frame frame = frames.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (frame == null) {
                return null;
            }
            if (frame.text == null) {
                // keep the terminal marker for any later poll
                frames.offer(frame);
                throw new JetstreamDisconnectedException(frame.closeReason, frame.error);
            }
            socket.request(1);
            return frame.text;
        }

        @Override
        public void close() {
            closed = true;
            WebSocket current = socket;
            if (current != null && !current.isInputClosed()) {
                current.abort();
            }
            frames.offer(Frame.closed("closed locally", null));
        }
    }
}
