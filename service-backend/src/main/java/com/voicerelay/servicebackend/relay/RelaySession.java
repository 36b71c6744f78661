package com.voicerelay.servicebackend.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.voicerelay.servicebackend.exception.RelayServiceException;
import com.voicerelay.servicebackend.exception.UpstreamConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One client connection paired with one upstream connection.
 *
 * Each direction is driven by its own socket's read loop. Both directions share a single
 * termination signal: whichever event ends the session first (a close or error on either leg,
 * an upstream connect failure, shutdown) completes it, and completing it closes both legs.
 * Once the session has begun closing no further frame is forwarded in either direction.
 */
public class RelaySession {
    private static final Logger log = LoggerFactory.getLogger(RelaySession.class);

    private final WebSocketSession client;
    private final ObjectMapper objectMapper;
    private final Duration connectTimeout;

    private final AtomicReference<RelayState> state = new AtomicReference<>(RelayState.OUTBOUND_CONNECTING);
    private final CompletableFuture<WebSocketSession> upstreamReady = new CompletableFuture<>();
    private final CompletableFuture<Termination> termination = new CompletableFuture<>();
    private final CompletableFuture<Termination> closed = new CompletableFuture<>();

    // guard the send side of each leg; terminate() takes both, client first
    private final Object clientSendLock = new Object();
    private final Object upstreamSendLock = new Object();

    private final AtomicLong framesToUpstream = new AtomicLong();
    private final AtomicLong framesToClient = new AtomicLong();

    private volatile WebSocketSession upstream;

    public RelaySession(WebSocketSession client, ObjectMapper objectMapper, Duration connectTimeout) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.connectTimeout = connectTimeout;
        termination.thenAccept(this::closeLegs);
    }

    public String getId() {
        return client.getId();
    }

    public RelayState getState() {
        return state.get();
    }

    public long getFramesToUpstream() {
        return framesToUpstream.get();
    }

    public long getFramesToClient() {
        return framesToClient.get();
    }

    /**
     * Completes once both legs have been closed.
     */
    public CompletableFuture<Termination> closeFuture() {
        return closed;
    }

    void upstreamConnected(WebSocketSession session) {
        this.upstream = session;
        if (state.compareAndSet(RelayState.OUTBOUND_CONNECTING, RelayState.RELAYING)) {
            log.info("Relay {} connected to upstream (upstream session {})", getId(), session.getId());
            upstreamReady.complete(session);
        } else {
            log.info("Relay {} already {} when upstream opened, closing upstream", getId(), state.get());
            closeQuietly(session, CloseStatus.NORMAL, "upstream");
        }
    }

    void upstreamConnectFailed(Throwable cause) {
        if (state.get() != RelayState.OUTBOUND_CONNECTING) {
            return;
        }
        UpstreamConnectionException error = UpstreamConnectionException.connectFailed(cause);
        log.warn("Relay {} could not connect to upstream: {}", getId(), describe(cause));
        sendError(error);
        terminate(CloseStatuses.SETUP_FAILED, CloseStatus.NORMAL);
    }

    void upstreamFailed(Throwable cause) {
        if (state.get().isClosingOrClosed()) {
            return;
        }
        UpstreamConnectionException error = UpstreamConnectionException.streamFailed(cause);
        log.warn("Relay {} upstream transport error: {}", getId(), describe(cause));
        sendError(error);
        terminate(CloseStatus.SERVER_ERROR, CloseStatus.SERVER_ERROR);
    }

    void upstreamClosed(CloseStatus status) {
        log.info("Relay {} upstream closed: {}", getId(), status);
        terminate(CloseStatuses.forwardable(status), status);
    }

    void clientClosed(CloseStatus status) {
        log.info("Relay {} client closed: {}", getId(), status);
        terminate(status, CloseStatuses.forwardable(status));
    }

    void clientFailed(Throwable cause) {
        if (state.get().isClosingOrClosed()) {
            return;
        }
        log.warn("Relay {} client transport error: {}", getId(), describe(cause));
        terminate(CloseStatus.SERVER_ERROR, CloseStatus.NORMAL);
    }

    /**
     * Forwards a client frame upstream. While the upstream is still connecting, the caller
     * waits for it (bounded by the connect timeout) so frames keep their order.
     *
     * @return true if the frame was sent
     */
    boolean forwardToUpstream(WebSocketMessage<?> message) {
        if (state.get() == RelayState.OUTBOUND_CONNECTING && !awaitUpstream()) {
            log.debug("Relay {} dropped client frame, upstream never opened", getId());
            return false;
        }
        int length = message.getPayloadLength();
        Exception failure;
        synchronized (upstreamSendLock) {
            if (state.get() != RelayState.RELAYING) {
                return false;
            }
            failure = send(upstream, message);
        }
        if (failure != null) {
            // the failure path takes the client lock, so it runs outside the upstream lock
            upstreamFailed(failure);
            return false;
        }
        long count = framesToUpstream.incrementAndGet();
        log.trace("Relay {} client -> upstream frame #{} ({} bytes)", getId(), count, length);
        return true;
    }

    /**
     * @return true if the frame was sent
     */
    boolean forwardToClient(WebSocketMessage<?> message) {
        int length = message.getPayloadLength();
        Exception failure;
        synchronized (clientSendLock) {
            if (state.get() != RelayState.RELAYING) {
                return false;
            }
            failure = send(client, message);
        }
        if (failure != null) {
            clientFailed(failure);
            return false;
        }
        long count = framesToClient.incrementAndGet();
        log.trace("Relay {} upstream -> client frame #{} ({} bytes)", getId(), count, length);
        return true;
    }

    /**
     * Starts closing both legs. Only the first call has any effect.
     *
     * @param clientStatus   status used to close the client leg if it is still open
     * @param upstreamStatus status used to close the upstream leg if it is still open
     */
    public void terminate(CloseStatus clientStatus, CloseStatus upstreamStatus) {
        RelayState previous;
        synchronized (clientSendLock) {
            synchronized (upstreamSendLock) {
                previous = state.getAndUpdate(s -> s.isClosingOrClosed() ? s : RelayState.CLOSING);
            }
        }
        if (previous.isClosingOrClosed()) {
            return;
        }
        upstreamReady.cancel(false);
        termination.complete(new Termination(clientStatus, upstreamStatus));
    }

    /**
     * @return the failure, or null if the frame was handed to the socket
     */
    private static Exception send(WebSocketSession session, WebSocketMessage<?> message) {
        try {
            session.sendMessage(message);
            return null;
        } catch (IOException | IllegalStateException e) {
            return e;
        }
    }

    private boolean awaitUpstream() {
        try {
            upstreamReady.get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException | TimeoutException | CancellationException e) {
            return false;
        }
    }

    private void sendError(RelayServiceException error) {
        synchronized (clientSendLock) {
            if (state.get().isClosingOrClosed() || !client.isOpen()) {
                return;
            }
            try {
                String json = objectMapper.writeValueAsString(RelayErrorFrame.from(error));
                client.sendMessage(new TextMessage(json));
            } catch (JsonProcessingException e) {
                log.error("Relay {} could not serialize error frame", getId(), e);
            } catch (IOException | IllegalStateException e) {
                log.warn("Relay {} could not deliver error frame: {}", getId(), e.getMessage());
            }
        }
    }

    private void closeLegs(Termination reason) {
        closeQuietly(client, CloseStatuses.forwardable(reason.clientStatus()), "client");
        WebSocketSession upstreamSession = upstream;
        if (upstreamSession != null) {
            closeQuietly(upstreamSession, CloseStatuses.forwardable(reason.upstreamStatus()), "upstream");
        }
        state.set(RelayState.CLOSED);
        closed.complete(reason);
        log.info("Relay {} closed ({} frames upstream, {} frames to client)",
                getId(), framesToUpstream.get(), framesToClient.get());
    }

    private void closeQuietly(WebSocketSession session, CloseStatus status, String leg) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(status);
        } catch (IOException | IllegalStateException e) {
            log.warn("Relay {} error closing {} leg: {}", getId(), leg, e.getMessage());
        }
    }

    private static String describe(Throwable cause) {
        return cause == null ? "unknown" : cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    /**
     * Close statuses chosen by the event that ended the session.
     */
    public record Termination(CloseStatus clientStatus, CloseStatus upstreamStatus) {
    }
}
