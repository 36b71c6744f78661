package com.voicerelay.servicebackend.relay;

import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketSession;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Opens the outbound leg of a relay session.
 */
public interface UpstreamConnector {

    /**
     * Starts connecting to the upstream endpoint. The returned future completes once the
     * connection is open, or exceptionally when it cannot be established. Events on the
     * connection are delivered to {@code handler}.
     */
    CompletableFuture<WebSocketSession> connect(URI uri, WebSocketHandler handler);
}
