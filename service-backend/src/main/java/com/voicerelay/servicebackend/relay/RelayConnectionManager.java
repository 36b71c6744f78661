package com.voicerelay.servicebackend.relay;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.net.URI;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Pairs every accepted client connection with its own upstream connection and routes
 * events of the client leg to the right {@link RelaySession}.
 *
 * Sessions share nothing with each other; the map below only tracks which are alive.
 */
public class RelayConnectionManager {
    private static final Logger log = LoggerFactory.getLogger(RelayConnectionManager.class);

    private final ConcurrentHashMap<String, RelaySession> activeSessions = new ConcurrentHashMap<>();
    private final UpstreamConnector upstreamConnector;
    private final UpstreamProperties upstreamProperties;
    private final ObjectMapper objectMapper;

    public RelayConnectionManager(UpstreamConnector upstreamConnector,
                                  UpstreamProperties upstreamProperties,
                                  ObjectMapper objectMapper) {
        this.upstreamConnector = upstreamConnector;
        this.upstreamProperties = upstreamProperties;
        this.objectMapper = objectMapper;
    }

    /**
     * Registers an authenticated client connection and starts connecting its upstream leg,
     * forwarding the client's query parameters unchanged.
     */
    public RelaySession open(WebSocketSession client) {
        RelaySession relay = new RelaySession(client, objectMapper, upstreamProperties.connectTimeout());
        activeSessions.put(relay.getId(), relay);
        relay.closeFuture().whenComplete((termination, error) -> activeSessions.remove(relay.getId()));

        String rawQuery = client.getUri() != null ? client.getUri().getRawQuery() : null;
        URI upstreamUri = UpstreamUris.withQuery(upstreamProperties.url(), rawQuery);
        log.info("Relay {} opened, connecting to upstream {}", relay.getId(), upstreamUri);

        try {
            upstreamConnector.connect(upstreamUri, new UpstreamLegHandler(relay))
                    .orTimeout(upstreamProperties.connectTimeout().toMillis(), TimeUnit.MILLISECONDS)
                    .whenComplete((session, error) -> {
                        if (error != null) {
                            relay.upstreamConnectFailed(unwrap(error));
                        }
                    });
        } catch (RuntimeException e) {
            relay.upstreamConnectFailed(e);
        }
        return relay;
    }

    public void forwardFromClient(WebSocketSession client, WebSocketMessage<?> message) {
        RelaySession relay = activeSessions.get(client.getId());
        if (relay == null) {
            log.debug("Dropped frame from client {} without a live relay", client.getId());
            return;
        }
        relay.forwardToUpstream(message);
    }

    public void clientClosed(WebSocketSession client, CloseStatus status) {
        RelaySession relay = activeSessions.get(client.getId());
        if (relay != null) {
            relay.clientClosed(status);
        }
    }

    public void clientFailed(WebSocketSession client, Throwable error) {
        RelaySession relay = activeSessions.get(client.getId());
        if (relay != null) {
            relay.clientFailed(error);
        }
    }

    public int getActiveSessionCount() {
        return activeSessions.size();
    }

    /**
     * Closes every live relay with 1001 (going away).
     */
    public void shutdown() {
        log.info("Shutting down relay manager, {} active sessions", activeSessions.size());
        activeSessions.values().forEach(relay -> relay.terminate(CloseStatus.GOING_AWAY, CloseStatus.GOING_AWAY));
        activeSessions.clear();
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
