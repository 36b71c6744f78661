package com.voicerelay.servicebackend.relay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

/**
 * WebSocket handler for {@code /api/voice-agent}.
 *
 * Connections reaching this handler have already been authenticated during the handshake.
 * Frames are opaque: text and binary frames are passed on as they are, and all relay
 * logic lives in {@link RelayConnectionManager}.
 */
public class VoiceAgentRelayHandler extends AbstractWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(VoiceAgentRelayHandler.class);

    private final RelayConnectionManager relayConnectionManager;

    public VoiceAgentRelayHandler(RelayConnectionManager relayConnectionManager) {
        this.relayConnectionManager = relayConnectionManager;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        log.info("Client connected to /api/voice-agent: sessionId={}, protocol={}",
                session.getId(), session.getAcceptedProtocol() != null ? "access_token" : "none");
        relayConnectionManager.open(session);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        relayConnectionManager.forwardFromClient(session, message);
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        relayConnectionManager.forwardFromClient(session, message);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        relayConnectionManager.clientFailed(session, exception);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        relayConnectionManager.clientClosed(session, status);
    }

    @Override
    public boolean supportsPartialMessages() {
        return false;
    }
}
