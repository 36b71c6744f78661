package com.voicerelay.servicebackend.relay;

import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

/**
 * Receives events of the outbound leg and hands them to its {@link RelaySession}.
 */
class UpstreamLegHandler extends AbstractWebSocketHandler {

    private final RelaySession relay;

    UpstreamLegHandler(RelaySession relay) {
        this.relay = relay;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        relay.upstreamConnected(session);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        relay.forwardToClient(message);
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        relay.forwardToClient(message);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        relay.upstreamFailed(exception);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        relay.upstreamClosed(status);
    }
}
