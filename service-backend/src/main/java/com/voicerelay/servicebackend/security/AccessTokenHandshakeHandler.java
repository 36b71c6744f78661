package com.voicerelay.servicebackend.security;

import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.support.DefaultHandshakeHandler;

import java.util.List;

/**
 * Echoes the {@code access_token.<token>} subprotocol the client offered, as the
 * subprotocol negotiation contract requires. The token was verified by
 * {@link SessionTokenHandshakeInterceptor} before this point.
 */
public class AccessTokenHandshakeHandler extends DefaultHandshakeHandler {

    @Override
    protected String selectProtocol(List<String> requestedProtocols, WebSocketHandler webSocketHandler) {
        return AccessTokenSubprotocol.find(requestedProtocols)
                .orElseGet(() -> super.selectProtocol(requestedProtocols, webSocketHandler));
    }
}
