package com.voicerelay.servicebackend.security;

import com.voicerelay.servicebackend.exception.AuthenticationException;
import com.voicerelay.servicebackend.exception.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Authenticates relay upgrades before the connection is upgraded.
 *
 * Requests without a WebSocket {@code Upgrade} header get 426; requests without a valid
 * {@code access_token.<token>} subprotocol get 401. Either way no relay session is created.
 */
public class SessionTokenHandshakeInterceptor implements HandshakeInterceptor {
    private static final Logger log = LoggerFactory.getLogger(SessionTokenHandshakeInterceptor.class);

    private final SessionTokenService tokenService;

    public SessionTokenHandshakeInterceptor(SessionTokenService tokenService) {
        this.tokenService = tokenService;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request,
                                   ServerHttpResponse response,
                                   WebSocketHandler wsHandler,
                                   Map<String, Object> attributes) throws Exception {
        try {
            authenticate(request);
            return true;
        } catch (ProtocolException e) {
            log.warn("Rejected relay request from {}: {}", request.getRemoteAddress(), e.getMessage());
            response.setStatusCode(HttpStatus.UPGRADE_REQUIRED);
            response.getHeaders().set(HttpHeaders.UPGRADE, "websocket");
            response.getBody().write(e.getMessage().getBytes(StandardCharsets.UTF_8));
            return false;
        } catch (AuthenticationException e) {
            log.warn("Rejected relay upgrade from {}: {}", request.getRemoteAddress(), e.getCode());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
    }

    @Override
    public void afterHandshake(ServerHttpRequest request,
                               ServerHttpResponse response,
                               WebSocketHandler wsHandler,
                               Exception exception) {
    }

    void authenticate(ServerHttpRequest request) {
        String upgrade = request.getHeaders().getUpgrade();
        if (upgrade == null || !"websocket".equalsIgnoreCase(upgrade.trim())) {
            throw new ProtocolException("Expected WebSocket");
        }
        WebSocketHttpHeaders headers = new WebSocketHttpHeaders(request.getHeaders());
        String protocol = AccessTokenSubprotocol.find(headers.getSecWebSocketProtocol())
                .orElseThrow(AuthenticationException::invalidToken);
        if (!tokenService.verifyToken(AccessTokenSubprotocol.token(protocol))) {
            throw AuthenticationException.invalidToken();
        }
    }
}
