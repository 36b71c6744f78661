package com.voicerelay.servicebackend.security;

import java.util.List;
import java.util.Optional;

/**
 * Session token carried in the WebSocket subprotocol list as {@code access_token.<token>}.
 * Browsers cannot set headers on a WebSocket upgrade, so the subprotocol field carries it.
 */
public final class AccessTokenSubprotocol {
    public static final String PREFIX = "access_token.";

    private AccessTokenSubprotocol() {
    }

    public static String of(String token) {
        return PREFIX + token;
    }

    /**
     * @return the first offered subprotocol carrying a token
     */
    public static Optional<String> find(List<String> offeredProtocols) {
        if (offeredProtocols == null) {
            return Optional.empty();
        }
        return offeredProtocols.stream()
                .map(String::trim)
                .filter(p -> p.startsWith(PREFIX) && p.length() > PREFIX.length())
                .findFirst();
    }

    public static String token(String protocol) {
        return protocol.substring(PREFIX.length());
    }
}
