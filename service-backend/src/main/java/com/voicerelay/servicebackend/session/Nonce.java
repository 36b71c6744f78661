package com.voicerelay.servicebackend.session;

import java.time.Instant;

/**
 * Single-use value embedded in the bootstrap page and exchanged once for a session token.
 */
public record Nonce(String value, Instant expiresAt) {
}
