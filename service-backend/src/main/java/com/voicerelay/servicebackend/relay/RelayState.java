package com.voicerelay.servicebackend.relay;

/**
 * Lifecycle of a relay session once the inbound upgrade has been accepted.
 * Authentication happens earlier, in the handshake, so a session never exists
 * for a rejected request.
 */
public enum RelayState {
    OUTBOUND_CONNECTING,
    RELAYING,
    CLOSING,
    CLOSED;

    public boolean isClosingOrClosed() {
        return this == CLOSING || this == CLOSED;
    }
}
