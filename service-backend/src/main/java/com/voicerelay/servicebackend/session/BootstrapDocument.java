package com.voicerelay.servicebackend.session;

/**
 * Rendered entry page and the nonce embedded in it.
 */
public record BootstrapDocument(String html, Nonce nonce) {
}
