package com.voicerelay.servicebackend.security;

/**
 * Policy for issuing session tokens.
 *
 * DEVELOPMENT is selected when no signing secret is configured: a secret is generated at
 * startup and tokens are issued without a nonce. PRODUCTION uses the configured secret and
 * requires a valid nonce for every token.
 */
public enum SessionMode {
    DEVELOPMENT(false),
    PRODUCTION(true);

    private final boolean nonceRequired;

    SessionMode(boolean nonceRequired) {
        this.nonceRequired = nonceRequired;
    }

    public boolean isNonceRequired() {
        return nonceRequired;
    }

    public static SessionMode forSecret(String configuredSecret) {
        return configuredSecret == null || configuredSecret.isBlank() ? DEVELOPMENT : PRODUCTION;
    }
}
