package com.voicerelay.servicebackend.exception;

/**
 * Machine-readable error codes sent to clients, either in an HTTP error body
 * or in a relay error frame.
 */
public enum ErrorCode {
    INVALID_NONCE,
    INVALID_TOKEN,
    UPGRADE_REQUIRED,
    CONNECTION_FAILED,
    DEEPGRAM_ERROR,
    INTERNAL_SERVER_ERROR
}
