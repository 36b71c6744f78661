package com.voicerelay.servicebackend.exception;

/**
 * Invalid, missing or expired nonce or session token.
 * Terminal for the attempt: the client has to restart the bootstrap flow.
 */
public class AuthenticationException extends RelayServiceException {

    public AuthenticationException(ErrorCode code, String message) {
        super(code, message);
    }

    public static AuthenticationException invalidNonce() {
        return new AuthenticationException(ErrorCode.INVALID_NONCE,
                "Invalid session nonce. Please refresh the page and try again.");
    }

    public static AuthenticationException invalidToken() {
        return new AuthenticationException(ErrorCode.INVALID_TOKEN,
                "Missing or invalid session token. Please refresh the page and try again.");
    }

    @Override
    public String getErrorType() {
        return "AuthenticationError";
    }
}
