package com.voicerelay.servicebackend.exception;

/**
 * Base exception for all relay service errors.
 * Every subclass carries the {@link ErrorCode} reported to the client.
 */
public class RelayServiceException extends RuntimeException {

    private final ErrorCode code;

    public RelayServiceException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public RelayServiceException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    /**
     * Name used as the {@code type} field of error bodies, e.g. {@code AuthenticationError}.
     */
    public String getErrorType() {
        return "Error";
    }
}
