package com.voicerelay.servicebackend.exception;

/**
 * Malformed upgrade request, rejected before any relay session exists.
 */
public class ProtocolException extends RelayServiceException {

    public ProtocolException(String message) {
        super(ErrorCode.UPGRADE_REQUIRED, message);
    }

    @Override
    public String getErrorType() {
        return "ProtocolError";
    }
}
