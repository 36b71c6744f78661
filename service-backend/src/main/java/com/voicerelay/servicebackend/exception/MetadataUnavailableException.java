package com.voicerelay.servicebackend.exception;

public class MetadataUnavailableException extends RelayServiceException {

    public MetadataUnavailableException(String message) {
        super(ErrorCode.INTERNAL_SERVER_ERROR, message);
    }

    public MetadataUnavailableException(String message, Throwable cause) {
        super(ErrorCode.INTERNAL_SERVER_ERROR, message, cause);
    }

    @Override
    public String getErrorType() {
        return "MetadataError";
    }
}
