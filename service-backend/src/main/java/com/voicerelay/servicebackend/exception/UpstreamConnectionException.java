package com.voicerelay.servicebackend.exception;

/**
 * Failure of the outbound leg, either while connecting or mid-stream.
 * Reported to the connected client as an error frame before the session is torn down.
 */
public class UpstreamConnectionException extends RelayServiceException {

    public UpstreamConnectionException(ErrorCode code, String message) {
        super(code, message);
    }

    public UpstreamConnectionException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }

    public static UpstreamConnectionException connectFailed(Throwable cause) {
        return new UpstreamConnectionException(ErrorCode.CONNECTION_FAILED,
                "Failed to connect to Deepgram", cause);
    }

    public static UpstreamConnectionException streamFailed(Throwable cause) {
        return new UpstreamConnectionException(ErrorCode.DEEPGRAM_ERROR,
                "Deepgram connection error", cause);
    }

    @Override
    public String getErrorType() {
        return "UpstreamConnectionError";
    }
}
