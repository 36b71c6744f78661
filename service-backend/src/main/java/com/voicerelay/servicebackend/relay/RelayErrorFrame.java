package com.voicerelay.servicebackend.relay;

import com.voicerelay.servicebackend.exception.RelayServiceException;

/**
 * Error frame sent to the client over the relay socket:
 * {@code {"type": "Error", "description": "...", "code": "..."}}.
 */
public record RelayErrorFrame(String type, String description, String code) {

    public static RelayErrorFrame from(RelayServiceException error) {
        return new RelayErrorFrame("Error", error.getMessage(), error.getCode().name());
    }
}
