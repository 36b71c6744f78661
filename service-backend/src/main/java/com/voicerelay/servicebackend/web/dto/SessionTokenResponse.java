package com.voicerelay.servicebackend.web.dto;

public record SessionTokenResponse(String token) {
    public static SessionTokenResponse of(String token) {
        return new SessionTokenResponse(token);
    }
}
