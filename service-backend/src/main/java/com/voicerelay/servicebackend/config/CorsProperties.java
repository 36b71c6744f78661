package com.voicerelay.servicebackend.config;

import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Browser origins allowed to call {@code /api/**} and to open the relay socket.
 *
 * @param allowedOrigins origin patterns, e.g. {@code https://*.example.com}; the entry page is
 *                       served by this service, so cross-origin access is only needed when the
 *                       client is hosted elsewhere
 */
@Validated
@ConfigurationProperties(prefix = "app.cors")
public record CorsProperties(
        @NotEmpty @DefaultValue("*") List<String> allowedOrigins
) {

    String[] allowedOriginPatterns() {
        return allowedOrigins.toArray(String[]::new);
    }
}
