package com.voicerelay.servicebackend.security;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "session")
public record SessionProperties(
        String secret,
        @NotNull @DefaultValue("1h") Duration tokenTtl,
        @NotNull @DefaultValue("5m") Duration nonceTtl,
        @NotNull @DefaultValue("60s") Duration nonceSweepInterval
) {
}
