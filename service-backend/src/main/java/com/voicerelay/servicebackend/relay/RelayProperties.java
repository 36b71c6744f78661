package com.voicerelay.servicebackend.relay;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;

@ConfigurationProperties(prefix = "relay")
public record RelayProperties(
        @DefaultValue("1MB") DataSize maxTextMessageSize,
        @DefaultValue("1MB") DataSize maxBinaryMessageSize
) {
}
