package com.voicerelay.servicebackend.relay;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.net.URI;
import java.time.Duration;

/**
 * Upstream voice-agent endpoint and the server-held credential used to reach it.
 */
@Validated
@ConfigurationProperties(prefix = "upstream")
public record UpstreamProperties(
        @NotNull @DefaultValue("wss://agent.deepgram.com/v1/agent/converse") URI url,
        @NotBlank(message = "upstream.api-key is required (set DEEPGRAM_API_KEY)") String apiKey,
        @NotNull @DefaultValue("10s") Duration connectTimeout
) {
    @Override
    public String toString() {
        return "UpstreamProperties[url=" + url + ", connectTimeout=" + connectTimeout + "]";
    }
}
