package com.voicerelay.servicebackend.metadata;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param location Spring resource location of the deployment TOML file
 */
@ConfigurationProperties(prefix = "app.metadata")
public record MetadataProperties(
        @DefaultValue("file:./deepgram.toml") String location
) {
}
