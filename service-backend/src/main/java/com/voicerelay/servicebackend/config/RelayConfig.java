package com.voicerelay.servicebackend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.voicerelay.servicebackend.metadata.DeploymentMetadataService;
import com.voicerelay.servicebackend.metadata.MetadataProperties;
import com.voicerelay.servicebackend.relay.RelayConnectionManager;
import com.voicerelay.servicebackend.relay.RelayProperties;
import com.voicerelay.servicebackend.relay.StandardUpstreamConnector;
import com.voicerelay.servicebackend.relay.UpstreamConnector;
import com.voicerelay.servicebackend.relay.UpstreamProperties;
import com.voicerelay.servicebackend.relay.VoiceAgentRelayHandler;
import org.apache.tomcat.websocket.WsWebSocketContainer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

/**
 * Relay wiring: the upstream client, the connection manager and the inbound handler.
 */
@Configuration
@EnableConfigurationProperties({UpstreamProperties.class, RelayProperties.class, MetadataProperties.class})
public class RelayConfig {

    /**
     * Client-side container for upstream connections. Destroying it closes any upstream
     * socket still open and stops its threads.
     */
    @Bean(destroyMethod = "destroy")
    public WsWebSocketContainer upstreamWebSocketContainer(RelayProperties relayProperties) {
        WsWebSocketContainer container = new WsWebSocketContainer();
        container.setDefaultMaxTextMessageBufferSize((int) relayProperties.maxTextMessageSize().toBytes());
        container.setDefaultMaxBinaryMessageBufferSize((int) relayProperties.maxBinaryMessageSize().toBytes());
        return container;
    }

    @Bean
    public WebSocketClient upstreamWebSocketClient(WsWebSocketContainer upstreamWebSocketContainer) {
        return new StandardWebSocketClient(upstreamWebSocketContainer);
    }

    @Bean
    public UpstreamConnector upstreamConnector(WebSocketClient upstreamWebSocketClient,
                                               UpstreamProperties upstreamProperties) {
        return new StandardUpstreamConnector(upstreamWebSocketClient, upstreamProperties.apiKey());
    }

    @Bean(destroyMethod = "shutdown")
    public RelayConnectionManager relayConnectionManager(UpstreamConnector upstreamConnector,
                                                         UpstreamProperties upstreamProperties,
                                                         ObjectMapper objectMapper) {
        return new RelayConnectionManager(upstreamConnector, upstreamProperties, objectMapper);
    }

    @Bean
    public VoiceAgentRelayHandler voiceAgentRelayHandler(RelayConnectionManager relayConnectionManager) {
        return new VoiceAgentRelayHandler(relayConnectionManager);
    }

    @Bean
    public DeploymentMetadataService deploymentMetadataService(ResourceLoader resourceLoader,
                                                               MetadataProperties metadataProperties) {
        return new DeploymentMetadataService(resourceLoader, metadataProperties.location());
    }
}
