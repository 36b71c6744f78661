package com.voicerelay.servicebackend.config;

import com.voicerelay.servicebackend.relay.RelayProperties;
import com.voicerelay.servicebackend.relay.VoiceAgentRelayHandler;
import com.voicerelay.servicebackend.security.AccessTokenHandshakeHandler;
import com.voicerelay.servicebackend.security.SessionTokenHandshakeInterceptor;
import com.voicerelay.servicebackend.security.SessionTokenService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * WebSocket configuration for the voice-agent relay.
 *
 * Clients connect with:
 * - ws://host:port/api/voice-agent?&lt;upstream query&gt; offering subprotocol access_token.&lt;token&gt;
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {
    private static final Logger log = LoggerFactory.getLogger(WebSocketConfig.class);
    public static final String RELAY_PATH = "/api/voice-agent";

    private final VoiceAgentRelayHandler voiceAgentRelayHandler;
    private final SessionTokenService sessionTokenService;
    private final CorsProperties corsProperties;

    public WebSocketConfig(VoiceAgentRelayHandler voiceAgentRelayHandler,
                           SessionTokenService sessionTokenService,
                           CorsProperties corsProperties) {
        this.voiceAgentRelayHandler = voiceAgentRelayHandler;
        this.sessionTokenService = sessionTokenService;
        this.corsProperties = corsProperties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(voiceAgentRelayHandler, RELAY_PATH)
                .setHandshakeHandler(new AccessTokenHandshakeHandler())
                .addInterceptors(new SessionTokenHandshakeInterceptor(sessionTokenService))
                .setAllowedOriginPatterns(corsProperties.allowedOriginPatterns());
    }

    /**
     * Frame size limits of the inbound leg; audio frames exceed the container defaults.
     */
    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer(RelayProperties relayProperties) {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize((int) relayProperties.maxTextMessageSize().toBytes());
        container.setMaxBinaryMessageBufferSize((int) relayProperties.maxBinaryMessageSize().toBytes());
        return container;
    }

    @EventListener
    public void logEndpoints(WebServerInitializedEvent event) {
        int port = event.getWebServer().getPort();
        log.info("Voice agent relay listening on port {}", port);
        log.info("  GET {}  (WebSocket, subprotocol access_token.<token>)", RELAY_PATH);
        log.info("  GET /api/session, GET /api/metadata, GET /api/health");
    }
}
