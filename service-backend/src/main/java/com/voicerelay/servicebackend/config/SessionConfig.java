package com.voicerelay.servicebackend.config;

import com.voicerelay.servicebackend.security.SessionMode;
import com.voicerelay.servicebackend.security.SessionProperties;
import com.voicerelay.servicebackend.security.SessionTokenService;
import com.voicerelay.servicebackend.session.BootstrapPageTemplate;
import com.voicerelay.servicebackend.session.NonceStore;
import com.voicerelay.servicebackend.session.SessionBootstrapService;
import io.jsonwebtoken.security.WeakKeyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.time.Clock;

/**
 * Session credential wiring. This is the only place where the session mode is derived
 * from configuration; everything downstream receives it explicitly.
 */
@Configuration
@EnableConfigurationProperties(SessionProperties.class)
public class SessionConfig {
    private static final Logger log = LoggerFactory.getLogger(SessionConfig.class);

    private final SessionProperties properties;

    public SessionConfig(SessionProperties properties) {
        this.properties = properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SessionMode sessionMode() {
        SessionMode mode = SessionMode.forSecret(properties.secret());
        if (mode == SessionMode.PRODUCTION) {
            log.info("Session mode: PRODUCTION (configured signing secret, nonce required)");
        } else {
            log.warn("Session mode: DEVELOPMENT (generated signing secret, nonce not required). "
                    + "Set SESSION_SECRET for production.");
        }
        return mode;
    }

    @Bean
    public SessionTokenService sessionTokenService(SessionMode sessionMode, Clock clock) {
        if (sessionMode == SessionMode.DEVELOPMENT) {
            return SessionTokenService.withGeneratedSecret(properties.tokenTtl(), clock);
        }
        try {
            return SessionTokenService.withSecret(properties.secret(), properties.tokenTtl(), clock);
        } catch (WeakKeyException e) {
            throw new IllegalStateException("session.secret must be at least 32 bytes (256 bits)", e);
        }
    }

    @Bean(destroyMethod = "shutdown")
    public NonceStore nonceStore(Clock clock) {
        return new NonceStore(properties.nonceTtl(), clock, properties.nonceSweepInterval());
    }

    @Bean
    public SessionBootstrapService sessionBootstrapService(NonceStore nonceStore,
                                                           SessionTokenService sessionTokenService,
                                                           SessionMode sessionMode,
                                                           @Value("${app.bootstrap.template:classpath:bootstrap/index.html}")
                                                           Resource template) {
        return new SessionBootstrapService(
                nonceStore, sessionTokenService, BootstrapPageTemplate.load(template), sessionMode);
    }
}
