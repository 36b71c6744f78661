package com.voicerelay.servicebackend.web;

import com.voicerelay.servicebackend.relay.RelayConnectionManager;
import com.voicerelay.servicebackend.security.SessionMode;
import com.voicerelay.servicebackend.session.NonceStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;
import java.util.Map;

/**
 * Health check endpoint reporting relay and nonce store activity.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final RelayConnectionManager relayConnectionManager;
    private final NonceStore nonceStore;
    private final SessionMode sessionMode;

    public HealthController(RelayConnectionManager relayConnectionManager,
                            NonceStore nonceStore,
                            SessionMode sessionMode) {
        this.relayConnectionManager = relayConnectionManager;
        this.nonceStore = nonceStore;
        this.sessionMode = sessionMode;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "mode", sessionMode.name().toLowerCase(Locale.ROOT),
                "activeRelaySessions", relayConnectionManager.getActiveSessionCount(),
                "pendingNonces", nonceStore.pendingCount()));
    }
}
