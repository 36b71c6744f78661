package com.voicerelay.servicebackend.web;

import com.voicerelay.servicebackend.session.SessionBootstrapService;
import com.voicerelay.servicebackend.web.dto.SessionTokenResponse;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Exchanges the nonce embedded in the entry page for a session token.
 */
@RestController
@RequestMapping("/api/session")
public class SessionController {
    public static final String NONCE_HEADER = "X-Session-Nonce";

    private final SessionBootstrapService bootstrapService;

    public SessionController(SessionBootstrapService bootstrapService) {
        this.bootstrapService = bootstrapService;
    }

    /**
     * GET /api/session
     * Rejected with 403 INVALID_NONCE when a nonce is required and missing or not valid.
     */
    @GetMapping
    public ResponseEntity<SessionTokenResponse> createSession(
            @RequestHeader(value = NONCE_HEADER, required = false) String nonce) {
        String token = bootstrapService.exchangeNonceForToken(nonce);
        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .body(SessionTokenResponse.of(token));
    }
}
