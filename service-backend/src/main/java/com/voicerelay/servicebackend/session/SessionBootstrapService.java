package com.voicerelay.servicebackend.session;

import com.voicerelay.servicebackend.exception.AuthenticationException;
import com.voicerelay.servicebackend.security.SessionMode;
import com.voicerelay.servicebackend.security.SessionTokenService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bootstrap flow: serve the entry page with a fresh nonce, then trade that nonce
 * for a session token.
 */
public class SessionBootstrapService {
    private static final Logger log = LoggerFactory.getLogger(SessionBootstrapService.class);

    private final NonceStore nonceStore;
    private final SessionTokenService tokenService;
    private final BootstrapPageTemplate pageTemplate;
    private final SessionMode mode;

    public SessionBootstrapService(NonceStore nonceStore,
                                   SessionTokenService tokenService,
                                   BootstrapPageTemplate pageTemplate,
                                   SessionMode mode) {
        this.nonceStore = nonceStore;
        this.tokenService = tokenService;
        this.pageTemplate = pageTemplate;
        this.mode = mode;
    }

    public BootstrapDocument serveBootstrapPage() {
        Nonce nonce = nonceStore.issue();
        return new BootstrapDocument(pageTemplate.render(nonce.value()), nonce);
    }

    /**
     * @throws AuthenticationException with code INVALID_NONCE when a nonce is required and the
     *                                 candidate is missing, unknown, expired or already used
     */
    public String exchangeNonceForToken(String candidateNonce) {
        if (mode.isNonceRequired()) {
            if (candidateNonce == null || candidateNonce.isBlank()) {
                log.warn("Session token requested without a nonce");
                throw AuthenticationException.invalidNonce();
            }
            if (!nonceStore.consume(candidateNonce)) {
                log.warn("Session token requested with an invalid or already used nonce");
                throw AuthenticationException.invalidNonce();
            }
        }
        return tokenService.createToken();
    }
}
