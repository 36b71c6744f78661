package com.voicerelay.servicebackend.session;

import com.voicerelay.servicebackend.exception.AuthenticationException;
import com.voicerelay.servicebackend.exception.ErrorCode;
import com.voicerelay.servicebackend.security.SessionMode;
import com.voicerelay.servicebackend.security.SessionTokenService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionBootstrapServiceTest {
    private static final String SECRET = "test-signing-secret-0123456789abcdef0123";

    private NonceStore nonceStore;
    private SessionTokenService tokenService;
    private BootstrapPageTemplate template;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.systemUTC();
        nonceStore = new NonceStore(Duration.ofMinutes(5), clock);
        tokenService = SessionTokenService.withSecret(SECRET, Duration.ofHours(1), clock);
        template = new BootstrapPageTemplate("<html><head></head><body></body></html>");
    }

    @Test
    void bootstrapPageEmbedsFreshlyIssuedNonce() {
        SessionBootstrapService service = service(SessionMode.PRODUCTION);

        BootstrapDocument first = service.serveBootstrapPage();
        BootstrapDocument second = service.serveBootstrapPage();

        assertThat(first.html()).contains("content=\"" + first.nonce().value() + "\"");
        assertThat(second.nonce().value()).isNotEqualTo(first.nonce().value());
        assertThat(nonceStore.pendingCount()).isEqualTo(2);
    }

    @Test
    void productionExchangesValidNonceOnce() {
        SessionBootstrapService service = service(SessionMode.PRODUCTION);
        String nonce = service.serveBootstrapPage().nonce().value();

        String token = service.exchangeNonceForToken(nonce);

        assertThat(tokenService.verifyToken(token)).isTrue();
        assertThatThrownBy(() -> service.exchangeNonceForToken(nonce))
                .isInstanceOf(AuthenticationException.class)
                .extracting(e -> ((AuthenticationException) e).getCode())
                .isEqualTo(ErrorCode.INVALID_NONCE);
    }

    @Test
    void productionRejectsMissingNonce() {
        SessionBootstrapService service = service(SessionMode.PRODUCTION);

        assertThatThrownBy(() -> service.exchangeNonceForToken(null))
                .isInstanceOf(AuthenticationException.class)
                .hasMessageContaining("Invalid session nonce");
        assertThatThrownBy(() -> service.exchangeNonceForToken("  "))
                .isInstanceOf(AuthenticationException.class);
    }

    @Test
    void productionRejectsUnknownNonce() {
        SessionBootstrapService service = service(SessionMode.PRODUCTION);

        assertThatThrownBy(() -> service.exchangeNonceForToken("0123456789abcdef0123456789abcdef"))
                .isInstanceOf(AuthenticationException.class);
    }

    @Test
    void developmentIssuesTokenWithoutNonce() {
        SessionBootstrapService service = service(SessionMode.DEVELOPMENT);

        assertThat(tokenService.verifyToken(service.exchangeNonceForToken(null))).isTrue();
        assertThat(tokenService.verifyToken(service.exchangeNonceForToken("garbage"))).isTrue();
    }

    private SessionBootstrapService service(SessionMode mode) {
        return new SessionBootstrapService(nonceStore, tokenService, template, mode);
    }
}
