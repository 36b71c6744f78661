package com.voicerelay.servicebackend.security;

import org.junit.jupiter.api.Test;
import org.springframework.web.socket.WebSocketHandler;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class AccessTokenHandshakeHandlerTest {

    private final AccessTokenHandshakeHandler handler = new AccessTokenHandshakeHandler();
    private final WebSocketHandler wsHandler = mock(WebSocketHandler.class);

    @Test
    void echoesOfferedAccessTokenProtocol() {
        assertThat(handler.selectProtocol(List.of("access_token.tok"), wsHandler))
                .isEqualTo("access_token.tok");
    }

    @Test
    void selectsNoProtocolWhenNoneCarriesToken() {
        assertThat(handler.selectProtocol(List.of("chat"), wsHandler)).isNull();
    }
}
