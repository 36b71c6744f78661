package com.voicerelay.servicebackend.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.voicerelay.servicebackend.security.AccessTokenSubprotocol;
import com.voicerelay.servicebackend.security.SessionTokenService;
import com.voicerelay.servicebackend.support.MockUpstreamConfiguration;
import com.voicerelay.servicebackend.support.MockUpstreamHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import java.net.URI;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * End-to-end relay over real sockets: browser-side client, relay, and a mock voice agent
 * served by the same test server.
 */
@Tag("integration")
@Import(MockUpstreamConfiguration.class)
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT, properties = {
        "session.secret=test-signing-secret-0123456789abcdef0123",
        "upstream.api-key=test-service-key",
        "upstream.url=ws://voice-agent.invalid/v1/agent/converse",
        "upstream.connect-timeout=5s",
        "app.metadata.location=classpath:metadata/deepgram.toml"
})
class VoiceAgentRelayIntegrationTest {
    private static final long TIMEOUT_SECONDS = 5;

    @LocalServerPort
    private int port;

    @Autowired
    private SessionTokenService sessionTokenService;

    @Autowired
    private MockUpstreamHandler mockUpstream;

    @Autowired
    private RelayConnectionManager relayConnectionManager;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final StandardWebSocketClient webSocketClient = new StandardWebSocketClient();

    @BeforeEach
    void resetMockUpstream() {
        mockUpstream.reset();
    }

    @Test
    void relaysFramesInOrderInBothDirections() throws Exception {
        RecordingClient client = new RecordingClient();
        WebSocketSession session = connect(client, "");

        session.sendMessage(new TextMessage("A"));
        session.sendMessage(new BinaryMessage(new byte[]{1, 2, 3, 4}));
        session.sendMessage(new TextMessage("C"));
        session.sendMessage(new TextMessage("!reply"));

        assertThat(take(mockUpstream.received())).isEqualTo("A");
        assertThat(take(mockUpstream.received())).isEqualTo("binary:4");
        assertThat(take(mockUpstream.received())).isEqualTo("C");
        assertThat(take(mockUpstream.received())).isEqualTo("!reply");
        assertThat(client.nextText()).isEqualTo("X");
        assertThat(client.nextText()).isEqualTo("Y");

        session.close(CloseStatus.NORMAL);
        CloseStatus upstreamStatus = mockUpstream.closeStatuses().poll(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertThat(upstreamStatus).isNotNull();
        assertThat(upstreamStatus.getCode()).isEqualTo(1000);
    }

    @Test
    void upstreamReceivesServiceCredentialAndClientQueryButNotSessionToken() throws Exception {
        RecordingClient client = new RecordingClient();
        WebSocketSession session = connect(client, "?model=nova-3&greeting=hi%20there");

        HttpHeaders upstreamHeaders = mockUpstream.handshakeHeaders().poll(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        assertThat(upstreamHeaders).isNotNull();
        assertThat(upstreamHeaders.getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Token test-service-key");
        assertThat(upstreamHeaders.getFirst("X-Test-Query")).isEqualTo("model=nova-3&greeting=hi%20there");
        assertThat(upstreamHeaders.get(WebSocketHttpHeaders.SEC_WEBSOCKET_PROTOCOL)).isNull();
        session.close();
    }

    @Test
    void acceptedSubprotocolEchoesOfferedToken() throws Exception {
        String protocol = AccessTokenSubprotocol.of(sessionTokenService.createToken());
        WebSocketSession session = connect(new RecordingClient(), "", protocol);

        assertThat(session.getAcceptedProtocol()).isEqualTo(protocol);
        session.close();
    }

    @Test
    void upstreamCloseIsPropagatedToClient() throws Exception {
        RecordingClient client = new RecordingClient();
        WebSocketSession session = connect(client, "");

        session.sendMessage(new TextMessage("!close-1011"));

        CloseStatus status = client.closed.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertThat(status.getCode()).isEqualTo(1011);
        assertThat(status.getReason()).isEqualTo("agent failure");
        await().atMost(TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .until(() -> relayConnectionManager.getActiveSessionCount() == 0);
    }

    @Test
    void failedUpstreamConnectSendsErrorFrameThenCloses() throws Exception {
        RecordingClient client = new RecordingClient();
        connect(client, "?fail=connect");

        JsonNode error = objectMapper.readTree(client.nextText());
        assertThat(error.get("type").asText()).isEqualTo("Error");
        assertThat(error.get("code").asText()).isEqualTo("CONNECTION_FAILED");
        assertThat(error.get("description").asText()).isEqualTo("Failed to connect to Deepgram");

        CloseStatus status = client.closed.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertThat(status.getCode()).isEqualTo(3000);
    }

    @Test
    void upgradeWithInvalidTokenIsRefused() {
        assertThatThrownBy(() -> connect(new RecordingClient(), "", "access_token.forged"))
                .isInstanceOf(ExecutionException.class);
    }

    private WebSocketSession connect(RecordingClient client, String query) throws Exception {
        return connect(client, query, AccessTokenSubprotocol.of(sessionTokenService.createToken()));
    }

    private WebSocketSession connect(RecordingClient client, String query, String protocol) throws Exception {
        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        headers.setSecWebSocketProtocol(List.of(protocol));
        URI uri = URI.create("ws://localhost:" + port + "/api/voice-agent" + query);
        return webSocketClient.execute(client, headers, uri).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    private static String take(BlockingQueue<String> queue) throws InterruptedException {
        return queue.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    private static final class RecordingClient extends AbstractWebSocketHandler {
        private final BlockingQueue<WebSocketMessage<?>> messages = new LinkedBlockingQueue<>();
        private final CompletableFuture<CloseStatus> closed = new CompletableFuture<>();

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            messages.add(message);
        }

        @Override
        protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
            messages.add(message);
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            closed.complete(status);
        }

        String nextText() throws InterruptedException {
            WebSocketMessage<?> message = messages.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            assertThat(message).isInstanceOf(TextMessage.class);
            return ((TextMessage) message).getPayload();
        }
    }
}
