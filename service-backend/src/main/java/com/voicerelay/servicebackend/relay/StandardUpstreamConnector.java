package com.voicerelay.servicebackend.relay;

import org.springframework.http.HttpHeaders;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Connects with the service credential sent as {@code Authorization: Token <key>}.
 * The client's session token is never forwarded upstream.
 */
public class StandardUpstreamConnector implements UpstreamConnector {

    private final WebSocketClient webSocketClient;
    private final String apiKey;

    public StandardUpstreamConnector(WebSocketClient webSocketClient, String apiKey) {
        this.webSocketClient = webSocketClient;
        this.apiKey = apiKey;
    }

    @Override
    public CompletableFuture<WebSocketSession> connect(URI uri, WebSocketHandler handler) {
        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "Token " + apiKey);
        return webSocketClient.execute(handler, headers, uri);
    }
}
