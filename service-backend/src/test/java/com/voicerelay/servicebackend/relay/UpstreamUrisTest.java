package com.voicerelay.servicebackend.relay;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class UpstreamUrisTest {
    private static final URI AGENT = URI.create("wss://agent.example.com/v1/agent/converse");

    @Test
    void appendsRawQueryVerbatim() {
        assertThat(UpstreamUris.withQuery(AGENT, "model=nova-3&greeting=hi%20there"))
                .isEqualTo(URI.create("wss://agent.example.com/v1/agent/converse?model=nova-3&greeting=hi%20there"));
    }

    @Test
    void keepsExistingQueryOnUpstreamUrl() {
        URI withQuery = URI.create("wss://agent.example.com/converse?region=eu");

        assertThat(UpstreamUris.withQuery(withQuery, "a=1"))
                .isEqualTo(URI.create("wss://agent.example.com/converse?region=eu&a=1"));
    }

    @Test
    void returnsUpstreamUrlWithoutClientQuery() {
        assertThat(UpstreamUris.withQuery(AGENT, null)).isSameAs(AGENT);
        assertThat(UpstreamUris.withQuery(AGENT, "")).isSameAs(AGENT);
    }
}
