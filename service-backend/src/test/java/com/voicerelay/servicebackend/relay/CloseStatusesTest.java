package com.voicerelay.servicebackend.relay;

import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class CloseStatusesTest {

    @Test
    void sendableStatusIsForwardedUnchanged() {
        CloseStatus status = new CloseStatus(4001, "agent ended");

        assertThat(CloseStatuses.forwardable(status)).isEqualTo(status);
        assertThat(CloseStatuses.forwardable(CloseStatus.SERVER_ERROR)).isEqualTo(CloseStatus.SERVER_ERROR);
    }

    @Test
    void noStatusBecomesNormalClosure() {
        assertThat(CloseStatuses.forwardable(CloseStatus.NO_STATUS_CODE).getCode()).isEqualTo(1000);
        assertThat(CloseStatuses.forwardable(null).getCode()).isEqualTo(1000);
    }

    @Test
    void abnormalClosureBecomesUpstreamLost() {
        CloseStatus forwarded = CloseStatuses.forwardable(CloseStatus.NO_CLOSE_FRAME);

        assertThat(forwarded.getCode()).isEqualTo(1011);
        assertThat(forwarded.getReason()).isEqualTo("Upstream connection lost");
        assertThat(CloseStatuses.forwardable(CloseStatus.TLS_HANDSHAKE_FAILURE).getCode()).isEqualTo(1011);
    }

    @Test
    void longReasonIsTruncatedTo123Bytes() {
        CloseStatus forwarded = CloseStatuses.forwardable(new CloseStatus(1008, "é".repeat(100)));

        assertThat(forwarded.getCode()).isEqualTo(1008);
        assertThat(forwarded.getReason().getBytes(StandardCharsets.UTF_8)).hasSize(122);
    }

    @Test
    void setupFailedUsesApplicationCode() {
        assertThat(CloseStatuses.SETUP_FAILED.getCode()).isEqualTo(3000);
        assertThat(CloseStatuses.SETUP_FAILED.getReason()).isEqualTo("Setup failed");
    }
}
