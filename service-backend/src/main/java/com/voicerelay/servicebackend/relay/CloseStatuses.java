package com.voicerelay.servicebackend.relay;

import org.springframework.web.socket.CloseStatus;

import java.nio.charset.StandardCharsets;

/**
 * Translates a close status received on one leg into one that may be sent on the other.
 */
public final class CloseStatuses {
    public static final CloseStatus SETUP_FAILED = new CloseStatus(3000, "Setup failed");
    public static final CloseStatus UPSTREAM_LOST = CloseStatus.SERVER_ERROR.withReason("Upstream connection lost");

    // RFC 6455 limits the close payload to 125 bytes, two of which hold the code
    private static final int MAX_REASON_BYTES = 123;

    private CloseStatuses() {
    }

    public static CloseStatus forwardable(CloseStatus status) {
        if (status == null || status.equalsCode(CloseStatus.NO_STATUS_CODE)) {
            return CloseStatus.NORMAL;
        }
        if (status.equalsCode(CloseStatus.NO_CLOSE_FRAME) || status.equalsCode(CloseStatus.TLS_HANDSHAKE_FAILURE)) {
            return UPSTREAM_LOST;
        }
        String reason = status.getReason();
        if (reason == null || reason.getBytes(StandardCharsets.UTF_8).length <= MAX_REASON_BYTES) {
            return status;
        }
        return new CloseStatus(status.getCode(), truncate(reason));
    }

    private static String truncate(String reason) {
        StringBuilder out = new StringBuilder();
        int bytes = 0;
        for (int i = 0; i < reason.length(); ) {
            int cp = reason.codePointAt(i);
            int len = new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8).length;
            if (bytes + len > MAX_REASON_BYTES) {
                break;
            }
            out.appendCodePoint(cp);
            bytes += len;
            i += Character.charCount(cp);
        }
        return out.toString();
    }
}
