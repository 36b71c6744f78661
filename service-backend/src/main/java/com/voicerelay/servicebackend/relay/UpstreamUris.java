package com.voicerelay.servicebackend.relay;

import java.net.URI;

public final class UpstreamUris {

    private UpstreamUris() {
    }

    /**
     * Appends the client's raw query string to the upstream URL unchanged.
     */
    public static URI withQuery(URI upstream, String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return upstream;
        }
        String base = upstream.toString();
        String separator = upstream.getRawQuery() == null ? "?" : "&";
        return URI.create(base + separator + rawQuery);
    }
}
