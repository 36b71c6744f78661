package com.voicerelay.servicebackend.session;

import org.springframework.core.io.Resource;
import org.springframework.web.util.HtmlUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Entry document with a slot for the session nonce.
 * The nonce is written into a {@code <meta name="session-nonce">} tag placed just before
 * {@code </head>}, or at the top of the document when it has no head.
 */
public class BootstrapPageTemplate {
    public static final String NONCE_META_NAME = "session-nonce";
    private static final String HEAD_CLOSE = "</head>";

    private final String html;

    public BootstrapPageTemplate(String html) {
        this.html = html;
    }

    public static BootstrapPageTemplate load(Resource resource) {
        try {
            return new BootstrapPageTemplate(resource.getContentAsString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read bootstrap page template " + resource.getDescription(), e);
        }
    }

    public String render(String nonce) {
        String meta = "<meta name=\"" + NONCE_META_NAME + "\" content=\"" + HtmlUtils.htmlEscape(nonce) + "\">";
        int headClose = html.toLowerCase(Locale.ROOT).indexOf(HEAD_CLOSE);
        if (headClose < 0) {
            return meta + "\n" + html;
        }
        return html.substring(0, headClose) + meta + "\n" + html.substring(headClose);
    }
}
