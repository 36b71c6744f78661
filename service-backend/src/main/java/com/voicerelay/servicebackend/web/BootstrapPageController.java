package com.voicerelay.servicebackend.web;

import com.voicerelay.servicebackend.session.BootstrapDocument;
import com.voicerelay.servicebackend.session.SessionBootstrapService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Serves the entry page. Every load gets its own nonce, so the page is never cached.
 */
@RestController
public class BootstrapPageController {
    private static final Logger log = LoggerFactory.getLogger(BootstrapPageController.class);

    private final SessionBootstrapService bootstrapService;

    public BootstrapPageController(SessionBootstrapService bootstrapService) {
        this.bootstrapService = bootstrapService;
    }

    @GetMapping(value = {"/", "/index.html"}, produces = MediaType.TEXT_HTML_VALUE)
    public ResponseEntity<String> bootstrapPage() {
        BootstrapDocument document = bootstrapService.serveBootstrapPage();
        log.debug("Served bootstrap page, nonce valid until {}", document.nonce().expiresAt());
        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .contentType(MediaType.TEXT_HTML)
                .body(document.html());
    }
}
