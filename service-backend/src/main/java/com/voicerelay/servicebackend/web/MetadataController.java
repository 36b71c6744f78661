package com.voicerelay.servicebackend.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.voicerelay.servicebackend.metadata.DeploymentMetadataService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/metadata")
public class MetadataController {

    private final DeploymentMetadataService metadataService;

    public MetadataController(DeploymentMetadataService metadataService) {
        this.metadataService = metadataService;
    }

    @GetMapping
    public ResponseEntity<JsonNode> metadata() {
        return ResponseEntity.ok(metadataService.readMetadata());
    }
}
