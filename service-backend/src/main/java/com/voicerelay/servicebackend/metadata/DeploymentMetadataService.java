package com.voicerelay.servicebackend.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.voicerelay.servicebackend.exception.MetadataUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads the {@code [meta]} table of the deployment TOML file.
 * The file is read on every call so edits show up without a restart.
 */
public class DeploymentMetadataService {
    private static final Logger log = LoggerFactory.getLogger(DeploymentMetadataService.class);
    private static final String META_TABLE = "meta";

    private final ResourceLoader resourceLoader;
    private final String location;
    private final TomlMapper tomlMapper = new TomlMapper();

    public DeploymentMetadataService(ResourceLoader resourceLoader, String location) {
        this.resourceLoader = resourceLoader;
        this.location = location;
    }

    /**
     * @throws MetadataUnavailableException if the file cannot be read or parsed, or has no
     *                                      {@code [meta]} table
     */
    public JsonNode readMetadata() {
        Resource resource = resourceLoader.getResource(location);
        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = tomlMapper.readTree(in);
        } catch (IOException e) {
            log.error("Error reading metadata from {}: {}", location, e.getMessage());
            throw new MetadataUnavailableException("Failed to read metadata from deepgram.toml", e);
        }

        JsonNode meta = root.get(META_TABLE);
        if (meta == null || !meta.isObject()) {
            throw new MetadataUnavailableException("Missing [meta] section in deepgram.toml");
        }
        return meta;
    }
}
