package com.example.homemic_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

/**
 * Limits and credentials for clip uploads from nodes.
 */
@ConfigurationProperties(prefix = "homemic.ingest")
public class IngestProperties {
    private DataSize maxFileSize = DataSize.ofMegabytes(100);
    /** Shared secret nodes send as {@code X-Node-Token}. Blank disables the check. */
    private String nodeToken = "";

    public DataSize getMaxFileSize() { return maxFileSize; }
    public void setMaxFileSize(DataSize maxFileSize) { this.maxFileSize = maxFileSize; }

    public String getNodeToken() { return nodeToken; }
    public void setNodeToken(String nodeToken) { this.nodeToken = nodeToken; }
}
