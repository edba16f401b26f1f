package com.example.sourcesync.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.webdav")
public class AppWebDavProperties {

    private int connectTimeoutMs = 5000;

    private int socketTimeoutMs = 15000;

    /**
     * Pooled connections per host; should cover app.sync.list-thread-count.
     */
    private int maxConnectionsPerRoute = 8;
}
