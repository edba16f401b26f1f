package com.example.sourcesync.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.security")
public class AppSecurityProperties {

    /**
     * AES key for source credential encryption (16/24/32 chars).
     */
    private String encryptKey = "changeit12345678";
}
