package com.example.sourcesync.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class SyncSourceConfigEntity {

    private Long id;

    private Long userId;

    private String name;

    private String sourceType;

    private String baseUrl;

    private String username;

    private String passwordEnc;

    private String rootPath;

    private Integer enabled;

    private LocalDateTime lastSyncAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
