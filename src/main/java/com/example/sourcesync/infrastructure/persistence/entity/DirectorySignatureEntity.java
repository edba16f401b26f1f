package com.example.sourcesync.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class DirectorySignatureEntity {

    private Long id;

    private Long userId;

    private Long configId;

    private String dirPath;

    private String dirPathMd5;

    private String dirEtag;

    private Integer fileCount;

    private Integer subdirCount;

    private LocalDateTime lastScannedAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
