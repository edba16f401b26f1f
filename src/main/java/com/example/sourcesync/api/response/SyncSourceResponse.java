package com.example.sourcesync.api.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SyncSourceResponse {

    private Long id;

    private Long userId;

    private String name;

    private String sourceType;

    private String baseUrl;

    private String username;

    private String rootPath;

    private Integer enabled;

    private LocalDateTime lastSyncAt;

    private LocalDateTime createdAt;
}
