package com.example.sourcesync.api.request;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;

@Data
public class CreateSyncSourceRequest {

    @NotNull
    private Long userId;

    @NotBlank
    private String name;

    /** Only "webdav" can be synced; other types are accepted for failure tracking. */
    private String sourceType = "webdav";

    @NotBlank
    private String baseUrl;

    @NotBlank
    private String username;

    @NotBlank
    private String password;

    /** Optional root path. Empty value means '/' on backend side. */
    private String rootPath;

    private Boolean enabled = true;
}
