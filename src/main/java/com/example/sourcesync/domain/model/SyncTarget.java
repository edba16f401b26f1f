package com.example.sourcesync.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A WebDAV source resolved for one sync run, with the password already decrypted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SyncTarget {

    private Long userId;

    private Long configId;

    private String baseUrl;

    private String username;

    private String password;

    private String rootPath;

    @Override
    public String toString() {
        return "SyncTarget{userId=" + userId + ", configId=" + configId + ", baseUrl='" + baseUrl
                + "', rootPath='" + rootPath + "'}";
    }
}
