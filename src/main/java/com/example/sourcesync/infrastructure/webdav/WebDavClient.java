package com.example.sourcesync.infrastructure.webdav;

import com.example.sourcesync.domain.model.WebDavDirectoryInfo;
import com.github.sardine.Sardine;

public interface WebDavClient {

    /** Create a Sardine session reused for every listing of one sync run. */
    Sardine createSession(String username, String password);

    /**
     * Depth-1 listing of a single directory: its own ETag, direct files and direct subdirectories.
     * Failures surface as {@link IllegalStateException} carrying the original Sardine/IO cause.
     */
    WebDavDirectoryInfo listDirectory(Sardine session, String directoryUrl, String rootUrl);

    /** Build the full root URL from baseUrl and rootPath. */
    String buildRootUrl(String baseUrl, String rootPath);

    /** Directory URL of a path relative to the root; an empty path is the root itself. */
    String resolveDirectoryUrl(String rootUrl, String relativePath);

    void closeSession(Sardine session);
}
