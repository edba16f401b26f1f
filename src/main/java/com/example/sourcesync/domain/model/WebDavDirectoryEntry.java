package com.example.sourcesync.domain.model;

import java.util.Date;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A child directory as reported by a depth-1 listing of its parent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WebDavDirectoryEntry {

    private String relativePath;

    private String directoryUrl;

    private String etag;

    private Date lastModified;
}
