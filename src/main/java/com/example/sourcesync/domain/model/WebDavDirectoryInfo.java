package com.example.sourcesync.domain.model;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WebDavDirectoryInfo {

    private String relativePath;

    private String directoryUrl;

    private String etag;

    private Date lastModified;

    private int childCount;

    private List<WebDavFileObject> files = new ArrayList<>();

    private List<WebDavDirectoryEntry> subdirectories = new ArrayList<>();

    private String serverType;

    private long responseTimeMs;
}
