package com.example.sourcesync.domain.model;

import com.example.sourcesync.domain.enumtype.SyncStrategy;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class SyncResult {

    private SyncStrategy strategyUsed;

    private List<WebDavFileObject> files = new ArrayList<>();

    private int directoriesScanned;

    private int directoriesSkipped;

    private int directoriesFailed;

    private int loopRejections;

    private long durationMs;
}
