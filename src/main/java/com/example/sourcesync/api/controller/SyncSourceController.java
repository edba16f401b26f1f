package com.example.sourcesync.api.controller;

import com.example.sourcesync.api.request.CreateSyncSourceRequest;
import com.example.sourcesync.api.response.ApiResponse;
import com.example.sourcesync.api.response.SyncSourceResponse;
import com.example.sourcesync.application.service.SmartSyncService;
import com.example.sourcesync.application.service.SyncSourceService;
import com.example.sourcesync.domain.model.SyncResult;
import java.util.Optional;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/sync/sources")
public class SyncSourceController {

    private final SyncSourceService syncSourceService;
    private final SmartSyncService smartSyncService;

    public SyncSourceController(SyncSourceService syncSourceService, SmartSyncService smartSyncService) {
        this.syncSourceService = syncSourceService;
        this.smartSyncService = smartSyncService;
    }

    @PostMapping
    public ApiResponse<SyncSourceResponse> createSource(@Valid @RequestBody CreateSyncSourceRequest request) {
        return ApiResponse.success(syncSourceService.createSource(request));
    }

    /**
     * Runs one smart sync synchronously. An empty payload means nothing changed.
     */
    @PostMapping("/{id}/sync")
    public ApiResponse<SyncResult> sync(@RequestParam("userId") Long userId, @PathVariable("id") Long id) {
        Optional<SyncResult> result = smartSyncService.syncSource(userId, id);
        return ApiResponse.success(result.orElse(null));
    }
}
