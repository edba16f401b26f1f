package com.example.sourcesync.api.controller;

import com.example.sourcesync.api.request.ExcludeResourceRequest;
import com.example.sourcesync.api.request.ResolveFailureRequest;
import com.example.sourcesync.api.request.RetryFailureRequest;
import com.example.sourcesync.api.response.ApiResponse;
import com.example.sourcesync.api.response.SourceFailureStatsResponse;
import com.example.sourcesync.api.response.SourceScanFailureResponse;
import com.example.sourcesync.application.service.SourceFailureService;
import java.util.List;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/source-failures")
public class SourceFailureController {

    private final SourceFailureService sourceFailureService;

    public SourceFailureController(SourceFailureService sourceFailureService) {
        this.sourceFailureService = sourceFailureService;
    }

    @GetMapping
    public ApiResponse<List<SourceScanFailureResponse>> listFailures(
            @RequestParam("userId") Long userId,
            @RequestParam(value = "sourceType", required = false) String sourceType,
            @RequestParam(value = "errorType", required = false) String errorType,
            @RequestParam(value = "severity", required = false) String severity,
            @RequestParam(value = "includeResolved", defaultValue = "false") boolean includeResolved,
            @RequestParam(value = "includeExcluded", defaultValue = "false") boolean includeExcluded,
            @RequestParam(value = "limit", defaultValue = "50") int limit,
            @RequestParam(value = "offset", defaultValue = "0") int offset) {
        return ApiResponse.success(sourceFailureService.listFailures(userId, sourceType, errorType, severity,
                includeResolved, includeExcluded, limit, offset));
    }

    @GetMapping("/stats")
    public ApiResponse<SourceFailureStatsResponse> stats(
            @RequestParam("userId") Long userId,
            @RequestParam(value = "sourceType", required = false) String sourceType) {
        return ApiResponse.success(sourceFailureService.getStats(userId, sourceType));
    }

    @GetMapping("/{id}")
    public ApiResponse<SourceScanFailureResponse> getFailure(@RequestParam("userId") Long userId,
                                                             @PathVariable("id") Long id) {
        return ApiResponse.success(sourceFailureService.getFailure(userId, id));
    }

    @PostMapping("/{id}/retry")
    public ApiResponse<SourceScanFailureResponse> retry(@RequestParam("userId") Long userId,
                                                        @PathVariable("id") Long id,
                                                        @Valid @RequestBody(required = false)
                                                        RetryFailureRequest request) {
        String notes = request == null ? null : request.getNotes();
        return ApiResponse.success(sourceFailureService.retryFailure(userId, id, notes));
    }

    @PostMapping("/{id}/exclude")
    public ApiResponse<SourceScanFailureResponse> exclude(@RequestParam("userId") Long userId,
                                                          @PathVariable("id") Long id,
                                                          @Valid @RequestBody(required = false)
                                                          ExcludeResourceRequest request) {
        String notes = request == null ? null : request.getNotes();
        return ApiResponse.success(sourceFailureService.excludeResource(userId, id, notes));
    }

    @PostMapping("/{id}/resolve")
    public ApiResponse<SourceScanFailureResponse> resolve(@RequestParam("userId") Long userId,
                                                          @PathVariable("id") Long id,
                                                          @Valid @RequestBody(required = false)
                                                          ResolveFailureRequest request) {
        String notes = request == null ? null : request.getNotes();
        return ApiResponse.success(sourceFailureService.resolveFailure(userId, id, notes));
    }
}
