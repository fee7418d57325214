package com.appbuilder.controller;

import com.appbuilder.dto.BuildLogResponse;
import com.appbuilder.dto.BuildRequest;
import com.appbuilder.dto.BuildResponse;
import com.appbuilder.dto.BuildStatisticsResponse;
import com.appbuilder.dto.BuildStatusResponse;
import com.appbuilder.dto.CleanupReport;
import com.appbuilder.dto.CleanupRequest;
import com.appbuilder.dto.PageResponse;
import com.appbuilder.dto.QueueEntryResponse;
import com.appbuilder.dto.SystemStatsResponse;
import com.appbuilder.dto.ToolchainHealthResponse;
import com.appbuilder.model.enums.LogLevel;
import com.appbuilder.service.BuildCleanupService;
import com.appbuilder.service.BuildLogService;
import com.appbuilder.service.BuildMonitor;
import com.appbuilder.service.BuildService;
import com.appbuilder.service.ToolchainHealthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@RestController
@RequestMapping("/api/builds")
@RequiredArgsConstructor
public class BuildController {

    private static final Set<String> ALLOWED_SORT_FIELDS = Set.of(
            "createdAt", "startedAt", "completedAt", "status", "buildNumber", "durationSeconds");
    private static final int MAX_PAGE_SIZE = 100;
    private static final int MAX_RECENT = 50;
    private static final MediaType APK_MEDIA_TYPE = MediaType.parseMediaType("application/vnd.android.package-archive");

    private final BuildService buildService;
    private final BuildLogService buildLogService;
    private final BuildMonitor buildMonitor;
    private final BuildCleanupService cleanupService;
    private final ToolchainHealthService toolchainHealthService;

    // ── Lifecycle ─────────────────────────────────────────────────────────

    @PostMapping
    public ResponseEntity<BuildResponse> create(@Valid @RequestBody BuildRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(buildService.createBuild(request));
    }

    @PostMapping("/{id}/cancel")
    public BuildResponse cancel(@PathVariable UUID id) {
        return buildService.cancelBuild(id);
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<BuildResponse> retry(@PathVariable UUID id) {
        return ResponseEntity.status(HttpStatus.CREATED).body(buildService.retryBuild(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        buildService.delete(id);
        return ResponseEntity.noContent().build();
    }

    // ── Reads ─────────────────────────────────────────────────────────────

    @GetMapping
    public PageResponse<BuildResponse> findAll(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "10") int size,
            @RequestParam(required = false) UUID projectId,
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "createdAt") String sortBy,
            @RequestParam(defaultValue = "desc") String sortDir) {
        if (!ALLOWED_SORT_FIELDS.contains(sortBy)) sortBy = "createdAt";
        if (size < 1) size = 10;
        if (size > MAX_PAGE_SIZE) size = MAX_PAGE_SIZE;
        if (page < 0) page = 0;
        Sort sort = sortDir.equalsIgnoreCase("asc")
                ? Sort.by(sortBy).ascending()
                : Sort.by(sortBy).descending();
        return buildService.findAll(projectId, status, PageRequest.of(page, size, sort));
    }

    @GetMapping("/{id}")
    public BuildStatusResponse status(@PathVariable UUID id) {
        return buildMonitor.statusSnapshot(id);
    }

    @GetMapping("/{id}/logs")
    public List<BuildLogResponse> logs(@PathVariable UUID id, @RequestParam(required = false) String level) {
        buildService.findBuild(id);
        return buildLogService.findLogs(id, parseLevel(level));
    }

    @GetMapping("/{id}/build-log")
    public ResponseEntity<String> buildLog(@PathVariable UUID id, @RequestParam(required = false) Integer tail) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=build-" + id + ".log")
                .contentType(MediaType.TEXT_PLAIN)
                .body(buildService.getBuildLog(id, tail));
    }

    @GetMapping("/{id}/download")
    public ResponseEntity<Resource> download(@PathVariable UUID id) {
        Path artifact = buildService.getArtifact(id);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(artifact.getFileName().toString())
                        .build()
                        .toString())
                .contentType(APK_MEDIA_TYPE)
                .body(new FileSystemResource(artifact));
    }

    // ── Monitoring ────────────────────────────────────────────────────────

    @GetMapping("/queue")
    public List<QueueEntryResponse> queue() {
        return buildMonitor.queue();
    }

    @GetMapping("/stats")
    public SystemStatsResponse systemStats() {
        return buildMonitor.systemStats();
    }

    @GetMapping("/statistics")
    public BuildStatisticsResponse statistics() {
        return buildMonitor.statistics();
    }

    @GetMapping("/recent")
    public List<BuildResponse> recent(@RequestParam(defaultValue = "10") int limit) {
        if (limit < 1) limit = 10;
        if (limit > MAX_RECENT) limit = MAX_RECENT;
        return buildMonitor.recentBuilds(limit);
    }

    @GetMapping("/stale")
    public List<BuildResponse> stale() {
        return buildMonitor.findStaleBuilds();
    }

    @GetMapping("/toolchain")
    public ToolchainHealthResponse toolchain() {
        return toolchainHealthService.check();
    }

    // ── Maintenance ───────────────────────────────────────────────────────

    @PostMapping("/cleanup")
    public CleanupReport cleanup(@Valid @RequestBody CleanupRequest request) {
        return cleanupService.purge(request);
    }

    private static LogLevel parseLevel(String level) {
        if (level == null || level.isBlank()) {
            return null;
        }
        try {
            return LogLevel.valueOf(level.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown log level: " + level);
        }
    }
}
