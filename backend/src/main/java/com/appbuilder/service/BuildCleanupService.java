package com.appbuilder.service;

import com.appbuilder.config.BuildProperties;
import com.appbuilder.dto.CleanupReport;
import com.appbuilder.dto.CleanupRequest;
import com.appbuilder.model.Build;
import com.appbuilder.model.enums.BuildStatus;
import com.appbuilder.repository.BuildRepository;
import com.appbuilder.util.FileManager;
import com.appbuilder.util.FormatUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Retention housekeeping: old builds with their logs and artifacts, artifacts no build
 * references any more, and temp build directories left behind by crashed workers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BuildCleanupService {

    static final Duration TEMP_DIR_MAX_AGE = Duration.ofHours(24);
    private static final List<String> TEMP_DIR_PREFIXES = List.of("build_", "flutter_build_");

    private final BuildRepository repository;
    private final BuildLogService buildLogService;
    private final ArtifactStore artifactStore;
    private final FileManager fileManager;
    private final BuildRegistry buildRegistry;
    private final BuildProperties properties;

    /**
     * Deletes terminal builds created before the retention cutoff. Active builds are never
     * touched. A failure on one build is logged and the purge moves on.
     */
    public CleanupReport purge(CleanupRequest request) {
        int retentionDays = request.getRetentionDays() != null
                ? request.getRetentionDays()
                : properties.getRetentionDays();
        LocalDateTime cutoff = LocalDateTime.now().minusDays(retentionDays);

        Set<BuildStatus> statuses = EnumSet.copyOf(BuildStatus.TERMINAL);
        if (request.isKeepSuccessful()) statuses.remove(BuildStatus.SUCCESS);
        if (request.isKeepFailed()) statuses.remove(BuildStatus.FAILED);

        CleanupReport report = CleanupReport.builder()
                .dryRun(request.isDryRun())
                .cutoff(cutoff)
                .build();

        List<Build> candidates = statuses.isEmpty()
                ? List.of()
                : repository.findByStatusInAndCreatedAtBefore(statuses, cutoff);
        long bytesFreed = 0;
        for (Build build : candidates) {
            report.getCandidateBuildIds().add(build.getId());
            if (request.isDryRun()) {
                bytesFreed += artifactStore.resolve(build.getArtifactPath()).map(this::sizeOf).orElse(0L);
                continue;
            }
            try {
                long freed = artifactStore.delete(build.getArtifactPath());
                if (freed > 0) {
                    report.setArtifactsDeleted(report.getArtifactsDeleted() + 1);
                }
                bytesFreed += freed;
                buildLogService.deleteLogs(build.getId());
                repository.delete(build);
                report.setBuildsDeleted(report.getBuildsDeleted() + 1);
            } catch (RuntimeException e) {
                log.warn("Failed to delete build {}: {}", build.getId(), e.getMessage());
            }
        }

        if (request.isCleanOrphans()) {
            bytesFreed += cleanOrphanedArtifacts(report, request.isDryRun());
        }
        if (request.isCleanTemp()) {
            bytesFreed += cleanTempDirectories(report, request.isDryRun());
        }

        report.setBytesFreed(bytesFreed);
        report.setBytesFreedDisplay(FormatUtils.formatFileSize(bytesFreed));
        log.info("{}Build cleanup: {} builds older than {} days, {} orphaned files, {} temp dirs, {} freed",
                request.isDryRun() ? "[dry run] " : "",
                request.isDryRun() ? candidates.size() : report.getBuildsDeleted(),
                retentionDays, report.getOrphanedFilesDeleted(), report.getTempDirectoriesDeleted(),
                report.getBytesFreedDisplay());
        return report;
    }

    private long cleanOrphanedArtifacts(CleanupReport report, boolean dryRun) {
        long freed = 0;
        for (Path orphan : artifactStore.findOrphans(repository.findAllArtifactPaths())) {
            long size = sizeOf(orphan);
            if (dryRun) {
                report.setOrphanedFilesDeleted(report.getOrphanedFilesDeleted() + 1);
                freed += size;
                continue;
            }
            try {
                Files.deleteIfExists(orphan);
                report.setOrphanedFilesDeleted(report.getOrphanedFilesDeleted() + 1);
                freed += size;
            } catch (IOException e) {
                log.warn("Failed to delete orphaned artifact {}: {}", orphan, e.getMessage());
            }
        }
        return freed;
    }

    private long cleanTempDirectories(CleanupReport report, boolean dryRun) {
        Path tempRoot = properties.getTempDir();
        if (!Files.isDirectory(tempRoot)) {
            return 0L;
        }
        Instant threshold = Instant.now().minus(TEMP_DIR_MAX_AGE);
        long freed = 0;
        try (Stream<Path> entries = Files.list(tempRoot)) {
            for (Path dir : entries.filter(Files::isDirectory).toList()) {
                String name = dir.getFileName().toString();
                if (TEMP_DIR_PREFIXES.stream().noneMatch(name::startsWith)
                        || !isOlderThan(dir, threshold)
                        || isOwnedByRunningBuild(name)) {
                    continue;
                }
                long size = fileManager.directorySize(dir);
                if (dryRun || fileManager.cleanup(dir)) {
                    report.setTempDirectoriesDeleted(report.getTempDirectoriesDeleted() + 1);
                    freed += size;
                }
            }
        } catch (IOException e) {
            log.warn("Failed to list temp directory {}: {}", tempRoot, e.getMessage());
        }
        return freed;
    }

    // build_<uuid>_<random>
    private boolean isOwnedByRunningBuild(String dirName) {
        if (!dirName.startsWith("build_") || dirName.length() < 42) {
            return false;
        }
        try {
            return buildRegistry.isRunningHere(UUID.fromString(dirName.substring(6, 42)));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private boolean isOlderThan(Path path, Instant threshold) {
        try {
            return Files.getLastModifiedTime(path).toInstant().isBefore(threshold);
        } catch (IOException e) {
            return false;
        }
    }

    private long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            return 0L;
        }
    }
}
