package com.appbuilder.service;

import com.appbuilder.config.BuildProperties;
import com.appbuilder.dto.BuildResponse;
import com.appbuilder.dto.BuildStatisticsResponse;
import com.appbuilder.dto.BuildStatusResponse;
import com.appbuilder.dto.ProjectBuildStatsResponse;
import com.appbuilder.dto.QueueEntryResponse;
import com.appbuilder.dto.SystemStatsResponse;
import com.appbuilder.exception.NotFoundException;
import com.appbuilder.model.Build;
import com.appbuilder.model.Project;
import com.appbuilder.model.enums.BuildStatus;
import com.appbuilder.repository.BuildRepository;
import com.appbuilder.repository.ProjectRepository;
import com.appbuilder.util.FormatUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only views over builds: per-build snapshots, the queue and aggregate statistics.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class BuildMonitor {

    static final int RECENT_LOG_LIMIT = 10;
    static final int BUILD_LOG_TAIL_CHARS = 5000;
    static final int RECENT_BUILD_LIMIT = 5;
    static final int BUSY_QUEUE_SIZE = 10;
    static final int HIGH_LOAD_ACTIVE_BUILDS = 5;

    private final BuildRepository repository;
    private final ProjectRepository projectRepository;
    private final BuildLogService buildLogService;
    private final ArtifactStore artifactStore;
    private final BuildProperties properties;

    // ── Per build ─────────────────────────────────────────────────────────

    public BuildStatusResponse statusSnapshot(UUID buildId) {
        Build build = repository.findById(buildId)
                .orElseThrow(() -> new NotFoundException("Build not found: " + buildId));

        Long duration = durationSeconds(build, LocalDateTime.now());
        Optional<Path> artifact = build.getStatus() == BuildStatus.SUCCESS
                ? artifactStore.resolve(build.getArtifactPath())
                : Optional.empty();

        BuildStatusResponse.ArtifactInfo artifactInfo = artifact.map(path -> BuildStatusResponse.ArtifactInfo.builder()
                        .downloadUrl("/api/builds/" + buildId + "/download")
                        .fileName(path.getFileName().toString())
                        .size(build.getArtifactSize())
                        .sizeDisplay(FormatUtils.formatFileSize(build.getArtifactSize()))
                        .build())
                .orElse(null);

        return BuildStatusResponse.builder()
                .build(BuildResponse.from(build, resolveProjectName(build.getProjectId())))
                .durationSeconds(duration)
                .durationDisplay(duration != null ? FormatUtils.formatDuration(duration) : null)
                .recentLogs(buildLogService.findRecent(buildId, RECENT_LOG_LIMIT))
                .buildLogTail(build.isComplete() ? FormatUtils.tail(build.getBuildLog(), BUILD_LOG_TAIL_CHARS) : null)
                .artifact(artifactInfo)
                .canRetry(BuildStatus.RETRYABLE.contains(build.getStatus()))
                .canDownload(artifact.isPresent())
                .build();
    }

    /**
     * Stored duration for finished builds, elapsed time so far for running ones,
     * null when the build never started.
     */
    static Long durationSeconds(Build build, LocalDateTime now) {
        if (build.getDurationSeconds() != null) {
            return build.getDurationSeconds();
        }
        if (build.getStartedAt() == null) {
            return null;
        }
        LocalDateTime end = build.getCompletedAt() != null ? build.getCompletedAt() : now;
        return Math.max(0, Duration.between(build.getStartedAt(), end).toSeconds());
    }

    // ── Queue ─────────────────────────────────────────────────────────────

    public List<QueueEntryResponse> queue() {
        LocalDateTime now = LocalDateTime.now();
        List<Build> pending = repository.findByStatusOrderByCreatedAtAsc(BuildStatus.PENDING);
        List<QueueEntryResponse> entries = new ArrayList<>();
        for (int i = 0; i < pending.size(); i++) {
            Build build = pending.get(i);
            long wait = Math.max(0, Duration.between(build.getCreatedAt(), now).toSeconds());
            entries.add(QueueEntryResponse.builder()
                    .position(i + 1)
                    .buildId(build.getId())
                    .projectId(build.getProjectId())
                    .projectName(resolveProjectName(build.getProjectId()))
                    .buildNumber(build.getBuildNumber())
                    .versionNumber(build.getVersionNumber())
                    .buildType(build.getBuildType().name())
                    .createdAt(build.getCreatedAt())
                    .waitSeconds(wait)
                    .waitTime(FormatUtils.formatDuration(wait))
                    .build());
        }
        return entries;
    }

    // ── Aggregates ────────────────────────────────────────────────────────

    public SystemStatsResponse systemStats() {
        LocalDateTime now = LocalDateTime.now();
        LocalDateTime dayAgo = now.minusHours(24);

        long active = repository.countByStatusIn(BuildStatus.ACTIVE);
        long queueSize = repository.countByStatus(BuildStatus.PENDING);
        long success24h = repository.countByStatusAndCreatedAtAfter(BuildStatus.SUCCESS, dayAgo);
        long failed24h = repository.countByStatusAndCreatedAtAfter(BuildStatus.FAILED, dayAgo);

        return SystemStatsResponse.builder()
                .totalBuilds(repository.count())
                .builds24h(repository.countByCreatedAtAfter(dayAgo))
                .builds7d(repository.countByCreatedAtAfter(now.minusDays(7)))
                .activeBuilds(active)
                .queueSize(queueSize)
                .successRate24h(successRate(success24h, success24h + failed24h))
                .systemStatus(systemStatus(queueSize, active))
                .build();
    }

    static String systemStatus(long queueSize, long activeBuilds) {
        if (queueSize == 0 && activeBuilds == 0) return "idle";
        if (queueSize > BUSY_QUEUE_SIZE) return "busy";
        if (activeBuilds > HIGH_LOAD_ACTIVE_BUILDS) return "high_load";
        return "normal";
    }

    public ProjectBuildStatsResponse projectStats(UUID projectId) {
        Project project = projectRepository.findById(projectId)
                .orElseThrow(() -> new NotFoundException("Project not found: " + projectId));

        Map<String, Long> breakdown = new LinkedHashMap<>();
        for (BuildStatus status : BuildStatus.values()) {
            breakdown.put(status.name(), 0L);
        }
        for (Object[] row : repository.countByStatusForProject(projectId)) {
            breakdown.put(((BuildStatus) row[0]).name(), ((Number) row[1]).longValue());
        }
        long total = breakdown.values().stream().mapToLong(Long::longValue).sum();
        Double average = repository.averageDurationForProject(projectId, BuildStatus.SUCCESS);

        return ProjectBuildStatsResponse.builder()
                .projectId(projectId)
                .projectName(project.getName())
                .totalBuilds(total)
                .statusBreakdown(breakdown)
                .successRate(successRate(breakdown.get(BuildStatus.SUCCESS.name()), total))
                .averageBuildTimeSeconds(average)
                .averageBuildTime(average != null ? FormatUtils.formatDuration(Math.round(average)) : null)
                .recentBuilds(repository.findByProjectIdOrderByCreatedAtDesc(projectId,
                                PageRequest.of(0, RECENT_BUILD_LIMIT)).stream()
                        .map(b -> BuildResponse.from(b, project.getName()))
                        .toList())
                .build();
    }

    public BuildStatisticsResponse statistics() {
        Double average = repository.averageDuration(BuildStatus.SUCCESS);
        return BuildStatisticsResponse.builder()
                .totalBuilds(repository.count())
                .pendingCount(repository.countByStatus(BuildStatus.PENDING))
                .runningCount(repository.countByStatusIn(BuildStatus.RUNNING))
                .successCount(repository.countByStatus(BuildStatus.SUCCESS))
                .failedCount(repository.countByStatus(BuildStatus.FAILED))
                .cancelledCount(repository.countByStatus(BuildStatus.CANCELLED))
                .averageBuildTimeSeconds(average)
                .averageBuildTime(average != null ? FormatUtils.formatDuration(Math.round(average)) : null)
                .totalProjects(projectRepository.count())
                .build();
    }

    public List<BuildResponse> recentBuilds(int limit) {
        return repository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, limit)).stream()
                .map(b -> BuildResponse.from(b, resolveProjectName(b.getProjectId())))
                .toList();
    }

    /**
     * Running builds the next sweep would fail. Does not modify anything.
     */
    public List<BuildResponse> findStaleBuilds() {
        LocalDateTime cutoff = LocalDateTime.now().minus(properties.getStaleThreshold());
        return repository.findByStatusInAndStartedAtBefore(BuildStatus.RUNNING, cutoff).stream()
                .map(b -> BuildResponse.from(b, resolveProjectName(b.getProjectId())))
                .toList();
    }

    static double successRate(long successes, long total) {
        if (total == 0) return 0.0;
        return Math.round(successes * 1000.0 / total) / 10.0;
    }

    private String resolveProjectName(UUID projectId) {
        return projectRepository.findById(projectId)
                .map(Project::getName)
                .orElse("(deleted)");
    }
}
