package com.appbuilder.model;

import com.appbuilder.model.enums.BuildStatus;
import com.appbuilder.model.enums.BuildType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One attempt to turn a project into an installable artifact.
 * Writes are guarded by {@link #lockVersion}; a build that reached a terminal status is never rewritten.
 */
@Entity
@Table(name = "appbuilder_builds", schema = "appbuilder",
        uniqueConstraints = @UniqueConstraint(name = "uk_build_project_number",
                columnNames = {"project_id", "build_number"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Build {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "project_id", nullable = false)
    private UUID projectId;

    @Column(name = "build_number", nullable = false)
    private Integer buildNumber;

    @Column(name = "version_number", nullable = false, length = 50)
    private String versionNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "build_type", nullable = false, length = 20)
    @Builder.Default
    private BuildType buildType = BuildType.RELEASE;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private BuildStatus status = BuildStatus.PENDING;

    @Column(nullable = false)
    @Builder.Default
    private Integer progress = 0;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "duration_seconds")
    private Long durationSeconds;

    /** Relative to the configured artifact root. */
    @Column(name = "artifact_path", length = 500)
    private String artifactPath;

    @Column(name = "artifact_size")
    private Long artifactSize;

    @Column(name = "flutter_version", length = 100)
    private String flutterVersion;

    @Column(name = "dart_version", length = 100)
    private String dartVersion;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "build_log", columnDefinition = "TEXT")
    private String buildLog;

    @Version
    @Column(name = "lock_version", nullable = false)
    private Long lockVersion;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = LocalDateTime.now();
    }

    public boolean isComplete() {
        return status.isTerminal();
    }

    public boolean isRunning() {
        return status.isRunning();
    }

    public boolean isActive() {
        return BuildStatus.ACTIVE.contains(status);
    }

    /**
     * Moves the build into a terminal status, stamping completion time and duration.
     */
    public void finish(BuildStatus terminal, LocalDateTime now) {
        status = terminal;
        completedAt = now;
        if (startedAt != null && durationSeconds == null) {
            durationSeconds = Math.max(0, Duration.between(startedAt, now).toSeconds());
        }
    }
}
