package com.appbuilder.dto;

import com.appbuilder.model.Build;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BuildResponse {

    private UUID id;
    private UUID projectId;
    private String projectName;
    private Integer buildNumber;
    private String versionNumber;
    private String buildType;
    private String status;
    private Integer progress;
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private Long durationSeconds;
    private String artifactPath;
    private Long artifactSize;
    private String flutterVersion;
    private String dartVersion;
    private String errorMessage;

    public static BuildResponse from(Build build, String projectName) {
        return BuildResponse.builder()
                .id(build.getId())
                .projectId(build.getProjectId())
                .projectName(projectName)
                .buildNumber(build.getBuildNumber())
                .versionNumber(build.getVersionNumber())
                .buildType(build.getBuildType().name())
                .status(build.getStatus().name())
                .progress(build.getProgress())
                .createdAt(build.getCreatedAt())
                .startedAt(build.getStartedAt())
                .completedAt(build.getCompletedAt())
                .durationSeconds(build.getDurationSeconds())
                .artifactPath(build.getArtifactPath())
                .artifactSize(build.getArtifactSize())
                .flutterVersion(build.getFlutterVersion())
                .dartVersion(build.getDartVersion())
                .errorMessage(build.getErrorMessage())
                .build();
    }
}
