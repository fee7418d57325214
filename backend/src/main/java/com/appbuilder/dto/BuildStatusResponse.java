package com.appbuilder.dto;

import lombok.*;

import java.util.List;

/**
 * Point-in-time view of one build for polling clients.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BuildStatusResponse {

    private BuildResponse build;
    private Long durationSeconds;
    private String durationDisplay;
    private List<BuildLogResponse> recentLogs;
    /** End of the captured tool output, only for finished builds. */
    private String buildLogTail;
    private ArtifactInfo artifact;
    private boolean canRetry;
    private boolean canDownload;

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class ArtifactInfo {
        private String downloadUrl;
        private String fileName;
        private Long size;
        private String sizeDisplay;
    }
}
