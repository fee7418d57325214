package com.appbuilder.dto;

import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CleanupReport {
    private boolean dryRun;
    private LocalDateTime cutoff;
    private int buildsDeleted;
    private int artifactsDeleted;
    private int orphanedFilesDeleted;
    private int tempDirectoriesDeleted;
    private long bytesFreed;
    private String bytesFreedDisplay;

    @Builder.Default
    private List<UUID> candidateBuildIds = new ArrayList<>();
}
