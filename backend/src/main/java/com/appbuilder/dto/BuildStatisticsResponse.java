package com.appbuilder.dto;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BuildStatisticsResponse {
    private long totalBuilds;
    private long pendingCount;
    private long runningCount;
    private long successCount;
    private long failedCount;
    private long cancelledCount;
    private Double averageBuildTimeSeconds;
    private String averageBuildTime;
    private long totalProjects;
}
