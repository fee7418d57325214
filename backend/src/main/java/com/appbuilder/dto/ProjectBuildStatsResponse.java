package com.appbuilder.dto;

import lombok.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProjectBuildStatsResponse {
    private UUID projectId;
    private String projectName;
    private long totalBuilds;
    private Map<String, Long> statusBreakdown;
    private double successRate;
    private Double averageBuildTimeSeconds;
    private String averageBuildTime;
    private List<BuildResponse> recentBuilds;
}
