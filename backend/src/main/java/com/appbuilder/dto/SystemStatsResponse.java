package com.appbuilder.dto;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SystemStatsResponse {
    private long totalBuilds;
    private long builds24h;
    private long builds7d;
    private long activeBuilds;
    private long queueSize;
    private double successRate24h;
    private String systemStatus;
}
