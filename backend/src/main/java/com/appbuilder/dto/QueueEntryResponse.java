package com.appbuilder.dto;

import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QueueEntryResponse {
    private int position;
    private UUID buildId;
    private UUID projectId;
    private String projectName;
    private Integer buildNumber;
    private String versionNumber;
    private String buildType;
    private LocalDateTime createdAt;
    private long waitSeconds;
    private String waitTime;
}
