package com.appbuilder.dto;

import com.appbuilder.model.BuildLog;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.*;

import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BuildLogResponse {

    private Long id;
    private String level;
    private String stage;
    private String message;
    private JsonNode details;
    private LocalDateTime createdAt;

    public static BuildLogResponse from(BuildLog log, JsonNode details) {
        return BuildLogResponse.builder()
                .id(log.getId())
                .level(log.getLevel().name())
                .stage(log.getStage())
                .message(log.getMessage())
                .details(details)
                .createdAt(log.getCreatedAt())
                .build();
    }
}
