package com.appbuilder.service;

import com.appbuilder.dto.BuildLogResponse;
import com.appbuilder.model.BuildLog;
import com.appbuilder.model.enums.LogLevel;
import com.appbuilder.repository.BuildLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only per-build log. Entries are written in their own transaction so they survive
 * a failing pipeline step.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BuildLogService {

    private final BuildLogRepository repository;
    private final ObjectMapper objectMapper;

    public BuildLog append(UUID buildId, LogLevel level, String stage, String message) {
        return append(buildId, level, stage, message, null);
    }

    public BuildLog append(UUID buildId, LogLevel level, String stage, String message, Map<String, ?> details) {
        BuildLog entry = BuildLog.builder()
                .buildId(buildId)
                .level(level)
                .stage(stage)
                .message(message)
                .details(serialize(details))
                .build();
        return repository.save(entry);
    }

    @Transactional(readOnly = true)
    public List<BuildLogResponse> findLogs(UUID buildId, LogLevel level) {
        List<BuildLog> logs = level == null
                ? repository.findByBuildIdOrderByCreatedAtAscIdAsc(buildId)
                : repository.findByBuildIdAndLevelOrderByCreatedAtAscIdAsc(buildId, level);
        return logs.stream().map(this::toResponse).toList();
    }

    /** Newest first. */
    @Transactional(readOnly = true)
    public List<BuildLogResponse> findRecent(UUID buildId, int limit) {
        return repository.findByBuildIdOrderByCreatedAtDescIdDesc(buildId, PageRequest.of(0, limit)).stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional
    public int deleteLogs(UUID buildId) {
        return repository.deleteByBuildId(buildId);
    }

    private BuildLogResponse toResponse(BuildLog entry) {
        JsonNode details = null;
        if (entry.getDetails() != null) {
            try {
                details = objectMapper.readTree(entry.getDetails());
            } catch (JsonProcessingException e) {
                log.error("Failed to deserialize log details for entry {}: {}", entry.getId(), e.getMessage());
            }
        }
        return BuildLogResponse.from(entry, details);
    }

    private String serialize(Map<String, ?> details) {
        if (details == null || details.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize log details: {}", e.getMessage());
            return null;
        }
    }
}
