package com.appbuilder.controller;

import com.appbuilder.dto.PageResponse;
import com.appbuilder.dto.ProjectBuildStatsResponse;
import com.appbuilder.dto.ProjectRequest;
import com.appbuilder.dto.ProjectResponse;
import com.appbuilder.service.BuildMonitor;
import com.appbuilder.service.ProjectService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Set;
import java.util.UUID;

@RestController
@RequestMapping("/api/projects")
@RequiredArgsConstructor
public class ProjectController {

    private static final Set<String> ALLOWED_SORT_FIELDS = Set.of("name", "packageName", "createdAt", "updatedAt");
    private static final int MAX_PAGE_SIZE = 100;

    private final ProjectService service;
    private final BuildMonitor buildMonitor;

    @GetMapping
    public PageResponse<ProjectResponse> findAll(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "10") int size,
            @RequestParam(required = false) String name,
            @RequestParam(defaultValue = "name") String sortBy,
            @RequestParam(defaultValue = "asc") String sortDir) {
        if (!ALLOWED_SORT_FIELDS.contains(sortBy)) {
            sortBy = "name";
        }
        if (size < 1) size = 10;
        if (size > MAX_PAGE_SIZE) size = MAX_PAGE_SIZE;
        if (page < 0) page = 0;

        Sort sort = sortDir.equalsIgnoreCase("desc")
                ? Sort.by(sortBy).descending()
                : Sort.by(sortBy).ascending();
        return service.findAllPaged(name, PageRequest.of(page, size, sort));
    }

    @GetMapping("/{id}")
    public ProjectResponse findById(@PathVariable UUID id) {
        return service.findById(id);
    }

    @PostMapping
    public ResponseEntity<ProjectResponse> create(@Valid @RequestBody ProjectRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(service.create(request));
    }

    @GetMapping("/{id}/build-stats")
    public ProjectBuildStatsResponse buildStats(@PathVariable UUID id) {
        return buildMonitor.projectStats(id);
    }
}
