package com.appbuilder.service;

import com.appbuilder.dto.PageResponse;
import com.appbuilder.dto.ProjectRequest;
import com.appbuilder.dto.ProjectResponse;
import com.appbuilder.exception.NotFoundException;
import com.appbuilder.model.Project;
import com.appbuilder.repository.ProjectRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
@RequiredArgsConstructor
public class ProjectService {

    private final ProjectRepository repository;

    @Transactional(readOnly = true)
    public PageResponse<ProjectResponse> findAllPaged(String name, Pageable pageable) {
        Specification<Project> spec = Specification.where(null);

        if (name != null && !name.isBlank()) {
            spec = spec.and((root, query, cb) ->
                    cb.like(cb.lower(root.get("name")), "%" + name.toLowerCase() + "%"));
        }
        return PageResponse.from(repository.findAll(spec, pageable), ProjectResponse::from);
    }

    @Transactional(readOnly = true)
    public ProjectResponse findById(UUID id) {
        Project project = repository.findById(id)
                .orElseThrow(() -> new NotFoundException("Project not found: " + id));
        return ProjectResponse.from(project);
    }

    @Transactional
    public ProjectResponse create(ProjectRequest request) {
        if (repository.existsByPackageName(request.getPackageName())) {
            throw new IllegalArgumentException("Project with package name '" + request.getPackageName()
                    + "' already exists");
        }

        Project project = Project.builder()
                .name(request.getName())
                .packageName(request.getPackageName())
                .description(request.getDescription() != null ? request.getDescription() : "")
                .build();

        return ProjectResponse.from(repository.save(project));
    }
}
