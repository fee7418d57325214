package com.appbuilder.service;

import com.appbuilder.config.BuildProperties;
import com.appbuilder.dto.BuildRequest;
import com.appbuilder.dto.BuildResponse;
import com.appbuilder.dto.PageResponse;
import com.appbuilder.exception.InvalidBuildStateException;
import com.appbuilder.exception.NotFoundException;
import com.appbuilder.generator.ProjectCodeGenerator;
import com.appbuilder.model.Build;
import com.appbuilder.model.Project;
import com.appbuilder.model.enums.BuildStatus;
import com.appbuilder.model.enums.BuildType;
import com.appbuilder.model.enums.LogLevel;
import com.appbuilder.repository.BuildRepository;
import com.appbuilder.repository.ProjectRepository;
import com.appbuilder.toolchain.ApkSigner;
import com.appbuilder.toolchain.FlutterBuilder;
import com.appbuilder.toolchain.SigningResult;
import com.appbuilder.toolchain.ToolchainResult;
import com.appbuilder.toolchain.ToolchainVersions;
import com.appbuilder.util.FileManager;
import com.appbuilder.util.FormatUtils;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.annotation.Lazy;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Owns the build lifecycle: creation, the generate/build/sign pipeline, cancellation,
 * retry and the stale-build sweep.
 *
 * <p>Status only moves forward:
 * {@code PENDING -> PREPARING -> GENERATING -> BUILDING -> SUCCESS | FAILED | CANCELLED}.
 * Every write is optimistic-locked, so when a cancel or sweep finishes a build first the
 * pipeline stops without touching it again.
 */
@Service
@Slf4j
public class BuildService {

    static final String SDK_NOT_FOUND = "Flutter SDK not found or not properly configured";
    static final String CANCELLED_BY_USER = "Build cancelled by user";
    static final String SIGNING_NOT_CONFIGURED = "APK signing enabled but not configured";

    static final String STAGE_QUEUED = "queued";
    static final String STAGE_PREPARING = "preparing";
    static final String STAGE_GENERATING = "generating";
    static final String STAGE_BUILDING = "building";
    static final String STAGE_SIGNING = "signing";
    static final String STAGE_COMPLETED = "completed";
    static final String STAGE_FAILED = "failed";
    static final String STAGE_CANCELLED = "cancelled";
    static final String STAGE_TIMEOUT = "timeout";
    static final String STAGE_RETRY = "retry";

    private static final int CANCEL_ATTEMPTS = 3;
    private static final long MB = 1024L * 1024L;

    // Files owned by the generator; everything else comes from `flutter create`
    private static final List<String> GENERATED_ROOT_FILES = List.of(
            "pubspec.yaml", "l10n.yaml", "analysis_options.yaml");
    private static final List<String> GENERATED_DIRS = List.of("lib/", "assets/", "test/");

    private final BuildRepository repository;
    private final ProjectRepository projectRepository;
    private final BuildLogService buildLogService;
    private final FlutterBuilder flutterBuilder;
    private final ApkSigner apkSigner;
    private final FileManager fileManager;
    private final ArtifactStore artifactStore;
    private final ProjectCodeGenerator codeGenerator;
    private final BuildRegistry buildRegistry;
    private final BuildProperties properties;
    private final BuildDispatcher buildDispatcher;

    public BuildService(BuildRepository repository,
                        ProjectRepository projectRepository,
                        BuildLogService buildLogService,
                        FlutterBuilder flutterBuilder,
                        ApkSigner apkSigner,
                        FileManager fileManager,
                        ArtifactStore artifactStore,
                        ProjectCodeGenerator codeGenerator,
                        BuildRegistry buildRegistry,
                        BuildProperties properties,
                        @Lazy BuildDispatcher buildDispatcher) {
        this.repository = repository;
        this.projectRepository = projectRepository;
        this.buildLogService = buildLogService;
        this.flutterBuilder = flutterBuilder;
        this.apkSigner = apkSigner;
        this.fileManager = fileManager;
        this.artifactStore = artifactStore;
        this.codeGenerator = codeGenerator;
        this.buildRegistry = buildRegistry;
        this.properties = properties;
        this.buildDispatcher = buildDispatcher;
    }

    /** The pipeline lost a race with a cancel or a sweep and must not write again. */
    static class BuildSupersededException extends RuntimeException {
        BuildSupersededException(String message) {
            super(message);
        }
    }

    // ── Creation ──────────────────────────────────────────────────────────

    @Transactional
    public BuildResponse createBuild(BuildRequest request) {
        Project project = projectRepository.findByIdForUpdate(request.getProjectId())
                .orElseThrow(() -> new NotFoundException("Project not found: " + request.getProjectId()));
        ensureNoActiveBuild(project.getId());

        BuildType type = request.getBuildType() != null ? request.getBuildType() : BuildType.RELEASE;
        Build build = newBuild(project.getId(), type, request.getVersionNumber());
        buildLogService.append(build.getId(), LogLevel.INFO, STAGE_QUEUED, "Build queued",
                Map.of("buildNumber", build.getBuildNumber(), "buildType", type.name()));
        log.info("Queued build #{} ({} {}) for project {}", build.getBuildNumber(), type.mode(),
                build.getVersionNumber(), project.getId());

        dispatchAfterCommit(build.getId());
        return BuildResponse.from(build, project.getName());
    }

    /**
     * Starts a fresh build with the same project, version and type as a failed or
     * cancelled one. The original build is left untouched.
     */
    @Transactional
    public BuildResponse retryBuild(UUID buildId) {
        Build original = findBuild(buildId);
        if (!BuildStatus.RETRYABLE.contains(original.getStatus())) {
            throw new InvalidBuildStateException("Can only retry failed or cancelled builds");
        }
        projectRepository.findByIdForUpdate(original.getProjectId())
                .orElseThrow(() -> new NotFoundException("Project not found: " + original.getProjectId()));
        ensureNoActiveBuild(original.getProjectId());

        Build retry = newBuild(original.getProjectId(), original.getBuildType(), original.getVersionNumber());
        buildLogService.append(retry.getId(), LogLevel.INFO, STAGE_RETRY,
                "Retrying build (original: " + buildId + ")", Map.of("originalBuildId", buildId.toString()));
        log.info("Retrying build {} as {}", buildId, retry.getId());

        dispatchAfterCommit(retry.getId());
        return BuildResponse.from(retry, resolveProjectName(retry.getProjectId()));
    }

    private Build newBuild(UUID projectId, BuildType type, String versionNumber) {
        Build build = Build.builder()
                .projectId(projectId)
                .buildNumber(repository.findMaxBuildNumber(projectId) + 1)
                .versionNumber(versionNumber)
                .buildType(type)
                .status(BuildStatus.PENDING)
                .progress(0)
                .build();
        return repository.save(build);
    }

    private void ensureNoActiveBuild(UUID projectId) {
        if (repository.existsByProjectIdAndStatusIn(projectId, BuildStatus.ACTIVE)) {
            throw new InvalidBuildStateException("Another build is already in progress for this project");
        }
    }

    private void dispatchAfterCommit(UUID buildId) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    buildDispatcher.dispatch(buildId);
                }
            });
        } else {
            buildDispatcher.dispatch(buildId);
        }
    }

    // ── Pipeline ──────────────────────────────────────────────────────────

    /**
     * Runs the whole pipeline for a pending build. Never throws: every failure ends as a
     * {@code FAILED} build with a log entry. Builds that are no longer pending are skipped.
     */
    public void processBuild(UUID buildId) {
        Build build = repository.findById(buildId).orElse(null);
        if (build == null) {
            log.warn("Build {} not found, skipping", buildId);
            return;
        }
        if (build.getStatus() != BuildStatus.PENDING) {
            log.warn("Build {} is {}, not pending; skipping", buildId, build.getStatus());
            return;
        }

        MDC.put("buildId", buildId.toString());
        buildRegistry.register(buildId);
        Path workDir = null;
        try {
            // 1. Claim and preflight
            build.setStatus(BuildStatus.PREPARING);
            build.setStartedAt(LocalDateTime.now());
            build.setProgress(5);
            build = save(build);
            buildLogService.append(buildId, LogLevel.INFO, STAGE_PREPARING, "Build process started");

            if (!flutterBuilder.checkSdk()) {
                markFailed(build, SDK_NOT_FOUND, SDK_NOT_FOUND);
                return;
            }
            ToolchainVersions versions = flutterBuilder.getVersions();
            build.setFlutterVersion(versions.flutterVersion());
            build.setDartVersion(versions.dartVersion());
            warnOnLowDiskSpace(buildId);

            // 2. Generate sources into a scoped directory
            ensureNotCancelled(buildId);
            build.setStatus(BuildStatus.GENERATING);
            build.setProgress(20);
            build = save(build);

            UUID projectId = build.getProjectId();
            Project project = projectRepository.findById(projectId)
                    .orElseThrow(() -> new NotFoundException("Project not found: " + projectId));
            workDir = fileManager.createScopedTempDir("build_" + buildId + "_");
            buildLogService.append(buildId, LogLevel.INFO, STAGE_GENERATING, "Generating project files",
                    Map.of("workDir", workDir.toString()));

            ToolchainResult scaffold = flutterBuilder.scaffoldProject(workDir, project.getPackageName(),
                    project.getDescription(), tracker(buildId));
            if (!scaffold.success()) {
                ensureNotCancelled(buildId);
                handleToolchainFailure(build, scaffold, STAGE_GENERATING);
                return;
            }
            if (!writeGeneratedSources(build, project, workDir)) {
                return;
            }

            // 3. Build
            ensureNotCancelled(buildId);
            build.setStatus(BuildStatus.BUILDING);
            build.setProgress(40);
            build = save(build);
            buildLogService.append(buildId, LogLevel.INFO, STAGE_BUILDING,
                    "Running flutter build apk --" + build.getBuildType().mode());

            ToolchainResult result = flutterBuilder.buildArtifact(workDir, build.getBuildType(), tracker(buildId));
            ensureNotCancelled(buildId);
            if (!result.success()) {
                handleToolchainFailure(build, result, STAGE_BUILDING);
                return;
            }

            // 4. Optional signing
            Path apk = result.artifactPath();
            if (build.getBuildType() == BuildType.RELEASE && properties.getSigning().isEnabled()) {
                if (!apkSigner.isConfigured()) {
                    markFailed(build, SIGNING_NOT_CONFIGURED, result.output());
                    return;
                }
                SigningResult signed = apkSigner.sign(apk, null);
                if (!signed.success()) {
                    markFailed(build, signed.message(), result.output());
                    return;
                }
                apk = Path.of(signed.message());
                buildLogService.append(buildId, LogLevel.INFO, STAGE_SIGNING, "APK signed");
                SigningResult verified = apkSigner.verify(apk);
                if (!verified.success()) {
                    buildLogService.append(buildId, LogLevel.WARNING, STAGE_SIGNING,
                            "Signature verification failed: " + verified.message());
                }
            }

            // 5. Store and finish
            LocalDateTime now = LocalDateTime.now();
            ArtifactStore.StoredArtifact stored = artifactStore.store(build, project, apk, now);
            build.setArtifactPath(stored.relativePath());
            build.setArtifactSize(stored.size());
            build.setBuildLog(result.output());
            build.setErrorMessage(null);
            build.setProgress(100);
            build.finish(BuildStatus.SUCCESS, now);
            build = save(build);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("artifact", stored.relativePath());
            details.put("size", FormatUtils.formatFileSize(stored.size()));
            details.put("duration", FormatUtils.formatDuration(build.getDurationSeconds()));
            buildLogService.append(buildId, LogLevel.INFO, STAGE_COMPLETED, "Build completed successfully", details);
            log.info("Build {} succeeded in {}", buildId, FormatUtils.formatDuration(build.getDurationSeconds()));

        } catch (BuildSupersededException e) {
            log.info("Build {} stopped: {}", buildId, e.getMessage());
        } catch (Exception e) {
            log.error("Build {} failed with exception: {}", buildId, e.getMessage(), e);
            failWithException(buildId, e);
        } finally {
            if (workDir != null && !fileManager.cleanup(workDir)) {
                log.warn("Temp directory {} was not fully removed", workDir);
            }
            buildRegistry.release(buildId);
            MDC.remove("buildId");
        }
    }

    private boolean writeGeneratedSources(Build build, Project project, Path workDir) throws IOException {
        Map<String, String> generated;
        try {
            generated = codeGenerator.generate(project);
        } catch (RuntimeException e) {
            log.warn("Code generation failed for project {}: {}", project.getId(), e.getMessage());
            markFailed(build, "Code generation failed: " + e.getMessage(), stackTrace(e));
            return false;
        }

        Map<String, String> owned = new LinkedHashMap<>();
        generated.forEach((path, content) -> {
            if (isGeneratorOwned(path)) owned.put(path, content);
        });
        fileManager.writeFiles(workDir, owned);
        flutterBuilder.applyVersion(workDir, build.getVersionNumber(), build.getBuildNumber());
        flutterBuilder.writeLocalProperties(workDir, build.getBuildType(),
                build.getVersionNumber(), build.getBuildNumber());

        buildLogService.append(build.getId(), LogLevel.INFO, STAGE_GENERATING,
                "Generated " + owned.size() + " project files",
                Map.of("written", owned.size(), "skipped", generated.size() - owned.size()));
        return true;
    }

    static boolean isGeneratorOwned(String relativePath) {
        String path = relativePath.replace('\\', '/');
        return GENERATED_ROOT_FILES.contains(path) || GENERATED_DIRS.stream().anyMatch(path::startsWith);
    }

    private void warnOnLowDiskSpace(UUID buildId) {
        long free = fileManager.availableSpace(properties.getTempDir());
        if (free < properties.getMinFreeSpaceMb() * MB) {
            buildLogService.append(buildId, LogLevel.WARNING, STAGE_PREPARING,
                    "Low disk space in build directory: " + FormatUtils.formatFileSize(free) + " available");
        }
    }

    private Consumer<Process> tracker(UUID buildId) {
        return process -> buildRegistry.track(buildId, process);
    }

    private void ensureNotCancelled(UUID buildId) {
        if (buildRegistry.isCancelled(buildId)) {
            throw new BuildSupersededException("cancelled while running");
        }
    }

    // ── Failure handling ──────────────────────────────────────────────────

    private void handleToolchainFailure(Build build, ToolchainResult result, String stage) {
        String output = result.output() != null && !result.output().isBlank() ? result.output() : result.message();
        BuildErrorExtractor.extractGradleError(output).ifPresent(error ->
                buildLogService.append(build.getId(), LogLevel.ERROR, stage, "Gradle error: " + error));
        for (String hint : BuildErrorExtractor.hintsFor(output)) {
            buildLogService.append(build.getId(), LogLevel.ERROR, stage, hint);
        }
        markFailed(build, BuildErrorExtractor.extractErrorMessage(output), output);
    }

    private void markFailed(Build build, String errorMessage, String buildLog) {
        build.setErrorMessage(errorMessage);
        build.setBuildLog(buildLog);
        build.finish(BuildStatus.FAILED, LocalDateTime.now());
        save(build);
        buildLogService.append(build.getId(), LogLevel.ERROR, STAGE_FAILED, "Build failed: " + errorMessage);
        log.warn("Build {} failed: {}", build.getId(), errorMessage);
    }

    private void failWithException(UUID buildId, Exception cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        try {
            Build build = repository.findById(buildId).orElse(null);
            if (build == null || build.isComplete()) {
                return;
            }
            build.setErrorMessage(message);
            build.setBuildLog("Error: " + message + "\n\n" + stackTrace(cause));
            build.finish(BuildStatus.FAILED, LocalDateTime.now());
            repository.save(build);
            buildLogService.append(buildId, LogLevel.ERROR, STAGE_FAILED, "Build failed with exception: " + message);
        } catch (ObjectOptimisticLockingFailureException e) {
            log.info("Build {} finished concurrently, exception not recorded", buildId);
        } catch (RuntimeException e) {
            log.error("Failed to record failure of build {}: {}", buildId, e.getMessage(), e);
        }
    }

    private Build save(Build build) {
        try {
            return repository.save(build);
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new BuildSupersededException("build was finished concurrently (cancelled or timed out)");
        }
    }

    private static String stackTrace(Throwable t) {
        StringWriter out = new StringWriter();
        t.printStackTrace(new PrintWriter(out));
        return out.toString();
    }

    // ── Cancellation and sweep ────────────────────────────────────────────

    /**
     * Cancels a pending or running build and kills the tool it is currently running.
     */
    public BuildResponse cancelBuild(UUID buildId) {
        for (int attempt = 1; ; attempt++) {
            Build build = findBuild(buildId);
            if (build.isComplete()) {
                throw new InvalidBuildStateException("Build cannot be cancelled in its current state: "
                        + build.getStatus().name().toLowerCase());
            }
            build.setErrorMessage(CANCELLED_BY_USER);
            build.finish(BuildStatus.CANCELLED, LocalDateTime.now());
            try {
                build = repository.save(build);
            } catch (ObjectOptimisticLockingFailureException e) {
                // the pipeline advanced a stage under us; reload and try again
                if (attempt >= CANCEL_ATTEMPTS) throw e;
                continue;
            }
            buildLogService.append(buildId, LogLevel.WARNING, STAGE_CANCELLED, CANCELLED_BY_USER);
            buildRegistry.cancel(buildId);
            log.info("Build {} cancelled", buildId);
            return BuildResponse.from(build, resolveProjectName(build.getProjectId()));
        }
    }

    /**
     * Fails every running build that started longer ago than the stale threshold.
     * Returns how many builds were swept.
     */
    public int sweepStaleBuilds() {
        long minutes = properties.getStaleThreshold().toMinutes();
        LocalDateTime now = LocalDateTime.now();
        LocalDateTime cutoff = now.minus(properties.getStaleThreshold());
        String reason = "Build timed out: no progress for more than " + minutes + " minutes";

        int swept = 0;
        for (Build build : repository.findByStatusInAndStartedAtBefore(BuildStatus.RUNNING, cutoff)) {
            BuildStatus staleStatus = build.getStatus();
            build.setErrorMessage(reason);
            build.finish(BuildStatus.FAILED, now);
            try {
                repository.save(build);
            } catch (ObjectOptimisticLockingFailureException e) {
                log.debug("Build {} changed while sweeping, skipped", build.getId());
                continue;
            }
            buildLogService.append(build.getId(), LogLevel.ERROR, STAGE_TIMEOUT,
                    "Build marked as failed due to timeout (stuck in " + staleStatus.name().toLowerCase() + " state)");
            buildRegistry.cancel(build.getId());
            swept++;
        }
        if (swept > 0) {
            log.warn("Marked {} stale builds as failed", swept);
        }
        return swept;
    }

    // ── Queries ───────────────────────────────────────────────────────────

    @Transactional(readOnly = true)
    public PageResponse<BuildResponse> findAll(UUID projectId, String status, Pageable pageable) {
        Specification<Build> spec = Specification.where(null);

        if (projectId != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("projectId"), projectId));
        }
        if (status != null && !status.isBlank()) {
            BuildStatus bs = parseStatus(status);
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), bs));
        }

        Page<Build> page = repository.findAll(spec, pageable);
        return PageResponse.from(page, this::toResponse);
    }

    @Transactional(readOnly = true)
    public BuildResponse findById(UUID id) {
        return toResponse(findBuild(id));
    }

    @Transactional(readOnly = true)
    public Build findBuild(UUID id) {
        return repository.findById(id)
                .orElseThrow(() -> new NotFoundException("Build not found: " + id));
    }

    @Transactional(readOnly = true)
    public String getBuildLog(UUID id, Integer tail) {
        if (tail != null && tail <= 0) {
            throw new IllegalArgumentException("tail must be positive");
        }
        Build build = findBuild(id);
        String buildLog = build.getBuildLog() != null ? build.getBuildLog() : "";
        return tail != null ? FormatUtils.tail(buildLog, tail) : buildLog;
    }

    /**
     * The stored artifact of a successful build.
     */
    @Transactional(readOnly = true)
    public Path getArtifact(UUID id) {
        Build build = findBuild(id);
        if (build.getStatus() != BuildStatus.SUCCESS) {
            throw new InvalidBuildStateException("Build is not successful, no artifact available");
        }
        return artifactStore.resolve(build.getArtifactPath())
                .orElseThrow(() -> new NotFoundException("Artifact file not found for build: " + id));
    }

    @Transactional
    public void delete(UUID id) {
        Build build = findBuild(id);
        if (build.isActive()) {
            throw new InvalidBuildStateException("Cannot delete an active build, cancel it first");
        }
        artifactStore.delete(build.getArtifactPath());
        buildLogService.deleteLogs(id);
        repository.delete(build);
        log.info("Deleted build {}", id);
    }

    BuildResponse toResponse(Build build) {
        return BuildResponse.from(build, resolveProjectName(build.getProjectId()));
    }

    String resolveProjectName(UUID projectId) {
        return projectRepository.findById(projectId)
                .map(Project::getName)
                .orElse("(deleted)");
    }

    private static BuildStatus parseStatus(String status) {
        try {
            return BuildStatus.valueOf(status.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown build status: " + status);
        }
    }
}
