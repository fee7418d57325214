package com.appbuilder.controller;

import com.appbuilder.IntegrationTestBase;
import com.appbuilder.model.Build;
import com.appbuilder.model.Project;
import com.appbuilder.model.enums.BuildStatus;
import com.appbuilder.model.enums.LogLevel;
import com.appbuilder.service.ArtifactStore;
import com.appbuilder.service.BuildLogService;
import com.appbuilder.toolchain.ToolchainVersions;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@DisplayName("BuildController Tests")
class BuildControllerTest extends IntegrationTestBase {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ArtifactStore artifactStore;

    @Autowired
    private BuildLogService buildLogService;

    private Project project;

    @BeforeEach
    void setUp() {
        project = createProject("Shop", "com.example.shop");
    }

    private String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }

    // ============================================================================
    // Projects
    // ============================================================================

    @Test
    @DisplayName("POST /api/projects creates a project")
    void testCreateProject() throws Exception {
        mockMvc.perform(post("/api/projects")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "Notes", "packageName", "com.example.notes"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").exists())
                .andExpect(jsonPath("$.packageName").value("com.example.notes"));
    }

    @Test
    @DisplayName("POST /api/projects rejects malformed and duplicate package names")
    void testCreateProject_Invalid() throws Exception {
        mockMvc.perform(post("/api/projects")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "Bad", "packageName", "notapackage"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.packageName").exists());

        mockMvc.perform(post("/api/projects")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "Copy", "packageName", "com.example.shop"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(containsString("already exists")));
    }

    @Test
    @DisplayName("GET /api/projects/{id}/build-stats returns the status breakdown")
    void testProjectBuildStats() throws Exception {
        createBuild(project.getId(), BuildStatus.SUCCESS);
        createBuild(project.getId(), BuildStatus.FAILED);

        mockMvc.perform(get("/api/projects/{id}/build-stats", project.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalBuilds").value(2))
                .andExpect(jsonPath("$.statusBreakdown.SUCCESS").value(1))
                .andExpect(jsonPath("$.successRate").value(50.0));
    }

    // ============================================================================
    // Build lifecycle
    // ============================================================================

    @Test
    @DisplayName("POST /api/builds queues a build")
    void testCreateBuild() throws Exception {
        mockMvc.perform(post("/api/builds")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of(
                                "projectId", project.getId(),
                                "versionNumber", "2.1.0",
                                "buildType", "debug"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.buildType").value("DEBUG"))
                .andExpect(jsonPath("$.buildNumber").value(1))
                .andExpect(jsonPath("$.projectName").value("Shop"));

        verify(buildDispatcher).dispatch(any());
    }

    @Test
    @DisplayName("POST /api/builds validates the version number")
    void testCreateBuild_InvalidVersion() throws Exception {
        mockMvc.perform(post("/api/builds")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("projectId", project.getId(), "versionNumber", "1.0"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.versionNumber")
                        .value("Version number must be in format X.Y.Z (e.g., 1.0.0)"));
    }

    @Test
    @DisplayName("POST /api/builds returns 404 for an unknown project")
    void testCreateBuild_UnknownProject() throws Exception {
        mockMvc.perform(post("/api/builds")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("projectId", UUID.randomUUID(), "versionNumber", "1.0.0"))))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value(startsWith("Project not found")));
    }

    @Test
    @DisplayName("POST /api/builds returns 409 while another build is active")
    void testCreateBuild_Conflict() throws Exception {
        createBuild(project.getId(), BuildStatus.GENERATING, LocalDateTime.now(), LocalDateTime.now());

        mockMvc.perform(post("/api/builds")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("projectId", project.getId(), "versionNumber", "1.0.0"))))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("POST /api/builds/{id}/cancel cancels active builds and rejects finished ones")
    void testCancel() throws Exception {
        Build pending = createBuild(project.getId(), BuildStatus.PENDING);

        mockMvc.perform(post("/api/builds/{id}/cancel", pending.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"))
                .andExpect(jsonPath("$.errorMessage").value("Build cancelled by user"));

        mockMvc.perform(post("/api/builds/{id}/cancel", pending.getId()))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("POST /api/builds/{id}/retry creates a new build")
    void testRetry() throws Exception {
        Build failed = createBuild(project.getId(), BuildStatus.FAILED);

        mockMvc.perform(post("/api/builds/{id}/retry", failed.getId()))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(not(failed.getId().toString())))
                .andExpect(jsonPath("$.buildNumber").value(2));
    }

    @Test
    @DisplayName("DELETE /api/builds/{id} removes a finished build")
    void testDelete() throws Exception {
        Build done = createBuild(project.getId(), BuildStatus.CANCELLED);

        mockMvc.perform(delete("/api/builds/{id}", done.getId()))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/builds/{id}", done.getId()))
                .andExpect(status().isNotFound());
    }

    // ============================================================================
    // Reads
    // ============================================================================

    @Test
    @DisplayName("GET /api/builds filters by status and falls back to safe sorting")
    void testFindAll() throws Exception {
        createBuild(project.getId(), BuildStatus.SUCCESS);
        createBuild(project.getId(), BuildStatus.FAILED);

        mockMvc.perform(get("/api/builds")
                        .param("projectId", project.getId().toString())
                        .param("status", "success")
                        .param("sortBy", "errorMessage")
                        .param("size", "500"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(1))
                .andExpect(jsonPath("$.size").value(100))
                .andExpect(jsonPath("$.content[0].status").value("SUCCESS"));
    }

    @Test
    @DisplayName("GET /api/builds/{id} returns a status snapshot")
    void testStatus() throws Exception {
        Build failed = createBuild(project.getId(), BuildStatus.FAILED);
        buildLogService.append(failed.getId(), LogLevel.ERROR, "failed", "Build failed: boom");

        mockMvc.perform(get("/api/builds/{id}", failed.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.build.status").value("FAILED"))
                .andExpect(jsonPath("$.canRetry").value(true))
                .andExpect(jsonPath("$.canDownload").value(false))
                .andExpect(jsonPath("$.durationDisplay").value("2m 0s"))
                .andExpect(jsonPath("$.recentLogs[0].message").value("Build failed: boom"));
    }

    @Test
    @DisplayName("GET /api/builds/{id}/logs filters by level and rejects unknown levels")
    void testLogs() throws Exception {
        Build build = createBuild(project.getId(), BuildStatus.FAILED);
        buildLogService.append(build.getId(), LogLevel.INFO, "preparing", "Build process started");
        buildLogService.append(build.getId(), LogLevel.ERROR, "failed", "Build failed: boom",
                Map.of("exitCode", 1));

        mockMvc.perform(get("/api/builds/{id}/logs", build.getId()).param("level", "error"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].stage").value("failed"))
                .andExpect(jsonPath("$[0].details.exitCode").value(1));

        mockMvc.perform(get("/api/builds/{id}/logs", build.getId()).param("level", "loud"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown log level: loud"));
    }

    @Test
    @DisplayName("GET /api/builds/{id}/build-log returns the raw build output")
    void testBuildLog() throws Exception {
        Build build = createBuild(project.getId(), BuildStatus.FAILED);
        build.setBuildLog("FAILURE: Build failed with an exception.");
        buildRepository.save(build);

        mockMvc.perform(get("/api/builds/{id}/build-log", build.getId()))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", containsString("build-" + build.getId() + ".log")))
                .andExpect(content().string("FAILURE: Build failed with an exception."));

        mockMvc.perform(get("/api/builds/{id}/build-log", build.getId()).param("tail", "10"))
                .andExpect(status().isOk())
                .andExpect(content().string("exception."));

        mockMvc.perform(get("/api/builds/{id}/build-log", build.getId()).param("tail", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("tail must be positive"));
    }

    @Test
    @DisplayName("GET /api/builds/{id}/download serves the APK of a successful build")
    void testDownload() throws Exception {
        Build build = createBuild(project.getId(), BuildStatus.SUCCESS);
        Path apk = artifactStore.root().resolve("apks/com.example.shop_1.0.0_download.apk");
        Files.createDirectories(apk.getParent());
        Files.writeString(apk, "apk-content");
        build.setArtifactPath("apks/com.example.shop_1.0.0_download.apk");
        build.setArtifactSize(11L);
        buildRepository.save(build);

        mockMvc.perform(get("/api/builds/{id}/download", build.getId()))
                .andExpect(status().isOk())
                .andExpect(content().contentType("application/vnd.android.package-archive"))
                .andExpect(header().string("Content-Disposition",
                        containsString("com.example.shop_1.0.0_download.apk")))
                .andExpect(content().string("apk-content"));
        Files.deleteIfExists(apk);
    }

    @Test
    @DisplayName("GET /api/builds/{id}/download returns 409 for unsuccessful builds")
    void testDownload_NotSuccessful() throws Exception {
        Build build = createBuild(project.getId(), BuildStatus.FAILED);

        mockMvc.perform(get("/api/builds/{id}/download", build.getId()))
                .andExpect(status().isConflict());
    }

    // ============================================================================
    // Monitoring and maintenance
    // ============================================================================

    @Test
    @DisplayName("GET /api/builds/queue and /stats report pending work")
    void testQueueAndStats() throws Exception {
        createBuild(project.getId(), BuildStatus.PENDING);

        mockMvc.perform(get("/api/builds/queue"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].position").value(1))
                .andExpect(jsonPath("$[0].projectName").value("Shop"));

        mockMvc.perform(get("/api/builds/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.queueSize").value(1))
                .andExpect(jsonPath("$.activeBuilds").value(1))
                .andExpect(jsonPath("$.systemStatus").value("normal"));
    }

    @Test
    @DisplayName("GET /api/builds/statistics, /recent and /stale")
    void testStatisticsRecentStale() throws Exception {
        LocalDateTime old = LocalDateTime.now().minusHours(2);
        createBuild(project.getId(), BuildStatus.BUILDING, old, old);

        mockMvc.perform(get("/api/builds/statistics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runningCount").value(1))
                .andExpect(jsonPath("$.totalProjects").value(1));

        mockMvc.perform(get("/api/builds/recent").param("limit", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)));

        mockMvc.perform(get("/api/builds/stale"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].status").value("BUILDING"));
    }

    @Test
    @DisplayName("GET /api/builds/toolchain reports toolchain health")
    void testToolchain() throws Exception {
        when(flutterBuilder.checkSdk()).thenReturn(true);
        when(flutterBuilder.getVersions()).thenReturn(new ToolchainVersions("3.19.6", "3.3.4"));
        when(flutterBuilder.flutterExecutable()).thenReturn("flutter");

        mockMvc.perform(get("/api/builds/toolchain"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.flutterAvailable").value(true))
                .andExpect(jsonPath("$.flutterVersion").value("3.19.6"))
                .andExpect(jsonPath("$.signingEnabled").value(false));
    }

    @Test
    @DisplayName("POST /api/builds/cleanup runs a dry-run purge")
    void testCleanup() throws Exception {
        Build old = createBuild(project.getId(), BuildStatus.FAILED, LocalDateTime.now().minusDays(60), null);

        mockMvc.perform(post("/api/builds/cleanup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("retentionDays", 30, "dryRun", true, "cleanOrphans", false))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dryRun").value(true))
                .andExpect(jsonPath("$.buildsDeleted").value(0))
                .andExpect(jsonPath("$.candidateBuildIds[0]").value(old.getId().toString()));

        mockMvc.perform(post("/api/builds/cleanup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("retentionDays", -1))))
                .andExpect(status().isBadRequest());
    }
}
