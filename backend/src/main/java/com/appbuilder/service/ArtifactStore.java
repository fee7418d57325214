package com.appbuilder.service;

import com.appbuilder.config.BuildProperties;
import com.appbuilder.model.Build;
import com.appbuilder.model.Project;
import com.appbuilder.util.FileManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Durable storage for finished artifacts. Builds reference artifacts by a path relative to
 * the configured artifact root; every resolution is checked against that root.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ArtifactStore {

    static final String APK_DIR = "apks";
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final BuildProperties properties;
    private final FileManager fileManager;

    public record StoredArtifact(String relativePath, long size) {
    }

    public Path root() {
        return properties.getArtifactDir().toAbsolutePath().normalize();
    }

    /**
     * Copies a freshly built APK out of the temp directory under a name made of the package
     * name, version and build time.
     */
    public StoredArtifact store(Build build, Project project, Path apk, LocalDateTime builtAt) throws IOException {
        String fileName = "%s_%s_%s_%s.apk".formatted(
                project.getPackageName(),
                build.getVersionNumber(),
                builtAt.format(STAMP),
                build.getId().toString().substring(0, 8));
        String relative = APK_DIR + "/" + fileName;
        Path target = root().resolve(relative);
        fileManager.copyFile(apk, target);
        return new StoredArtifact(relative, Files.size(target));
    }

    public Optional<Path> resolve(String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            return Optional.empty();
        }
        Path candidate = root().resolve(relativePath);
        if (!fileManager.isPathSafe(candidate, root())) {
            log.warn("Artifact path escapes the artifact root, ignoring: {}", relativePath);
            return Optional.empty();
        }
        return Files.isRegularFile(candidate) ? Optional.of(candidate) : Optional.empty();
    }

    /**
     * Deletes the artifact if present. Returns the number of bytes freed.
     */
    public long delete(String relativePath) {
        Optional<Path> file = resolve(relativePath);
        if (file.isEmpty()) {
            return 0L;
        }
        try {
            long size = Files.size(file.get());
            Files.deleteIfExists(file.get());
            log.debug("Deleted artifact {}", file.get());
            return size;
        } catch (IOException e) {
            log.warn("Failed to delete artifact {}: {}", file.get(), e.getMessage());
            return 0L;
        }
    }

    /**
     * Stored APKs that none of {@code referencedPaths} points at.
     */
    public List<Path> findOrphans(Collection<String> referencedPaths) {
        Set<Path> referenced = referencedPaths.stream()
                .map(p -> root().resolve(p).normalize())
                .collect(Collectors.toSet());
        return fileManager.findFiles(root().resolve(APK_DIR), "*.apk").stream()
                .map(p -> p.toAbsolutePath().normalize())
                .filter(p -> !referenced.contains(p))
                .toList();
    }
}
