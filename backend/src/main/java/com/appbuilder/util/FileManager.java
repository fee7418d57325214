package com.appbuilder.util;

import com.appbuilder.config.BuildProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * File-system operations used by the build pipeline. Writes propagate failures;
 * cleanup and probes are best-effort and never throw.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FileManager {

    private final BuildProperties properties;

    // ── Temp directories ──────────────────────────────────────────────────

    /**
     * Creates a fresh, uniquely named directory under the configured temp root.
     * The caller owns it and must remove it with {@link #cleanup(Path)}.
     */
    public Path createScopedTempDir(String prefix) throws IOException {
        Path root = properties.getTempDir();
        Files.createDirectories(root);
        Path dir = Files.createTempDirectory(root, prefix);
        log.debug("Created temp directory {}", dir);
        return dir;
    }

    // ── Writing ───────────────────────────────────────────────────────────

    /**
     * Writes every entry of {@code files} below {@code baseDir}, creating parent directories.
     * Stops at the first failure; files already written are left in place.
     */
    public void writeFiles(Path baseDir, Map<String, String> files) throws IOException {
        for (Map.Entry<String, String> entry : files.entrySet()) {
            Path target = baseDir.resolve(entry.getKey());
            if (!isPathSafe(target, baseDir)) {
                throw new IOException("Refusing to write outside " + baseDir + ": " + entry.getKey());
            }
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, entry.getValue() != null ? entry.getValue() : "", StandardCharsets.UTF_8);
        }
        log.debug("Wrote {} files to {}", files.size(), baseDir);
    }

    public void writeBinaryFile(Path path, byte[] content) throws IOException {
        Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(path, content);
    }

    public Path copyFile(Path source, Path target) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
    }

    public Optional<String> readFile(Path path) {
        try {
            return Optional.of(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    // ── Searching ─────────────────────────────────────────────────────────

    /**
     * Recursively finds regular files below {@code dir} whose file name matches {@code pattern}
     * (glob syntax, e.g. {@code *.apk}).
     */
    public List<Path> findFiles(Path dir, String pattern) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> matcher.matches(p.getFileName()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.warn("Failed to search {} for {}: {}", dir, pattern, e.getMessage());
            return List.of();
        }
    }

    // ── Cleanup ───────────────────────────────────────────────────────────

    /**
     * Deletes {@code path} recursively. Returns true when nothing is left behind.
     */
    public boolean cleanup(Path path) {
        if (path == null || !Files.exists(path)) {
            return true;
        }
        AtomicBoolean complete = new AtomicBoolean(true);
        try {
            Files.walkFileTree(path, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    delete(file, complete);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.warn("Cannot visit {} during cleanup: {}", file, exc.getMessage());
                    complete.set(false);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                    delete(dir, complete);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("Failed to clean up {}: {}", path, e.getMessage());
            return false;
        }
        if (complete.get()) {
            log.debug("Cleaned up {}", path);
        }
        return complete.get();
    }

    // ── Probes ────────────────────────────────────────────────────────────

    public long directorySize(Path path) {
        if (!Files.exists(path)) {
            return 0L;
        }
        try (Stream<Path> walk = Files.walk(path)) {
            return walk.filter(Files::isRegularFile).mapToLong(this::sizeOf).sum();
        } catch (IOException e) {
            log.warn("Failed to compute size of {}: {}", path, e.getMessage());
            return 0L;
        }
    }

    /**
     * Usable bytes on the file store holding {@code path}, or 0 when it cannot be determined.
     */
    public long availableSpace(Path path) {
        try {
            Path probe = path;
            while (probe != null && !Files.exists(probe)) {
                probe = probe.toAbsolutePath().getParent();
            }
            if (probe == null) {
                return 0L;
            }
            return Files.getFileStore(probe).getUsableSpace();
        } catch (IOException e) {
            log.warn("Failed to determine free space for {}: {}", path, e.getMessage());
            return 0L;
        }
    }

    /**
     * True when {@code path}, once made absolute and normalized, lies inside {@code baseDir}.
     * Containment is component-wise: {@code /data/builds2} is not inside {@code /data/builds}.
     */
    public boolean isPathSafe(Path path, Path baseDir) {
        if (path == null || baseDir == null) {
            return false;
        }
        Path base = baseDir.toAbsolutePath().normalize();
        Path candidate = path.toAbsolutePath().normalize();
        return candidate.startsWith(base);
    }

    private long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            return 0L;
        }
    }

    private void delete(Path p, AtomicBoolean complete) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", p, e.getMessage());
            complete.set(false);
        }
    }
}
