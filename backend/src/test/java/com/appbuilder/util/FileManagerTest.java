package com.appbuilder.util;

import com.appbuilder.config.BuildProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FileManager Tests")
class FileManagerTest {

    @TempDir
    Path root;

    private FileManager fileManager;

    @BeforeEach
    void setUp() {
        BuildProperties properties = new BuildProperties();
        properties.setTempDir(root.resolve("tmp"));
        fileManager = new FileManager(properties);
    }

    // ============================================================================
    // Temp directories and writing
    // ============================================================================

    @Test
    @DisplayName("Should create distinct temp directories under the configured root")
    void testCreateScopedTempDir() throws IOException {
        Path first = fileManager.createScopedTempDir("build_42_");
        Path second = fileManager.createScopedTempDir("build_42_");

        assertNotEquals(first, second);
        assertTrue(Files.isDirectory(first));
        assertTrue(first.getFileName().toString().startsWith("build_42_"));
        assertEquals(root.resolve("tmp"), first.getParent());
    }

    @Test
    @DisplayName("Should write nested files creating parent directories")
    void testWriteFiles() throws IOException {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("pubspec.yaml", "name: shop\n");
        files.put("lib/screens/home_screen.dart", "// home");

        fileManager.writeFiles(root, files);

        assertEquals("name: shop\n", Files.readString(root.resolve("pubspec.yaml")));
        assertEquals("// home", Files.readString(root.resolve("lib/screens/home_screen.dart")));
    }

    @Test
    @DisplayName("Should refuse to write outside the base directory")
    void testWriteFiles_Escape() {
        Path base = root.resolve("project");
        IOException ex = assertThrows(IOException.class,
                () -> fileManager.writeFiles(base, Map.of("../outside.txt", "x")));
        assertTrue(ex.getMessage().contains("outside"));
        assertFalse(Files.exists(root.resolve("outside.txt")));
    }

    @Test
    @DisplayName("Should propagate write failures")
    void testWriteFiles_Failure() throws IOException {
        Files.writeString(root.resolve("lib"), "a file where a directory is expected");

        assertThrows(IOException.class, () -> fileManager.writeFiles(root, Map.of("lib/main.dart", "x")));
    }

    // ============================================================================
    // Search, cleanup and probes
    // ============================================================================

    @Test
    @DisplayName("Should find files recursively by file name pattern")
    void testFindFiles() throws IOException {
        fileManager.writeFiles(root, Map.of(
                "build/app/outputs/flutter-apk/app-release.apk", "apk",
                "build/app/outputs/apk/release/app-release.apk", "apk",
                "build/app/outputs/mapping.txt", "map"));

        List<Path> apks = fileManager.findFiles(root, "*.apk");

        assertThat(apks).hasSize(2).allMatch(p -> p.getFileName().toString().equals("app-release.apk"));
        assertThat(fileManager.findFiles(root.resolve("missing"), "*.apk")).isEmpty();
    }

    @Test
    @DisplayName("Should delete a directory tree and tolerate missing paths")
    void testCleanup() throws IOException {
        Path dir = fileManager.createScopedTempDir("build_");
        fileManager.writeFiles(dir, Map.of("a/b/c.txt", "c", "d.txt", "d"));

        assertTrue(fileManager.cleanup(dir));
        assertFalse(Files.exists(dir));
        assertTrue(fileManager.cleanup(dir));
        assertTrue(fileManager.cleanup(null));
    }

    @Test
    @DisplayName("Should sum the sizes of all files below a directory")
    void testDirectorySize() throws IOException {
        fileManager.writeFiles(root, Map.of("a.txt", "12345", "sub/b.txt", "123"));

        assertEquals(8L, fileManager.directorySize(root));
        assertEquals(0L, fileManager.directorySize(root.resolve("missing")));
    }

    @Test
    @DisplayName("Should report free space, probing the nearest existing parent")
    void testAvailableSpace() {
        assertTrue(fileManager.availableSpace(root) > 0);
        assertTrue(fileManager.availableSpace(root.resolve("not/yet/created")) > 0);
    }

    @ParameterizedTest
    @CsvSource({
            "/data/builds, /data/builds/apks/app.apk, true",
            "/data/builds, /data/builds, true",
            "/data/builds, /data/builds/../../etc/passwd, false",
            "/data/builds, /data/builds2/app.apk, false",
            "/data/builds, /etc/passwd, false",
            "/data/builds, /data/builds/apks/../app.apk, true"
    })
    @DisplayName("Should accept only paths contained in the base directory")
    void testIsPathSafe(String base, String candidate, boolean expected) {
        assertEquals(expected, fileManager.isPathSafe(Path.of(candidate), Path.of(base)));
    }

    @Test
    @DisplayName("Should write binary content creating parent directories, and read text back")
    void testWriteBinaryAndRead() throws IOException {
        Path target = root.resolve("keystores/nested/blob.bin");

        fileManager.writeBinaryFile(target, new byte[]{0x50, 0x4B, 0x03, 0x04});

        assertArrayEquals(new byte[]{0x50, 0x4B, 0x03, 0x04}, Files.readAllBytes(target));
        Files.writeString(root.resolve("pubspec.yaml"), "name: shop\n");
        assertEquals("name: shop\n", fileManager.readFile(root.resolve("pubspec.yaml")).orElseThrow());
        assertTrue(fileManager.readFile(root.resolve("missing.yaml")).isEmpty());
    }
}
