package com.appbuilder.toolchain;

import com.appbuilder.config.BuildProperties;
import com.appbuilder.model.enums.BuildType;
import com.appbuilder.platform.Platform;
import com.appbuilder.util.CommandResult;
import com.appbuilder.util.CommandRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Drives the Flutter toolchain: preflight checks, project scaffolding,
 * dependency resolution and the APK build itself.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FlutterBuilder {

    static final String APK_NOT_FOUND = "APK file not found";

    private static final Duration VERSION_TIMEOUT = Duration.ofSeconds(10);
    private static final Pattern FLUTTER_VERSION = Pattern.compile("Flutter\\s+(\\S+)");
    private static final Pattern DART_VERSION = Pattern.compile("Dart\\s+(\\S+)");
    private static final Pattern PUBSPEC_VERSION = Pattern.compile("(?m)^version:.*$");

    private final BuildProperties properties;
    private final CommandRunner commandRunner;
    private final Platform platform;

    // ── Environment ───────────────────────────────────────────────────────

    /** The SDK launcher when the configured SDK has one, otherwise whatever PATH resolves. */
    public String flutterExecutable() {
        if (properties.hasFlutterSdk()) {
            Path candidate = Path.of(properties.getFlutterSdkPath(), "bin", platform.executableName("flutter"));
            if (Files.exists(candidate)) {
                return candidate.toString();
            }
        }
        return "flutter";
    }

    /**
     * Variables every toolchain invocation runs with, merged over the inherited environment.
     */
    public Map<String, String> toolchainEnvironment() {
        Map<String, String> env = new LinkedHashMap<>();
        List<String> pathPrefix = new ArrayList<>();

        if (properties.hasFlutterSdk()) {
            env.put("FLUTTER_ROOT", properties.getFlutterSdkPath());
            pathPrefix.add(Path.of(properties.getFlutterSdkPath(), "bin").toString());
        }
        if (properties.hasAndroidSdk()) {
            env.put("ANDROID_SDK_ROOT", properties.getAndroidSdkPath());
            env.put("ANDROID_HOME", properties.getAndroidSdkPath());
            pathPrefix.add(Path.of(properties.getAndroidSdkPath(), "platform-tools").toString());
        }
        if (properties.hasJavaHome()) {
            env.put("JAVA_HOME", properties.getJavaHome());
            pathPrefix.add(Path.of(properties.getJavaHome(), "bin").toString());
        }
        if (!pathPrefix.isEmpty()) {
            String inherited = System.getenv().getOrDefault("PATH", "");
            pathPrefix.add(inherited);
            env.put("PATH", String.join(File.pathSeparator, pathPrefix));
        }
        return env;
    }

    // ── Preflight ─────────────────────────────────────────────────────────

    public boolean checkSdk() {
        CommandResult result = commandRunner.run(List.of(flutterExecutable(), "doctor", "-v"),
                null, toolchainEnvironment(), properties.getPreflightTimeout());
        if (!result.isSuccess()) {
            log.warn("Flutter SDK check failed (exit {}): {}", result.exitCode(), firstLine(result.errorOrOutput()));
        }
        return result.isSuccess();
    }

    public Optional<String> getVersion() {
        return Optional.ofNullable(getVersions().flutterVersion());
    }

    public Optional<String> getDartVersion() {
        return Optional.ofNullable(getVersions().dartVersion());
    }

    /**
     * Parses both versions out of a single {@code flutter --version} call.
     */
    public ToolchainVersions getVersions() {
        CommandResult result = commandRunner.run(List.of(flutterExecutable(), "--version"),
                null, toolchainEnvironment(), VERSION_TIMEOUT);
        if (!result.isSuccess()) {
            return ToolchainVersions.UNKNOWN;
        }
        String flutter = null;
        String dart = null;
        for (String line : result.stdout().split("\\R")) {
            if (flutter == null && line.contains("Flutter")) {
                Matcher m = FLUTTER_VERSION.matcher(line);
                flutter = m.find() ? m.group(1) : line.strip();
            }
            if (dart == null && line.contains("Dart")) {
                Matcher m = DART_VERSION.matcher(line);
                if (m.find()) dart = m.group(1);
            }
        }
        return new ToolchainVersions(flutter, dart);
    }

    public boolean checkAndroidSdk() {
        if (!properties.hasAndroidSdk()) {
            return false;
        }
        Path sdk = Path.of(properties.getAndroidSdkPath());
        return Files.isDirectory(sdk) && Files.isDirectory(sdk.resolve("platform-tools"));
    }

    // ── Project setup ─────────────────────────────────────────────────────

    /**
     * Creates the platform scaffolding (android/, gradle wrappers) in {@code projectDir}.
     */
    public ToolchainResult scaffoldProject(Path projectDir, String packageName, String description,
                                           Consumer<Process> onStart) {
        List<String> command = List.of(flutterExecutable(), "create",
                "--org", organisationOf(packageName),
                "--project-name", projectNameOf(packageName),
                "--description", description != null && !description.isBlank() ? description : projectNameOf(packageName),
                "--platforms", "android",
                ".");
        CommandResult result = commandRunner.run(command, projectDir, toolchainEnvironment(),
                properties.getDependencyTimeout(), onStart);
        if (!result.isSuccess()) {
            return ToolchainResult.failed("Project scaffolding failed: " + result.errorOrOutput(),
                    result.combinedOutput());
        }
        return ToolchainResult.ok("Project scaffolded");
    }

    /**
     * Rewrites the {@code version:} line of pubspec.yaml to {@code <versionName>+<versionCode>}.
     */
    public void applyVersion(Path projectDir, String versionName, int versionCode) throws IOException {
        Path pubspec = projectDir.resolve("pubspec.yaml");
        if (!Files.exists(pubspec)) {
            throw new IOException("pubspec.yaml not found in " + projectDir);
        }
        String content = Files.readString(pubspec, StandardCharsets.UTF_8);
        String versionLine = "version: " + versionName + "+" + versionCode;
        Matcher m = PUBSPEC_VERSION.matcher(content);
        String updated = m.find()
                ? m.replaceFirst(Matcher.quoteReplacement(versionLine))
                : content + (content.endsWith("\n") ? "" : "\n") + versionLine + "\n";
        Files.writeString(pubspec, updated, StandardCharsets.UTF_8);
    }

    public void writeLocalProperties(Path projectDir, BuildType buildType, String versionName, int versionCode)
            throws IOException {
        StringBuilder props = new StringBuilder();
        if (properties.hasAndroidSdk()) {
            props.append("sdk.dir=").append(escape(properties.getAndroidSdkPath())).append('\n');
        }
        if (properties.hasFlutterSdk()) {
            props.append("flutter.sdk=").append(escape(properties.getFlutterSdkPath())).append('\n');
        }
        props.append("flutter.buildMode=").append(buildType.mode()).append('\n');
        props.append("flutter.versionName=").append(versionName).append('\n');
        props.append("flutter.versionCode=").append(versionCode).append('\n');

        Path target = projectDir.resolve("android").resolve("local.properties");
        Files.createDirectories(target.getParent());
        Files.writeString(target, props.toString(), StandardCharsets.UTF_8);
    }

    // ── Build ─────────────────────────────────────────────────────────────

    /**
     * clean, pub get, then gen-l10n when the project has an l10n.yaml.
     * The first failing step ends the sequence.
     */
    public ToolchainResult resolveDependencies(Path projectDir, Consumer<Process> onStart) {
        Map<String, String> env = toolchainEnvironment();

        CommandResult clean = commandRunner.run(List.of(flutterExecutable(), "clean"),
                projectDir, env, properties.getCleanTimeout(), onStart);
        if (!clean.isSuccess()) {
            return ToolchainResult.failed("flutter clean failed: " + clean.errorOrOutput(), clean.combinedOutput());
        }

        CommandResult pubGet = commandRunner.run(List.of(flutterExecutable(), "pub", "get"),
                projectDir, env, properties.getDependencyTimeout(), onStart);
        if (!pubGet.isSuccess()) {
            return ToolchainResult.failed("flutter pub get failed: " + pubGet.errorOrOutput(), pubGet.combinedOutput());
        }

        if (Files.exists(projectDir.resolve("l10n.yaml"))) {
            CommandResult l10n = commandRunner.run(List.of(flutterExecutable(), "gen-l10n"),
                    projectDir, env, properties.getDependencyTimeout(), onStart);
            if (!l10n.isSuccess()) {
                return ToolchainResult.failed("flutter gen-l10n failed: " + l10n.errorOrOutput(),
                        l10n.combinedOutput());
            }
        }
        return ToolchainResult.ok("Dependencies resolved");
    }

    public ToolchainResult buildArtifact(Path projectDir, BuildType buildType, Consumer<Process> onStart) {
        ToolchainResult deps = resolveDependencies(projectDir, onStart);
        if (!deps.success()) {
            return deps;
        }

        List<String> command = List.of(flutterExecutable(), "build", "apk", "--" + buildType.mode(), "--verbose");
        log.info("Building {} APK in {}", buildType.mode(), projectDir);
        CommandResult result = commandRunner.run(command, projectDir, toolchainEnvironment(),
                properties.getBuildTimeout(), onStart);
        String output = result.combinedOutput();

        if (!result.isSuccess()) {
            return ToolchainResult.failed(output, output);
        }

        Optional<Path> apk = locateArtifact(projectDir, buildType);
        if (apk.isEmpty()) {
            log.warn("Build command succeeded but no {} APK was produced in {}", buildType.mode(), projectDir);
            return ToolchainResult.failed(APK_NOT_FOUND, output);
        }
        return ToolchainResult.built(apk.get(), output);
    }

    Optional<Path> locateArtifact(Path projectDir, BuildType buildType) {
        String fileName = "app-" + buildType.mode() + ".apk";
        Path outputs = projectDir.resolve("build").resolve("app").resolve("outputs");
        List<Path> candidates = List.of(
                outputs.resolve("flutter-apk").resolve(fileName),
                outputs.resolve("apk").resolve(buildType.mode()).resolve(fileName));
        return candidates.stream().filter(Files::isRegularFile).findFirst();
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    public static String projectNameOf(String packageName) {
        String last = packageName.contains(".")
                ? packageName.substring(packageName.lastIndexOf('.') + 1)
                : packageName;
        String name = last.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
        if (name.isEmpty() || Character.isDigit(name.charAt(0))) {
            name = "app_" + name;
        }
        return name;
    }

    static String organisationOf(String packageName) {
        int dot = packageName.lastIndexOf('.');
        return dot > 0 ? packageName.substring(0, dot) : "com.example";
    }

    // local.properties is read as a java.util.Properties file
    private static String escape(String path) {
        return path.replace("\\", "\\\\");
    }

    private static String firstLine(String text) {
        if (text == null) return "";
        int nl = text.indexOf('\n');
        return nl < 0 ? text : text.substring(0, nl);
    }
}
