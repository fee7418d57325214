package com.appbuilder.service;

import com.appbuilder.config.BuildProperties;
import com.appbuilder.dto.ToolchainHealthResponse;
import com.appbuilder.platform.Platform;
import com.appbuilder.toolchain.ApkSigner;
import com.appbuilder.toolchain.FlutterBuilder;
import com.appbuilder.toolchain.ToolchainVersions;
import com.appbuilder.util.FileManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks that the build host is able to run builds: configured paths, toolchain, signing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ToolchainHealthService {

    private final BuildProperties properties;
    private final FlutterBuilder flutterBuilder;
    private final ApkSigner apkSigner;
    private final FileManager fileManager;
    private final Platform platform;

    @EventListener(ApplicationReadyEvent.class)
    public void logConfigurationProblems() {
        List<String> errors = validateConfiguration();
        if (errors.isEmpty()) {
            log.info("Build configuration OK (platform={}, maxConcurrentBuilds={})",
                    platform.name(), properties.getMaxConcurrentBuilds());
        } else {
            errors.forEach(error -> log.warn("Build configuration problem: {}", error));
        }
    }

    /**
     * Static checks only; no external tool is started.
     */
    public List<String> validateConfiguration() {
        List<String> errors = new ArrayList<>();
        if (properties.hasFlutterSdk() && !Files.isDirectory(Path.of(properties.getFlutterSdkPath()))) {
            errors.add("Flutter SDK path does not exist: " + properties.getFlutterSdkPath());
        }
        if (properties.hasAndroidSdk() && !Files.isDirectory(Path.of(properties.getAndroidSdkPath()))) {
            errors.add("Android SDK path does not exist: " + properties.getAndroidSdkPath());
        }
        if (properties.hasJavaHome() && !Files.isDirectory(Path.of(properties.getJavaHome()))) {
            errors.add("Java home does not exist: " + properties.getJavaHome());
        }
        if (properties.getMaxConcurrentBuilds() < 1) {
            errors.add("max-concurrent-builds must be at least 1");
        }
        if (properties.getSigning().isEnabled() && !apkSigner.isConfigured()) {
            errors.add("APK signing is enabled but keystore settings are incomplete or the keystore is missing");
        }
        checkWritable("Temp build directory", properties.getTempDir(), errors);
        checkWritable("Artifact directory", properties.getArtifactDir(), errors);
        return errors;
    }

    /**
     * Full check including toolchain preflight; may take as long as the preflight timeout.
     */
    public ToolchainHealthResponse check() {
        List<String> errors = validateConfiguration();
        boolean flutterAvailable = flutterBuilder.checkSdk();
        ToolchainVersions versions = flutterAvailable ? flutterBuilder.getVersions() : ToolchainVersions.UNKNOWN;
        if (!flutterAvailable) {
            errors.add("Flutter SDK not found or not properly configured");
        }

        return ToolchainHealthResponse.builder()
                .valid(errors.isEmpty())
                .platform(platform.name())
                .flutterAvailable(flutterAvailable)
                .flutterExecutable(flutterBuilder.flutterExecutable())
                .flutterVersion(versions.flutterVersion())
                .dartVersion(versions.dartVersion())
                .androidSdkConfigured(flutterBuilder.checkAndroidSdk())
                .signingEnabled(properties.getSigning().isEnabled())
                .signingConfigured(apkSigner.isConfigured())
                .tempDirFreeBytes(fileManager.availableSpace(properties.getTempDir()))
                .artifactDirFreeBytes(fileManager.availableSpace(properties.getArtifactDir()))
                .configurationErrors(errors)
                .build();
    }

    private void checkWritable(String label, Path dir, List<String> errors) {
        try {
            Files.createDirectories(dir);
            if (!Files.isWritable(dir)) {
                errors.add(label + " is not writable: " + dir);
            }
        } catch (IOException e) {
            errors.add(label + " cannot be created: " + dir + " (" + e.getMessage() + ")");
        }
    }
}
