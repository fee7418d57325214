package com.appbuilder.toolchain;

import com.appbuilder.config.BuildProperties;
import com.appbuilder.platform.Platform;
import com.appbuilder.util.CommandResult;
import com.appbuilder.util.CommandRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Signs and verifies APKs with {@code apksigner}. No method throws; failures come back
 * as an unsuccessful {@link SigningResult}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ApkSigner {

    private static final Duration SIGN_TIMEOUT = Duration.ofSeconds(60);
    private static final Duration VERIFY_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration KEYTOOL_TIMEOUT = Duration.ofSeconds(30);

    private final BuildProperties properties;
    private final CommandRunner commandRunner;
    private final Platform platform;

    public boolean isConfigured() {
        BuildProperties.Signing signing = properties.getSigning();
        return notBlank(signing.getKeystorePath())
                && Files.isRegularFile(Path.of(signing.getKeystorePath()))
                && notBlank(signing.getKeystorePassword())
                && notBlank(signing.getKeyAlias())
                && notBlank(signing.getKeyPassword());
    }

    /**
     * Signs {@code apk} into {@code output}, or into {@code <name>-signed.apk} next to it when
     * {@code output} is null.
     */
    public SigningResult sign(Path apk, Path output) {
        if (!isConfigured()) {
            return SigningResult.failed("APK signing not configured");
        }
        if (apk == null || !Files.isRegularFile(apk)) {
            return SigningResult.failed("APK file not found: " + apk);
        }
        Optional<String> tool = findApkSigner();
        if (tool.isEmpty()) {
            return SigningResult.failed("apksigner tool not found");
        }

        Path target = output != null ? output : defaultSignedPath(apk);
        BuildProperties.Signing signing = properties.getSigning();
        List<String> command = List.of(tool.get(), "sign",
                "--ks", signing.getKeystorePath(),
                "--ks-pass", "pass:" + signing.getKeystorePassword(),
                "--ks-key-alias", signing.getKeyAlias(),
                "--key-pass", "pass:" + signing.getKeyPassword(),
                "--out", target.toString(),
                apk.toString());

        CommandResult result = commandRunner.run(command, null, null, SIGN_TIMEOUT);
        if (!result.isSuccess()) {
            log.warn("APK signing failed for {}: {}", apk.getFileName(), result.errorOrOutput());
            return SigningResult.failed("APK signing failed: " + result.errorOrOutput());
        }
        log.info("Signed APK written to {}", target);
        return SigningResult.ok(target.toString());
    }

    public SigningResult verify(Path apk) {
        if (apk == null || !Files.isRegularFile(apk)) {
            return SigningResult.failed("APK file not found: " + apk);
        }
        Optional<String> tool = findApkSigner();
        if (tool.isEmpty()) {
            return SigningResult.failed("apksigner tool not found");
        }
        CommandResult result = commandRunner.run(List.of(tool.get(), "verify", "--verbose", apk.toString()),
                null, null, VERIFY_TIMEOUT);
        return result.isSuccess()
                ? SigningResult.ok(result.stdout())
                : SigningResult.failed(result.errorOrOutput());
    }

    /**
     * Creates the shared debug keystore under the artifact root unless it already exists.
     */
    public SigningResult createDebugKeystore() {
        Path keystore = properties.getArtifactDir().resolve("keystores").resolve("debug.keystore");
        if (Files.exists(keystore)) {
            return SigningResult.ok(keystore.toString());
        }
        try {
            Files.createDirectories(keystore.getParent());
        } catch (IOException e) {
            return SigningResult.failed("Cannot create keystore directory: " + e.getMessage());
        }

        List<String> command = List.of(keytoolExecutable(), "-genkey", "-v",
                "-keystore", keystore.toString(),
                "-alias", "androiddebugkey",
                "-keyalg", "RSA",
                "-keysize", "2048",
                "-validity", "10000",
                "-storepass", "android",
                "-keypass", "android",
                "-dname", "CN=Android Debug,O=Android,C=US");
        CommandResult result = commandRunner.run(command, null, null, KEYTOOL_TIMEOUT);
        if (!result.isSuccess()) {
            return SigningResult.failed("Failed to create debug keystore: " + result.errorOrOutput());
        }
        log.info("Created debug keystore at {}", keystore);
        return SigningResult.ok(keystore.toString());
    }

    // ── Tool lookup ───────────────────────────────────────────────────────

    /**
     * apksigner from PATH, else the newest {@code build-tools/<version>} of the Android SDK that ships it.
     */
    Optional<String> findApkSigner() {
        if (commandRunner.commandExists("apksigner")) {
            return Optional.of("apksigner");
        }
        if (!properties.hasAndroidSdk()) {
            return Optional.empty();
        }
        Path buildTools = Path.of(properties.getAndroidSdkPath(), "build-tools");
        if (!Files.isDirectory(buildTools)) {
            return Optional.empty();
        }
        String executable = platform.executableName("apksigner");
        try (Stream<Path> versions = Files.list(buildTools)) {
            return versions.filter(Files::isDirectory)
                    .sorted(Comparator.comparing((Path p) -> p.getFileName().toString(), ApkSigner::compareVersions)
                            .reversed())
                    .map(dir -> dir.resolve(executable))
                    .filter(Files::isRegularFile)
                    .map(Path::toString)
                    .findFirst();
        } catch (IOException e) {
            log.warn("Failed to scan {}: {}", buildTools, e.getMessage());
            return Optional.empty();
        }
    }

    private String keytoolExecutable() {
        if (properties.hasJavaHome()) {
            Path candidate = Path.of(properties.getJavaHome(), "bin", "keytool");
            if (Files.exists(candidate)) {
                return candidate.toString();
            }
        }
        return "keytool";
    }

    /**
     * Numeric, segment-wise comparison so that {@code 34.0.0} sorts above {@code 9.0.0}.
     * Non-numeric qualifiers (e.g. {@code 35.0.0-rc1}) compare by their leading digits.
     */
    static int compareVersions(String a, String b) {
        String[] left = a.split("[.\\-]");
        String[] right = b.split("[.\\-]");
        for (int i = 0; i < Math.max(left.length, right.length); i++) {
            long l = i < left.length ? leadingNumber(left[i]) : 0;
            long r = i < right.length ? leadingNumber(right[i]) : 0;
            if (l != r) {
                return Long.compare(l, r);
            }
        }
        return a.compareTo(b);
    }

    private static long leadingNumber(String segment) {
        int end = 0;
        while (end < segment.length() && Character.isDigit(segment.charAt(end))) end++;
        if (end == 0) return 0;
        try {
            return Long.parseLong(segment.substring(0, end));
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }

    private static Path defaultSignedPath(Path apk) {
        String name = apk.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String signed = dot > 0
                ? name.substring(0, dot) + "-signed" + name.substring(dot)
                : name + "-signed";
        return apk.resolveSibling(signed);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
