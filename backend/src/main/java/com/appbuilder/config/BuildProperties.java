package com.appbuilder.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Typed build configuration, bound from the {@code builds.*} keys of application.yml.
 * Every component receives it through injection; nothing reads the environment directly.
 */
@Data
@ConfigurationProperties(prefix = "builds")
public class BuildProperties {

    /** Flutter SDK root. Blank means "use flutter from PATH". */
    private String flutterSdkPath = "";

    private String androidSdkPath = "";

    private String javaHome = "";

    /** Root under which scoped build directories are created. */
    private Path tempDir = Path.of(System.getProperty("java.io.tmpdir"), "appbuilder");

    /** Root under which finished artifacts are stored. Artifact paths are relative to it. */
    private Path artifactDir = Path.of("media", "builds");

    private Duration buildTimeout = Duration.ofSeconds(600);

    private Duration preflightTimeout = Duration.ofSeconds(30);

    private Duration cleanTimeout = Duration.ofSeconds(60);

    private Duration dependencyTimeout = Duration.ofSeconds(120);

    private Duration staleThreshold = Duration.ofMinutes(60);

    private int maxConcurrentBuilds = 3;

    private int retentionDays = 30;

    private long minFreeSpaceMb = 1024;

    private Signing signing = new Signing();

    private Scheduler scheduler = new Scheduler();

    @Data
    public static class Signing {
        private boolean enabled = false;
        private String keystorePath = "";
        private String keystorePassword = "";
        private String keyAlias = "";
        private String keyPassword = "";
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private String staleSweepCron = "0 */15 * * * *";
        private String purgeCron = "0 0 3 * * *";
        private String queueCron = "*/30 * * * * *";
        /** Keep successful builds when the scheduled purge runs. */
        private boolean keepSuccessful = false;
    }

    public boolean hasFlutterSdk() {
        return flutterSdkPath != null && !flutterSdkPath.isBlank();
    }

    public boolean hasAndroidSdk() {
        return androidSdkPath != null && !androidSdkPath.isBlank();
    }

    public boolean hasJavaHome() {
        return javaHome != null && !javaHome.isBlank();
    }
}
