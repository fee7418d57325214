package com.appbuilder.toolchain;

import java.nio.file.Path;

/**
 * Result of a toolchain step. On failure {@code message} carries the tool output or a
 * short reason; {@code output} is the full combined output when a tool actually ran.
 */
public record ToolchainResult(boolean success, String message, Path artifactPath, String output) {

    public static ToolchainResult ok(String message) {
        return new ToolchainResult(true, message, null, "");
    }

    public static ToolchainResult built(Path artifact, String output) {
        return new ToolchainResult(true, "Build completed successfully", artifact, output);
    }

    public static ToolchainResult failed(String message) {
        return new ToolchainResult(false, message, null, message);
    }

    public static ToolchainResult failed(String message, String output) {
        return new ToolchainResult(false, message, null, output);
    }
}
