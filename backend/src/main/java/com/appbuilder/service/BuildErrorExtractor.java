package com.appbuilder.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pulls a human-readable failure reason out of raw toolchain output.
 */
public final class BuildErrorExtractor {

    static final String UNKNOWN_ERROR = "Build failed with unknown error";

    private static final List<String> ERROR_MARKERS = List.of(
            "Error:", "FAILURE:", "BUILD FAILED", "Could not", "Unable to");

    private static final String GRADLE_FAILURE = "FAILURE: Build failed with an exception.";
    private static final String WHAT_WENT_WRONG = "What went wrong:";

    private BuildErrorExtractor() {
    }

    /**
     * First line containing a known error marker, else the last non-empty line.
     */
    public static String extractErrorMessage(String output) {
        if (output == null || output.isBlank()) {
            return UNKNOWN_ERROR;
        }
        String[] lines = output.split("\\R");
        for (String line : lines) {
            for (String marker : ERROR_MARKERS) {
                if (line.contains(marker)) {
                    return line.strip();
                }
            }
        }
        for (int i = lines.length - 1; i >= 0; i--) {
            if (!lines[i].isBlank()) {
                return lines[i].strip();
            }
        }
        return UNKNOWN_ERROR;
    }

    /**
     * The "What went wrong" section of a Gradle failure report, or its first three lines
     * when the section is missing.
     */
    public static Optional<String> extractGradleError(String output) {
        if (output == null) {
            return Optional.empty();
        }
        List<String> section = new ArrayList<>();
        boolean inError = false;
        for (String line : output.split("\\R")) {
            if (line.contains(GRADLE_FAILURE)) {
                inError = true;
                continue;
            }
            if (inError) {
                if (line.contains("BUILD FAILED")) break;
                // verbose flutter output prefixes its own lines with [ +12 ms]
                if (!line.isBlank() && !line.startsWith("[")) {
                    section.add(line.strip());
                }
            }
        }
        if (section.isEmpty()) {
            return Optional.empty();
        }

        List<String> whatWentWrong = new ArrayList<>();
        boolean capture = false;
        for (String line : section) {
            if (line.contains(WHAT_WENT_WRONG)) {
                capture = true;
                continue;
            }
            if (capture && line.startsWith("*")) break;
            if (capture) whatWentWrong.add(line);
        }
        if (!whatWentWrong.isEmpty()) {
            return Optional.of(String.join(" ", whatWentWrong).strip());
        }
        return Optional.of(String.join(" ", section.subList(0, Math.min(3, section.size()))));
    }

    /**
     * Remediation hints for failure signatures seen often enough to recognise.
     */
    public static List<String> hintsFor(String output) {
        if (output == null) {
            return List.of();
        }
        List<String> hints = new ArrayList<>();
        if (output.contains("Could not resolve all files")) {
            hints.add("Dependencies resolution failed. Check internet connection.");
        } else if (output.contains("compileSdkVersion")) {
            hints.add("SDK version mismatch. Check Android SDK installation.");
        } else if (output.contains("AAPT2") || output.contains("aapt2")) {
            hints.add("Android build tools issue. Try updating Android SDK build-tools.");
        }
        if (output.contains("SDK location not found")) {
            hints.add("Android SDK location not found. Set builds.android-sdk-path.");
        }
        if (output.contains("licences have not been accepted") || output.contains("licenses have not been accepted")) {
            hints.add("Android SDK licences not accepted. Run 'flutter doctor --android-licenses' on the build host.");
        }
        return hints;
    }
}
