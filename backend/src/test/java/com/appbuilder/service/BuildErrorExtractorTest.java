package com.appbuilder.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BuildErrorExtractor Tests")
class BuildErrorExtractorTest {

    private static final String GRADLE_FAILURE = """
            Running Gradle task 'assembleRelease'...
            [  +12 ms] executing: gradlew assembleRelease
            FAILURE: Build failed with an exception.

            * What went wrong:
            Execution failed for task ':app:processReleaseResources'.
            > Android resource linking failed

            * Try:
            > Run with --stacktrace option to get the stack trace.

            BUILD FAILED in 41s
            """;

    // ============================================================================
    // extractErrorMessage
    // ============================================================================

    @Test
    @DisplayName("Should return the first line containing an error marker")
    void testExtractErrorMessage_FirstMarker() {
        String output = "Resolving dependencies...\n  Error: Dart SDK version mismatch  \nBUILD FAILED in 3s";

        assertEquals("Error: Dart SDK version mismatch", BuildErrorExtractor.extractErrorMessage(output));
    }

    @Test
    @DisplayName("Should prefer the earliest marker line in the output")
    void testExtractErrorMessage_GradleReport() {
        assertEquals("FAILURE: Build failed with an exception.",
                BuildErrorExtractor.extractErrorMessage(GRADLE_FAILURE));
    }

    @Test
    @DisplayName("Should fall back to the last non-empty line")
    void testExtractErrorMessage_LastLine() {
        assertEquals("exit code 137", BuildErrorExtractor.extractErrorMessage("compiling...\nexit code 137\n\n  \n"));
    }

    @Test
    @DisplayName("Should report an unknown error for empty output")
    void testExtractErrorMessage_Empty() {
        assertEquals("Build failed with unknown error", BuildErrorExtractor.extractErrorMessage(""));
        assertEquals("Build failed with unknown error", BuildErrorExtractor.extractErrorMessage(null));
        assertEquals("Build failed with unknown error", BuildErrorExtractor.extractErrorMessage("\n \n"));
    }

    // ============================================================================
    // extractGradleError and hints
    // ============================================================================

    @Test
    @DisplayName("Should extract the 'What went wrong' section of a Gradle failure")
    void testExtractGradleError() {
        Optional<String> error = BuildErrorExtractor.extractGradleError(GRADLE_FAILURE);

        assertEquals("Execution failed for task ':app:processReleaseResources'. > Android resource linking failed",
                error.orElseThrow());
    }

    @Test
    @DisplayName("Should return nothing when the output has no Gradle failure report")
    void testExtractGradleError_Absent() {
        assertTrue(BuildErrorExtractor.extractGradleError("Error: something else").isEmpty());
    }

    @Test
    @DisplayName("Should suggest remediation for known failure signatures")
    void testHints() {
        assertThat(BuildErrorExtractor.hintsFor("> Could not resolve all files for configuration"))
                .containsExactly("Dependencies resolution failed. Check internet connection.");
        assertThat(BuildErrorExtractor.hintsFor("AAPT2 aapt2-7.3.0 Daemon #0: Unexpected error"))
                .containsExactly("Android build tools issue. Try updating Android SDK build-tools.");
        assertThat(BuildErrorExtractor.hintsFor("SDK location not found. Define a valid SDK location"))
                .hasSize(1);
        assertThat(BuildErrorExtractor.hintsFor("all good")).isEmpty();
    }
}
