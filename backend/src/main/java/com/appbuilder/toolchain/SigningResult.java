package com.appbuilder.toolchain;

/**
 * {@code message} is the signed artifact's path on success and the reason otherwise.
 */
public record SigningResult(boolean success, String message) {

    public static SigningResult ok(String message) {
        return new SigningResult(true, message);
    }

    public static SigningResult failed(String message) {
        return new SigningResult(false, message);
    }
}
