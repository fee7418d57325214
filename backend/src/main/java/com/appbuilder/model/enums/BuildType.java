package com.appbuilder.model.enums;

public enum BuildType {
    DEBUG,
    PROFILE,
    RELEASE;

    /** Lower-case mode name used by the toolchain flags and artifact file names. */
    public String mode() {
        return name().toLowerCase();
    }
}
