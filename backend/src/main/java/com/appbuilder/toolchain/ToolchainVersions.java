package com.appbuilder.toolchain;

public record ToolchainVersions(String flutterVersion, String dartVersion) {

    public static final ToolchainVersions UNKNOWN = new ToolchainVersions(null, null);
}
