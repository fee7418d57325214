package com.appbuilder.dto;

import lombok.*;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ToolchainHealthResponse {
    private boolean valid;
    private String platform;
    private boolean flutterAvailable;
    private String flutterExecutable;
    private String flutterVersion;
    private String dartVersion;
    private boolean androidSdkConfigured;
    private boolean signingEnabled;
    private boolean signingConfigured;
    private long tempDirFreeBytes;
    private long artifactDirFreeBytes;
    private List<String> configurationErrors;
}
