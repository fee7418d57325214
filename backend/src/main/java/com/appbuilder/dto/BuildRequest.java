package com.appbuilder.dto;

import com.appbuilder.model.enums.BuildType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.*;

import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BuildRequest {

    @NotNull(message = "Project id is required")
    private UUID projectId;

    @Builder.Default
    private BuildType buildType = BuildType.RELEASE;

    @NotBlank(message = "Version number is required")
    @Pattern(regexp = "^\\d+\\.\\d+\\.\\d+$", message = "Version number must be in format X.Y.Z (e.g., 1.0.0)")
    private String versionNumber;
}
