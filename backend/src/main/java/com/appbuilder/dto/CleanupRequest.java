package com.appbuilder.dto;

import jakarta.validation.constraints.Min;
import lombok.*;

/**
 * Options for a retention purge. A null {@code retentionDays} falls back to the configured default.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CleanupRequest {

    @Min(value = 0, message = "Retention days must not be negative")
    private Integer retentionDays;

    private boolean keepSuccessful;

    private boolean keepFailed;

    private boolean dryRun;

    @Builder.Default
    private boolean cleanOrphans = true;

    private boolean cleanTemp;
}
