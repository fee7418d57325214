package com.appbuilder.model;

import com.appbuilder.model.enums.LogLevel;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "appbuilder_build_logs", schema = "appbuilder",
        indexes = @Index(name = "idx_build_logs_build", columnList = "build_id, created_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BuildLog {

    // identity keeps append order when timestamps collide
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "build_id", nullable = false)
    private UUID buildId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private LogLevel level = LogLevel.INFO;

    @Column(length = 50)
    private String stage;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String message;

    /** Structured extras serialized as JSON. */
    @Column(columnDefinition = "TEXT")
    private String details;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
