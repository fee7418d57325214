package com.appbuilder.repository;

import com.appbuilder.model.Build;
import com.appbuilder.model.enums.BuildStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface BuildRepository extends JpaRepository<Build, UUID>, JpaSpecificationExecutor<Build> {

    @Query("SELECT COALESCE(MAX(b.buildNumber), 0) FROM Build b WHERE b.projectId = :projectId")
    int findMaxBuildNumber(@Param("projectId") UUID projectId);

    boolean existsByProjectIdAndStatusIn(UUID projectId, Collection<BuildStatus> statuses);

    List<Build> findByStatusOrderByCreatedAtAsc(BuildStatus status);

    List<Build> findByStatusInAndStartedAtBefore(Collection<BuildStatus> statuses, LocalDateTime cutoff);

    List<Build> findByStatusInAndCreatedAtBefore(Collection<BuildStatus> statuses, LocalDateTime cutoff);

    List<Build> findByProjectIdOrderByCreatedAtDesc(UUID projectId, Pageable pageable);

    List<Build> findAllByOrderByCreatedAtDesc(Pageable pageable);

    long countByStatus(BuildStatus status);

    long countByStatusIn(Collection<BuildStatus> statuses);

    long countByCreatedAtAfter(LocalDateTime since);

    long countByStatusAndCreatedAtAfter(BuildStatus status, LocalDateTime since);

    @Query("SELECT b.status, COUNT(b) FROM Build b WHERE b.projectId = :projectId GROUP BY b.status")
    List<Object[]> countByStatusForProject(@Param("projectId") UUID projectId);

    @Query("SELECT AVG(b.durationSeconds) FROM Build b WHERE b.status = :status AND b.durationSeconds IS NOT NULL")
    Double averageDuration(@Param("status") BuildStatus status);

    @Query("SELECT AVG(b.durationSeconds) FROM Build b "
            + "WHERE b.projectId = :projectId AND b.status = :status AND b.durationSeconds IS NOT NULL")
    Double averageDurationForProject(@Param("projectId") UUID projectId, @Param("status") BuildStatus status);

    @Query("SELECT b.artifactPath FROM Build b WHERE b.artifactPath IS NOT NULL")
    List<String> findAllArtifactPaths();
}
