package com.appbuilder.repository;

import com.appbuilder.model.BuildLog;
import com.appbuilder.model.enums.LogLevel;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface BuildLogRepository extends JpaRepository<BuildLog, Long> {

    List<BuildLog> findByBuildIdOrderByCreatedAtAscIdAsc(UUID buildId);

    List<BuildLog> findByBuildIdAndLevelOrderByCreatedAtAscIdAsc(UUID buildId, LogLevel level);

    List<BuildLog> findByBuildIdOrderByCreatedAtDescIdDesc(UUID buildId, Pageable pageable);

    long countByBuildIdAndLevel(UUID buildId, LogLevel level);

    @Modifying
    @Query("DELETE FROM BuildLog l WHERE l.buildId = :buildId")
    int deleteByBuildId(@Param("buildId") UUID buildId);
}
