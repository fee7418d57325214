package com.appbuilder.service;

import com.appbuilder.config.BuildProperties;
import com.appbuilder.dto.CleanupReport;
import com.appbuilder.dto.CleanupRequest;
import com.appbuilder.model.Build;
import com.appbuilder.model.enums.BuildStatus;
import com.appbuilder.repository.BuildRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Hands builds to the bounded build executor and runs the periodic housekeeping tasks:
 * stale sweep, retention purge and pick-up of pending builds nobody dispatched.
 */
@Service
@Slf4j
public class BuildDispatcher {

    static final String TASK_STALE_SWEEP = "stale-sweep";
    static final String TASK_PURGE = "retention-purge";
    static final String TASK_QUEUE = "queue-pickup";

    private final BuildRepository repository;
    private final BuildService buildService;
    private final BuildCleanupService cleanupService;
    private final TaskExecutor buildExecutor;
    private final TaskScheduler taskScheduler;
    private final BuildProperties properties;

    private final Set<UUID> dispatched = ConcurrentHashMap.newKeySet();
    private final ConcurrentHashMap<String, ScheduledFuture<?>> scheduledTasks = new ConcurrentHashMap<>();

    public BuildDispatcher(BuildRepository repository,
                           BuildService buildService,
                           BuildCleanupService cleanupService,
                           @Qualifier("buildExecutor") TaskExecutor buildExecutor,
                           TaskScheduler taskScheduler,
                           BuildProperties properties) {
        this.repository = repository;
        this.buildService = buildService;
        this.cleanupService = cleanupService;
        this.buildExecutor = buildExecutor;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
    }

    @PostConstruct
    public void registerPeriodicTasks() {
        BuildProperties.Scheduler scheduler = properties.getScheduler();
        if (!scheduler.isEnabled()) {
            log.info("Build scheduler disabled, periodic build tasks not registered");
            return;
        }
        registerTask(TASK_STALE_SWEEP, scheduler.getStaleSweepCron(), this::sweepStaleBuilds);
        registerTask(TASK_PURGE, scheduler.getPurgeCron(),
                () -> purgeOldBuilds(properties.getRetentionDays(), scheduler.isKeepSuccessful()));
        registerTask(TASK_QUEUE, scheduler.getQueueCron(), this::dispatchPendingBuilds);
        log.info("Registered {} periodic build tasks", scheduledTasks.size());
    }

    @PreDestroy
    public void cancelPeriodicTasks() {
        scheduledTasks.keySet().forEach(this::cancelTask);
    }

    // ── Dispatch ──────────────────────────────────────────────────────────

    /**
     * Queues the pipeline for {@code buildId} on the build executor. A build already queued
     * or running on this node is not queued again.
     */
    public boolean dispatch(UUID buildId) {
        if (!dispatched.add(buildId)) {
            log.debug("Build {} already dispatched", buildId);
            return false;
        }
        try {
            buildExecutor.execute(() -> runBuild(buildId));
            return true;
        } catch (TaskRejectedException e) {
            dispatched.remove(buildId);
            log.error("Build executor rejected build {}: {}", buildId, e.getMessage());
            return false;
        }
    }

    public boolean isDispatched(UUID buildId) {
        return dispatched.contains(buildId);
    }

    /**
     * Dispatches pending builds in creation order, e.g. ones left behind by a restart.
     */
    public int dispatchPendingBuilds() {
        List<Build> pending = repository.findByStatusOrderByCreatedAtAsc(BuildStatus.PENDING);
        int count = 0;
        for (Build build : pending) {
            if (dispatch(build.getId())) count++;
        }
        if (count > 0) {
            log.info("Dispatched {} pending builds", count);
        }
        return count;
    }

    private void runBuild(UUID buildId) {
        try {
            buildService.processBuild(buildId);
        } catch (Exception e) {
            log.error("Build task failed for build {}: {}", buildId, e.getMessage(), e);
        } finally {
            dispatched.remove(buildId);
        }
    }

    // ── Periodic tasks ────────────────────────────────────────────────────

    public int sweepStaleBuilds() {
        try {
            return buildService.sweepStaleBuilds();
        } catch (Exception e) {
            log.error("Stale build sweep failed: {}", e.getMessage(), e);
            return 0;
        }
    }

    public CleanupReport purgeOldBuilds(int retentionDays, boolean keepSuccessful) {
        CleanupRequest request = CleanupRequest.builder()
                .retentionDays(retentionDays)
                .keepSuccessful(keepSuccessful)
                .cleanOrphans(true)
                .cleanTemp(true)
                .build();
        try {
            return cleanupService.purge(request);
        } catch (Exception e) {
            log.error("Retention purge failed: {}", e.getMessage(), e);
            return CleanupReport.builder().build();
        }
    }

    private void registerTask(String name, String cron, Runnable task) {
        cancelTask(name); // cancel existing if any
        try {
            ScheduledFuture<?> future = taskScheduler.schedule(task, new CronTrigger(cron));
            scheduledTasks.put(name, future);
        } catch (Exception e) {
            log.error("Failed to register periodic task {} ({}): {}", name, cron, e.getMessage());
        }
    }

    private void cancelTask(String name) {
        ScheduledFuture<?> future = scheduledTasks.remove(name);
        if (future != null) {
            future.cancel(false);
        }
    }
}
