package com.appbuilder.service;

import com.appbuilder.util.CommandRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the builds this node is executing and the external process each is currently
 * waiting on, so a cancel can stop the tool instead of waiting for it to finish.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BuildRegistry {

    private final CommandRunner commandRunner;

    private final ConcurrentHashMap<UUID, RunningBuild> runningBuilds = new ConcurrentHashMap<>();

    private static final class RunningBuild {
        volatile Process process;
        volatile boolean cancelled;
    }

    public void register(UUID buildId) {
        runningBuilds.put(buildId, new RunningBuild());
    }

    /**
     * Unregister a finished build. Cleans up all state.
     */
    public void release(UUID buildId) {
        runningBuilds.remove(buildId);
    }

    public boolean isRunningHere(UUID buildId) {
        return runningBuilds.containsKey(buildId);
    }

    /**
     * Records {@code process} as the tool currently running for {@code buildId}. If the build
     * was cancelled in the meantime the process is killed straight away.
     */
    public void track(UUID buildId, Process process) {
        RunningBuild running = runningBuilds.get(buildId);
        if (running == null) {
            return;
        }
        running.process = process;
        if (running.cancelled) {
            commandRunner.killProcessTree(process.pid());
        }
    }

    public boolean isCancelled(UUID buildId) {
        RunningBuild running = runningBuilds.get(buildId);
        return running != null && running.cancelled;
    }

    /**
     * Flags the build as cancelled and kills the process tree of its current tool.
     * Returns true when a live process was killed.
     */
    public boolean cancel(UUID buildId) {
        RunningBuild running = runningBuilds.get(buildId);
        if (running == null) {
            return false;
        }
        running.cancelled = true;
        Process process = running.process;
        if (process == null || !process.isAlive()) {
            return false;
        }
        log.info("Killing toolchain process {} for build {}", process.pid(), buildId);
        return commandRunner.killProcessTree(process.pid());
    }
}
