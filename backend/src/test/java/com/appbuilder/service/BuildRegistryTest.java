package com.appbuilder.service;

import com.appbuilder.util.CommandRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@DisplayName("BuildRegistry Tests")
class BuildRegistryTest {

    private CommandRunner commandRunner;
    private BuildRegistry registry;
    private final UUID buildId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        commandRunner = mock(CommandRunner.class);
        registry = new BuildRegistry(commandRunner);
    }

    private Process liveProcess(long pid) {
        Process process = mock(Process.class);
        when(process.pid()).thenReturn(pid);
        when(process.isAlive()).thenReturn(true);
        return process;
    }

    @Test
    @DisplayName("Should kill the tracked process when a running build is cancelled")
    void testCancel_KillsTrackedProcess() {
        registry.register(buildId);
        registry.track(buildId, liveProcess(4242L));
        when(commandRunner.killProcessTree(4242L)).thenReturn(true);

        assertTrue(registry.cancel(buildId));
        assertTrue(registry.isCancelled(buildId));
        verify(commandRunner).killProcessTree(4242L);
    }

    @Test
    @DisplayName("Should kill a process started after the cancel arrived")
    void testTrack_AfterCancel() {
        registry.register(buildId);
        assertFalse(registry.cancel(buildId));

        registry.track(buildId, liveProcess(7L));

        verify(commandRunner).killProcessTree(7L);
    }

    @Test
    @DisplayName("Should ignore builds not running on this node")
    void testCancel_Unknown() {
        assertFalse(registry.cancel(buildId));
        assertFalse(registry.isCancelled(buildId));
        registry.track(buildId, liveProcess(9L));
        verify(commandRunner, never()).killProcessTree(anyLong());
    }

    @Test
    @DisplayName("Should forget cancellation once the build is released")
    void testRelease() {
        registry.register(buildId);
        registry.cancel(buildId);
        assertTrue(registry.isRunningHere(buildId));

        registry.release(buildId);

        assertFalse(registry.isRunningHere(buildId));
        assertFalse(registry.isCancelled(buildId));
        registry.register(buildId);
        assertFalse(registry.isCancelled(buildId));
    }
}
