package com.appbuilder.service;

import com.appbuilder.config.BuildProperties;
import com.appbuilder.dto.CleanupReport;
import com.appbuilder.dto.CleanupRequest;
import com.appbuilder.model.Build;
import com.appbuilder.model.enums.BuildStatus;
import com.appbuilder.repository.BuildRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.CronTrigger;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("BuildDispatcher Tests")
class BuildDispatcherTest {

    @Mock
    private BuildRepository repository;

    @Mock
    private BuildService buildService;

    @Mock
    private BuildCleanupService cleanupService;

    @Mock
    private TaskScheduler taskScheduler;

    private final List<Runnable> queued = new ArrayList<>();
    private BuildProperties properties;
    private BuildDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        properties = new BuildProperties();
        TaskExecutor collectingExecutor = queued::add;
        dispatcher = new BuildDispatcher(repository, buildService, cleanupService,
                collectingExecutor, taskScheduler, properties);
    }

    private void runQueued() {
        List<Runnable> tasks = new ArrayList<>(queued);
        queued.clear();
        tasks.forEach(Runnable::run);
    }

    // ============================================================================
    // Dispatch
    // ============================================================================

    @Test
    @DisplayName("Should queue a build only once until it has run")
    void testDispatch_Deduplicates() {
        UUID buildId = UUID.randomUUID();

        assertTrue(dispatcher.dispatch(buildId));
        assertFalse(dispatcher.dispatch(buildId));
        assertEquals(1, queued.size());
        assertTrue(dispatcher.isDispatched(buildId));

        runQueued();

        verify(buildService).processBuild(buildId);
        assertFalse(dispatcher.isDispatched(buildId));
        assertTrue(dispatcher.dispatch(buildId));
    }

    @Test
    @DisplayName("Should forget a build the executor rejected")
    void testDispatch_Rejected() {
        TaskExecutor rejecting = task -> {
            throw new TaskRejectedException("queue full");
        };
        dispatcher = new BuildDispatcher(repository, buildService, cleanupService, rejecting, taskScheduler, properties);
        UUID buildId = UUID.randomUUID();

        assertFalse(dispatcher.dispatch(buildId));
        assertFalse(dispatcher.isDispatched(buildId));
    }

    @Test
    @DisplayName("Should release the build even when the pipeline throws")
    void testDispatch_PipelineThrows() {
        UUID buildId = UUID.randomUUID();
        doThrow(new IllegalStateException("database down")).when(buildService).processBuild(buildId);
        dispatcher.dispatch(buildId);

        assertDoesNotThrow(this::runQueued);
        assertFalse(dispatcher.isDispatched(buildId));
    }

    @Test
    @DisplayName("Should dispatch pending builds in creation order")
    void testDispatchPendingBuilds() {
        Build first = Build.builder().id(UUID.randomUUID()).status(BuildStatus.PENDING).build();
        Build second = Build.builder().id(UUID.randomUUID()).status(BuildStatus.PENDING).build();
        when(repository.findByStatusOrderByCreatedAtAsc(BuildStatus.PENDING)).thenReturn(List.of(first, second));
        dispatcher.dispatch(second.getId());

        assertEquals(1, dispatcher.dispatchPendingBuilds());
        runQueued();

        InOrder order = inOrder(buildService);
        order.verify(buildService).processBuild(second.getId());
        order.verify(buildService).processBuild(first.getId());
    }

    // ============================================================================
    // Periodic tasks
    // ============================================================================

    @Test
    @DisplayName("Should register the sweep, purge and queue tasks with their cron triggers")
    void testRegisterPeriodicTasks() {
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Trigger.class));

        dispatcher.registerPeriodicTasks();

        ArgumentCaptor<Trigger> triggers = ArgumentCaptor.forClass(Trigger.class);
        verify(taskScheduler, times(3)).schedule(any(Runnable.class), triggers.capture());
        assertThat(triggers.getAllValues())
                .extracting(t -> ((CronTrigger) t).getExpression())
                .containsExactly("0 */15 * * * *", "0 0 3 * * *", "*/30 * * * * *");

        dispatcher.cancelPeriodicTasks();

        verify(future, times(3)).cancel(false);
    }

    @Test
    @DisplayName("Should not register anything when the scheduler is disabled")
    void testRegisterPeriodicTasks_Disabled() {
        properties.getScheduler().setEnabled(false);

        dispatcher.registerPeriodicTasks();

        verifyNoInteractions(taskScheduler);
    }

    @Test
    @DisplayName("Should keep the scheduler alive when a sweep fails")
    void testSweepStaleBuilds_Failure() {
        when(buildService.sweepStaleBuilds()).thenThrow(new IllegalStateException("lock timeout"));

        assertEquals(0, dispatcher.sweepStaleBuilds());
    }

    @Test
    @DisplayName("Should purge with orphan and temp cleanup enabled")
    void testPurgeOldBuilds() {
        CleanupReport expected = CleanupReport.builder().buildsDeleted(4).build();
        when(cleanupService.purge(any())).thenReturn(expected);

        assertSame(expected, dispatcher.purgeOldBuilds(14, true));

        ArgumentCaptor<CleanupRequest> request = ArgumentCaptor.forClass(CleanupRequest.class);
        verify(cleanupService).purge(request.capture());
        assertEquals(14, request.getValue().getRetentionDays());
        assertTrue(request.getValue().isKeepSuccessful());
        assertFalse(request.getValue().isKeepFailed());
        assertTrue(request.getValue().isCleanOrphans());
        assertTrue(request.getValue().isCleanTemp());
        assertFalse(request.getValue().isDryRun());
    }
}
