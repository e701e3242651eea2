package com.puzzlehub.puzzleservice.puzzle.application;

import com.puzzlehub.puzzleservice.infrastructure.store.StoreUnavailableException;
import com.puzzlehub.puzzleservice.puzzle.config.PuzzleSyncProperties;
import com.puzzlehub.puzzleservice.puzzle.sync.ParticipantContext;
import com.puzzlehub.puzzleservice.puzzle.sync.ParticipantSyncClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionMaintenanceCoordinatorTest {

    private ParticipantClientRegistry registry;
    private ScheduledExecutorService scheduler;
    private PuzzleSyncProperties props;
    private SessionMaintenanceCoordinator coordinator;

    @BeforeEach
    void setUp() {
        registry = mock(ParticipantClientRegistry.class);
        scheduler = mock(ScheduledExecutorService.class);
        props = new PuzzleSyncProperties();
        props.setHeartbeatInterval(Duration.ofSeconds(4));
        coordinator = new SessionMaintenanceCoordinator(registry, props, scheduler);
    }

    private static ParticipantSyncClient client(String sessionId, String userId) {
        ParticipantSyncClient c = mock(ParticipantSyncClient.class);
        when(c.participant()).thenReturn(new ParticipantContext(sessionId, userId, "conn-" + userId));
        return c;
    }

    @Test
    void readySchedulesHeartbeatSweepAndReconcile() {
        coordinator.onReady();

        verify(scheduler).scheduleWithFixedDelay(any(Runnable.class), eq(4_000L), eq(4_000L), eq(TimeUnit.MILLISECONDS));
        verify(scheduler).scheduleWithFixedDelay(any(Runnable.class), eq(2_000L), eq(2_000L), eq(TimeUnit.MILLISECONDS));
        verify(scheduler).scheduleWithFixedDelay(any(Runnable.class), eq(10_000L), eq(10_000L), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void heartbeatCoversEveryLocalClientDespiteFailures() {
        ParticipantSyncClient alice = client("s-1", "alice");
        ParticipantSyncClient bob = client("s-1", "bob");
        ParticipantSyncClient carol = client("s-2", "carol");
        when(bob.heartbeat()).thenThrow(new StoreUnavailableException("down"));
        when(registry.all()).thenReturn(List.of(alice, bob, carol));

        coordinator.heartbeatAll();

        verify(alice).heartbeat();
        verify(bob).heartbeat();
        verify(carol).heartbeat();
    }

    @Test
    void sweepRunsOncePerSession() {
        ParticipantSyncClient alice = client("s-1", "alice");
        ParticipantSyncClient carol = client("s-2", "carol");
        when(registry.onePerSession()).thenReturn(List.of(alice, carol));

        coordinator.sweepAll();

        verify(alice).sweep();
        verify(carol).sweep();
    }
}
