package com.puzzlehub.puzzleservice.puzzle.sync;

import com.puzzlehub.puzzleservice.puzzle.domain.enums.SyncStatus;
import com.puzzlehub.puzzleservice.puzzle.sync.event.PuzzleEventBus;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 同步状态：仅在状态变化时通知渲染层。
 */
@Slf4j
public class SyncStatusTracker {

    private final ParticipantContext ctx;
    private final PuzzleEventBus events;
    private final AtomicReference<SyncStatus> status = new AtomicReference<>(SyncStatus.CONNECTED);

    public SyncStatusTracker(ParticipantContext ctx, PuzzleEventBus events) {
        this.ctx = ctx;
        this.events = events;
    }

    public SyncStatus current() {
        return status.get();
    }

    public void connected() {
        transition(SyncStatus.CONNECTED);
    }

    public void degraded(String operation) {
        if (transition(SyncStatus.DEGRADED)) {
            log.warn("同步降级（冲突重试耗尽）: sessionId={}, participantId={}, op={}",
                    ctx.sessionId(), ctx.participantId(), operation);
        }
    }

    public void reconnecting(RuntimeException cause) {
        if (transition(SyncStatus.RECONNECTING)) {
            log.warn("共享存储不可达，进入重连: sessionId={}, participantId={}, cause={}",
                    ctx.sessionId(), ctx.participantId(), cause.getMessage());
        }
    }

    private boolean transition(SyncStatus next) {
        SyncStatus prev = status.getAndSet(next);
        if (prev == next) {
            return false;
        }
        events.fire(l -> l.onSyncStatusChanged(next));
        return true;
    }
}
