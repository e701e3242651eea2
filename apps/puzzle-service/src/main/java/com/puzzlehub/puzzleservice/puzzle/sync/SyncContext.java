package com.puzzlehub.puzzleservice.puzzle.sync;

import com.puzzlehub.puzzleservice.infrastructure.store.SharedStore;
import com.puzzlehub.puzzleservice.infrastructure.store.StoreCodec;
import com.puzzlehub.puzzleservice.puzzle.config.PuzzleSyncProperties;
import com.puzzlehub.puzzleservice.puzzle.sync.event.PuzzleEventBus;

import java.time.Clock;

/**
 * 单个参与者客户端内各组件共享的依赖
 */
public record SyncContext(ParticipantContext participant,
                          SharedStore store,
                          StoreCodec codec,
                          PuzzleSyncProperties props,
                          Clock clock,
                          SessionCache cache,
                          LocalPieceView view,
                          SyncStatusTracker status,
                          PuzzleEventBus events) {

    public String sessionId() {
        return participant.sessionId();
    }

    public String me() {
        return participant.participantId();
    }

    public long now() {
        return clock.millis();
    }
}
