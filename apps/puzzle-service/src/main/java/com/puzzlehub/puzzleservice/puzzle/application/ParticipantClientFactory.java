package com.puzzlehub.puzzleservice.puzzle.application;

import com.puzzlehub.puzzleservice.infrastructure.store.SharedStore;
import com.puzzlehub.puzzleservice.infrastructure.store.StoreCodec;
import com.puzzlehub.puzzleservice.puzzle.config.PuzzleSyncProperties;
import com.puzzlehub.puzzleservice.puzzle.sync.CompletionSink;
import com.puzzlehub.puzzleservice.puzzle.sync.ParticipantContext;
import com.puzzlehub.puzzleservice.puzzle.sync.ParticipantSyncClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 组装参与者同步客户端：每个客户端拿到独立的连接标识，只共享存储与配置。
 */
@Component
public class ParticipantClientFactory {

    private final SharedStore store;
    private final StoreCodec codec;
    private final PuzzleSyncProperties props;
    private final Clock clock;
    private final CompletionSink completionSink;
    private final ScheduledExecutorService scheduler;
    private final Random random = new SecureRandom();

    public ParticipantClientFactory(SharedStore store,
                                    StoreCodec codec,
                                    PuzzleSyncProperties props,
                                    Clock clock,
                                    CompletionSink completionSink,
                                    @Qualifier("puzzleMaintenanceScheduler") ScheduledExecutorService scheduler) {
        this.store = store;
        this.codec = codec;
        this.props = props;
        this.clock = clock;
        this.completionSink = completionSink;
        this.scheduler = scheduler;
    }

    public ParticipantSyncClient create(String sessionId, String participantId) {
        ParticipantContext ctx = new ParticipantContext(sessionId, participantId, "conn-" + UUID.randomUUID());
        return new ParticipantSyncClient(ctx, store, codec, props, clock, random, completionSink, scheduler);
    }
}
