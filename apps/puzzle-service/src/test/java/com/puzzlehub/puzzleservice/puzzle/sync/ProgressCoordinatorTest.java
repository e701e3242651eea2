package com.puzzlehub.puzzleservice.puzzle.sync;

import com.puzzlehub.puzzleservice.infrastructure.store.StoreChange;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.ProgressRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.Difficulty;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.SessionPhase;
import com.puzzlehub.puzzleservice.puzzle.infrastructure.store.PuzzleKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressCoordinatorTest {

    private SyncFixture fx;
    private ParticipantSyncClient alice;
    private ParticipantSyncClient bob;
    private RecordingListener aliceEvents;
    private RecordingListener bobEvents;

    @BeforeEach
    void setUp() {
        fx = new SyncFixture();
    }

    private void startGame() {
        alice = fx.host("alice", Difficulty.EASY);
        bob = fx.joined("bob");
        aliceEvents = new RecordingListener();
        bobEvents = new RecordingListener();
        alice.addListener(aliceEvents);
        bob.addListener(bobEvents);
        alice.start();
    }

    private void placeAll() {
        List<String> ids = fx.pieceIds();
        for (int i = 0; i < ids.size(); i++) {
            fx.place(i % 2 == 0 ? alice : bob, ids.get(i));
            fx.clock.advance(3_000);
        }
    }

    // ── counting ───────────────────────────────────────────────────────────

    @Test
    void startInitializesProgress() {
        startGame();

        ProgressRecord p = alice.progress();
        assertThat(p.getEpoch()).isEqualTo(1L);
        assertThat(p.getCompletedCount()).isZero();
        assertThat(p.getTotalPieceCount()).isEqualTo(6);
        assertThat(p.percent()).isZero();
    }

    @Test
    void placementObservedByEveryoneCountsOnce() {
        startGame();

        fx.place(alice, fx.pieceIds().get(0));

        assertThat(fx.progress().getCompletedCount()).isEqualTo(1);
        assertThat(fx.progress().getLastPlacedBy()).isEqualTo("alice");
        assertThat(bobEvents.progress).isNotEmpty();
        assertThat(bobEvents.progress.get(bobEvents.progress.size() - 1).getCompletedCount()).isEqualTo(1);
    }

    @Test
    void replayedPlacementDoesNotDoubleCount() {
        startGame();
        String pieceId = fx.pieceIds().get(0);
        fx.place(alice, pieceId);
        Map<String, Object> placed = fx.store.read(PuzzleKeys.piece(SyncFixture.SESSION, pieceId));

        // 一个尚未加载快照的观察者反复收到同一条放置
        ParticipantSyncClient late = fx.client("carol");
        late.onChange(StoreChange.of(PuzzleKeys.piece(SyncFixture.SESSION, pieceId), placed));
        late.onChange(StoreChange.of(PuzzleKeys.piece(SyncFixture.SESSION, pieceId), placed));

        assertThat(fx.progress().getCompletedCount()).isEqualTo(1);
    }

    // ── reconcile ──────────────────────────────────────────────────────────

    @Test
    void reconcileRestoresMissedIncrement() {
        startGame();
        fx.place(alice, fx.pieceIds().get(0));
        fx.place(bob, fx.pieceIds().get(1));
        // 模拟丢失的自增：计数与标记都回到 0
        fx.store.write(PuzzleKeys.progress(SyncFixture.SESSION),
                Map.of("epoch", 1L, "completedCount", 0, "totalPieceCount", 6));

        ProgressRecord repaired = bob.reconcile();

        assertThat(repaired.getCompletedCount()).isEqualTo(2);
        assertThat(fx.store.read(PuzzleKeys.progress(SyncFixture.SESSION)))
                .containsKeys("placed:" + fx.pieceIds().get(0), "placed:" + fx.pieceIds().get(1));
    }

    @Test
    void reconcileWithoutDriftWritesNothing() {
        startGame();
        fx.place(alice, fx.pieceIds().get(0));
        AtomicInteger writes = new AtomicInteger();
        fx.store.subscribe(PuzzleKeys.progress(SyncFixture.SESSION), change -> writes.incrementAndGet());

        ProgressRecord p = bob.reconcile();

        assertThat(p.getCompletedCount()).isEqualTo(1);
        assertThat(writes).hasValue(0);
    }

    @Test
    void reconcileBeforePuzzleIsConfiguredReturnsNull() {
        ParticipantSyncClient host = fx.client("alice");
        host.createSession();
        host.attach();

        assertThat(host.reconcile()).isNull();
    }

    @Test
    void reconcileCompletesWhenLastIncrementWasLost() {
        startGame();
        List<String> ids = fx.pieceIds();
        for (String id : ids.subList(0, ids.size() - 1)) {
            fx.place(alice, id);
        }
        // 最后一块绕过客户端直接写入存储（例如放置者在自增前崩溃）
        String last = ids.get(ids.size() - 1);
        fx.store.update(PuzzleKeys.piece(SyncFixture.SESSION, last),
                Map.of("placed", true, "placedBy", "alice", "placedAt", fx.clock.millis(), "placedPoints", 100L));
        fx.store.write(PuzzleKeys.progress(SyncFixture.SESSION),
                Map.of("epoch", 1L, "completedCount", ids.size() - 1, "totalPieceCount", ids.size()));
        assertThat(fx.session().getPhase()).isEqualTo(SessionPhase.PLAYING);
        fx.published.clear();

        bob.reconcile();

        assertThat(fx.session().getPhase()).isEqualTo(SessionPhase.COMPLETED);
        assertThat(fx.published).hasSize(1);
    }

    // ── completion ─────────────────────────────────────────────────────────

    @Test
    void completionIsPublishedExactlyOnce() {
        startGame();

        placeAll();
        bob.reconcile();
        alice.reconcile();

        assertThat(fx.published).hasSize(1);
        assertThat(aliceEvents.completions).hasSize(1);
        assertThat(bobEvents.completions).hasSize(1);
        assertThat(fx.progress().percent()).isEqualTo(100);
        assertThat(fx.session().getPhase()).isEqualTo(SessionPhase.COMPLETED);
    }

    @Test
    void failingSinkDoesNotUndoCompletion() {
        fx.sink = record -> {
            throw new IllegalStateException("broker down");
        };
        startGame();

        placeAll();

        assertThat(fx.session().getPhase()).isEqualTo(SessionPhase.COMPLETED);
        assertThat(alice.completion()).isNotNull();
        assertThat(aliceEvents.completions).hasSize(1);
        assertThat(bobEvents.completions).hasSize(1);
    }
}
