package com.puzzlehub.puzzleservice.puzzle.sync;

import com.puzzlehub.puzzleservice.infrastructure.store.StoreChange;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.ParticipantRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.PieceRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.Difficulty;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.DropResult;
import com.puzzlehub.puzzleservice.puzzle.domain.model.Vec3;
import com.puzzlehub.puzzleservice.puzzle.infrastructure.store.PuzzleKeys;
import com.puzzlehub.puzzleservice.puzzle.sync.event.PieceView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PiecePositionSynchronizerTest {

    private SyncFixture fx;
    private ParticipantSyncClient alice;
    private ParticipantSyncClient bob;
    private RecordingListener aliceEvents;
    private RecordingListener bobEvents;
    private String pieceId;

    @BeforeEach
    void setUp() {
        fx = new SyncFixture();
        alice = fx.host("alice", Difficulty.EASY);
        bob = fx.joined("bob");
        alice.start();
        aliceEvents = new RecordingListener();
        bobEvents = new RecordingListener();
        alice.addListener(aliceEvents);
        bob.addListener(bobEvents);
        pieceId = fx.pieceIds().get(0);
    }

    private PieceView view(ParticipantSyncClient c, String id) {
        return c.pieces().stream().filter(p -> p.id().equals(id)).findFirst().orElseThrow();
    }

    // ── move ───────────────────────────────────────────────────────────────

    @Test
    void movesStreamToObservers() {
        alice.grab(pieceId);

        assertThat(alice.move(pieceId, new Vec3(0.1, 0.2, 0.05), 15)).isTrue();

        PieceView seen = view(bob, pieceId);
        assertThat(seen.currentPosition()).isEqualTo(new Vec3(0.1, 0.2, 0.05));
        assertThat(seen.rotation()).isEqualTo(15.0);
        assertThat(fx.piece(pieceId).getLastUpdatedBy()).isEqualTo("alice");
    }

    @Test
    void moveWithoutLockIsIgnored() {
        PieceRecord before = fx.piece(pieceId);

        assertThat(bob.move(pieceId, new Vec3(0.3, 0.3, 0), 0)).isFalse();
        assertThat(fx.piece(pieceId)).isEqualTo(before);
    }

    @Test
    void movesAfterTakeoverAreRejected() {
        alice.grab(pieceId);
        fx.clock.advance(fx.props.getLockTtl().toMillis());
        bob.grab(pieceId);
        bob.move(pieceId, new Vec3(0.7, 0.7, 0), 0);
        PieceRecord before = fx.piece(pieceId);

        assertThat(alice.move(pieceId, new Vec3(-0.7, -0.7, 0), 0)).isFalse();

        assertThat(fx.piece(pieceId)).isEqualTo(before);
    }

    @Test
    void staleOwnerCannotOverwriteNewOwnerEvenWithLaggingView() {
        alice.grab(pieceId);
        // 断开订阅：alice 收不到接管通知，本地仍以为自己持锁
        alice.detach();
        fx.clock.advance(fx.props.getLockTtl().toMillis());
        bob.grab(pieceId);
        bob.move(pieceId, new Vec3(0.7, 0.7, 0), 0);
        PieceRecord before = fx.piece(pieceId);
        fx.clock.advance(1_000);

        assertThat(alice.move(pieceId, new Vec3(-0.7, -0.7, 0), 0)).isFalse();

        PieceRecord after = fx.piece(pieceId);
        assertThat(after).isEqualTo(before);
        assertThat(after.getLockOwner()).isEqualTo("bob");
        assertThat(after.getLockTimestamp()).isEqualTo(before.getLockTimestamp());
        // 被拒后以存储为准纠正本地持锁者，后续 move 在本地即被拦下
        assertThat(view(alice, pieceId).lockOwner()).isEqualTo("bob");
        assertThat(alice.move(pieceId, new Vec3(-0.7, -0.7, 0), 0)).isFalse();
    }

    @Test
    void ownEchoesAreSuppressedWhileDragging() {
        alice.grab(pieceId);
        aliceEvents.clear();
        bobEvents.clear();

        for (int i = 1; i <= 3; i++) {
            alice.move(pieceId, new Vec3(0.1 * i, 0, 0), 0);
        }

        assertThat(aliceEvents.pieceUpdates).isEmpty();
        assertThat(bobEvents.pieceUpdates).hasSize(3);
        assertThat(view(alice, pieceId).currentPosition().x()).isCloseTo(0.3, within(1e-9));
    }

    @Test
    void outOfOrderUpdateIsDiscarded() {
        alice.grab(pieceId);
        alice.move(pieceId, new Vec3(0.5, 0.5, 0), 0);
        PieceRecord current = fx.piece(pieceId);
        PieceRecord older = current.toBuilder().seq(current.getSeq() - 1).x(-0.9).build();

        bob.onChange(StoreChange.of(PuzzleKeys.piece(SyncFixture.SESSION, pieceId), fx.codec.toFields(older)));

        assertThat(view(bob, pieceId).currentPosition().x()).isEqualTo(0.5);
    }

    @Test
    void updateFromEarlierEpochIsDiscarded() {
        PieceRecord current = fx.piece(pieceId);
        PieceRecord stale = current.toBuilder().epoch(current.getEpoch() - 1).seq(current.getSeq() + 100).x(-0.9).build();

        bob.onChange(StoreChange.of(PuzzleKeys.piece(SyncFixture.SESSION, pieceId), fx.codec.toFields(stale)));

        assertThat(view(bob, pieceId).currentPosition().x()).isEqualTo(current.getX());
    }

    // ── drop ───────────────────────────────────────────────────────────────

    @Test
    void dropNearTargetSnapsAndMarksPlaced() {
        Vec3 target = fx.target(pieceId);
        alice.grab(pieceId);

        DropResult r = alice.drop(pieceId, new Vec3(target.x() + 0.1, target.y() - 0.1, 0), 0);

        assertThat(r).isEqualTo(DropResult.PLACED);
        PieceRecord stored = fx.piece(pieceId);
        assertThat(stored.isPlaced()).isTrue();
        assertThat(stored.getPlacedBy()).isEqualTo("alice");
        assertThat(stored.getLockOwner()).isEmpty();
        assertThat(stored.getX()).isEqualTo(target.x());
        assertThat(stored.getY()).isEqualTo(target.y());
        assertThat(view(bob, pieceId).placed()).isTrue();
        assertThat(bobEvents.placed).singleElement()
                .satisfies(e -> assertThat(e.participantId()).isEqualTo("alice"));
        assertThat(aliceEvents.placed).hasSize(1);
    }

    @Test
    void dropFarFromTargetStaysWhereReleased() {
        Vec3 target = fx.target(pieceId);
        alice.grab(pieceId);
        Vec3 far = new Vec3(target.x() + 0.5, target.y(), 0);

        assertThat(alice.drop(pieceId, far, 0)).isEqualTo(DropResult.DROPPED);

        PieceRecord stored = fx.piece(pieceId);
        assertThat(stored.isPlaced()).isFalse();
        assertThat(stored.getLockOwner()).isEmpty();
        assertThat(stored.getX()).isEqualTo(far.x());
        assertThat(bobEvents.placed).isEmpty();
    }

    @Test
    void dropWithoutLockIsNotOwner() {
        assertThat(bob.drop(pieceId, fx.target(pieceId), 0)).isEqualTo(DropResult.NOT_OWNER);
        assertThat(fx.piece(pieceId).isPlaced()).isFalse();
    }

    @Test
    void cancelKeepsLastStreamedPosition() {
        alice.grab(pieceId);
        alice.move(pieceId, new Vec3(0.7, -0.2, 0), 0);

        alice.cancel(pieceId);

        PieceRecord stored = fx.piece(pieceId);
        assertThat(stored.getLockOwner()).isEmpty();
        assertThat(stored.isPlaced()).isFalse();
        assertThat(stored.getX()).isEqualTo(0.7);
    }

    @Test
    void seqIsMonotonicAcrossGrabMoveDrop() {
        long start = fx.piece(pieceId).getSeq();
        alice.grab(pieceId);
        alice.move(pieceId, new Vec3(0.1, 0, 0), 0);
        alice.move(pieceId, new Vec3(0.2, 0, 0), 0);
        alice.drop(pieceId, new Vec3(0.9, 0.9, 0), 0);

        assertThat(fx.piece(pieceId).getSeq()).isEqualTo(start + 4);
    }

    // ── scoring ────────────────────────────────────────────────────────────

    @Test
    void quickPlacementsBuildCombo() {
        String second = fx.pieceIds().get(1);

        fx.place(alice, pieceId);
        fx.clock.advance(1_000);
        fx.place(alice, second);

        ParticipantRecord p = fx.participant("alice");
        // 150（基础 + 快速），然后 100 + 50 + 25 × 1
        assertThat(p.getPoints()).isEqualTo(150 + 175);
        assertThat(p.getAccurateDrops()).isEqualTo(2);
        assertThat(p.getMoveCount()).isEqualTo(2);
        assertThat(p.getMaxCombo()).isEqualTo(1);
        assertThat(fx.piece(second).getPlacedPoints()).isEqualTo(175);
    }

    @Test
    void slowPlacementGetsBaseOnly() {
        alice.grab(pieceId);
        fx.clock.advance(fx.props.getScoring().getQuickPlacementThreshold().toMillis());
        alice.move(pieceId, new Vec3(0, 0, 0), 0);

        alice.drop(pieceId, fx.target(pieceId), 0);

        assertThat(fx.participant("alice").getPoints()).isEqualTo(100);
    }

    @Test
    void missResetsCombo() {
        String second = fx.pieceIds().get(1);
        String third = fx.pieceIds().get(2);
        fx.place(alice, pieceId);
        fx.place(alice, second);
        assertThat(fx.participant("alice").getComboCount()).isEqualTo(1);

        alice.grab(third);
        alice.drop(third, new Vec3(5, 5, 0), 0);

        ParticipantRecord p = fx.participant("alice");
        assertThat(p.getComboCount()).isZero();
        assertThat(p.getMaxCombo()).isEqualTo(1);
        assertThat(p.getMoveCount()).isEqualTo(3);
        assertThat(p.getAccurateDrops()).isEqualTo(2);
    }
}
