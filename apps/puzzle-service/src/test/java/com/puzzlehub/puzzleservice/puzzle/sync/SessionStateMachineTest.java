package com.puzzlehub.puzzleservice.puzzle.sync;

import com.puzzlehub.puzzleservice.puzzle.domain.constants.PuzzleMessages;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.ParticipantRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.PieceRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.SessionRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.Difficulty;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.DropResult;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.LockResult;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.SessionPhase;
import com.puzzlehub.puzzleservice.puzzle.domain.model.PuzzleGeometry;
import com.puzzlehub.puzzleservice.puzzle.infrastructure.store.PuzzleKeys;
import com.puzzlehub.puzzleservice.puzzle.sync.event.PieceView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionStateMachineTest {

    private SyncFixture fx;
    private ParticipantSyncClient alice;
    private ParticipantSyncClient bob;
    private RecordingListener bobEvents;

    @BeforeEach
    void setUp() {
        fx = new SyncFixture();
        alice = fx.host("alice", Difficulty.EASY);
        bob = fx.joined("bob");
        bobEvents = new RecordingListener();
        bob.addListener(bobEvents);
    }

    // ── create / configure ─────────────────────────────────────────────────

    @Test
    void createdSessionWaitsWithCreatorAsHost() {
        SessionRecord s = fx.session();

        assertThat(s.getPhase()).isEqualTo(SessionPhase.WAITING);
        assertThat(s.getEpoch()).isEqualTo(1L);
        assertThat(s.getHostId()).isEqualTo("alice");
        assertThat(fx.participant("alice").isHost()).isTrue();
        assertThat(fx.participant("bob").isHost()).isFalse();
    }

    @Test
    void creatingExistingSessionFails() {
        assertThatThrownBy(() -> fx.client("mallory").createSession())
                .isInstanceOf(IllegalStateException.class)
                .hasMessage(PuzzleMessages.SESSION_EXISTS);
        assertThat(fx.session().getHostId()).isEqualTo("alice");
    }

    @Test
    void onlyHostMayConfigureOrStart() {
        assertThatThrownBy(() -> bob.configurePuzzle(fx.puzzle()))
                .hasMessage(PuzzleMessages.ONLY_HOST);
        assertThatThrownBy(bob::start)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage(PuzzleMessages.ONLY_HOST);
    }

    @Test
    void startRequiresConfiguredPuzzle() {
        SyncFixture other = new SyncFixture();
        ParticipantSyncClient host = other.client("alice");
        host.createSession();
        host.attach();

        assertThatThrownBy(host::start)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage(PuzzleMessages.PUZZLE_NOT_CONFIGURED);
    }

    @Test
    void puzzleCannotChangeOnceStarted() {
        alice.start();

        assertThatThrownBy(() -> alice.configurePuzzle(PuzzleGeometry.configure("p-2", "https://img.example/dog.png",
                100, 100, Difficulty.HARD, null, null)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("PHASE_NOT_ALLOWED");
    }

    // ── start / pause / resume ─────────────────────────────────────────────

    @Test
    void startScramblesPiecesAndNotifiesObservers() {
        alice.start();

        assertThat(fx.session().getPhase()).isEqualTo(SessionPhase.PLAYING);
        assertThat(fx.session().getStartedAt()).isEqualTo(SyncFixture.T0);
        for (String id : fx.pieceIds()) {
            PieceRecord p = fx.piece(id);
            assertThat(p.getEpoch()).isEqualTo(1L);
            assertThat(p.isPlaced()).isFalse();
            assertThat(p.getLockOwner()).isEmpty();
        }
        assertThat(bobEvents.phases).containsExactly(SessionPhase.PLAYING);
    }

    @Test
    void startTwiceIsRejected() {
        alice.start();

        assertThatThrownBy(alice::start).hasMessageStartingWith("PHASE_NOT_ALLOWED");
    }

    @Test
    void pauseIsOnlyAllowedWhilePlaying() {
        assertThatThrownBy(alice::pause).hasMessageStartingWith("PHASE_NOT_ALLOWED");
        assertThatThrownBy(alice::resume).hasMessageStartingWith("PHASE_NOT_ALLOWED");
    }

    @Test
    void pauseAndResumeGateInteraction() {
        alice.start();
        String pieceId = fx.pieceIds().get(0);

        alice.pause();
        assertThat(bob.grab(pieceId)).isEqualTo(LockResult.NOT_PLAYING);

        alice.resume();
        assertThat(bob.grab(pieceId)).isEqualTo(LockResult.GRANTED);
        assertThat(bobEvents.phases).containsExactly(SessionPhase.PLAYING, SessionPhase.PAUSED, SessionPhase.PLAYING);
    }

    @Test
    void elapsedTimeExcludesPauses() {
        alice.start();
        fx.clock.advance(10_000);
        alice.pause();
        fx.clock.advance(60_000);
        assertThat(bob.elapsedMillis()).isEqualTo(10_000L);

        alice.resume();
        fx.clock.advance(5_000);

        assertThat(bob.elapsedMillis()).isEqualTo(15_000L);
        assertThat(fx.session().getPausedTotalMillis()).isEqualTo(60_000L);
    }

    // ── reset ──────────────────────────────────────────────────────────────

    @Test
    void resetFromWaitingIsRejected() {
        assertThatThrownBy(alice::reset).hasMessageStartingWith("PHASE_NOT_ALLOWED");
    }

    @Test
    void resetStartsNewEpochWithFreshBoard() {
        alice.start();
        String pieceId = fx.pieceIds().get(0);
        fx.place(bob, pieceId);

        SessionRecord reset = alice.reset();

        assertThat(reset.getEpoch()).isEqualTo(2L);
        assertThat(reset.getPhase()).isEqualTo(SessionPhase.WAITING);
        assertThat(reset.getStartedAt()).isZero();
        assertThat(fx.piece(pieceId).isPlaced()).isFalse();
        assertThat(fx.piece(pieceId).getEpoch()).isEqualTo(2L);
        assertThat(fx.progress().getEpoch()).isEqualTo(2L);
        assertThat(fx.progress().getCompletedCount()).isZero();
        ParticipantRecord scored = fx.participant("bob");
        assertThat(scored.getEpoch()).isEqualTo(2L);
        assertThat(scored.getPoints()).isZero();
        assertThat(scored.getMoveCount()).isZero();
        assertThat(bob.pieces()).noneMatch(PieceView::placed);
        assertThat(bobEvents.phases).endsWith(SessionPhase.WAITING);
    }

    @Test
    void resetDiscardsInFlightDragFromPreviousEpoch() {
        alice.start();
        String pieceId = fx.pieceIds().get(0);
        bob.grab(pieceId);

        alice.reset();
        alice.start();

        assertThat(fx.piece(pieceId).getLockOwner()).isEmpty();
        assertThat(bob.drop(pieceId, fx.target(pieceId), 0)).isEqualTo(DropResult.NOT_OWNER);
        assertThat(fx.piece(pieceId).isPlaced()).isFalse();
    }

    // ── teardown ───────────────────────────────────────────────────────────

    @Test
    void nonHostCannotTearDown() {
        assertThatThrownBy(bob::teardown).hasMessage(PuzzleMessages.ONLY_HOST);
    }

    @Test
    void teardownRemovesEverythingAndEndsSession() {
        alice.start();
        String pieceId = fx.pieceIds().get(0);

        alice.teardown();

        assertThat(fx.store.read(PuzzleKeys.session(SyncFixture.SESSION))).isEmpty();
        assertThat(fx.store.read(PuzzleKeys.puzzle(SyncFixture.SESSION))).isEmpty();
        assertThat(fx.store.read(PuzzleKeys.progress(SyncFixture.SESSION))).isEmpty();
        assertThat(fx.store.read(PuzzleKeys.participantIndex(SyncFixture.SESSION))).isEmpty();
        assertThat(fx.store.read(PuzzleKeys.piece(SyncFixture.SESSION, pieceId))).isEmpty();
        assertThat(bobEvents.ended).hasValue(1);
    }
}
