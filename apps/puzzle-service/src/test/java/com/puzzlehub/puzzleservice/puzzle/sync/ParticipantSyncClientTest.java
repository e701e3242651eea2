package com.puzzlehub.puzzleservice.puzzle.sync;

import com.puzzlehub.puzzleservice.puzzle.domain.dto.CompletionRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.SessionRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.Difficulty;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.LockResult;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.SessionPhase;
import com.puzzlehub.puzzleservice.puzzle.sync.event.PieceView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 两名参与者在同一存储上完成一局简单难度（3×2）拼图
 */
class ParticipantSyncClientTest {

    private SyncFixture fx;
    private ParticipantSyncClient alice;
    private ParticipantSyncClient bob;
    private RecordingListener aliceEvents;
    private RecordingListener bobEvents;

    @BeforeEach
    void setUp() {
        fx = new SyncFixture();
        alice = fx.host("alice", Difficulty.EASY);
        bob = fx.joined("bob");
        aliceEvents = new RecordingListener();
        bobEvents = new RecordingListener();
        alice.addListener(aliceEvents);
        bob.addListener(bobEvents);
    }

    /**
     * alice 放前 4 块，bob 放最后 2 块；每块拾取 1 秒后放下，块与块之间间隔 3 秒（不触发 combo）
     */
    private void playRound() {
        List<String> ids = fx.pieceIds();
        for (int i = 0; i < ids.size(); i++) {
            fx.place(i < 4 ? alice : bob, ids.get(i));
            if (i < ids.size() - 1) {
                fx.clock.advance(3_000);
            }
        }
    }

    @Test
    void bothParticipantsSeeTheSameBoard() {
        alice.start();

        List<PieceView> seenByAlice = alice.pieces();
        List<PieceView> seenByBob = bob.pieces();

        assertThat(seenByAlice).hasSize(6);
        assertThat(seenByBob).containsExactlyElementsOf(seenByAlice);
        assertThat(seenByAlice).noneMatch(PieceView::placed);
    }

    @Test
    void fullRoundCompletesOnceForEveryone() {
        alice.start();

        playRound();

        assertThat(fx.published).hasSize(1);
        assertThat(aliceEvents.completions).hasSize(1);
        assertThat(bobEvents.completions).hasSize(1);
        assertThat(aliceEvents.placed).hasSize(6);
        assertThat(bobEvents.placed).hasSize(6);
        assertThat(alice.progress().percent()).isEqualTo(100);
        assertThat(bob.pieces()).allMatch(PieceView::placed);
        assertThat(bobEvents.phases).endsWith(SessionPhase.COMPLETED);
    }

    @Test
    void completionRecordCreditsTheFinalMover() {
        alice.start();

        playRound();

        CompletionRecord record = fx.published.get(0);
        assertThat(record.getSessionId()).isEqualTo(SyncFixture.SESSION);
        assertThat(record.getEpoch()).isEqualTo(1L);
        assertThat(record.getParticipantId()).isEqualTo("bob");
        assertThat(record.getMoveCount()).isEqualTo(2);
        assertThat(record.getAccuracy()).isEqualTo(100.0);
        // 6 块 × 4 秒，减去最后一块之后未推进的 3 秒
        assertThat(record.getCompletionTimeMs()).isEqualTo(21_000L);
        // 2 × 150 + 1000 + (1000 - 21) × 2 + 100 × 10
        assertThat(record.getPoints()).isEqualTo(300 + 1_000 + 1_958 + 1_000);
        assertThat(bob.completion()).isEqualTo(record);

        SessionRecord s = alice.session();
        assertThat(s.getCompletedBy()).isEqualTo("bob");
        assertThat(s.getCompletionPoints()).isEqualTo(record.getPoints());
        assertThat(alice.elapsedMillis()).isEqualTo(21_000L);
    }

    @Test
    void completedSessionRejectsFurtherGrabs() {
        alice.start();
        playRound();

        assertThat(bob.grab(fx.pieceIds().get(0))).isEqualTo(LockResult.NOT_PLAYING);
    }

    @Test
    void lateJoinerLoadsFinishedBoard() {
        alice.start();
        playRound();

        ParticipantSyncClient carol = fx.joined("carol");

        assertThat(carol.pieces()).hasSize(6).allMatch(PieceView::placed);
        assertThat(carol.completion()).isNotNull();
        assertThat(carol.session().getPhase()).isEqualTo(SessionPhase.COMPLETED);
    }

    @Test
    void secondRoundAfterResetCompletesAgain() {
        alice.start();
        playRound();

        alice.reset();
        assertThat(bob.completion()).isNull();
        alice.start();
        fx.clock.advance(3_000);
        playRound();

        assertThat(fx.published).hasSize(2);
        assertThat(fx.published.get(1).getEpoch()).isEqualTo(2L);
        assertThat(aliceEvents.completions).extracting(CompletionRecord::getEpoch).containsExactly(1L, 2L);
        assertThat(bobEvents.completions).extracting(CompletionRecord::getEpoch).containsExactly(1L, 2L);
    }
}
