package com.puzzlehub.puzzleservice.puzzle.sync;

import com.puzzlehub.puzzleservice.puzzle.domain.dto.CompletionRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.CursorRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.ParticipantRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.ProgressRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.SessionPhase;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.SyncStatus;
import com.puzzlehub.puzzleservice.puzzle.sync.event.PiecePlacedEvent;
import com.puzzlehub.puzzleservice.puzzle.sync.event.PieceView;
import com.puzzlehub.puzzleservice.puzzle.sync.event.PuzzleEventListener;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 记录收到的全部事件
 */
class RecordingListener implements PuzzleEventListener {

    final List<PieceView> pieceUpdates = new CopyOnWriteArrayList<>();
    final List<PiecePlacedEvent> placed = new CopyOnWriteArrayList<>();
    final List<ProgressRecord> progress = new CopyOnWriteArrayList<>();
    final List<SessionPhase> phases = new CopyOnWriteArrayList<>();
    final List<CompletionRecord> completions = new CopyOnWriteArrayList<>();
    final List<String> joined = new CopyOnWriteArrayList<>();
    final List<String> leftExplicitly = new CopyOnWriteArrayList<>();
    final List<String> wentOffline = new CopyOnWriteArrayList<>();
    final List<String> hosts = new CopyOnWriteArrayList<>();
    final List<CursorRecord> cursors = new CopyOnWriteArrayList<>();
    final List<SyncStatus> statuses = new CopyOnWriteArrayList<>();
    final AtomicInteger ended = new AtomicInteger();

    @Override
    public void onPieceUpdated(PieceView piece) {
        pieceUpdates.add(piece);
    }

    @Override
    public void onPiecePlaced(PiecePlacedEvent event) {
        placed.add(event);
    }

    @Override
    public void onProgressChanged(ProgressRecord p) {
        progress.add(p);
    }

    @Override
    public void onSessionPhaseChanged(SessionPhase phase, long epoch) {
        phases.add(phase);
    }

    @Override
    public void onSessionCompleted(CompletionRecord record) {
        completions.add(record);
    }

    @Override
    public void onParticipantJoined(ParticipantRecord participant) {
        joined.add(participant.getParticipantId());
    }

    @Override
    public void onParticipantLeft(String participantId, boolean explicit) {
        (explicit ? leftExplicitly : wentOffline).add(participantId);
    }

    @Override
    public void onHostChanged(String hostId) {
        hosts.add(hostId);
    }

    @Override
    public void onCursorMoved(CursorRecord cursor) {
        cursors.add(cursor);
    }

    @Override
    public void onSyncStatusChanged(SyncStatus status) {
        statuses.add(status);
    }

    @Override
    public void onSessionEnded() {
        ended.incrementAndGet();
    }

    void clear() {
        pieceUpdates.clear();
        placed.clear();
        progress.clear();
        phases.clear();
        completions.clear();
        joined.clear();
        leftExplicitly.clear();
        wentOffline.clear();
        hosts.clear();
        cursors.clear();
        statuses.clear();
    }
}
