package com.puzzlehub.puzzleservice.puzzle.interfaces.ws;

import com.puzzlehub.puzzleservice.puzzle.domain.dto.CompletionRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.CursorRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.ParticipantRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.ProgressRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.SessionPhase;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.SyncStatus;
import com.puzzlehub.puzzleservice.puzzle.interfaces.ws.dto.PuzzleWsMessages.BroadcastEvent;
import com.puzzlehub.puzzleservice.puzzle.interfaces.ws.dto.PuzzleWsMessages.EventTypes;
import com.puzzlehub.puzzleservice.puzzle.sync.event.PiecePlacedEvent;
import com.puzzlehub.puzzleservice.puzzle.sync.event.PieceView;
import com.puzzlehub.puzzleservice.puzzle.sync.event.PuzzleEventListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.util.Map;

/**
 * 把一个参与者客户端的事件推送到该用户的 STOMP 队列：/user/{userId}/queue/puzzle.{sessionId}
 */
@Slf4j
public class StompEventForwarder implements PuzzleEventListener {

    private final SimpMessagingTemplate messaging;
    private final String sessionId;
    private final String userId;

    public StompEventForwarder(SimpMessagingTemplate messaging, String sessionId, String userId) {
        this.messaging = messaging;
        this.sessionId = sessionId;
        this.userId = userId;
    }

    public static String destination(String sessionId) {
        return "/queue/puzzle." + sessionId;
    }

    @Override
    public void onPieceUpdated(PieceView piece) {
        send(EventTypes.PIECE, piece);
    }

    @Override
    public void onPiecePlaced(PiecePlacedEvent event) {
        send(EventTypes.PLACED, event);
    }

    @Override
    public void onProgressChanged(ProgressRecord progress) {
        send(EventTypes.PROGRESS, Map.of(
                "epoch", progress.getEpoch(),
                "completedCount", progress.getCompletedCount(),
                "totalPieceCount", progress.getTotalPieceCount(),
                "percent", progress.percent()));
    }

    @Override
    public void onSessionPhaseChanged(SessionPhase phase, long epoch) {
        send(EventTypes.PHASE, Map.of("phase", phase.name(), "epoch", epoch));
    }

    @Override
    public void onSessionCompleted(CompletionRecord record) {
        send(EventTypes.COMPLETED, record);
    }

    @Override
    public void onParticipantJoined(ParticipantRecord participant) {
        send(EventTypes.JOINED, participant);
    }

    @Override
    public void onParticipantLeft(String participantId, boolean explicit) {
        send(EventTypes.LEFT, Map.of("participantId", participantId, "explicit", explicit));
    }

    @Override
    public void onHostChanged(String hostId) {
        send(EventTypes.HOST, Map.of("hostId", hostId));
    }

    @Override
    public void onCursorMoved(CursorRecord cursor) {
        send(EventTypes.CURSOR, cursor);
    }

    @Override
    public void onSyncStatusChanged(SyncStatus status) {
        send(EventTypes.SYNC, Map.of("status", status.name()));
    }

    @Override
    public void onSessionEnded() {
        send(EventTypes.ENDED, Map.of("sessionId", sessionId));
    }

    private void send(String type, Object payload) {
        messaging.convertAndSendToUser(userId, destination(sessionId), new BroadcastEvent(sessionId, type, payload));
    }
}
