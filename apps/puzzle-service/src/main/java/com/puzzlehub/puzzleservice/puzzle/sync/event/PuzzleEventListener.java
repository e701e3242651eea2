package com.puzzlehub.puzzleservice.puzzle.sync.event;

import com.puzzlehub.puzzleservice.puzzle.domain.dto.CompletionRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.CursorRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.ParticipantRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.ProgressRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.SessionPhase;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.SyncStatus;

/**
 * 渲染/输入层关心的事件；按需覆盖，默认空实现。
 * 回调可能来自存储通知线程，实现方不得阻塞。
 */
public interface PuzzleEventListener {

    default void onPieceUpdated(PieceView piece) {}

    default void onPiecePlaced(PiecePlacedEvent event) {}

    default void onProgressChanged(ProgressRecord progress) {}

    default void onSessionPhaseChanged(SessionPhase phase, long epoch) {}

    /** 每个会话每轮恰好一次 */
    default void onSessionCompleted(CompletionRecord record) {}

    default void onParticipantJoined(ParticipantRecord participant) {}

    /**
     * @param explicit true 为主动离开；false 为心跳超时判定离线
     */
    default void onParticipantLeft(String participantId, boolean explicit) {}

    default void onHostChanged(String hostId) {}

    default void onCursorMoved(CursorRecord cursor) {}

    default void onSyncStatusChanged(SyncStatus status) {}

    /** 会话被拆除 */
    default void onSessionEnded() {}
}
