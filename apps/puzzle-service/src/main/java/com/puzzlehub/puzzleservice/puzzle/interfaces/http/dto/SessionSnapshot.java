package com.puzzlehub.puzzleservice.puzzle.interfaces.http.dto;

import com.puzzlehub.puzzleservice.puzzle.domain.dto.ProgressRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.PuzzleRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.SessionRecord;
import com.puzzlehub.puzzleservice.puzzle.sync.event.PieceView;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * 会话全貌快照：进入页面或重连后一次拉取
 */
@Data
@AllArgsConstructor
public class SessionSnapshot {
    private SessionRecord session;
    /** 未配置时为 null */
    private PuzzleRecord puzzle;
    private List<PieceView> pieces;
    private ProgressRecord progress;
    private List<ParticipantSummary> participants;
    private long elapsedMillis;
    private String syncStatus;
}
