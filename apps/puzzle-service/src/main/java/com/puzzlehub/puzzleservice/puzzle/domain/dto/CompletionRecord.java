package com.puzzlehub.puzzleservice.puzzle.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 最终完成记录：每个会话每轮只写一次，交给计分/排行榜。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletionRecord {
    private String sessionId;
    private long epoch;
    private String participantId;
    private long completionTimeMs;
    private int moveCount;
    private double accuracy;
    private long points;
    private long completedAt;
}
