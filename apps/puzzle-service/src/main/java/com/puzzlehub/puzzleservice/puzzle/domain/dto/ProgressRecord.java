package com.puzzlehub.puzzleservice.puzzle.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 进度计数（进度路径中除去逐块放置标记后的部分）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProgressRecord {
    private long epoch;
    private int completedCount;
    private int totalPieceCount;
    private String lastPlacedBy;

    /**
     * 完成百分比（整数）
     */
    public int percent() {
        return totalPieceCount <= 0 ? 0 : completedCount * 100 / totalPieceCount;
    }
}
