package com.puzzlehub.puzzleservice.puzzle.domain.dto;

import com.puzzlehub.puzzleservice.puzzle.domain.enums.Difficulty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 拼图配置：图片引用、网格与难度参数。开始游戏后不可修改。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PuzzleRecord {
    private String puzzleId;
    private String imageUrl;
    /** 图片原始像素宽高，仅用于计算宽高比 */
    private int imageWidth;
    private int imageHeight;
    private Difficulty difficulty;
    private int columns;
    private int rows;
    private int totalPieces;
    private double snapDistance;
    private boolean rotationRequired;
}
