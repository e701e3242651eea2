package com.puzzlehub.puzzleservice.puzzle.interfaces.http.dto;

import lombok.Data;

/**
 * 配置拼图请求：图片引用 + 原始像素尺寸 + 难度（columns/rows 为空时用难度默认网格）
 */
@Data
public class ConfigurePuzzleRequest {
    private String puzzleId;
    private String imageUrl;
    private int imageWidth;
    private int imageHeight;
    /** easy / medium / hard / expert，空则 medium */
    private String difficulty;
    private Integer columns;
    private Integer rows;
}
