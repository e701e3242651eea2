package com.puzzlehub.puzzleservice.puzzle.domain.enums;

import java.util.Locale;

/**
 * 难度：决定默认网格、吸附距离阈值以及是否要求旋转对齐。
 * 吸附距离以棋盘高度 1.0 为单位。
 */
public enum Difficulty {

    EASY(3, 2, 0.4, false),
    MEDIUM(4, 3, 0.3, true),
    HARD(5, 4, 0.2, true),
    EXPERT(6, 5, 0.15, true);

    private final int columns;
    private final int rows;
    private final double snapDistance;
    private final boolean rotationRequired;

    Difficulty(int columns, int rows, double snapDistance, boolean rotationRequired) {
        this.columns = columns;
        this.rows = rows;
        this.snapDistance = snapDistance;
        this.rotationRequired = rotationRequired;
    }

    public int columns() {
        return columns;
    }

    public int rows() {
        return rows;
    }

    public double snapDistance() {
        return snapDistance;
    }

    public boolean rotationRequired() {
        return rotationRequired;
    }

    /**
     * 大小写不敏感解析；空值按 MEDIUM 处理
     */
    public static Difficulty fromCode(String code) {
        if (code == null || code.isBlank()) {
            return MEDIUM;
        }
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("未知难度: " + code);
        }
    }
}
