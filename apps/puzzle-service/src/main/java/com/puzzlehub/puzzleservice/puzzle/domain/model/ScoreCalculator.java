package com.puzzlehub.puzzleservice.puzzle.domain.model;

import com.puzzlehub.puzzleservice.puzzle.config.PuzzleSyncProperties.Scoring;

/**
 * 计分规则（纯函数）。
 * <pre>
 * 单次放置 = 100 + (拾取到放下 &lt; 5s ? 50 : 0) + 25 × combo
 * 终局     = 累计 + 1000 + max(0, 1000 - 用时秒) × 2 + floor(准确率%) × 10
 * 准确率   = 正确放置次数 / 拾取次数 × 100
 * </pre>
 */
public final class ScoreCalculator {

    private final Scoring rules;

    public ScoreCalculator(Scoring rules) {
        this.rules = rules;
    }

    /**
     * 计算新的 combo 计数：距上次正确放置在窗口内则 +1，否则归零
     *
     * @param lastPlacementAt 上次正确放置时间，0 表示尚无
     */
    public int nextCombo(int currentCombo, long lastPlacementAt, long now) {
        if (lastPlacementAt > 0 && now - lastPlacementAt < rules.getComboWindow().toMillis()) {
            return currentCombo + 1;
        }
        return 0;
    }

    public long placementPoints(long moveDurationMillis, int comboCount) {
        long pts = rules.getAccuratePlacement();
        if (moveDurationMillis < rules.getQuickPlacementThreshold().toMillis()) {
            pts += rules.getQuickPlacement();
        }
        return pts + (long) rules.getCombo() * comboCount;
    }

    public double accuracy(int moveCount, int accurateDrops) {
        if (moveCount <= 0) {
            return 0.0;
        }
        return accurateDrops * 100.0 / moveCount;
    }

    public long timeBonus(long completionTimeMs) {
        long seconds = completionTimeMs / 1000;
        return Math.max(0, rules.getTimeBonusBase() - seconds) * rules.getTimeBonusFactor();
    }

    public long accuracyBonus(double accuracy) {
        return (long) Math.floor(accuracy) * rules.getAccuracyFactor();
    }

    public long finalPoints(long accumulatedPoints, long completionTimeMs, double accuracy) {
        return accumulatedPoints + rules.getCompletionBonus() + timeBonus(completionTimeMs) + accuracyBonus(accuracy);
    }
}
