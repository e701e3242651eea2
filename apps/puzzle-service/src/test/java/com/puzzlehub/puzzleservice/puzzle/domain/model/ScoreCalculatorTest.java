package com.puzzlehub.puzzleservice.puzzle.domain.model;

import com.puzzlehub.puzzleservice.puzzle.config.PuzzleSyncProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScoreCalculatorTest {

    private final ScoreCalculator calc = new ScoreCalculator(new PuzzleSyncProperties.Scoring());

    @Test
    void accuracyIsCorrectDropsOverGrabs() {
        assertThat(calc.accuracy(10, 8)).isEqualTo(80.0);
        assertThat(calc.accuracy(0, 0)).isEqualTo(0.0);
    }

    @Test
    void timeBonusShrinksPerSecondAndNeverGoesNegative() {
        assertThat(calc.timeBonus(90_000)).isEqualTo(1_820);
        assertThat(calc.timeBonus(90_999)).isEqualTo(1_820);
        assertThat(calc.timeBonus(1_000_000)).isZero();
        assertThat(calc.timeBonus(5_000_000)).isZero();
    }

    @Test
    void accuracyBonusFloorsPercent() {
        assertThat(calc.accuracyBonus(66.67)).isEqualTo(660);
    }

    @Test
    void finalPointsAddsAllBonuses() {
        // 1000 累计 + 1000 完成 + 1820 时间 + 800 准确率
        assertThat(calc.finalPoints(1_000, 90_000, 80.0)).isEqualTo(4_620);
    }

    @Test
    void quickPlacementEarnsBonus() {
        assertThat(calc.placementPoints(4_999, 0)).isEqualTo(150);
        assertThat(calc.placementPoints(5_000, 0)).isEqualTo(100);
        assertThat(calc.placementPoints(Long.MAX_VALUE, 2)).isEqualTo(150);
    }

    @Test
    void comboGrowsOnlyInsideWindow() {
        long last = 10_000;

        assertThat(calc.nextCombo(2, last, last + 2_999)).isEqualTo(3);
        assertThat(calc.nextCombo(2, last, last + 3_000)).isZero();
        assertThat(calc.nextCombo(0, 0, last)).isZero();
    }
}
