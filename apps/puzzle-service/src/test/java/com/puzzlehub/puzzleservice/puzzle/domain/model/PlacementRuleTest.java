package com.puzzlehub.puzzleservice.puzzle.domain.model;

import com.puzzlehub.puzzleservice.puzzle.domain.dto.PieceRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.PuzzleRecord;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PlacementRuleTest {

    private final PlacementRule rule = new PlacementRule(5.0);

    private static PuzzleRecord puzzle(boolean rotationRequired) {
        return PuzzleRecord.builder().snapDistance(0.4).rotationRequired(rotationRequired).build();
    }

    private static PieceRecord pieceAtOrigin() {
        return PieceRecord.builder().pieceId("piece-0-0").targetRotation(0.0).lockOwner("").build();
    }

    // ── distance ────────────────────────────────────────────────────────────

    @Test
    void exactlyAtSnapDistanceIsNotPlaced() {
        assertThat(rule.isCorrect(puzzle(false), pieceAtOrigin(), new Vec3(0.4, 0, 0), 0)).isFalse();
    }

    @Test
    void justInsideSnapDistanceIsPlaced() {
        assertThat(rule.isCorrect(puzzle(false), pieceAtOrigin(), new Vec3(0.399, 0, 0), 0)).isTrue();
    }

    @Test
    void distanceIncludesDepth() {
        assertThat(rule.isCorrect(puzzle(false), pieceAtOrigin(), new Vec3(0.3, 0, 0.3), 0)).isFalse();
    }

    @Test
    void rotationIgnoredWhenNotRequired() {
        assertThat(rule.isCorrect(puzzle(false), pieceAtOrigin(), Vec3.ZERO, 180)).isTrue();
    }

    @Test
    void placedPieceIsNeverPlacedAgain() {
        PieceRecord placed = pieceAtOrigin().toBuilder().placed(true).build();

        assertThat(rule.isCorrect(puzzle(false), placed, Vec3.ZERO, 0)).isFalse();
    }

    // ── rotation ────────────────────────────────────────────────────────────

    @Test
    void rotationWithinToleranceIsAligned() {
        assertThat(rule.isCorrect(puzzle(true), pieceAtOrigin(), Vec3.ZERO, 5.0)).isTrue();
        assertThat(rule.isCorrect(puzzle(true), pieceAtOrigin(), Vec3.ZERO, 5.5)).isFalse();
    }

    @Test
    void rotationWrapsAroundFullTurn() {
        assertThat(rule.rotationAligned(357, 0)).isTrue();
        assertThat(rule.rotationAligned(360, 0)).isTrue();
        assertThat(rule.rotationAligned(-3, 0)).isTrue();
        assertThat(rule.rotationAligned(90, 0)).isFalse();
        assertThat(rule.rotationAligned(452, 90)).isTrue();
    }
}
