package com.puzzlehub.puzzleservice.puzzle.domain.model;

import com.puzzlehub.puzzleservice.puzzle.domain.dto.PieceRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.PuzzleRecord;

/**
 * 放置校验：
 *  - 距离目标严格小于吸附阈值（恰好等于阈值不算放置）；
 *  - 难度要求旋转时，当前角度与目标角度之差（按 360° 取模）不超过容差；
 *  - 已放置的拼块不再重复放置。
 */
public final class PlacementRule {

    private final double rotationEpsilonDegrees;

    public PlacementRule(double rotationEpsilonDegrees) {
        this.rotationEpsilonDegrees = rotationEpsilonDegrees;
    }

    public boolean isCorrect(PuzzleRecord puzzle, PieceRecord piece, Vec3 position, double rotationDegrees) {
        if (piece.isPlaced()) {
            return false;
        }
        Vec3 target = new Vec3(piece.getTargetX(), piece.getTargetY(), piece.getTargetZ());
        if (!(position.distanceTo(target) < puzzle.getSnapDistance())) {
            return false;
        }
        return !puzzle.isRotationRequired()
                || rotationAligned(rotationDegrees, piece.getTargetRotation());
    }

    boolean rotationAligned(double rotation, double target) {
        double diff = ((rotation - target) % 360.0 + 360.0) % 360.0;
        return diff <= rotationEpsilonDegrees || 360.0 - diff <= rotationEpsilonDegrees;
    }
}
