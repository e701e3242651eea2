package com.puzzlehub.puzzleservice.puzzle.sync.event;

import com.puzzlehub.puzzleservice.puzzle.domain.dto.PieceRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.model.Vec3;
import org.apache.commons.lang3.StringUtils;

/**
 * 提供给渲染层的拼块快照
 */
public record PieceView(String id,
                        Vec3 targetPosition,
                        Vec3 currentPosition,
                        double rotation,
                        boolean placed,
                        String lockOwner) {

    public static PieceView of(PieceRecord r) {
        return new PieceView(
                r.getPieceId(),
                new Vec3(r.getTargetX(), r.getTargetY(), r.getTargetZ()),
                new Vec3(r.getX(), r.getY(), r.getZ()),
                r.getRotation(),
                r.isPlaced(),
                StringUtils.defaultString(r.getLockOwner()));
    }
}
