package com.puzzlehub.puzzleservice.puzzle.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 光标位置（尽力而为，不参与一致性保证）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CursorRecord {
    private String participantId;
    private double x;
    private double y;
    private long updatedAt;
}
