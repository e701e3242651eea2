package com.puzzlehub.puzzleservice.puzzle.interfaces.http.dto;

import com.puzzlehub.puzzleservice.puzzle.domain.dto.ParticipantRecord;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 参与者列表的单行摘要（含在线判定结果）
 */
@Data
@AllArgsConstructor
public class ParticipantSummary {
    private String participantId;
    private String displayName;
    private boolean host;
    private boolean online;
    private int moveCount;
    private int accurateDrops;
    private long points;
    private int maxCombo;

    public static ParticipantSummary from(ParticipantRecord p, boolean online, long currentEpoch) {
        boolean current = p.getEpoch() == currentEpoch;
        return new ParticipantSummary(
                p.getParticipantId(),
                p.getDisplayName(),
                p.isHost(),
                online,
                current ? p.getMoveCount() : 0,
                current ? p.getAccurateDrops() : 0,
                current ? p.getPoints() : 0L,
                current ? p.getMaxCombo() : 0
        );
    }
}
