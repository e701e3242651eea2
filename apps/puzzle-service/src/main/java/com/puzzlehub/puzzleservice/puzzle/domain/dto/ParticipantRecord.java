package com.puzzlehub.puzzleservice.puzzle.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 参与者记录：身份、房主标记、心跳与计分计数。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ParticipantRecord {
    private String participantId;
    private String displayName;
    /** 每个会话恰好一位 */
    private boolean host;
    private long joinedAt;
    /** 最近心跳时间；断线清理会将其置 0 */
    private long lastHeartbeat;

    /** 计分所属轮次；与会话 epoch 不一致时视为清零 */
    private long epoch;
    /** 拾取次数 */
    private int moveCount;
    /** 正确放置次数 */
    private int accurateDrops;
    private long points;
    private int comboCount;
    private int maxCombo;
    private long lastPlacementAt;
}
