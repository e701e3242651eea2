package com.puzzlehub.puzzleservice.puzzle.domain.dto;

import com.puzzlehub.puzzleservice.puzzle.domain.enums.SessionPhase;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 会话记录：阶段、轮次、计时锚点，以及终局后的完成摘要。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SessionRecord {
    private String sessionId;
    private String hostId;
    private SessionPhase phase;
    private long epoch;

    private long createdAt;
    private long startedAt;
    /** 当前暂停开始时间；未暂停为 0 */
    private long pausedAt;
    /** 已累计的暂停时长 */
    private long pausedTotalMillis;

    // ---- 完成摘要（phase=COMPLETED 时有效）----
    private long completedAt;
    private String completedBy;
    private long completionTimeMs;
    private double completionAccuracy;
    private long completionPoints;
}
