package com.puzzlehub.completionkafkanotifier.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 拼图完成记录。
 *
 * 每个会话的每一轮（epoch）只产生一条，由赢得 playing → completed 状态切换的客户端发布，
 * 供外部计分/排行榜服务消费。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletionRecordEvent {

    /** 拼图会话 ID */
    private String sessionId;

    /** 会话轮次（每次重置 +1），与 sessionId 一起构成幂等键 */
    private Long epoch;

    /** 放下最后一块拼图的参与者 */
    private String participantId;

    /** 完成用时（毫秒，不含暂停时间） */
    private Long completionTimeMs;

    /** 该参与者的拾取次数 */
    private Integer moveCount;

    /** 准确率（百分比，0-100） */
    private Double accuracy;

    /** 最终得分（含完成奖励、时间奖励、准确率奖励） */
    private Long points;

    /** 完成时间戳（毫秒） */
    private Long completedAt;

    /**
     * 幂等键：sessionId + ":" + epoch
     */
    public String dedupKey() {
        return sessionId + ":" + epoch;
    }
}
