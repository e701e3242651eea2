package com.puzzlehub.puzzleservice.puzzle.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个拼块的共享状态（扁平字段，存于 piece 路径）。
 * 旋转角以度为单位；位置以棋盘高度 1.0 为单位。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PieceRecord {
    /** piece-{col}-{row} */
    private String pieceId;
    private int col;
    private int row;
    /** 所属轮次；重置后旧轮次的更新一律丢弃 */
    private long epoch;

    // ---- 目标位姿 ----
    private double targetX;
    private double targetY;
    private double targetZ;
    private double targetRotation;

    // ---- 当前位姿（last-writer-wins）----
    private double x;
    private double y;
    private double z;
    private double rotation;

    /** 同一轮次内只能 false → true */
    private boolean placed;
    private String placedBy;
    private long placedAt;
    /** 放置者因本块获得的分数（终局结算按拼块汇总） */
    private long placedPoints;

    /** 持锁参与者；空串表示未锁定 */
    private String lockOwner;
    /** 最近一次加锁或移动的时间，用于 TTL 判定 */
    private long lockTimestamp;

    /** 单拼块单调递增序号，与 epoch 一起决定更新先后 */
    private long seq;
    private String lastUpdatedBy;
}
