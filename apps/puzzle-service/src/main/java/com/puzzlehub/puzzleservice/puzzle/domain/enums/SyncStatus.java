package com.puzzlehub.puzzleservice.puzzle.domain.enums;

/**
 * 客户端与共享存储的同步状态（对外展示给渲染层）
 */
public enum SyncStatus {
    /** 正常 */
    CONNECTED,
    /** 事务冲突重试耗尽，非致命；本地乐观状态保留 */
    DEGRADED,
    /** 存储不可达，暂停新的拼块交互 */
    RECONNECTING
}
