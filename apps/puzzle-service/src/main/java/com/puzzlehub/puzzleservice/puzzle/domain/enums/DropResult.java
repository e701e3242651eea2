package com.puzzlehub.puzzleservice.puzzle.domain.enums;

/**
 * 松手（释放锁）结果
 */
public enum DropResult {
    /** 校验通过，吸附到目标位置并标记已放置 */
    PLACED,
    /** 留在松手位置，锁已释放 */
    DROPPED,
    /** 调用方并不持有该拼块的锁（例如已被超时回收） */
    NOT_OWNER,
    /** 并发冲突重试耗尽，锁状态未知，稍后由 TTL 回收 */
    BUSY
}
