package com.puzzlehub.puzzleservice.puzzle.domain.enums;

/**
 * 拾取拼块（加锁）结果
 */
public enum LockResult {
    /** 获得独占权 */
    GRANTED,
    /** 被他人持有或拼块已放置；不算错误，不提示 */
    DENIED,
    /** 并发冲突重试耗尽 */
    BUSY,
    /** 会话不在 PLAYING 阶段 */
    NOT_PLAYING,
    /** 共享存储不可达 */
    UNAVAILABLE;

    public boolean granted() {
        return this == GRANTED;
    }
}
