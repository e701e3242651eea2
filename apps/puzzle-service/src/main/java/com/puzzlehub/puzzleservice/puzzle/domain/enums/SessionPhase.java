package com.puzzlehub.puzzleservice.puzzle.domain.enums;

/**
 * 会话阶段。只有 PLAYING 允许拾取拼块。
 */
public enum SessionPhase {

    WAITING,    // 等待开始（房主配置图片、难度）
    PLAYING,    // 进行中
    PAUSED,     // 暂停（房主）
    COMPLETED;  // 全部放置完成（仅能由 PLAYING 进入）

    /**
     * 状态机允许的迁移；重置（→ WAITING）单独处理，不在此列
     */
    public boolean canTransitionTo(SessionPhase target) {
        return switch (this) {
            case WAITING -> target == PLAYING;
            case PLAYING -> target == PAUSED || target == COMPLETED;
            case PAUSED -> target == PLAYING;
            case COMPLETED -> false;
        };
    }
}
