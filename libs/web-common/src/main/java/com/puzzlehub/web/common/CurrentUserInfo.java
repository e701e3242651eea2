package com.puzzlehub.web.common;

/**
 * 当前用户信息 DTO
 * 从 JWT token 中提取，作为拼图会话中的参与者身份
 */
public record CurrentUserInfo(
    /** 用户ID（JWT subject），即参与者ID */
    String userId,

    /** 用户名（preferred_username，如果没有则使用 userId） */
    String username,

    /** 昵称（name 声明，清理占位后缀；没有则为 null） */
    String nickname
) {
    /**
     * 获取显示名称（参与者列表、光标标签使用）
     * 优先级：nickname > username > userId
     */
    public String getDisplayName() {
        if (nickname != null && !nickname.isBlank()) {
            return nickname;
        }
        if (username != null && !username.isBlank()) {
            return username;
        }
        return userId;
    }
}
