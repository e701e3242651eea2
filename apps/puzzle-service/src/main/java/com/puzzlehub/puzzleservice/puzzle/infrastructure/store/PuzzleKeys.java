package com.puzzlehub.puzzleservice.puzzle.infrastructure.store;

/**
 * 统一管理拼图会话在共享存储中的路径，避免字符串散落。
 * 会话下所有数据都挂在 session(sessionId) 之下，订阅会话根路径即可收到全部变更。
 */
public final class PuzzleKeys {

    private static final String PFX = "puzzle:";

    private PuzzleKeys() {}

    // ---- 会话根（阶段、轮次、计时、完成摘要） ----
    public static String session(String sessionId) {
        return PFX + "session:" + sessionId;
    }

    // ---- 拼图配置 ----
    public static String puzzle(String sessionId) {
        return session(sessionId) + ":puzzle";
    }

    // ---- 单个拼块 ----
    public static String piece(String sessionId, String pieceId) {
        return session(sessionId) + ":piece:" + pieceId;
    }

    public static String piecePrefix(String sessionId) {
        return session(sessionId) + ":piece:";
    }

    // ---- 参与者 ----
    public static String participant(String sessionId, String participantId) {
        return session(sessionId) + ":participant:" + participantId;
    }

    public static String participantPrefix(String sessionId) {
        return session(sessionId) + ":participant:";
    }

    /** 参与者索引：participantId → joinedAt */
    public static String participantIndex(String sessionId) {
        return session(sessionId) + ":participants";
    }

    // ---- 进度计数 + 逐块放置标记 ----
    public static String progress(String sessionId) {
        return session(sessionId) + ":progress";
    }

    // ---- 完成记录（每轮一次） ----
    public static String completion(String sessionId) {
        return session(sessionId) + ":completion";
    }

    // ---- 光标（尽力而为） ----
    public static String cursor(String sessionId, String participantId) {
        return session(sessionId) + ":cursor:" + participantId;
    }

    public static String cursorPrefix(String sessionId) {
        return session(sessionId) + ":cursor:";
    }
}
