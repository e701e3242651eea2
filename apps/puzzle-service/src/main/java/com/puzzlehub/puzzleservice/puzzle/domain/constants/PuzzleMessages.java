package com.puzzlehub.puzzleservice.puzzle.domain.constants;

/**
 * 拼图会话相关的用户可见提示，统一管理避免硬编码
 */
public final class PuzzleMessages {

    private PuzzleMessages() {
        // 工具类，禁止实例化
    }

    // ========== 会话 ==========

    public static final String SESSION_NOT_FOUND = "SESSION_NOT_FOUND: 会话不存在或已结束";

    public static final String SESSION_EXISTS = "SESSION_EXISTS: 会话已存在";

    public static final String PUZZLE_NOT_CONFIGURED = "PUZZLE_NOT_CONFIGURED: 房主尚未配置拼图";

    public static final String ONLY_HOST = "ONLY_HOST: 只有房主可以执行该操作";

    public static final String NOT_A_PARTICIPANT = "NOT_A_PARTICIPANT: 你不在该会话中";

    /** 阶段不允许（需要格式化：当前阶段、目标操作） */
    public static final String PHASE_NOT_ALLOWED = "PHASE_NOT_ALLOWED: 当前阶段 %s 不允许%s";

    public static String formatPhaseNotAllowed(Object phase, String action) {
        return String.format(PHASE_NOT_ALLOWED, phase, action);
    }

    public static final String INVALID_IMAGE = "INVALID_IMAGE: 图片地址与尺寸必须有效";

    public static final String INVALID_GRID = "INVALID_GRID: 网格行列数必须在 1 到 50 之间";

    // ========== 同步 ==========

    public static final String SYNC_BUSY = "SYNC_BUSY: 同步繁忙，请稍后再试";

    public static final String STORE_UNAVAILABLE = "STORE_UNAVAILABLE: 正在重新连接";

    public static final String PIECE_NOT_FOUND = "PIECE_NOT_FOUND: 拼块不存在";
}
