package com.puzzlehub.puzzleservice.puzzle.interfaces.ws.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * WebSocket 消息对象定义（DTO）
 * ----------------------------------------
 * 两个方向：
 *   1. 前端 -> 后端：/app/puzzle.* 指令（PieceCmd、MoveCmd、CursorCmd、SimpleCmd）
 *   2. 后端 -> 前端：/user/queue/puzzle.{sessionId} 推送的事件（BroadcastEvent）
 */
public class PuzzleWsMessages {

    /**
     * 拼块指令：拾取、取消拖动
     */
    @Data
    public static class PieceCmd {
        private String sessionId;
        private String pieceId;
    }

    /**
     * 拖动/放下指令：位置以棋盘高度 1.0 为单位，旋转角为度
     */
    @Data
    public static class MoveCmd {
        private String sessionId;
        private String pieceId;
        private double x;
        private double y;
        private double z;
        private double rotation;
    }

    /**
     * 光标位置（尽力而为）
     */
    @Data
    public static class CursorCmd {
        private String sessionId;
        private double x;
        private double y;
    }

    /**
     * 无参数指令：心跳、开始、暂停、继续、重置
     */
    @Data
    public static class SimpleCmd {
        private String sessionId;
    }

    /**
     * 推送事件（服务端 → 客户端）
     * ---------------------------------------------
     *   - sessionId：所属会话；
     *   - type     ：事件类型（见 {@link EventTypes}）；
     *   - payload  ：事件内容。
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BroadcastEvent {
        private String sessionId;
        private String type;
        private Object payload;
    }

    /**
     * 指令结果（拾取/放下/取消的结果码）
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CommandResult {
        private String command;
        private String pieceId;
        private String result;
    }

    public static final class EventTypes {
        private EventTypes() {}

        public static final String PIECE = "PIECE";
        public static final String PLACED = "PLACED";
        public static final String PROGRESS = "PROGRESS";
        public static final String PHASE = "PHASE";
        public static final String COMPLETED = "COMPLETED";
        public static final String JOINED = "JOINED";
        public static final String LEFT = "LEFT";
        public static final String HOST = "HOST";
        public static final String CURSOR = "CURSOR";
        public static final String SYNC = "SYNC";
        public static final String ENDED = "ENDED";
        public static final String RESULT = "RESULT";
        public static final String ERROR = "ERROR";
    }
}
