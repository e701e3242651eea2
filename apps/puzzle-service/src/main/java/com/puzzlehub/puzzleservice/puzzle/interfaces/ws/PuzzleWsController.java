package com.puzzlehub.puzzleservice.puzzle.interfaces.ws;

import com.puzzlehub.puzzleservice.puzzle.application.PuzzleSessionService;
import com.puzzlehub.puzzleservice.puzzle.domain.model.Vec3;
import com.puzzlehub.puzzleservice.puzzle.interfaces.ws.dto.PuzzleWsMessages.BroadcastEvent;
import com.puzzlehub.puzzleservice.puzzle.interfaces.ws.dto.PuzzleWsMessages.CommandResult;
import com.puzzlehub.puzzleservice.puzzle.interfaces.ws.dto.PuzzleWsMessages.CursorCmd;
import com.puzzlehub.puzzleservice.puzzle.interfaces.ws.dto.PuzzleWsMessages.EventTypes;
import com.puzzlehub.puzzleservice.puzzle.interfaces.ws.dto.PuzzleWsMessages.MoveCmd;
import com.puzzlehub.puzzleservice.puzzle.interfaces.ws.dto.PuzzleWsMessages.PieceCmd;
import com.puzzlehub.puzzleservice.puzzle.interfaces.ws.dto.PuzzleWsMessages.SimpleCmd;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.DropResult;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.LockResult;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.ReleaseResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Controller;

import java.util.Objects;

/**
 * 拼图 WebSocket 控制器
 * ----------------------------------------
 * 接收前端通过 STOMP 发送的实时指令（/app/puzzle.*），转交同步核心。
 * 拼块、进度、阶段等变化由各参与者客户端订阅存储后推送，这里只回送指令结果与错误。
 * 指令失败不抛出，统一以 ERROR 事件回送给调用者。
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class PuzzleWsController {

    private final PuzzleSessionService service;
    private final SimpMessagingTemplate messaging;

    /**
     * 拾取拼块（申请锁）
     * 路径：/app/puzzle.grab
     */
    @MessageMapping("/puzzle.grab")
    public void grab(PieceCmd cmd, SimpMessageHeaderAccessor sha) {
        final String userId = userId(sha);
        try {
            LockResult r = service.grab(cmd.getSessionId(), userId, cmd.getPieceId());
            sendResult(cmd.getSessionId(), userId, new CommandResult("grab", cmd.getPieceId(), r.name()));
        } catch (Exception e) {
            sendError(cmd.getSessionId(), userId, e.getMessage());
        }
    }

    /**
     * 拖动中的位姿流（高频，不回送结果）
     */
    @MessageMapping("/puzzle.move")
    public void move(MoveCmd cmd, SimpMessageHeaderAccessor sha) {
        final String userId = userId(sha);
        try {
            service.move(cmd.getSessionId(), userId, cmd.getPieceId(),
                    new Vec3(cmd.getX(), cmd.getY(), cmd.getZ()), cmd.getRotation());
        } catch (Exception e) {
            sendError(cmd.getSessionId(), userId, e.getMessage());
        }
    }

    /**
     * 放下拼块：服务端做放置校验
     */
    @MessageMapping("/puzzle.drop")
    public void drop(MoveCmd cmd, SimpMessageHeaderAccessor sha) {
        final String userId = userId(sha);
        try {
            DropResult r = service.drop(cmd.getSessionId(), userId, cmd.getPieceId(),
                    new Vec3(cmd.getX(), cmd.getY(), cmd.getZ()), cmd.getRotation());
            sendResult(cmd.getSessionId(), userId, new CommandResult("drop", cmd.getPieceId(), r.name()));
        } catch (Exception e) {
            sendError(cmd.getSessionId(), userId, e.getMessage());
        }
    }

    /**
     * 取消拖动：不校验，直接释放锁
     */
    @MessageMapping("/puzzle.cancel")
    public void cancel(PieceCmd cmd, SimpMessageHeaderAccessor sha) {
        final String userId = userId(sha);
        try {
            ReleaseResult r = service.cancel(cmd.getSessionId(), userId, cmd.getPieceId());
            sendResult(cmd.getSessionId(), userId, new CommandResult("cancel", cmd.getPieceId(), r.name()));
        } catch (Exception e) {
            sendError(cmd.getSessionId(), userId, e.getMessage());
        }
    }

    @MessageMapping("/puzzle.heartbeat")
    public void heartbeat(SimpleCmd cmd, SimpMessageHeaderAccessor sha) {
        final String userId = userId(sha);
        try {
            service.heartbeat(cmd.getSessionId(), userId);
        } catch (Exception e) {
            sendError(cmd.getSessionId(), userId, e.getMessage());
        }
    }

    @MessageMapping("/puzzle.cursor")
    public void cursor(CursorCmd cmd, SimpMessageHeaderAccessor sha) {
        final String userId = userId(sha);
        try {
            service.cursor(cmd.getSessionId(), userId, cmd.getX(), cmd.getY());
        } catch (Exception e) {
            // 光标尽力而为，只记录
            log.debug("光标更新失败: sessionId={}, userId={}, cause={}", cmd.getSessionId(), userId, e.getMessage());
        }
    }

    // 开始（房主）
    @MessageMapping("/puzzle.start")
    public void start(SimpleCmd cmd, SimpMessageHeaderAccessor sha) {
        final String userId = userId(sha);
        try {
            service.start(cmd.getSessionId(), userId);
        } catch (Exception e) {
            sendError(cmd.getSessionId(), userId, e.getMessage());
        }
    }

    @MessageMapping("/puzzle.pause")
    public void pause(SimpleCmd cmd, SimpMessageHeaderAccessor sha) {
        final String userId = userId(sha);
        try {
            service.pause(cmd.getSessionId(), userId);
        } catch (Exception e) {
            sendError(cmd.getSessionId(), userId, e.getMessage());
        }
    }

    @MessageMapping("/puzzle.resume")
    public void resume(SimpleCmd cmd, SimpMessageHeaderAccessor sha) {
        final String userId = userId(sha);
        try {
            service.resume(cmd.getSessionId(), userId);
        } catch (Exception e) {
            sendError(cmd.getSessionId(), userId, e.getMessage());
        }
    }

    // 再来一轮（房主）
    @MessageMapping("/puzzle.reset")
    public void reset(SimpleCmd cmd, SimpMessageHeaderAccessor sha) {
        final String userId = userId(sha);
        try {
            service.reset(cmd.getSessionId(), userId);
        } catch (Exception e) {
            sendError(cmd.getSessionId(), userId, e.getMessage());
        }
    }

    private static String userId(SimpMessageHeaderAccessor sha) {
        return Objects.requireNonNull(sha.getUser(), "user is null").getName();
    }

    private void sendResult(String sessionId, String userId, CommandResult result) {
        messaging.convertAndSendToUser(userId, StompEventForwarder.destination(sessionId),
                new BroadcastEvent(sessionId, EventTypes.RESULT, result));
    }

    private void sendError(String sessionId, String userId, String message) {
        log.debug("指令失败: sessionId={}, userId={}, msg={}", sessionId, userId, message);
        messaging.convertAndSendToUser(userId, StompEventForwarder.destination(sessionId),
                new BroadcastEvent(sessionId, EventTypes.ERROR, message));
    }
}
