package com.puzzlehub.puzzleservice.puzzle.interfaces.http;

import com.puzzlehub.puzzleservice.puzzle.application.PuzzleSessionService;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.CompletionRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.ParticipantRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.PuzzleRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.SessionRecord;
import com.puzzlehub.puzzleservice.puzzle.interfaces.http.dto.ConfigurePuzzleRequest;
import com.puzzlehub.puzzleservice.puzzle.interfaces.http.dto.CreateSessionRequest;
import com.puzzlehub.puzzleservice.puzzle.interfaces.http.dto.SessionSnapshot;
import com.puzzlehub.web.common.ApiResponse;
import com.puzzlehub.web.common.CurrentUserHelper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 拼图会话 http 接口
 * 实时操作（拾取、拖动、放下、心跳、光标、开始/暂停/重置）走 STOMP，见 PuzzleWsController。
 */
@Slf4j
@RestController
@RequestMapping("/api/puzzle/sessions")
public class PuzzleRestController {

    private final PuzzleSessionService service;

    public PuzzleRestController(PuzzleSessionService service) {
        this.service = service;
    }

    /**
     * 创建会话：调用者成为房主并自动加入；可同时配置拼图
     */
    @PostMapping
    public ResponseEntity<ApiResponse<SessionRecord>> create(@RequestBody(required = false) CreateSessionRequest req,
                                                             @AuthenticationPrincipal Jwt jwt) {
        String userId = CurrentUserHelper.getUserId(jwt);
        CreateSessionRequest body = req != null ? req : new CreateSessionRequest();
        SessionRecord session = service.createSession(userId, CurrentUserHelper.getDisplayName(jwt),
                body.getSessionId(), body.getPuzzle());
        log.info("创建拼图会话: sessionId={}, hostId={}", session.getSessionId(), userId);
        return ResponseEntity.ok(ApiResponse.success(session));
    }

    /**
     * 配置拼图（房主，仅 WAITING）
     */
    @PutMapping("/{sessionId}/puzzle")
    public ResponseEntity<ApiResponse<PuzzleRecord>> configure(@PathVariable String sessionId,
                                                               @RequestBody ConfigurePuzzleRequest req,
                                                               @AuthenticationPrincipal Jwt jwt) {
        PuzzleRecord puzzle = service.configurePuzzle(sessionId, CurrentUserHelper.getUserId(jwt), req);
        return ResponseEntity.ok(ApiResponse.success(puzzle));
    }

    @PostMapping("/{sessionId}/join")
    public ResponseEntity<ApiResponse<ParticipantRecord>> join(@PathVariable String sessionId,
                                                               @AuthenticationPrincipal Jwt jwt) {
        ParticipantRecord p = service.join(sessionId, CurrentUserHelper.getUserId(jwt),
                CurrentUserHelper.getDisplayName(jwt));
        return ResponseEntity.ok(ApiResponse.success(p));
    }

    @PostMapping("/{sessionId}/leave")
    public ResponseEntity<ApiResponse<Void>> leave(@PathVariable String sessionId,
                                                   @AuthenticationPrincipal Jwt jwt) {
        service.leave(sessionId, CurrentUserHelper.getUserId(jwt));
        return ResponseEntity.ok(ApiResponse.success());
    }

    /**
     * 拆除会话（房主）
     */
    @DeleteMapping("/{sessionId}")
    public ResponseEntity<ApiResponse<Void>> teardown(@PathVariable String sessionId,
                                                      @AuthenticationPrincipal Jwt jwt) {
        service.teardown(sessionId, CurrentUserHelper.getUserId(jwt));
        return ResponseEntity.ok(ApiResponse.success());
    }

    /**
     * 会话全貌（进入页面/重连后拉取一次，之后以推送增量为准）
     */
    @GetMapping("/{sessionId}")
    public ResponseEntity<ApiResponse<SessionSnapshot>> view(@PathVariable String sessionId,
                                                             @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(ApiResponse.success(service.snapshot(sessionId, CurrentUserHelper.getUserId(jwt))));
    }

    @GetMapping("/{sessionId}/completion")
    public ResponseEntity<ApiResponse<CompletionRecord>> completion(@PathVariable String sessionId,
                                                                    @AuthenticationPrincipal Jwt jwt) {
        CompletionRecord record = service.completion(sessionId, CurrentUserHelper.getUserId(jwt));
        if (record == null) {
            return ResponseEntity.status(404).body(ApiResponse.notFound("COMPLETION_NOT_FOUND: 本轮尚未完成"));
        }
        return ResponseEntity.ok(ApiResponse.success(record));
    }
}
