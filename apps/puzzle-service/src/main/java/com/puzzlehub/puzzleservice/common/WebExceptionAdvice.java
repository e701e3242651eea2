package com.puzzlehub.puzzleservice.common;

import com.puzzlehub.puzzleservice.infrastructure.store.StoreUnavailableException;
import com.puzzlehub.puzzleservice.puzzle.domain.constants.PuzzleMessages;
import com.puzzlehub.web.common.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常映射处理器。
 */
@Slf4j
@RestControllerAdvice
public class WebExceptionAdvice {
    /**
     * 处理参数不合法异常（IllegalArgumentException）。
     * 例如会话不存在、图片尺寸无效、难度未知。
     * @param e 参数非法异常
     * @return HTTP 400（Bad Request），响应体为异常信息
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }
    /**
     * 处理非法状态异常（IllegalStateException）。
     * 例如阶段不允许、非房主操作、同步繁忙。
     * @param e 状态非法异常
     * @return HTTP 409（Conflict），响应体为异常信息
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse<Object>> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage()));
    }
    /**
     * 共享存储不可达：客户端稍后重试
     * @return HTTP 503（Service Unavailable）
     */
    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ApiResponse<Object>> unavailable(StoreUnavailableException e) {
        log.warn("共享存储不可达: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ApiResponse.unavailable(PuzzleMessages.STORE_UNAVAILABLE));
    }
}
