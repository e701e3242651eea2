package com.puzzlehub.puzzleservice.puzzle.interfaces.http.dto;

import lombok.Data;

/**
 * 创建会话请求；sessionId 为空时由服务端生成，puzzle 为空时稍后再配置
 */
@Data
public class CreateSessionRequest {
    private String sessionId;
    private ConfigurePuzzleRequest puzzle;
}
