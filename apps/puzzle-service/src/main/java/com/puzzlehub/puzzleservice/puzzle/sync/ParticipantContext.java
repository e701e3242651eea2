package com.puzzlehub.puzzleservice.puzzle.sync;

/**
 * 参与者客户端身份：会话、参与者、存储连接。
 * 显式传递给各组件，不依赖任何全局状态。
 *
 * @param connectionId 与共享存储的连接标识，断线清理按它登记
 */
public record ParticipantContext(String sessionId, String participantId, String connectionId) {
}
