package com.puzzlehub.puzzleservice.puzzle.sync.event;

/**
 * 拼块被正确放置（本地放置或观察到的远端放置）
 */
public record PiecePlacedEvent(String sessionId, String pieceId, long epoch, String participantId, long placedAt) {
}
