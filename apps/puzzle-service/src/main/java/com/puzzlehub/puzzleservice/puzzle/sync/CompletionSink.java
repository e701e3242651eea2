package com.puzzlehub.puzzleservice.puzzle.sync;

import com.puzzlehub.puzzleservice.puzzle.domain.dto.CompletionRecord;

/**
 * 完成记录出口（计分/排行榜）。只由赢得终局切换的客户端调用，每会话每轮一次。
 */
@FunctionalInterface
public interface CompletionSink {

    void publish(CompletionRecord record);
}
