package com.puzzlehub.completionkafkanotifier.listener;

import com.puzzlehub.completionkafkanotifier.event.CompletionRecordEvent;

/**
 * 完成记录监听器接口。
 *
 * 排行榜、成就等下游服务实现此接口即可接收完成记录：
 * <pre>
 * {@code
 * @Component
 * public class LeaderboardUpdater implements CompletionEventListener {
 *     @Override
 *     public void onPuzzleCompleted(CompletionRecordEvent event) {
 *         leaderboard.submit(event.getParticipantId(), event.getPoints());
 *     }
 * }
 * }
 * </pre>
 * 同一记录可能因重新消费而重复投递，实现方应以 {@link CompletionRecordEvent#dedupKey()} 去重。
 */
public interface CompletionEventListener {

    void onPuzzleCompleted(CompletionRecordEvent event);
}
