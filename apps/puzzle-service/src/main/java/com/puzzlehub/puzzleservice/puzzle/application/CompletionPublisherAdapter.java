package com.puzzlehub.puzzleservice.puzzle.application;

import com.puzzlehub.completionkafkanotifier.event.CompletionRecordEvent;
import com.puzzlehub.completionkafkanotifier.publisher.CompletionEventPublisher;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.CompletionRecord;
import com.puzzlehub.puzzleservice.puzzle.sync.CompletionSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * 完成记录出口：转成 Kafka 事件交给 completion-kafka-notifier。
 * 未配置 completion.kafka.bootstrap-servers 时发布器不存在，只记录日志。
 */
@Slf4j
@Component
public class CompletionPublisherAdapter implements CompletionSink {

    private final ObjectProvider<CompletionEventPublisher> publisherProvider;

    public CompletionPublisherAdapter(ObjectProvider<CompletionEventPublisher> publisherProvider) {
        this.publisherProvider = publisherProvider;
    }

    @Override
    public void publish(CompletionRecord record) {
        CompletionEventPublisher publisher = publisherProvider.getIfAvailable();
        if (publisher == null) {
            log.info("Kafka 未启用，完成记录仅落库: sessionId={}, epoch={}, participantId={}, points={}",
                    record.getSessionId(), record.getEpoch(), record.getParticipantId(), record.getPoints());
            return;
        }
        publisher.publish(toEvent(record));
    }

    static CompletionRecordEvent toEvent(CompletionRecord record) {
        return CompletionRecordEvent.builder()
                .sessionId(record.getSessionId())
                .epoch(record.getEpoch())
                .participantId(record.getParticipantId())
                .completionTimeMs(record.getCompletionTimeMs())
                .moveCount(record.getMoveCount())
                .accuracy(record.getAccuracy())
                .points(record.getPoints())
                .completedAt(record.getCompletedAt())
                .build();
    }
}
