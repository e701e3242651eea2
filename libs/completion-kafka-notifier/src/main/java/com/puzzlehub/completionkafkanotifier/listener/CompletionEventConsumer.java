package com.puzzlehub.completionkafkanotifier.listener;

import com.alibaba.fastjson2.JSON;
import com.puzzlehub.completionkafkanotifier.event.CompletionRecordEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 完成记录消费者。
 *
 * 监听 Kafka 中的完成记录，依次调用所有 {@link CompletionEventListener}。
 * 手动提交 offset：只有所有监听器处理成功后才提交，失败的消息会被重新消费。
 */
@Slf4j
@Component
public class CompletionEventConsumer {

    private final List<CompletionEventListener> listeners;

    @Autowired(required = false)
    public CompletionEventConsumer(List<CompletionEventListener> listeners) {
        this.listeners = listeners != null ? listeners : List.of();
        log.info("完成记录消费者初始化完成，发现 {} 个监听器", this.listeners.size());
    }

    /**
     * 消费完成记录。
     *
     * @param message 消息内容（JSON 字符串）
     * @param ack     手动提交确认对象
     */
    @KafkaListener(topics = "${completion.kafka.topic:puzzle-completed}",
                   containerFactory = "completionKafkaListenerContainerFactory")
    public void consumeCompletion(String message, Acknowledgment ack) {
        CompletionRecordEvent event;
        try {
            event = JSON.parseObject(message, CompletionRecordEvent.class);
        } catch (Exception e) {
            // 无法解析的消息重试也不会成功，提交后跳过
            log.error("完成记录解析失败，跳过: message={}", message, e);
            ack.acknowledge();
            return;
        }
        if (event == null || event.getSessionId() == null) {
            log.warn("完成记录缺少 sessionId，跳过: message={}", message);
            ack.acknowledge();
            return;
        }
        log.debug("收到完成记录: sessionId={}, epoch={}, participantId={}",
                event.getSessionId(), event.getEpoch(), event.getParticipantId());

        if (listeners.isEmpty()) {
            log.warn("收到完成记录，但未发现任何 CompletionEventListener 实现: sessionId={}", event.getSessionId());
            ack.acknowledge();
            return;
        }

        boolean allSuccess = true;
        for (CompletionEventListener listener : listeners) {
            try {
                listener.onPuzzleCompleted(event);
            } catch (Exception e) {
                log.error("监听器处理完成记录失败: listener={}, sessionId={}",
                        listener.getClass().getName(), event.getSessionId(), e);
                allSuccess = false;
            }
        }

        if (allSuccess) {
            ack.acknowledge();
            log.debug("完成记录处理完成并提交: sessionId={}", event.getSessionId());
        } else {
            log.warn("完成记录部分监听器失败，不提交 offset: sessionId={}", event.getSessionId());
        }
    }
}
