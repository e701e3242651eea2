package com.puzzlehub.completionkafkanotifier.publisher;

import com.alibaba.fastjson2.JSON;
import com.puzzlehub.completionkafkanotifier.event.CompletionRecordEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * 完成记录发布器。
 *
 * 以 sessionId 作为消息 key，保证同一会话的记录落在同一分区、按轮次有序。
 */
@Slf4j
@Component
public class CompletionEventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;

    @Value("${completion.kafka.topic:puzzle-completed}")
    private String topic;

    public CompletionEventPublisher(@Qualifier("completionKafkaTemplate") KafkaTemplate<String, String> kafkaTemplate) {
        this.kafkaTemplate = kafkaTemplate;
    }

    /**
     * 异步发布完成记录。
     *
     * @return 发送结果；调用方可忽略，失败已记录错误日志
     */
    public CompletableFuture<SendResult<String, String>> publish(CompletionRecordEvent event) {
        String message = JSON.toJSONString(event);
        CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(topic, event.getSessionId(), message);
        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.info("完成记录发布成功: sessionId={}, epoch={}, offset={}",
                        event.getSessionId(), event.getEpoch(), result.getRecordMetadata().offset());
            } else {
                log.error("完成记录发布失败: sessionId={}, epoch={}", event.getSessionId(), event.getEpoch(), ex);
            }
        });
        return future;
    }
}
