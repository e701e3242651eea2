package com.puzzlehub.completionkafkanotifier.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.ComponentScan;

/**
 * 完成记录 Kafka 通知器自动配置类。
 *
 * 配置了 completion.kafka.bootstrap-servers 时启用，扫描注册：
 * - {@link CompletionKafkaConfig}
 * - {@link com.puzzlehub.completionkafkanotifier.publisher.CompletionEventPublisher}
 * - {@link com.puzzlehub.completionkafkanotifier.listener.CompletionEventConsumer}
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "completion.kafka", name = "bootstrap-servers")
@ComponentScan(basePackages = "com.puzzlehub.completionkafkanotifier")
public class CompletionKafkaNotifierAutoConfiguration {
}
