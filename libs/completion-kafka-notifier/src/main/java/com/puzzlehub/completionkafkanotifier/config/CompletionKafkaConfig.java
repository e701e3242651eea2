package com.puzzlehub.completionkafkanotifier.config;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.ContainerProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * 拼图完成记录 Kafka 配置。
 *
 * 配置要求（application.yml）：
 * <pre>
 * completion:
 *   kafka:
 *     bootstrap-servers: localhost:9092
 *     topic: puzzle-completed
 *     consumer:
 *       group-id: puzzle-completed-group
 * </pre>
 *
 * 条件控制由 {@link CompletionKafkaNotifierAutoConfiguration} 统一管理。
 */
@Configuration
public class CompletionKafkaConfig {

    /** Kafka 集群地址，多个 broker 用逗号分隔 */
    @Value("${completion.kafka.bootstrap-servers}")
    private String bootstrapServers;

    /** 消费者组 ID（排行榜/计分服务使用） */
    @Value("${completion.kafka.consumer.group-id:puzzle-completed-group}")
    private String consumerGroupId;

    /**
     * 生产者工厂。
     * 完成记录每局只产生一次，丢失即意味着排行榜缺一条成绩，因此要求 acks=all 且开启幂等。
     */
    @Bean
    public ProducerFactory<String, String> completionKafkaProducerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        // 消息体为 JSON 字符串
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        return new DefaultKafkaProducerFactory<>(props);
    }

    @Bean
    public KafkaTemplate<String, String> completionKafkaTemplate() {
        return new KafkaTemplate<>(completionKafkaProducerFactory());
    }

    /**
     * 消费者配置：手动提交 offset，从最早位置开始（成绩不能漏）。
     */
    @Bean
    public ConsumerFactory<String, String> completionKafkaConsumerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, consumerGroupId);
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 50);
        return new DefaultKafkaConsumerFactory<>(props);
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, String> completionKafkaListenerContainerFactory() {
        ConcurrentKafkaListenerContainerFactory<String, String> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(completionKafkaConsumerFactory());
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL);
        factory.setConcurrency(1);
        return factory;
    }
}
