package com.puzzlehub.puzzleservice.infrastructure.redis;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * RedisConfig
 * -------------------------------------------------------
 * Redis 连接与序列化配置（共享存储的 Redis 后端）
 * -------------------------------------------------------
 * Responsibilities:
 *  - 提供统一的 RedisTemplate（Key: String，Hash 字段值: JSON）；
 *  - 提供 pub/sub 监听容器，用于把路径变更推送给各参与者客户端。
 * 仅在 puzzle.store.type=redis（默认）时生效；memory 模式下不连接 Redis。
 */
@Configuration
@ConditionalOnProperty(prefix = "puzzle.store", name = "type", havingValue = "redis", matchIfMissing = true)
public class RedisConfig {

    /**
     * 通用 RedisTemplate
     * -------------------------------------------------------
     * Key / Hash Key 采用 StringRedisSerializer，保证路径与字段名可读；
     * Value / Hash Value 使用 GenericJackson2JsonRedisSerializer，变更通知也用它序列化。
     */
    @Bean
    public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory factory) {
        RedisTemplate<String, Object> tpl = new RedisTemplate<>();
        tpl.setConnectionFactory(factory);

        StringRedisSerializer keySer = new StringRedisSerializer();
        GenericJackson2JsonRedisSerializer valSer = new GenericJackson2JsonRedisSerializer();

        tpl.setKeySerializer(keySer);
        tpl.setValueSerializer(valSer);
        tpl.setHashKeySerializer(keySer);
        tpl.setHashValueSerializer(valSer);

        tpl.afterPropertiesSet();
        return tpl;
    }

    /**
     * 变更通知监听容器（每个订阅一个 channel + 子路径 pattern）
     */
    @Bean
    public RedisMessageListenerContainer storeListenerContainer(RedisConnectionFactory factory) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(factory);
        return container;
    }
}
