package com.puzzlehub.puzzleservice.infrastructure.store;

import com.puzzlehub.puzzleservice.infrastructure.redis.RedisOps;
import com.puzzlehub.puzzleservice.puzzle.config.PuzzleSyncProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

/**
 * 共享存储后端选择：
 *  - puzzle.store.type=redis（默认）：多节点部署，Redis Hash + pub/sub；
 *  - puzzle.store.type=memory：单节点开发调试，进程内存储。
 */
@Slf4j
@Configuration
public class StoreConfig {

    @Bean
    @ConditionalOnProperty(prefix = "puzzle.store", name = "type", havingValue = "redis", matchIfMissing = true)
    public SharedStore redisSharedStore(RedisOps ops, RedisMessageListenerContainer storeListenerContainer,
                                        PuzzleSyncProperties props) {
        int maxAttempts = props.getTxMaxAttempts();
        log.info("共享存储后端: redis, txMaxAttempts={}", maxAttempts);
        return new RedisSharedStore(ops, storeListenerContainer, maxAttempts);
    }

    @Bean
    @ConditionalOnProperty(prefix = "puzzle.store", name = "type", havingValue = "memory")
    public SharedStore inMemorySharedStore(PuzzleSyncProperties props) {
        int maxAttempts = props.getTxMaxAttempts();
        log.info("共享存储后端: memory, txMaxAttempts={}", maxAttempts);
        return new InMemorySharedStore(maxAttempts);
    }
}
