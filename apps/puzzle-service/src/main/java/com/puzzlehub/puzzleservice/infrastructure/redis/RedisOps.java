package com.puzzlehub.puzzleservice.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 公用 Redis 工具类：
 * - 封装 Hash / Key / 发布 / 事务 原语
 * - 业务路径与字段名由上层（共享存储、拼图键名）组织
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "puzzle.store", name = "type", havingValue = "redis", matchIfMissing = true)
public class RedisOps {

    private final RedisTemplate<String, Object> redis;

    // -------------- Hash --------------

    /**
     * 写入单个 Hash 字段
     */
    public void hSet(String key, String field, Object val) {
        redis.opsForHash().put(key, field, val);
    }

    /**
     * 获取整个 Hash（转为 Map<String,Object>）
     */
    public Map<String, Object> hGetAll(String key) {
        Map<Object, Object> raw = redis.opsForHash().entries(key);
        return toStringKeys(raw);
    }

    /**
     * 用新字段表整体替换 Hash（MULTI: DEL + HSET）
     */
    public void hReplace(String key, Map<String, Object> fields) {
        redis.execute(new SessionCallback<List<Object>>() {
            @SuppressWarnings("unchecked")
            @Override
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                operations.multi();
                operations.delete((K) key);
                if (!fields.isEmpty()) {
                    operations.opsForHash().putAll((K) key, fields);
                }
                return operations.exec();
            }
        });
    }

    /**
     * 合并写入字段并在同一事务内读回完整 Hash（MULTI: HSET + HGETALL）
     *
     * @return 写入后的完整字段表
     */
    public Map<String, Object> hMergeAndGet(String key, Map<String, Object> fields) {
        List<Object> res = redis.execute(new SessionCallback<List<Object>>() {
            @SuppressWarnings("unchecked")
            @Override
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                operations.multi();
                operations.opsForHash().putAll((K) key, fields);
                operations.opsForHash().entries((K) key);
                return operations.exec();
            }
        });
        if (res == null || res.size() < 2 || !(res.get(1) instanceof Map<?, ?> all)) {
            return new HashMap<>(fields);
        }
        return toStringKeys(all);
    }

    // -------------- Key --------------

    /**
     * 删除一个或多个 Key
     */
    public Long del(String... keys) {
        return redis.delete(List.of(keys));
    }

    // -------------- Pub/Sub --------------

    /**
     * 发布消息（值序列化器编码）
     */
    public void publish(String channel, Object message) {
        redis.convertAndSend(channel, message);
    }

    /**
     * 执行需要 WATCH/MULTI/EXEC 的会话回调
     */
    public <T> T execute(SessionCallback<T> callback) {
        return redis.execute(callback);
    }

    /**
     * 使用模板的值序列化器解码 pub/sub 消息体
     */
    public Object deserialize(byte[] body) {
        return redis.getValueSerializer().deserialize(body);
    }

    static Map<String, Object> toStringKeys(Map<?, ?> raw) {
        Map<String, Object> out = new HashMap<>();
        raw.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }
}
