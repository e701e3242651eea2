package com.puzzlehub.puzzleservice.infrastructure.store;

import com.puzzlehub.puzzleservice.infrastructure.redis.RedisOps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.PatternTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.listener.Topic;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * RedisSharedStore
 * -------------------------------------------------------
 * 共享存储的 Redis 实现：
 *  - 每个路径对应一个 Hash；
 *  - transactionalUpdate：WATCH 路径 → HGETALL → 调用更新函数 → MULTI(DEL + HSET) → EXEC，
 *    EXEC 结果为空（null 或空列表）说明 WATCH 的键被并发修改、事务已被丢弃，
 *    重新读取后重试，次数上限 maxAttempts；
 *  - 每次写入成功后向 "puzzle-store:" + path 频道发布 {@link StoreChange}；
 *  - subscribe 同时订阅路径自身频道和 "路径:*" 模式，覆盖全部子路径；
 *  - 断线清理登记在 "puzzle-store:ondisconnect:{connectionId}" Hash 中，
 *    由本节点在 WebSocket 断开时执行；节点崩溃时不会执行，由心跳超时兜底。
 * 连接类异常统一转换为 {@link StoreUnavailableException}。
 */
@Slf4j
public class RedisSharedStore implements SharedStore {

    static final String CHANNEL_PREFIX = "puzzle-store:";
    static final String CLEANUP_PREFIX = "puzzle-store:ondisconnect:";
    static final String REMOVAL_MARKER = "__REMOVE__";

    private final RedisOps ops;
    private final RedisMessageListenerContainer container;
    private final int maxAttempts;

    public RedisSharedStore(RedisOps ops, RedisMessageListenerContainer container, int maxAttempts) {
        this.ops = ops;
        this.container = container;
        this.maxAttempts = maxAttempts;
    }

    @Override
    public void write(String path, Map<String, Object> value) {
        guarded(() -> {
            ops.hReplace(path, value);
            return null;
        });
        publish(value.isEmpty() ? StoreChange.removal(path) : StoreChange.of(path, new LinkedHashMap<>(value)));
    }

    @Override
    public void update(String path, Map<String, Object> fields) {
        if (fields.isEmpty()) {
            return;
        }
        Map<String, Object> merged = guarded(() -> ops.hMergeAndGet(path, fields));
        publish(StoreChange.of(path, merged));
    }

    @Override
    public Map<String, Object> read(String path) {
        return guarded(() -> ops.hGetAll(path));
    }

    @Override
    public TxResult transactionalUpdate(String path, UnaryOperator<Map<String, Object>> updateFn) {
        Map<String, Object> last = new HashMap<>();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            AtomicReference<Map<String, Object>> seen = new AtomicReference<>();
            AtomicReference<Map<String, Object>> written = new AtomicReference<>();
            Boolean committed = guarded(() -> ops.execute(new SessionCallback<Boolean>() {
                @SuppressWarnings("unchecked")
                @Override
                public <K, V> Boolean execute(RedisOperations<K, V> operations) throws DataAccessException {
                    // 1) 监视路径
                    operations.watch((K) path);
                    // 2) 读取当前值并交给更新函数
                    Map<Object, Object> raw = operations.opsForHash().entries((K) path);
                    Map<String, Object> current = new LinkedHashMap<>();
                    raw.forEach((k, v) -> current.put(String.valueOf(k), v));
                    seen.set(current);
                    Map<String, Object> next = updateFn.apply(new LinkedHashMap<>(current));
                    if (next == null) {
                        operations.unwatch();
                        return null;
                    }
                    // 3) 事务内整体替换
                    operations.multi();
                    operations.delete((K) path);
                    if (!next.isEmpty()) {
                        operations.opsForHash().putAll((K) path, next);
                    }
                    written.set(next);
                    // 4) 队列里至少有 DEL，结果为空只可能是 WATCH 的键被改动、事务被丢弃
                    List<Object> res = operations.exec();
                    return res != null && !res.isEmpty();
                }
            }));
            last = seen.get() == null ? last : seen.get();
            if (committed == null) {
                return TxResult.aborted(last, attempt);
            }
            if (committed) {
                Map<String, Object> value = written.get();
                publish(value.isEmpty() ? StoreChange.removal(path) : StoreChange.of(path, new LinkedHashMap<>(value)));
                return TxResult.committed(new LinkedHashMap<>(value), attempt);
            }
            log.debug("Redis 事务冲突，重试: path={}, attempt={}", path, attempt);
        }
        return TxResult.conflict(last, maxAttempts);
    }

    @Override
    public void remove(String path) {
        guarded(() -> ops.del(path));
        publish(StoreChange.removal(path));
    }

    @Override
    public Subscription subscribe(String path, StoreListener listener) {
        MessageListener ml = (Message message, byte[] pattern) -> {
            Object body = ops.deserialize(message.getBody());
            if (body instanceof StoreChange change) {
                listener.onChange(change);
            } else {
                log.warn("忽略无法识别的变更消息: channel={}", new String(message.getChannel()));
            }
        };
        List<Topic> topics = List.of(
                new ChannelTopic(CHANNEL_PREFIX + path),
                new PatternTopic(CHANNEL_PREFIX + path + StorePaths.SEPARATOR + "*"));
        guarded(() -> {
            container.addMessageListener(ml, topics);
            return null;
        });
        AtomicBoolean active = new AtomicBoolean(true);
        return () -> {
            if (active.compareAndSet(true, false)) {
                container.removeMessageListener(ml);
            }
        };
    }

    @Override
    public void onDisconnectCleanup(String connectionId, String path, Map<String, Object> valueOrRemoval) {
        Object action = valueOrRemoval == null ? REMOVAL_MARKER : new LinkedHashMap<>(valueOrRemoval);
        guarded(() -> {
            ops.hSet(CLEANUP_PREFIX + connectionId, path, action);
            return null;
        });
    }

    @Override
    @SuppressWarnings("unchecked")
    public void disconnect(String connectionId) {
        Map<String, Object> actions = guarded(() -> ops.hGetAll(CLEANUP_PREFIX + connectionId));
        guarded(() -> ops.del(CLEANUP_PREFIX + connectionId));
        log.debug("执行断线清理: connectionId={}, actions={}", connectionId, actions.size());
        actions.forEach((path, action) -> {
            if (action instanceof Map<?, ?> fields) {
                update(path, (Map<String, Object>) fields);
            } else {
                remove(path);
            }
        });
    }

    @Override
    public void cancelDisconnectCleanups(String connectionId) {
        guarded(() -> ops.del(CLEANUP_PREFIX + connectionId));
    }

    private void publish(StoreChange change) {
        guarded(() -> {
            ops.publish(CHANNEL_PREFIX + change.getPath(), change);
            return null;
        });
    }

    private static <T> T guarded(Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessResourceFailureException | QueryTimeoutException e) {
            throw new StoreUnavailableException("Redis 不可达: " + e.getMessage(), e);
        }
    }
}
