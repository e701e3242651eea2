package com.puzzlehub.puzzleservice.infrastructure.store;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.UnaryOperator;

/**
 * InMemorySharedStore
 * -------------------------------------------------------
 * 进程内共享存储：与 Redis 实现保持同一契约，用于单节点开发（puzzle.store.type=memory）与测试。
 * -------------------------------------------------------
 * 实现要点：
 *  - 每个路径维护一个只增的版本号（删除后仍保留），事务提交前比对版本，等价于 WATCH；
 *  - 更新函数在锁外执行，与真实存储一样会遇到并发冲突并重试；
 *  - 读写一律复制，调用方拿到的字段表与内部状态互不影响；
 *  - 变更通知在锁外通过 dispatcher 投递，默认在写入线程上同步回调；
 *  - setAvailable(false) 模拟存储不可达。
 */
@Slf4j
public class InMemorySharedStore implements SharedStore {

    private final Object lock = new Object();
    private final Map<String, Map<String, Object>> data = new HashMap<>();
    private final Map<String, Long> versions = new HashMap<>();
    private long versionSeq = 0L;

    private final List<Registration> subscriptions = new CopyOnWriteArrayList<>();
    /** connectionId → (path → 合并值；Optional.empty() 表示删除) */
    private final Map<String, Map<String, Optional<Map<String, Object>>>> cleanups = new ConcurrentHashMap<>();

    private final int maxAttempts;
    private final Executor dispatcher;
    private volatile boolean available = true;

    public InMemorySharedStore(int maxAttempts) {
        this(maxAttempts, Runnable::run);
    }

    public InMemorySharedStore(int maxAttempts, Executor dispatcher) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.dispatcher = dispatcher;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    @Override
    public void write(String path, Map<String, Object> value) {
        StoreChange change;
        synchronized (lock) {
            ensureAvailable();
            change = put(path, value);
        }
        dispatch(change);
    }

    @Override
    public void update(String path, Map<String, Object> fields) {
        StoreChange change;
        synchronized (lock) {
            ensureAvailable();
            Map<String, Object> merged = new LinkedHashMap<>(data.getOrDefault(path, Map.of()));
            merged.putAll(fields);
            change = put(path, merged);
        }
        dispatch(change);
    }

    @Override
    public Map<String, Object> read(String path) {
        synchronized (lock) {
            ensureAvailable();
            return copy(data.get(path));
        }
    }

    @Override
    public TxResult transactionalUpdate(String path, UnaryOperator<Map<String, Object>> updateFn) {
        Map<String, Object> current = Map.of();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            long seenVersion;
            synchronized (lock) {
                ensureAvailable();
                current = copy(data.get(path));
                seenVersion = versions.getOrDefault(path, 0L);
            }
            Map<String, Object> next = updateFn.apply(copy(current));
            if (next == null) {
                return TxResult.aborted(current, attempt);
            }
            StoreChange change;
            synchronized (lock) {
                ensureAvailable();
                if (versions.getOrDefault(path, 0L) != seenVersion) {
                    log.debug("内存存储事务冲突，重试: path={}, attempt={}", path, attempt);
                    continue;
                }
                change = put(path, next);
            }
            dispatch(change);
            return TxResult.committed(copy(next), attempt);
        }
        return TxResult.conflict(current, maxAttempts);
    }

    @Override
    public void remove(String path) {
        StoreChange change;
        synchronized (lock) {
            ensureAvailable();
            change = put(path, Map.of());
        }
        dispatch(change);
    }

    @Override
    public Subscription subscribe(String path, StoreListener listener) {
        ensureAvailable();
        Registration reg = new Registration(path, listener);
        subscriptions.add(reg);
        return () -> subscriptions.remove(reg);
    }

    @Override
    public void onDisconnectCleanup(String connectionId, String path, Map<String, Object> valueOrRemoval) {
        ensureAvailable();
        cleanups.computeIfAbsent(connectionId, k -> new ConcurrentHashMap<>())
                .put(path, Optional.ofNullable(valueOrRemoval).map(LinkedHashMap::new));
    }

    @Override
    public void disconnect(String connectionId) {
        Map<String, Optional<Map<String, Object>>> actions = cleanups.remove(connectionId);
        if (actions == null) {
            return;
        }
        log.debug("执行断线清理: connectionId={}, actions={}", connectionId, actions.size());
        actions.forEach((path, value) -> {
            if (value.isPresent()) {
                update(path, value.get());
            } else {
                remove(path);
            }
        });
    }

    @Override
    public void cancelDisconnectCleanups(String connectionId) {
        cleanups.remove(connectionId);
    }

    // ---------------- internal ----------------

    /** 调用方持有 lock */
    private StoreChange put(String path, Map<String, Object> value) {
        versions.put(path, ++versionSeq);
        if (value == null || value.isEmpty()) {
            data.remove(path);
            return StoreChange.removal(path);
        }
        Map<String, Object> stored = new LinkedHashMap<>(value);
        data.put(path, stored);
        return StoreChange.of(path, copy(stored));
    }

    private void dispatch(StoreChange change) {
        List<Registration> targets = new ArrayList<>();
        for (Registration reg : subscriptions) {
            if (StorePaths.covers(reg.path, change.getPath())) {
                targets.add(reg);
            }
        }
        for (Registration reg : targets) {
            StoreChange own = new StoreChange(change.getPath(), copy(change.getValue()), change.isRemoved());
            dispatcher.execute(() -> {
                try {
                    reg.listener.onChange(own);
                } catch (RuntimeException e) {
                    // 观察者异常不能反向影响写入方
                    log.warn("变更回调异常: path={}", own.getPath(), e);
                }
            });
        }
    }

    private void ensureAvailable() {
        if (!available) {
            throw new StoreUnavailableException("共享存储不可达");
        }
    }

    private static Map<String, Object> copy(Map<String, Object> src) {
        return src == null ? new LinkedHashMap<>() : new LinkedHashMap<>(src);
    }

    private record Registration(String path, StoreListener listener) {}
}
