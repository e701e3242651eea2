package com.puzzlehub.puzzleservice.puzzle.application;

import com.puzzlehub.puzzleservice.infrastructure.store.SharedStore;
import com.puzzlehub.puzzleservice.puzzle.interfaces.ws.StompEventForwarder;
import com.puzzlehub.puzzleservice.puzzle.sync.ParticipantSyncClient;
import com.puzzlehub.puzzleservice.puzzle.sync.event.PuzzleEventListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 本节点上存活的参与者客户端（key = sessionId:userId）。
 * 客户端注册时订阅会话并挂上 STOMP 推送；会话结束或用户断线时注销。
 */
@Slf4j
@Component
public class ParticipantClientRegistry {

    private final Map<String, ParticipantSyncClient> clients = new ConcurrentHashMap<>();
    private final SharedStore store;
    private final SimpMessagingTemplate messaging;

    public ParticipantClientRegistry(SharedStore store, SimpMessagingTemplate messaging) {
        this.store = store;
        this.messaging = messaging;
    }

    public ParticipantSyncClient get(String sessionId, String userId) {
        return clients.get(key(sessionId, userId));
    }

    /**
     * 登记并挂载客户端（会话必须已存在）
     *
     * @return 实际生效的客户端；并发注册时返回先到者
     */
    public ParticipantSyncClient register(ParticipantSyncClient client) {
        String sessionId = client.participant().sessionId();
        String userId = client.participant().participantId();
        ParticipantSyncClient existing = clients.putIfAbsent(key(sessionId, userId), client);
        if (existing != null) {
            return existing;
        }
        client.addListener(new StompEventForwarder(messaging, sessionId, userId));
        client.addListener(new PuzzleEventListener() {
            @Override
            public void onSessionEnded() {
                unregister(sessionId, userId);
            }
        });
        try {
            client.attach();
        } catch (RuntimeException e) {
            clients.remove(key(sessionId, userId), client);
            throw e;
        }
        log.debug("参与者客户端已登记: sessionId={}, userId={}, connectionId={}",
                sessionId, userId, client.participant().connectionId());
        return client;
    }

    public void unregister(String sessionId, String userId) {
        ParticipantSyncClient client = clients.remove(key(sessionId, userId));
        if (client != null) {
            client.detach();
        }
    }

    /**
     * 用户 WebSocket 断开：执行其各客户端登记的断线清理并注销。
     * 在线判定仍以心跳为准，这里只是加速。
     *
     * @return 注销的客户端数量
     */
    public int disconnectUser(String userId) {
        List<String> keys = new ArrayList<>();
        clients.forEach((k, c) -> {
            if (userId.equals(c.participant().participantId())) {
                keys.add(k);
            }
        });
        for (String k : keys) {
            ParticipantSyncClient client = clients.remove(k);
            if (client == null) {
                continue;
            }
            client.detach();
            try {
                store.disconnect(client.participant().connectionId());
            } catch (RuntimeException e) {
                log.warn("断线清理执行失败: userId={}, connectionId={}, cause={}",
                        userId, client.participant().connectionId(), e.getMessage());
            }
        }
        return keys.size();
    }

    /**
     * 本节点全部客户端的快照（用于代发心跳）
     */
    public Collection<ParticipantSyncClient> all() {
        return new ArrayList<>(clients.values());
    }

    /**
     * 每个会话取一个本地客户端（用于后台维护）
     */
    public Collection<ParticipantSyncClient> onePerSession() {
        Map<String, ParticipantSyncClient> bySession = new LinkedHashMap<>();
        clients.values().forEach(c -> bySession.putIfAbsent(c.participant().sessionId(), c));
        return bySession.values();
    }

    public int size() {
        return clients.size();
    }

    private static String key(String sessionId, String userId) {
        return sessionId + ":" + userId;
    }
}
