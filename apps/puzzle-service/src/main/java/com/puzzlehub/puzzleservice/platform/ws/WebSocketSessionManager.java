package com.puzzlehub.puzzleservice.platform.ws;

import com.puzzlehub.puzzleservice.puzzle.application.ParticipantClientRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.security.Principal;

/**
 * 监听 STOMP 连接/断开事件。
 *
 * 断开时执行该用户各参与者客户端登记的断线清理（心跳置 0、删除光标），
 * 让其他参与者在下一次离线扫描时就能判定离线；真正的离线判定仍以心跳为准。
 */
@Slf4j
@Component
public class WebSocketSessionManager {

    private final ParticipantClientRegistry registry;

    public WebSocketSessionManager(ParticipantClientRegistry registry) {
        this.registry = registry;
    }

    @EventListener
    public void handleSessionConnect(SessionConnectEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        Principal principal = accessor.getUser();
        if (principal == null) {
            log.warn("收到 SessionConnectEvent 但缺少用户信息，session={}", accessor.getSessionId());
            return;
        }
        log.info("用户 {} WebSocket 连接 {} 建立", principal.getName(), accessor.getSessionId());
    }

    /**
     * 连接断开（关闭页签、网络中断、进程崩溃都会触发）
     */
    @EventListener
    public void handleSessionDisconnect(SessionDisconnectEvent event) {
        Principal principal = event.getUser();
        if (principal == null) {
            return;
        }
        int cleaned = registry.disconnectUser(principal.getName());
        log.info("用户 {} WebSocket 连接 {} 断开，注销参与者客户端 {} 个",
                principal.getName(), event.getSessionId(), cleaned);
    }
}
