package com.puzzlehub.puzzleservice.puzzle.application;

import com.puzzlehub.puzzleservice.puzzle.config.PuzzleSyncProperties;
import com.puzzlehub.puzzleservice.puzzle.sync.ParticipantSyncClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * SessionMaintenanceCoordinator
 * -------------------------------------------------
 * 后台维护编排：应用就绪后按固定周期执行
 * 1) heartbeat：为本节点上每个已连接的参与者客户端续写心跳，节点宕机后心跳自然停止；
 * 2) sweep：对每个活跃会话回收遗弃锁（TTL）并扫描离线参与者；
 * 3) reconcile：以拼块扫描校正进度计数。
 * 多个节点同时维护同一会话是安全的：各步骤都是条件事务，重复执行为空操作。
 */
@Slf4j
@Component
public class SessionMaintenanceCoordinator {

    private final ParticipantClientRegistry registry;
    private final PuzzleSyncProperties props;
    private final ScheduledExecutorService scheduler;

    public SessionMaintenanceCoordinator(ParticipantClientRegistry registry,
                                         PuzzleSyncProperties props,
                                         @Qualifier("puzzleMaintenanceScheduler") ScheduledExecutorService scheduler) {
        this.registry = registry;
        this.props = props;
        this.scheduler = scheduler;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        long heartbeatMs = props.getHeartbeatInterval().toMillis();
        long sweepMs = props.getSweepInterval().toMillis();
        long reconcileMs = props.getReconcileInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::heartbeatAll, heartbeatMs, heartbeatMs, TimeUnit.MILLISECONDS);
        scheduler.scheduleWithFixedDelay(this::sweepAll, sweepMs, sweepMs, TimeUnit.MILLISECONDS);
        scheduler.scheduleWithFixedDelay(this::reconcileAll, reconcileMs, reconcileMs, TimeUnit.MILLISECONDS);
        log.info("会话维护任务已启动: heartbeatInterval={}ms, sweepInterval={}ms, reconcileInterval={}ms",
                heartbeatMs, sweepMs, reconcileMs);
    }

    void heartbeatAll() {
        for (ParticipantSyncClient client : registry.all()) {
            try {
                client.heartbeat();
            } catch (RuntimeException e) {
                log.warn("心跳写入失败: sessionId={}, participantId={}, cause={}",
                        client.participant().sessionId(), client.participant().participantId(), e.getMessage());
            }
        }
    }

    void sweepAll() {
        for (ParticipantSyncClient client : registry.onePerSession()) {
            try {
                client.sweep();
            } catch (RuntimeException e) {
                log.warn("会话扫描失败: sessionId={}, cause={}", client.participant().sessionId(), e.getMessage());
            }
        }
    }

    void reconcileAll() {
        for (ParticipantSyncClient client : registry.onePerSession()) {
            try {
                client.reconcile();
            } catch (RuntimeException e) {
                log.warn("进度对账失败: sessionId={}, cause={}", client.participant().sessionId(), e.getMessage());
            }
        }
    }
}
