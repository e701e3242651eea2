package com.puzzlehub.puzzleservice.puzzle.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 同步协议参数（puzzle.sync.*），默认值即协议约定值。
 */
@Data
@Component
@ConfigurationProperties(prefix = "puzzle.sync")
public class PuzzleSyncProperties {

    /** 拼块锁空闲多久（无移动）视为遗弃，任何观察者可强制回收 */
    private Duration lockTtl = Duration.ofSeconds(5);

    /** 心跳间隔：本节点按此频率为已连接的参与者续写心跳 */
    private Duration heartbeatInterval = Duration.ofSeconds(5);

    /** 超过该时长无心跳视为离线 */
    private Duration offlineThreshold = Duration.ofSeconds(15);

    /** 旋转对齐容差（度） */
    private double rotationEpsilonDegrees = 5.0;

    /** 乐观事务最大尝试次数（含首次） */
    private int txMaxAttempts = 5;

    /** 锁回收、离线扫描的周期 */
    private Duration sweepInterval = Duration.ofSeconds(2);

    /** 进度对账周期 */
    private Duration reconcileInterval = Duration.ofSeconds(10);

    /** 光标合并写入间隔 */
    private Duration cursorFlushInterval = Duration.ofMillis(100);

    private Scoring scoring = new Scoring();

    @Data
    public static class Scoring {
        private int accuratePlacement = 100;
        private int quickPlacement = 50;
        private Duration quickPlacementThreshold = Duration.ofSeconds(5);
        private int combo = 25;
        private Duration comboWindow = Duration.ofSeconds(3);
        private int completionBonus = 1000;
        private int timeBonusBase = 1000;
        private int timeBonusFactor = 2;
        private int accuracyFactor = 10;
    }
}
