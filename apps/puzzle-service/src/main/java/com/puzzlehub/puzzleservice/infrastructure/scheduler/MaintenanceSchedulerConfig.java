package com.puzzlehub.puzzleservice.infrastructure.scheduler;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 定时线程池配置类，统一创建同步维护用的 ScheduledThreadPoolExecutor。
 *
 * 功能说明：
 * 1. 从配置文件读取核心线程数（scheduler.maintenance.corePoolSize）；
 * 2. 线程命名为 puzzle-maint-N，便于排查；
 * 3. 守护线程，JVM 退出时不等待；
 * 4. DiscardPolicy：任务满时直接丢弃（下个周期会再次扫描）；
 * 5. setRemoveOnCancelPolicy(true)，取消的任务及时移出队列。
 *
 * 用于：锁回收与离线扫描、进度对账、光标合并写入。
 */
@Configuration
public class MaintenanceSchedulerConfig {

    @Value("${scheduler.maintenance.corePoolSize:2}")
    private int corePoolSize;

    @Bean(name = "puzzleMaintenanceScheduler", destroyMethod = "shutdownNow")
    public ScheduledThreadPoolExecutor puzzleMaintenanceScheduler() {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "puzzle-maint-" + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
        ScheduledThreadPoolExecutor executor =
                new ScheduledThreadPoolExecutor(corePoolSize, tf, new ThreadPoolExecutor.DiscardPolicy());
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    /**
     * 同步协议使用的时钟（测试中替换为可控时钟）
     */
    @Bean
    public Clock puzzleClock() {
        return Clock.systemUTC();
    }
}
