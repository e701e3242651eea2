package com.puzzlehub.puzzleservice.puzzle.sync;

import com.puzzlehub.puzzleservice.infrastructure.store.StoreCodec;
import com.puzzlehub.puzzleservice.infrastructure.store.StoreUnavailableException;
import com.puzzlehub.puzzleservice.infrastructure.store.TxResult;
import com.puzzlehub.puzzleservice.puzzle.domain.constants.PuzzleMessages;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.CursorRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.ParticipantRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.SessionRecord;
import com.puzzlehub.puzzleservice.puzzle.infrastructure.store.PuzzleKeys;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * PresenceManager
 * -------------------------------------------------
 * 在线状态与参与者生命周期：
 * 1) 在线判定：now - lastHeartbeat < offlineThreshold；心跳是主信号，断线清理只是加速；
 * 2) 离线：释放其全部拼块锁，房主离线不拆除会话；
 * 3) 主动离开：释放锁、删除记录；房主离开时移交给最早加入的剩余参与者；无人剩余则拆除会话；
 * 4) 光标：尽力而为，按刷新间隔合并写入。
 */
@Slf4j
public class PresenceManager {

    private final SyncContext ctx;
    private final PieceLockManager locks;
    private final SessionStateMachine stateMachine;
    /** 光标合并写入用；为 null 时直接写 */
    private final ScheduledExecutorService cursorScheduler;

    /** 本客户端已见过的参与者（用于加入/离开通知去重） */
    private final Set<String> knownParticipants = ConcurrentHashMap.newKeySet();
    /** 已判定离线的参与者，恢复心跳后移除 */
    private final Set<String> offlineParticipants = ConcurrentHashMap.newKeySet();

    private final AtomicReference<CursorRecord> pendingCursor = new AtomicReference<>();
    private final AtomicReference<ScheduledFuture<?>> cursorFlush = new AtomicReference<>();

    public PresenceManager(SyncContext ctx,
                           PieceLockManager locks,
                           SessionStateMachine stateMachine,
                           ScheduledExecutorService cursorScheduler) {
        this.ctx = ctx;
        this.locks = locks;
        this.stateMachine = stateMachine;
        this.cursorScheduler = cursorScheduler;
    }

    /**
     * 加入会话（重复加入保留已有计分，仅刷新心跳与昵称）
     */
    public ParticipantRecord join(String displayName) {
        SessionRecord session = ctx.cache().loadSession();
        final String me = ctx.me();
        final long now = ctx.now();
        TxResult r = ctx.store().transactionalUpdate(PuzzleKeys.participant(ctx.sessionId(), me), cur -> {
            ParticipantRecord p = ctx.codec().fromFields(cur, ParticipantRecord.class);
            if (p == null || p.getJoinedAt() <= 0) {
                p = ParticipantRecord.builder()
                        .participantId(me)
                        .displayName(StringUtils.defaultIfBlank(displayName, me))
                        .host(me.equals(session.getHostId()))
                        .joinedAt(now)
                        .epoch(session.getEpoch())
                        .build();
            } else if (StringUtils.isNotBlank(displayName)) {
                p.setDisplayName(displayName);
            }
            p.setLastHeartbeat(now);
            return ctx.codec().toFields(p);
        });
        if (r.isConflict()) {
            ctx.status().degraded("presence.join");
            throw new IllegalStateException(PuzzleMessages.SYNC_BUSY);
        }
        ParticipantRecord joined = ctx.codec().fromFields(r.value(), ParticipantRecord.class);
        ctx.store().update(PuzzleKeys.participantIndex(ctx.sessionId()), Map.of(me, joined.getJoinedAt()));

        String connectionId = ctx.participant().connectionId();
        ctx.store().onDisconnectCleanup(connectionId,
                PuzzleKeys.participant(ctx.sessionId(), me), Map.of("lastHeartbeat", 0L));
        ctx.store().onDisconnectCleanup(connectionId, PuzzleKeys.cursor(ctx.sessionId(), me), null);
        offlineParticipants.remove(me);
        log.info("参与者加入: sessionId={}, participantId={}, host={}", ctx.sessionId(), me, joined.isHost());
        return joined;
    }

    /**
     * 心跳
     *
     * @return 参与者记录不存在（已离开）或存储不可达时返回 false
     */
    public boolean heartbeat() {
        final long now = ctx.now();
        try {
            TxResult r = ctx.store().transactionalUpdate(PuzzleKeys.participant(ctx.sessionId(), ctx.me()), cur -> {
                if (cur.isEmpty()) {
                    return null;
                }
                cur.put("lastHeartbeat", now);
                return cur;
            });
            if (r.isConflict()) {
                ctx.status().degraded("presence.heartbeat");
                return false;
            }
            ctx.status().connected();
            return r.isCommitted();
        } catch (StoreUnavailableException e) {
            ctx.status().reconnecting(e);
            return false;
        }
    }

    /**
     * 主动离开
     */
    public void leave() {
        final String me = ctx.me();
        final String sid = ctx.sessionId();
        cancelCursorFlush();
        SessionRecord session = ctx.cache().loadSession();
        if (!ctx.store().read(PuzzleKeys.puzzle(sid)).isEmpty()) {
            locks.releaseAllHeldBy(me);
        }
        ctx.store().cancelDisconnectCleanups(ctx.participant().connectionId());
        ctx.store().remove(PuzzleKeys.participant(sid, me));
        ctx.store().remove(PuzzleKeys.cursor(sid, me));

        AtomicReference<Map<String, Object>> remaining = new AtomicReference<>(Map.of());
        ctx.store().transactionalUpdate(PuzzleKeys.participantIndex(sid), cur -> {
            cur.remove(me);
            remaining.set(new LinkedHashMap<>(cur));
            return cur;
        });
        log.info("参与者离开: sessionId={}, participantId={}, remaining={}", sid, me, remaining.get().size());

        if (remaining.get().isEmpty()) {
            stateMachine.destroy();
            return;
        }
        if (me.equals(session.getHostId())) {
            transferHost(remaining.get());
        }
    }

    /**
     * 扫描离线参与者：释放其锁并通知一次
     *
     * @return 本次新判定离线的参与者
     */
    public List<String> sweepOffline() {
        final long now = ctx.now();
        List<String> newlyOffline = new ArrayList<>();
        boolean puzzleConfigured = !ctx.store().read(PuzzleKeys.puzzle(ctx.sessionId())).isEmpty();
        for (ParticipantRecord p : participants()) {
            String id = p.getParticipantId();
            if (isOnline(p, now)) {
                offlineParticipants.remove(id);
                continue;
            }
            if (puzzleConfigured) {
                // 每轮扫描都释放，覆盖离线期间被其重新持有的情况
                locks.releaseAllHeldBy(id);
            }
            if (offlineParticipants.add(id)) {
                newlyOffline.add(id);
                log.info("参与者离线: sessionId={}, participantId={}, lastHeartbeat={}",
                        ctx.sessionId(), id, p.getLastHeartbeat());
                ctx.events().fire(l -> l.onParticipantLeft(id, false));
            }
        }
        return newlyOffline;
    }

    public boolean isOnline(ParticipantRecord p, long now) {
        return now - p.getLastHeartbeat() < ctx.props().getOfflineThreshold().toMillis();
    }

    /**
     * 当前会话的参与者（按加入先后）
     */
    public List<ParticipantRecord> participants() {
        List<ParticipantRecord> list = new ArrayList<>();
        for (String id : ctx.store().read(PuzzleKeys.participantIndex(ctx.sessionId())).keySet()) {
            ParticipantRecord p = ctx.codec().fromFields(
                    ctx.store().read(PuzzleKeys.participant(ctx.sessionId(), id)), ParticipantRecord.class);
            if (p != null && p.getParticipantId() != null) {
                list.add(p);
            }
        }
        list.sort(Comparator.comparingLong(ParticipantRecord::getJoinedAt)
                .thenComparing(ParticipantRecord::getParticipantId));
        return list;
    }

    /**
     * 更新光标位置（合并写入）
     */
    public void updateCursor(double x, double y) {
        CursorRecord cursor = new CursorRecord(ctx.me(), x, y, ctx.now());
        if (cursorScheduler == null) {
            writeCursor(cursor);
            return;
        }
        pendingCursor.set(cursor);
        ScheduledFuture<?> scheduled = cursorFlush.get();
        if (scheduled != null && !scheduled.isDone()) {
            return;
        }
        long delay = ctx.props().getCursorFlushInterval().toMillis();
        cursorFlush.set(cursorScheduler.schedule(this::flushCursor, delay, TimeUnit.MILLISECONDS));
    }

    /**
     * 远端参与者变更：首次出现通知加入，记录删除通知离开
     */
    public void applyRemote(String participantId, ParticipantRecord record) {
        if (record == null) {
            if (knownParticipants.remove(participantId)) {
                offlineParticipants.remove(participantId);
                ctx.events().fire(l -> l.onParticipantLeft(participantId, true));
            }
            return;
        }
        if (record.getParticipantId() == null) {
            // 断线清理写入的残片，不是完整记录
            return;
        }
        if (knownParticipants.add(participantId)) {
            ctx.events().fire(l -> l.onParticipantJoined(record));
        }
    }

    /**
     * 快照加载时登记已有参与者，不再补发加入通知
     */
    public void markKnown(List<ParticipantRecord> participants) {
        participants.forEach(p -> knownParticipants.add(p.getParticipantId()));
    }

    public void cancelCursorFlush() {
        ScheduledFuture<?> scheduled = cursorFlush.getAndSet(null);
        if (scheduled != null) {
            scheduled.cancel(false);
        }
        pendingCursor.set(null);
    }

    private void flushCursor() {
        CursorRecord cursor = pendingCursor.getAndSet(null);
        if (cursor != null) {
            writeCursor(cursor);
        }
    }

    private void writeCursor(CursorRecord cursor) {
        try {
            ctx.store().write(PuzzleKeys.cursor(ctx.sessionId(), cursor.getParticipantId()), ctx.codec().toFields(cursor));
        } catch (RuntimeException e) {
            log.debug("光标写入失败（忽略）: sessionId={}, participantId={}, cause={}",
                    ctx.sessionId(), cursor.getParticipantId(), e.getMessage());
        }
    }

    private void transferHost(Map<String, Object> remaining) {
        Optional<String> next = remaining.entrySet().stream()
                .sorted(Comparator.<Map.Entry<String, Object>>comparingLong(e -> StoreCodec.asLong(e.getValue()))
                        .thenComparing(Map.Entry::getKey))
                .map(Map.Entry::getKey)
                .findFirst();
        if (next.isEmpty()) {
            return;
        }
        final String oldHost = ctx.me();
        final String newHost = next.get();
        TxResult r = ctx.store().transactionalUpdate(PuzzleKeys.session(ctx.sessionId()), cur -> {
            SessionRecord s = ctx.codec().fromFields(cur, SessionRecord.class);
            if (s == null || !oldHost.equals(s.getHostId())) {
                return null;
            }
            s.setHostId(newHost);
            return ctx.codec().toFields(s);
        });
        if (!r.isCommitted()) {
            log.warn("房主移交未提交: sessionId={}, from={}, to={}, status={}",
                    ctx.sessionId(), oldHost, newHost, r.status());
            return;
        }
        ctx.store().transactionalUpdate(PuzzleKeys.participant(ctx.sessionId(), newHost), cur -> {
            if (cur.isEmpty()) {
                return null;
            }
            cur.put("host", true);
            return cur;
        });
        log.info("房主移交: sessionId={}, from={}, to={}", ctx.sessionId(), oldHost, newHost);
    }
}
