package com.puzzlehub.puzzleservice.puzzle.sync;

import com.puzzlehub.puzzleservice.infrastructure.store.StoreUnavailableException;
import com.puzzlehub.puzzleservice.infrastructure.store.TxResult;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.PieceRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.SessionRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.LockResult;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.ReleaseResult;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.SessionPhase;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.SyncStatus;
import com.puzzlehub.puzzleservice.puzzle.domain.model.PuzzleGeometry;
import com.puzzlehub.puzzleservice.puzzle.infrastructure.store.PuzzleKeys;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * PieceLockManager
 * -------------------------------------------------
 * 拼块独占操作权。
 *
 * 规则：
 * 1) 加锁是对 lockOwner 的比较并设置：空、已属于自己、或已遗弃时成功，否则 DENIED 且无副作用；
 * 2) 遗弃判定只看时间：now - lockTimestamp ≥ lockTtl（移动会刷新 lockTimestamp），与断线信号无关；
 * 3) 会话不在 PLAYING 时一律拒绝；已放置的拼块不可再拾取；
 * 4) 事务冲突重试耗尽返回 BUSY 并把同步状态置为 DEGRADED；存储不可达返回 UNAVAILABLE；
 * 5) 参与者离线或离开时，其持有的全部锁被释放。
 */
@Slf4j
public class PieceLockManager {

    private final SyncContext ctx;

    public PieceLockManager(SyncContext ctx) {
        this.ctx = ctx;
    }

    /**
     * 尝试为本参与者锁定拼块
     */
    public LockResult acquire(String pieceId) {
        try {
            SessionRecord session = ctx.cache().loadSession();
            if (ctx.status().current() == SyncStatus.RECONNECTING) {
                // 读到了会话，说明存储已恢复
                ctx.status().connected();
            }
            if (session.getPhase() != SessionPhase.PLAYING) {
                return LockResult.NOT_PLAYING;
            }
            final String me = ctx.me();
            final long now = ctx.now();
            final long ttl = ctx.props().getLockTtl().toMillis();
            AtomicBoolean evicted = new AtomicBoolean(false);

            TxResult r = ctx.store().transactionalUpdate(PuzzleKeys.piece(ctx.sessionId(), pieceId), cur -> {
                PieceRecord p = ctx.codec().fromFields(cur, PieceRecord.class);
                if (p == null || p.getEpoch() != session.getEpoch() || p.isPlaced()) {
                    return null;
                }
                String owner = p.getLockOwner();
                boolean free = StringUtils.isBlank(owner);
                boolean stale = !free && now - p.getLockTimestamp() >= ttl;
                if (!free && !me.equals(owner) && !stale) {
                    return null;
                }
                evicted.set(stale && !me.equals(owner));
                p.setLockOwner(me);
                p.setLockTimestamp(now);
                p.setSeq(p.getSeq() + 1);
                p.setLastUpdatedBy(me);
                return ctx.codec().toFields(p);
            });

            if (r.isConflict()) {
                ctx.status().degraded("lock.acquire");
                return LockResult.BUSY;
            }
            ctx.status().connected();
            if (!r.isCommitted()) {
                return LockResult.DENIED;
            }
            if (evicted.get()) {
                log.info("回收遗弃的拼块锁并接手: sessionId={}, pieceId={}, newOwner={}", ctx.sessionId(), pieceId, me);
            }
            ctx.view().put(ctx.codec().fromFields(r.value(), PieceRecord.class));
            return LockResult.GRANTED;
        } catch (StoreUnavailableException e) {
            ctx.status().reconnecting(e);
            return LockResult.UNAVAILABLE;
        }
    }

    /**
     * 释放本参与者持有的锁（不做放置校验，位置保持存储中的最新值）
     */
    public ReleaseResult release(String pieceId) {
        return releaseIfOwnedBy(pieceId, ctx.me(), false) ? ReleaseResult.OK : ReleaseResult.NOT_OWNER;
    }

    /**
     * 释放某参与者持有的全部锁（离线/离开时调用）
     *
     * @return 释放数量
     */
    public int releaseAllHeldBy(String participantId) {
        int released = 0;
        for (String pieceId : PuzzleGeometry.pieceIds(ctx.cache().puzzle())) {
            if (releaseIfOwnedBy(pieceId, participantId, false)) {
                released++;
            }
        }
        if (released > 0) {
            log.info("已释放参与者持有的拼块锁: sessionId={}, participantId={}, count={}",
                    ctx.sessionId(), participantId, released);
        }
        return released;
    }

    /**
     * 扫描并回收超过 TTL 未移动的锁
     *
     * @return 回收数量
     */
    public int evictStaleLocks() {
        int evicted = 0;
        for (String pieceId : PuzzleGeometry.pieceIds(ctx.cache().puzzle())) {
            if (releaseIfOwnedBy(pieceId, null, true)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("回收遗弃拼块锁: sessionId={}, count={}", ctx.sessionId(), evicted);
        }
        return evicted;
    }

    /**
     * @param owner     期望的持有者；为 null 时不限持有者
     * @param staleOnly 只释放已超过 TTL 的锁
     */
    private boolean releaseIfOwnedBy(String pieceId, String owner, boolean staleOnly) {
        final long now = ctx.now();
        final long ttl = ctx.props().getLockTtl().toMillis();
        TxResult r = ctx.store().transactionalUpdate(PuzzleKeys.piece(ctx.sessionId(), pieceId), cur -> {
            PieceRecord p = ctx.codec().fromFields(cur, PieceRecord.class);
            if (p == null || StringUtils.isBlank(p.getLockOwner())) {
                return null;
            }
            if (owner != null && !owner.equals(p.getLockOwner())) {
                return null;
            }
            if (staleOnly && now - p.getLockTimestamp() < ttl) {
                return null;
            }
            p.setLockOwner("");
            p.setSeq(p.getSeq() + 1);
            p.setLastUpdatedBy(ctx.me());
            return ctx.codec().toFields(p);
        });
        if (r.isConflict()) {
            ctx.status().degraded("lock.release");
            return false;
        }
        if (r.isCommitted()) {
            ctx.view().put(ctx.codec().fromFields(r.value(), PieceRecord.class));
            return true;
        }
        return false;
    }
}
