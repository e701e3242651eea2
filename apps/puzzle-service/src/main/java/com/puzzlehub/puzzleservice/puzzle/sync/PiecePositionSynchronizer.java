package com.puzzlehub.puzzleservice.puzzle.sync;

import com.puzzlehub.puzzleservice.infrastructure.store.StoreUnavailableException;
import com.puzzlehub.puzzleservice.infrastructure.store.TxResult;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.PieceRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.PuzzleRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.DropResult;
import com.puzzlehub.puzzleservice.puzzle.domain.model.PlacementRule;
import com.puzzlehub.puzzleservice.puzzle.domain.model.Vec3;
import com.puzzlehub.puzzleservice.puzzle.infrastructure.store.PuzzleKeys;
import com.puzzlehub.puzzleservice.puzzle.sync.event.PiecePlacedEvent;
import com.puzzlehub.puzzleservice.puzzle.sync.event.PieceView;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * PiecePositionSynchronizer
 * -------------------------------------------------
 * 拼块位姿同步：
 *  - move：事务内确认仍持锁后推送位姿，每次附带递增的 seq 与 lastUpdatedBy；
 *  - drop：本地做放置校验，事务内吸附（或原地放下）并释放锁；
 *  - applyRemote：回声抑制 + (epoch, seq) 排序，过期或乱序的更新直接丢弃。
 */
@Slf4j
public class PiecePositionSynchronizer {

    private final SyncContext ctx;
    private final PlacementRule placementRule;
    private final ScoreKeeper scoreKeeper;
    private final ProgressCoordinator progress;

    /** pieceId → 本次拾取的开始时间（计算“快速放置”） */
    private final Map<String, Long> grabStartedAt = new ConcurrentHashMap<>();

    public PiecePositionSynchronizer(SyncContext ctx,
                                     PlacementRule placementRule,
                                     ScoreKeeper scoreKeeper,
                                     ProgressCoordinator progress) {
        this.ctx = ctx;
        this.placementRule = placementRule;
        this.scoreKeeper = scoreKeeper;
        this.progress = progress;
    }

    /**
     * 登记一次新的拾取（锁刚到手时调用）
     */
    public void grabStarted(String pieceId, long now) {
        grabStartedAt.put(pieceId, now);
    }

    /**
     * 拖动中推送位姿：事务内确认存储中的 lockOwner 仍是自己才写入，
     * 锁被回收或接管后不会覆盖新持锁者的位姿，也不会续期 lockTimestamp。
     *
     * @return 未持锁、锁已失效或写入失败时返回 false
     */
    public boolean move(String pieceId, Vec3 position, double rotation) {
        PieceRecord local = ctx.view().get(pieceId);
        if (local == null || !ctx.me().equals(local.getLockOwner())) {
            return false;
        }
        final long epoch = local.getEpoch();
        final long localSeq = local.getSeq();
        final long now = ctx.now();
        final String me = ctx.me();

        TxResult r;
        try {
            r = ctx.store().transactionalUpdate(PuzzleKeys.piece(ctx.sessionId(), pieceId), cur -> {
                PieceRecord p = ctx.codec().fromFields(cur, PieceRecord.class);
                if (p == null || p.getEpoch() != epoch || !me.equals(p.getLockOwner())) {
                    return null;
                }
                p.setX(position.x());
                p.setY(position.y());
                p.setZ(position.z());
                p.setRotation(rotation);
                p.setSeq(Math.max(p.getSeq(), localSeq) + 1);
                p.setLockTimestamp(now);
                p.setLastUpdatedBy(me);
                return ctx.codec().toFields(p);
            });
        } catch (StoreUnavailableException e) {
            // 位姿流是尽力而为，本地乐观状态保留
            ctx.status().reconnecting(e);
            return false;
        }

        if (r.isConflict()) {
            ctx.status().degraded("piece.move");
            return false;
        }
        if (!r.isCommitted()) {
            // 锁已不属于自己：以存储为准纠正本地持锁者，之后的 move 直接拒绝
            PieceRecord latest = ctx.codec().fromFields(r.value(), PieceRecord.class);
            if (latest != null && !applyRemote(latest)) {
                ctx.view().put(latest);
                ctx.events().fire(l -> l.onPieceUpdated(PieceView.of(latest)));
            }
            grabStartedAt.remove(pieceId);
            log.debug("move 被拒绝，锁已失效: sessionId={}, pieceId={}, me={}", ctx.sessionId(), pieceId, me);
            return false;
        }
        PieceRecord committed = ctx.codec().fromFields(r.value(), PieceRecord.class);
        ctx.view().put(committed);
        log.debug("move: sessionId={}, pieceId={}, seq={}", ctx.sessionId(), pieceId, committed.getSeq());
        return true;
    }

    /**
     * 放下拼块：校验放置并释放锁
     */
    public DropResult drop(String pieceId, Vec3 position, double rotation) {
        PieceRecord local = ctx.view().get(pieceId);
        if (local == null || !ctx.me().equals(local.getLockOwner())) {
            return DropResult.NOT_OWNER;
        }
        PuzzleRecord puzzle = ctx.cache().puzzle();
        final long epoch = local.getEpoch();
        final long localSeq = local.getSeq();
        final long now = ctx.now();
        final boolean correct = placementRule.isCorrect(puzzle, local, position, rotation);
        Long startedAt = grabStartedAt.get(pieceId);
        final ScoreKeeper.PlacementScore score = correct
                ? scoreKeeper.previewPlacement(epoch, startedAt == null ? Long.MAX_VALUE : now - startedAt, now)
                : null;
        final String me = ctx.me();
        AtomicBoolean placedNow = new AtomicBoolean(false);

        TxResult r;
        try {
            r = ctx.store().transactionalUpdate(PuzzleKeys.piece(ctx.sessionId(), pieceId), cur -> {
                placedNow.set(false);
                PieceRecord p = ctx.codec().fromFields(cur, PieceRecord.class);
                if (p == null || p.getEpoch() != epoch || !me.equals(p.getLockOwner())) {
                    return null;
                }
                if (correct && !p.isPlaced()) {
                    p.setX(p.getTargetX());
                    p.setY(p.getTargetY());
                    p.setZ(p.getTargetZ());
                    p.setRotation(p.getTargetRotation());
                    p.setPlaced(true);
                    p.setPlacedBy(me);
                    p.setPlacedAt(now);
                    p.setPlacedPoints(score.points());
                    placedNow.set(true);
                } else {
                    p.setX(position.x());
                    p.setY(position.y());
                    p.setZ(position.z());
                    p.setRotation(rotation);
                }
                p.setLockOwner("");
                p.setSeq(Math.max(p.getSeq(), localSeq) + 1);
                p.setLastUpdatedBy(me);
                return ctx.codec().toFields(p);
            });
        } catch (StoreUnavailableException e) {
            ctx.status().reconnecting(e);
            throw e;
        }

        if (r.isConflict()) {
            ctx.status().degraded("piece.drop");
            return DropResult.BUSY;
        }
        grabStartedAt.remove(pieceId);
        if (!r.isCommitted()) {
            // 锁已被回收，以存储中的值为准
            PieceRecord latest = ctx.codec().fromFields(r.value(), PieceRecord.class);
            if (latest != null) {
                applyRemote(latest);
            }
            return DropResult.NOT_OWNER;
        }
        PieceRecord committed = ctx.codec().fromFields(r.value(), PieceRecord.class);
        if (placedNow.get()) {
            scoreKeeper.applyPlacement(epoch, score, now);
        } else {
            scoreKeeper.recordMiss(epoch);
        }
        PieceRecord before = ctx.view().get(pieceId);
        ctx.view().put(committed);
        if (before == null || before.getSeq() < committed.getSeq()) {
            ctx.events().fire(l -> l.onPieceUpdated(PieceView.of(committed)));
        }
        if (placedNow.get()) {
            log.debug("拼块放置成功: sessionId={}, pieceId={}, by={}, points={}, combo={}",
                    ctx.sessionId(), pieceId, me, score.points(), score.combo());
            announcePlaced(committed);
            return DropResult.PLACED;
        }
        return DropResult.DROPPED;
    }

    /**
     * 拖动取消：丢弃拾取计时（锁由锁管理器释放）
     */
    public void cancelled(String pieceId) {
        grabStartedAt.remove(pieceId);
    }

    /**
     * 应用远端拼块更新
     *
     * @return 是否被采纳
     */
    public boolean applyRemote(PieceRecord remote) {
        PieceRecord local = ctx.view().get(remote.getPieceId());
        if (local != null) {
            // 本地正在拖动，且远端记录仍显示我持锁：这是自己写入的回声
            if (ctx.me().equals(local.getLockOwner()) && ctx.me().equals(remote.getLockOwner())) {
                return false;
            }
            if (!isNewer(remote, local)) {
                return false;
            }
        }
        ctx.view().put(remote);
        ctx.events().fire(l -> l.onPieceUpdated(PieceView.of(remote)));
        if (remote.isPlaced()) {
            announcePlaced(remote);
        }
        return true;
    }

    /**
     * 快照加载时登记已放置的拼块，不再重复通知
     */
    public void markLoadedPlacements(Iterable<PieceRecord> pieces) {
        for (PieceRecord p : pieces) {
            if (p.isPlaced()) {
                ctx.view().markPlacementAnnounced(p.getEpoch(), p.getPieceId());
            }
        }
    }

    static boolean isNewer(PieceRecord remote, PieceRecord local) {
        if (remote.getEpoch() != local.getEpoch()) {
            return remote.getEpoch() > local.getEpoch();
        }
        return remote.getSeq() > local.getSeq();
    }

    private void announcePlaced(PieceRecord piece) {
        if (!ctx.view().markPlacementAnnounced(piece.getEpoch(), piece.getPieceId())) {
            return;
        }
        PiecePlacedEvent event = new PiecePlacedEvent(
                ctx.sessionId(), piece.getPieceId(), piece.getEpoch(), piece.getPlacedBy(), piece.getPlacedAt());
        ctx.events().fire(l -> l.onPiecePlaced(event));
        progress.onPiecePlaced(event);
    }
}
