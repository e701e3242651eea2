package com.puzzlehub.puzzleservice.puzzle.sync;

import com.puzzlehub.puzzleservice.infrastructure.store.SharedStore;
import com.puzzlehub.puzzleservice.infrastructure.store.StoreChange;
import com.puzzlehub.puzzleservice.infrastructure.store.StoreCodec;
import com.puzzlehub.puzzleservice.infrastructure.store.Subscription;
import com.puzzlehub.puzzleservice.puzzle.config.PuzzleSyncProperties;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.CompletionRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.CursorRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.ParticipantRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.PieceRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.ProgressRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.PuzzleRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.SessionRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.DropResult;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.LockResult;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.ReleaseResult;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.SyncStatus;
import com.puzzlehub.puzzleservice.puzzle.domain.model.PlacementRule;
import com.puzzlehub.puzzleservice.puzzle.domain.model.PuzzleGeometry;
import com.puzzlehub.puzzleservice.puzzle.domain.model.ScoreCalculator;
import com.puzzlehub.puzzleservice.puzzle.domain.model.Vec3;
import com.puzzlehub.puzzleservice.puzzle.infrastructure.store.PuzzleKeys;
import com.puzzlehub.puzzleservice.puzzle.sync.event.PieceView;
import com.puzzlehub.puzzleservice.puzzle.sync.event.PuzzleEventBus;
import com.puzzlehub.puzzleservice.puzzle.sync.event.PuzzleEventListener;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicReference;

/**
 * ParticipantSyncClient
 * -------------------------------------------------------
 * 一个参与者的同步客户端：持有本地视图，只通过共享存储与其他客户端协作。
 * -------------------------------------------------------
 * 组成：
 *  - PieceLockManager：拼块独占权；
 *  - PiecePositionSynchronizer：位姿流、放置校验、回声抑制；
 *  - ProgressCoordinator：进度计数与唯一终局；
 *  - PresenceManager：加入/心跳/离开/离线扫描/光标；
 *  - SessionStateMachine：阶段迁移与重置、拆除。
 * 订阅会话根路径后，所有远端变更在 {@link #onChange(StoreChange)} 中按路径分发。
 */
@Slf4j
public class ParticipantSyncClient {

    private final SyncContext ctx;
    private final PieceLockManager locks;
    private final PiecePositionSynchronizer positions;
    private final ProgressCoordinator progress;
    private final PresenceManager presence;
    private final SessionStateMachine stateMachine;
    private final ScoreKeeper scoreKeeper;

    /** 最近一次通知给渲染层的会话状态（阶段/房主变化检测） */
    private final AtomicReference<SessionRecord> lastSeenSession = new AtomicReference<>();
    private final AtomicReference<Subscription> subscription = new AtomicReference<>();

    public ParticipantSyncClient(ParticipantContext participant,
                                 SharedStore store,
                                 StoreCodec codec,
                                 PuzzleSyncProperties props,
                                 Clock clock,
                                 Random random,
                                 CompletionSink sink,
                                 ScheduledExecutorService cursorScheduler) {
        PuzzleEventBus events = new PuzzleEventBus();
        this.ctx = new SyncContext(participant, store, codec, props, clock,
                new SessionCache(participant.sessionId(), store, codec),
                new LocalPieceView(),
                new SyncStatusTracker(participant, events),
                events);
        ScoreCalculator calculator = new ScoreCalculator(props.getScoring());
        this.scoreKeeper = new ScoreKeeper(ctx, calculator);
        this.locks = new PieceLockManager(ctx);
        this.progress = new ProgressCoordinator(ctx, calculator, sink);
        this.positions = new PiecePositionSynchronizer(ctx,
                new PlacementRule(props.getRotationEpsilonDegrees()), scoreKeeper, progress);
        this.stateMachine = new SessionStateMachine(ctx, progress, random);
        this.presence = new PresenceManager(ctx, locks, stateMachine, cursorScheduler);
    }

    // ==================== 生命周期 ====================

    /**
     * 订阅会话变更并加载快照
     */
    public void attach() {
        if (subscription.get() == null) {
            Subscription sub = ctx.store().subscribe(PuzzleKeys.session(ctx.sessionId()), this::onChange);
            if (!subscription.compareAndSet(null, sub)) {
                sub.unsubscribe();
            }
        }
        loadSnapshot();
    }

    public void detach() {
        Subscription sub = subscription.getAndSet(null);
        if (sub != null) {
            sub.unsubscribe();
        }
        presence.cancelCursorFlush();
    }

    /**
     * 从存储重新加载会话、拼图、拼块与参与者（加入或重连时调用）
     */
    public void loadSnapshot() {
        SessionRecord session = ctx.cache().loadSession();
        lastSeenSession.compareAndSet(null, session);
        PuzzleRecord puzzle = ctx.codec().fromFields(
                ctx.store().read(PuzzleKeys.puzzle(ctx.sessionId())), PuzzleRecord.class);
        if (puzzle != null) {
            ctx.cache().updatePuzzle(puzzle);
            List<PieceRecord> pieces = new ArrayList<>();
            for (String pieceId : PuzzleGeometry.pieceIds(puzzle)) {
                PieceRecord p = ctx.codec().fromFields(
                        ctx.store().read(PuzzleKeys.piece(ctx.sessionId(), pieceId)), PieceRecord.class);
                if (p != null) {
                    pieces.add(p);
                }
            }
            ctx.view().replaceAll(pieces);
            positions.markLoadedPlacements(pieces);
        }
        presence.markKnown(presence.participants());
        log.debug("快照已加载: sessionId={}, participantId={}, pieces={}",
                ctx.sessionId(), ctx.me(), ctx.view().size());
    }

    // ==================== 拼块操作 ====================

    public LockResult grab(String pieceId) {
        PieceRecord before = ctx.view().get(pieceId);
        boolean alreadyHeld = before != null && ctx.me().equals(before.getLockOwner());
        LockResult result = locks.acquire(pieceId);
        if (result.granted() && !alreadyHeld) {
            PieceRecord held = ctx.view().get(pieceId);
            scoreKeeper.recordGrab(held.getEpoch());
            positions.grabStarted(pieceId, ctx.now());
        }
        return result;
    }

    public boolean move(String pieceId, Vec3 position, double rotation) {
        return positions.move(pieceId, position, rotation);
    }

    public DropResult drop(String pieceId, Vec3 position, double rotation) {
        return positions.drop(pieceId, position, rotation);
    }

    /**
     * 拖动取消：不做放置校验，直接释放锁
     */
    public ReleaseResult cancel(String pieceId) {
        positions.cancelled(pieceId);
        return locks.release(pieceId);
    }

    // ==================== 在线状态 ====================

    public ParticipantRecord join(String displayName) {
        ParticipantRecord joined = presence.join(displayName);
        presence.applyRemote(joined.getParticipantId(), joined);
        return joined;
    }

    public boolean heartbeat() {
        return presence.heartbeat();
    }

    public void leave() {
        presence.leave();
    }

    public void updateCursor(double x, double y) {
        presence.updateCursor(x, y);
    }

    // ==================== 会话（房主） ====================

    public SessionRecord createSession() {
        SessionRecord s = stateMachine.create();
        lastSeenSession.compareAndSet(null, s);
        return s;
    }

    public void configurePuzzle(PuzzleRecord puzzle) {
        stateMachine.configurePuzzle(puzzle);
    }

    public SessionRecord start() {
        return stateMachine.start();
    }

    public SessionRecord pause() {
        return stateMachine.pause();
    }

    public SessionRecord resume() {
        return stateMachine.resume();
    }

    public SessionRecord reset() {
        return stateMachine.reset();
    }

    public void teardown() {
        stateMachine.teardown();
    }

    // ==================== 维护 ====================

    /**
     * 回收遗弃锁并扫描离线参与者
     */
    public void sweep() {
        if (!ctx.store().read(PuzzleKeys.puzzle(ctx.sessionId())).isEmpty()) {
            locks.evictStaleLocks();
        }
        presence.sweepOffline();
    }

    /**
     * @return 拼图尚未配置时为 null
     */
    public ProgressRecord reconcile() {
        if (ctx.store().read(PuzzleKeys.puzzle(ctx.sessionId())).isEmpty()) {
            return null;
        }
        return progress.reconcile();
    }

    // ==================== 查询 ====================

    public List<PieceView> pieces() {
        return ctx.view().snapshot();
    }

    public ProgressRecord progress() {
        return progress.current();
    }

    public List<ParticipantRecord> participants() {
        return presence.participants();
    }

    public boolean isOnline(ParticipantRecord p) {
        return presence.isOnline(p, ctx.now());
    }

    public SessionRecord session() {
        return ctx.cache().loadSession();
    }

    /**
     * @return 未配置时为 null
     */
    public PuzzleRecord puzzle() {
        return ctx.codec().fromFields(ctx.store().read(PuzzleKeys.puzzle(ctx.sessionId())), PuzzleRecord.class);
    }

    public long elapsedMillis() {
        return SessionStateMachine.elapsedMillis(ctx.cache().loadSession(), ctx.now());
    }

    public CompletionRecord completion() {
        return ctx.codec().fromFields(
                ctx.store().read(PuzzleKeys.completion(ctx.sessionId())), CompletionRecord.class);
    }

    public SyncStatus status() {
        return ctx.status().current();
    }

    public ParticipantContext participant() {
        return ctx.participant();
    }

    public void addListener(PuzzleEventListener listener) {
        ctx.events().add(listener);
    }

    public void removeListener(PuzzleEventListener listener) {
        ctx.events().remove(listener);
    }

    // ==================== 远端变更分发 ====================

    void onChange(StoreChange change) {
        String sid = ctx.sessionId();
        String path = change.getPath();
        try {
            if (path.equals(PuzzleKeys.session(sid))) {
                onSessionChange(change);
            } else if (path.equals(PuzzleKeys.puzzle(sid))) {
                if (!change.isRemoved()) {
                    ctx.cache().updatePuzzle(ctx.codec().fromFields(change.getValue(), PuzzleRecord.class));
                }
            } else if (path.startsWith(PuzzleKeys.piecePrefix(sid))) {
                if (change.isRemoved()) {
                    ctx.view().remove(path.substring(PuzzleKeys.piecePrefix(sid).length()));
                } else {
                    positions.applyRemote(ctx.codec().fromFields(change.getValue(), PieceRecord.class));
                }
            } else if (path.startsWith(PuzzleKeys.participantPrefix(sid))) {
                String participantId = path.substring(PuzzleKeys.participantPrefix(sid).length());
                presence.applyRemote(participantId, change.isRemoved()
                        ? null
                        : ctx.codec().fromFields(change.getValue(), ParticipantRecord.class));
            } else if (path.startsWith(PuzzleKeys.cursorPrefix(sid))) {
                if (!change.isRemoved()) {
                    CursorRecord cursor = ctx.codec().fromFields(change.getValue(), CursorRecord.class);
                    if (!ctx.me().equals(cursor.getParticipantId())) {
                        ctx.events().fire(l -> l.onCursorMoved(cursor));
                    }
                }
            } else if (path.equals(PuzzleKeys.progress(sid))) {
                if (!change.isRemoved()) {
                    ProgressRecord p = ctx.codec().fromFields(change.getValue(), ProgressRecord.class);
                    ctx.events().fire(l -> l.onProgressChanged(p));
                }
            } else if (path.equals(PuzzleKeys.completion(sid))) {
                if (!change.isRemoved()) {
                    progress.announceCompletion(ctx.codec().fromFields(change.getValue(), CompletionRecord.class));
                }
            }
        } catch (RuntimeException e) {
            log.warn("处理远端变更失败: sessionId={}, participantId={}, path={}", sid, ctx.me(), path, e);
        }
    }

    private void onSessionChange(StoreChange change) {
        if (change.isRemoved()) {
            lastSeenSession.set(null);
            log.info("会话已结束: sessionId={}, participantId={}", ctx.sessionId(), ctx.me());
            ctx.events().fire(PuzzleEventListener::onSessionEnded);
            return;
        }
        SessionRecord s = ctx.codec().fromFields(change.getValue(), SessionRecord.class);
        ctx.cache().updateSession(s);
        SessionRecord prev = lastSeenSession.getAndSet(s);
        if (prev == null || prev.getPhase() != s.getPhase() || prev.getEpoch() != s.getEpoch()) {
            ctx.events().fire(l -> l.onSessionPhaseChanged(s.getPhase(), s.getEpoch()));
        }
        if (prev != null && !Objects.equals(prev.getHostId(), s.getHostId())) {
            ctx.events().fire(l -> l.onHostChanged(s.getHostId()));
        }
    }
}
