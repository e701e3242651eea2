package com.puzzlehub.puzzleservice.puzzle.sync;

import com.puzzlehub.puzzleservice.infrastructure.store.TxResult;
import com.puzzlehub.puzzleservice.puzzle.domain.constants.PuzzleMessages;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.ParticipantRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.PieceRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.ProgressRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.PuzzleRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.SessionRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.SessionPhase;
import com.puzzlehub.puzzleservice.puzzle.domain.model.PuzzleGeometry;
import com.puzzlehub.puzzleservice.puzzle.infrastructure.store.PuzzleKeys;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Random;
import java.util.function.UnaryOperator;

/**
 * SessionStateMachine
 * -------------------------------------------------
 * 会话阶段：WAITING → PLAYING ⇄ PAUSED，PLAYING → COMPLETED（由进度协调器触发）。
 * 房主专属：配置拼图（仅 WAITING）、开始、暂停、继续、重置（epoch+1 回到 WAITING）、拆除。
 * 所有迁移都是会话路径上的事务，阶段不符时放弃并抛出 IllegalStateException。
 */
@Slf4j
public class SessionStateMachine {

    private final SyncContext ctx;
    private final ProgressCoordinator progress;
    private final Random random;

    public SessionStateMachine(SyncContext ctx, ProgressCoordinator progress, Random random) {
        this.ctx = ctx;
        this.progress = progress;
        this.random = random;
    }

    /**
     * 创建会话，调用者成为房主
     *
     * @throws IllegalStateException 会话已存在
     */
    public SessionRecord create() {
        final long now = ctx.now();
        TxResult r = ctx.store().transactionalUpdate(PuzzleKeys.session(ctx.sessionId()), cur -> {
            if (!cur.isEmpty()) {
                return null;
            }
            SessionRecord s = SessionRecord.builder()
                    .sessionId(ctx.sessionId())
                    .hostId(ctx.me())
                    .phase(SessionPhase.WAITING)
                    .epoch(1L)
                    .createdAt(now)
                    .build();
            return ctx.codec().toFields(s);
        });
        SessionRecord s = committedOrThrow(r, PuzzleMessages.SESSION_EXISTS);
        ctx.cache().updateSession(s);
        log.info("会话已创建: sessionId={}, hostId={}", ctx.sessionId(), ctx.me());
        return s;
    }

    /**
     * 配置拼图（仅 WAITING，开始后不可修改）
     */
    public void configurePuzzle(PuzzleRecord puzzle) {
        SessionRecord s = requireHost();
        if (s.getPhase() != SessionPhase.WAITING) {
            throw new IllegalStateException(PuzzleMessages.formatPhaseNotAllowed(s.getPhase(), "配置拼图"));
        }
        ctx.store().write(PuzzleKeys.puzzle(ctx.sessionId()), ctx.codec().toFields(puzzle));
        ctx.cache().updatePuzzle(puzzle);
        log.info("拼图已配置: sessionId={}, difficulty={}, grid={}x{}",
                ctx.sessionId(), puzzle.getDifficulty(), puzzle.getColumns(), puzzle.getRows());
    }

    /**
     * 开始：本轮拼块尚未生成时先打乱生成
     */
    public SessionRecord start() {
        SessionRecord s = requireHost();
        if (s.getPhase() != SessionPhase.WAITING) {
            throw new IllegalStateException(PuzzleMessages.formatPhaseNotAllowed(s.getPhase(), "开始"));
        }
        PuzzleRecord puzzle = ctx.cache().puzzle();
        ProgressRecord current = progress.current();
        if (current == null || current.getEpoch() != s.getEpoch()) {
            scramble(puzzle, s.getEpoch());
        }
        final long now = ctx.now();
        SessionRecord started = transition("开始", cur -> {
            if (cur.getPhase() != SessionPhase.WAITING || cur.getEpoch() != s.getEpoch()) {
                return null;
            }
            cur.setPhase(SessionPhase.PLAYING);
            cur.setStartedAt(now);
            cur.setPausedAt(0L);
            cur.setPausedTotalMillis(0L);
            return cur;
        });
        log.info("会话开始: sessionId={}, epoch={}, pieces={}", ctx.sessionId(), started.getEpoch(), puzzle.getTotalPieces());
        return started;
    }

    public SessionRecord pause() {
        requireHost();
        final long now = ctx.now();
        SessionRecord paused = transition("暂停", cur -> {
            if (!cur.getPhase().canTransitionTo(SessionPhase.PAUSED)) {
                return null;
            }
            cur.setPhase(SessionPhase.PAUSED);
            cur.setPausedAt(now);
            return cur;
        });
        log.info("会话暂停: sessionId={}", ctx.sessionId());
        return paused;
    }

    public SessionRecord resume() {
        requireHost();
        final long now = ctx.now();
        SessionRecord resumed = transition("继续", cur -> {
            if (cur.getPhase() != SessionPhase.PAUSED) {
                return null;
            }
            cur.setPhase(SessionPhase.PLAYING);
            cur.setPausedTotalMillis(cur.getPausedTotalMillis() + Math.max(0L, now - cur.getPausedAt()));
            cur.setPausedAt(0L);
            return cur;
        });
        log.info("会话继续: sessionId={}", ctx.sessionId());
        return resumed;
    }

    /**
     * 重置：epoch+1 回到 WAITING，重新打乱拼块并清空进度与参与者计分
     */
    public SessionRecord reset() {
        requireHost();
        SessionRecord reset = transition("重置", cur -> {
            if (cur.getPhase() == SessionPhase.WAITING) {
                return null;
            }
            return SessionRecord.builder()
                    .sessionId(cur.getSessionId())
                    .hostId(cur.getHostId())
                    .phase(SessionPhase.WAITING)
                    .epoch(cur.getEpoch() + 1)
                    .createdAt(cur.getCreatedAt())
                    .build();
        });
        final long epoch = reset.getEpoch();
        scramble(ctx.cache().puzzle(), epoch);
        ctx.store().remove(PuzzleKeys.completion(ctx.sessionId()));
        for (String participantId : ctx.store().read(PuzzleKeys.participantIndex(ctx.sessionId())).keySet()) {
            ctx.store().transactionalUpdate(PuzzleKeys.participant(ctx.sessionId(), participantId), cur -> {
                ParticipantRecord p = ctx.codec().fromFields(cur, ParticipantRecord.class);
                if (p == null) {
                    return null;
                }
                ScoreKeeper.resetCounters(p, epoch);
                return ctx.codec().toFields(p);
            });
        }
        log.info("会话重置: sessionId={}, newEpoch={}", ctx.sessionId(), epoch);
        return reset;
    }

    /**
     * 房主拆除会话
     */
    public void teardown() {
        requireHost();
        destroy();
    }

    /**
     * 删除会话下的全部路径，会话根最后删除
     */
    void destroy() {
        String sid = ctx.sessionId();
        PuzzleRecord puzzle = ctx.codec().fromFields(ctx.store().read(PuzzleKeys.puzzle(sid)), PuzzleRecord.class);
        if (puzzle != null) {
            for (String pieceId : PuzzleGeometry.pieceIds(puzzle)) {
                ctx.store().remove(PuzzleKeys.piece(sid, pieceId));
            }
        }
        Map<String, Object> index = ctx.store().read(PuzzleKeys.participantIndex(sid));
        for (String participantId : index.keySet()) {
            ctx.store().remove(PuzzleKeys.participant(sid, participantId));
            ctx.store().remove(PuzzleKeys.cursor(sid, participantId));
        }
        ctx.store().remove(PuzzleKeys.participantIndex(sid));
        ctx.store().remove(PuzzleKeys.progress(sid));
        ctx.store().remove(PuzzleKeys.completion(sid));
        ctx.store().remove(PuzzleKeys.puzzle(sid));
        ctx.store().remove(PuzzleKeys.session(sid));
        log.info("会话已拆除: sessionId={}, by={}", sid, ctx.me());
    }

    /**
     * 会话已进行时长（扣除暂停）
     */
    public static long elapsedMillis(SessionRecord s, long now) {
        if (s.getStartedAt() <= 0) {
            return 0L;
        }
        long end;
        if (s.getPhase() == SessionPhase.COMPLETED && s.getCompletedAt() > 0) {
            end = s.getCompletedAt();
        } else if (s.getPausedAt() > 0) {
            end = s.getPausedAt();
        } else {
            end = now;
        }
        return Math.max(0L, end - s.getStartedAt() - s.getPausedTotalMillis());
    }

    SessionRecord requireHost() {
        SessionRecord s = ctx.cache().loadSession();
        if (!ctx.me().equals(s.getHostId())) {
            throw new IllegalStateException(PuzzleMessages.ONLY_HOST);
        }
        return s;
    }

    private void scramble(PuzzleRecord puzzle, long epoch) {
        for (PieceRecord piece : PuzzleGeometry.scrambledPieces(puzzle, epoch, random)) {
            ctx.store().write(PuzzleKeys.piece(ctx.sessionId(), piece.getPieceId()), ctx.codec().toFields(piece));
        }
        progress.initialize(epoch, puzzle.getTotalPieces());
        log.debug("拼块已打乱: sessionId={}, epoch={}, count={}", ctx.sessionId(), epoch, puzzle.getTotalPieces());
    }

    private SessionRecord transition(String action, UnaryOperator<SessionRecord> change) {
        final SessionPhase[] seen = new SessionPhase[1];
        TxResult r = ctx.store().transactionalUpdate(PuzzleKeys.session(ctx.sessionId()), cur -> {
            SessionRecord s = ctx.codec().fromFields(cur, SessionRecord.class);
            if (s == null) {
                return null;
            }
            seen[0] = s.getPhase();
            SessionRecord next = change.apply(s);
            return next == null ? null : ctx.codec().toFields(next);
        });
        if (r.isConflict()) {
            ctx.status().degraded("session." + action);
            throw new IllegalStateException(PuzzleMessages.SYNC_BUSY);
        }
        if (!r.isCommitted()) {
            if (seen[0] == null) {
                throw new IllegalArgumentException(PuzzleMessages.SESSION_NOT_FOUND);
            }
            throw new IllegalStateException(PuzzleMessages.formatPhaseNotAllowed(seen[0], action));
        }
        SessionRecord s = ctx.codec().fromFields(r.value(), SessionRecord.class);
        ctx.cache().updateSession(s);
        return s;
    }

    private SessionRecord committedOrThrow(TxResult r, String abortedMessage) {
        if (r.isConflict()) {
            ctx.status().degraded("session.create");
            throw new IllegalStateException(PuzzleMessages.SYNC_BUSY);
        }
        if (!r.isCommitted()) {
            throw new IllegalStateException(abortedMessage);
        }
        return ctx.codec().fromFields(r.value(), SessionRecord.class);
    }
}
