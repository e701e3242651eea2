package com.puzzlehub.puzzleservice.puzzle.sync;

import com.puzzlehub.puzzleservice.infrastructure.store.StoreCodec;
import com.puzzlehub.puzzleservice.infrastructure.store.TxResult;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.CompletionRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.ParticipantRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.PieceRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.ProgressRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.PuzzleRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.SessionRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.SessionPhase;
import com.puzzlehub.puzzleservice.puzzle.domain.model.PuzzleGeometry;
import com.puzzlehub.puzzleservice.puzzle.domain.model.ScoreCalculator;
import com.puzzlehub.puzzleservice.puzzle.infrastructure.store.PuzzleKeys;
import com.puzzlehub.puzzleservice.puzzle.sync.event.PiecePlacedEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ProgressCoordinator
 * -------------------------------------------------
 * 进度与终局：
 * 1) 每个客户端（放置者与所有观察者）都会上报“已放置”，计数由逐块标记保证幂等；
 * 2) 计数达到总数时尝试 PLAYING → COMPLETED，事务保证只有一个客户端胜出；
 * 3) 胜出者写完成记录并交给 CompletionSink，其余尝试为空操作；
 * 4) 定期对账：以拼块的权威扫描补齐漏掉的标记。
 */
@Slf4j
public class ProgressCoordinator {

    /** 进度路径中逐块放置标记的字段前缀 */
    static final String PLACED_MARKER = "placed:";

    private final SyncContext ctx;
    private final ScoreCalculator calculator;
    private final CompletionSink sink;
    /** 本客户端已通知过完成的轮次 */
    private final AtomicLong announcedCompletionEpoch = new AtomicLong(-1L);

    public ProgressCoordinator(SyncContext ctx, ScoreCalculator calculator, CompletionSink sink) {
        this.ctx = ctx;
        this.calculator = calculator;
        this.sink = sink;
    }

    /**
     * 处理一次放置（可重复调用，同一拼块只计一次）
     */
    public void onPiecePlaced(PiecePlacedEvent event) {
        final String marker = PLACED_MARKER + event.pieceId();
        TxResult r = ctx.store().transactionalUpdate(PuzzleKeys.progress(ctx.sessionId()), cur -> {
            if (cur.isEmpty() || StoreCodec.asLong(cur.get("epoch")) != event.epoch() || cur.containsKey(marker)) {
                return null;
            }
            int total = (int) StoreCodec.asLong(cur.get("totalPieceCount"));
            int count = (int) StoreCodec.asLong(cur.get("completedCount"));
            cur.put(marker, event.participantId());
            cur.put("completedCount", Math.min(total, count + 1));
            cur.put("lastPlacedBy", event.participantId());
            return cur;
        });
        if (r.isConflict()) {
            ctx.status().degraded("progress.increment");
            return;
        }
        ProgressRecord progress = ctx.codec().fromFields(r.value(), ProgressRecord.class);
        if (progress != null && progress.getEpoch() == event.epoch()
                && progress.getTotalPieceCount() > 0
                && progress.getCompletedCount() >= progress.getTotalPieceCount()) {
            tryComplete(event.epoch());
        }
    }

    /**
     * 对账：扫描本轮已放置的拼块，补齐进度标记与计数（只增不减）
     *
     * @return 对账后的进度；进度尚未初始化时返回 null
     */
    public ProgressRecord reconcile() {
        SessionRecord session = ctx.cache().loadSession();
        final long epoch = session.getEpoch();
        List<PieceRecord> placed = scanPlaced(ctx.cache().puzzle(), epoch);

        TxResult r = ctx.store().transactionalUpdate(PuzzleKeys.progress(ctx.sessionId()), cur -> {
            if (cur.isEmpty() || StoreCodec.asLong(cur.get("epoch")) != epoch) {
                return null;
            }
            Map<String, Object> next = new LinkedHashMap<>(cur);
            boolean changed = false;
            for (PieceRecord p : placed) {
                if (next.putIfAbsent(PLACED_MARKER + p.getPieceId(), p.getPlacedBy()) == null) {
                    changed = true;
                }
            }
            int total = (int) StoreCodec.asLong(next.get("totalPieceCount"));
            int markers = (int) next.keySet().stream().filter(k -> k.startsWith(PLACED_MARKER)).count();
            int count = Math.min(total, markers);
            if (count != (int) StoreCodec.asLong(next.get("completedCount"))) {
                changed = true;
            }
            if (!changed) {
                return null;
            }
            next.put("completedCount", count);
            placed.stream()
                    .max((a, b) -> Long.compare(a.getPlacedAt(), b.getPlacedAt()))
                    .ifPresent(last -> next.put("lastPlacedBy", last.getPlacedBy()));
            return next;
        });
        if (r.isConflict()) {
            ctx.status().degraded("progress.reconcile");
        } else if (r.isCommitted()) {
            log.info("进度对账修正: sessionId={}, epoch={}, completedCount={}",
                    ctx.sessionId(), epoch, r.value().get("completedCount"));
        }
        ProgressRecord progress = ctx.codec().fromFields(r.value(), ProgressRecord.class);
        if (progress != null && session.getPhase() == SessionPhase.PLAYING
                && progress.getTotalPieceCount() > 0
                && progress.getCompletedCount() >= progress.getTotalPieceCount()) {
            tryComplete(epoch);
        }
        return progress;
    }

    /**
     * 尝试终局切换
     *
     * @return 本客户端是否赢得切换
     */
    public boolean tryComplete(long epoch) {
        PuzzleRecord puzzle = ctx.cache().puzzle();
        List<PieceRecord> placed = scanPlaced(puzzle, epoch);
        if (placed.size() < puzzle.getTotalPieces()) {
            return false;
        }
        PieceRecord last = placed.stream()
                .max((a, b) -> Long.compare(a.getPlacedAt(), b.getPlacedAt()))
                .orElseThrow();
        final String mover = last.getPlacedBy();
        int accurateDrops = 0;
        long accumulated = 0L;
        for (PieceRecord p : placed) {
            if (mover.equals(p.getPlacedBy())) {
                accurateDrops++;
                accumulated += p.getPlacedPoints();
            }
        }
        ParticipantRecord participant = ctx.codec().fromFields(
                ctx.store().read(PuzzleKeys.participant(ctx.sessionId(), mover)), ParticipantRecord.class);
        int recordedMoves = participant != null && participant.getEpoch() == epoch ? participant.getMoveCount() : 0;
        // 参与者记录已删除（离开）时，拾取次数至少等于正确放置次数
        final int moveCount = Math.max(recordedMoves, accurateDrops);
        final double accuracy = calculator.accuracy(moveCount, accurateDrops);
        final long points = accumulated;
        final long now = ctx.now();

        TxResult r = ctx.store().transactionalUpdate(PuzzleKeys.session(ctx.sessionId()), cur -> {
            SessionRecord s = ctx.codec().fromFields(cur, SessionRecord.class);
            if (s == null || s.getEpoch() != epoch || s.getPhase() != SessionPhase.PLAYING) {
                return null;
            }
            s.setPhase(SessionPhase.COMPLETED);
            s.setCompletedAt(now);
            s.setPausedAt(0L);
            long elapsed = SessionStateMachine.elapsedMillis(s, now);
            s.setCompletedBy(mover);
            s.setCompletionTimeMs(elapsed);
            s.setCompletionAccuracy(accuracy);
            s.setCompletionPoints(calculator.finalPoints(points, elapsed, accuracy));
            return ctx.codec().toFields(s);
        });
        if (r.isConflict()) {
            ctx.status().degraded("session.complete");
            return false;
        }
        if (!r.isCommitted()) {
            return false;
        }
        SessionRecord s = ctx.codec().fromFields(r.value(), SessionRecord.class);
        CompletionRecord record = CompletionRecord.builder()
                .sessionId(ctx.sessionId())
                .epoch(epoch)
                .participantId(mover)
                .completionTimeMs(s.getCompletionTimeMs())
                .moveCount(moveCount)
                .accuracy(accuracy)
                .points(s.getCompletionPoints())
                .completedAt(now)
                .build();
        ctx.store().write(PuzzleKeys.completion(ctx.sessionId()), ctx.codec().toFields(record));
        log.info("拼图完成: sessionId={}, epoch={}, mover={}, timeMs={}, accuracy={}, points={}",
                ctx.sessionId(), epoch, mover, record.getCompletionTimeMs(), accuracy, record.getPoints());
        try {
            sink.publish(record);
        } catch (RuntimeException e) {
            // 完成记录已落库，外部通知失败不回滚终局
            log.error("完成记录发布失败: sessionId={}, epoch={}", ctx.sessionId(), epoch, e);
        }
        announceCompletion(record);
        return true;
    }

    /**
     * 通知渲染层完成（每轮每客户端一次）
     */
    public void announceCompletion(CompletionRecord record) {
        long prev = announcedCompletionEpoch.get();
        if (record.getEpoch() <= prev || !announcedCompletionEpoch.compareAndSet(prev, record.getEpoch())) {
            return;
        }
        ctx.events().fire(l -> l.onSessionCompleted(record));
    }

    public ProgressRecord current() {
        return ctx.codec().fromFields(ctx.store().read(PuzzleKeys.progress(ctx.sessionId())), ProgressRecord.class);
    }

    /**
     * 初始化某一轮次的进度（开始或重置时写入）
     */
    public void initialize(long epoch, int totalPieces) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("epoch", epoch);
        fields.put("completedCount", 0);
        fields.put("totalPieceCount", totalPieces);
        ctx.store().write(PuzzleKeys.progress(ctx.sessionId()), fields);
    }

    private List<PieceRecord> scanPlaced(PuzzleRecord puzzle, long epoch) {
        List<PieceRecord> placed = new ArrayList<>();
        for (String pieceId : PuzzleGeometry.pieceIds(puzzle)) {
            PieceRecord p = ctx.codec().fromFields(
                    ctx.store().read(PuzzleKeys.piece(ctx.sessionId(), pieceId)), PieceRecord.class);
            if (p != null && p.getEpoch() == epoch && p.isPlaced()) {
                placed.add(p);
            }
        }
        return placed;
    }
}
