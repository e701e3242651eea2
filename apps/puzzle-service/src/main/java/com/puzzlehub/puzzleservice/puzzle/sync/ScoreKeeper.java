package com.puzzlehub.puzzleservice.puzzle.sync;

import com.puzzlehub.puzzleservice.infrastructure.store.TxResult;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.ParticipantRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.model.ScoreCalculator;
import com.puzzlehub.puzzleservice.puzzle.infrastructure.store.PuzzleKeys;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * 本参与者的计分计数（拾取次数、正确放置、combo、累计分）。
 * 计数挂在参与者记录上，按轮次隔离：记录 epoch 与当前轮次不一致时先清零再累加。
 * 这些计数是展示用的实时值；终局结算以拼块上的 placedPoints 为准。
 */
@Slf4j
public class ScoreKeeper {

    /** 一次正确放置的预估结果 */
    public record PlacementScore(int combo, long points) {}

    private final SyncContext ctx;
    private final ScoreCalculator calculator;

    public ScoreKeeper(SyncContext ctx, ScoreCalculator calculator) {
        this.ctx = ctx;
        this.calculator = calculator;
    }

    /**
     * 每次成功拾取计一次移动
     */
    public void recordGrab(long epoch) {
        mutate(epoch, "grab", p -> p.setMoveCount(p.getMoveCount() + 1));
    }

    /**
     * 按当前计数预估本次放置得分（写入拼块前调用）
     */
    public PlacementScore previewPlacement(long epoch, long moveDurationMillis, long now) {
        ParticipantRecord p = ctx.codec().fromFields(
                ctx.store().read(PuzzleKeys.participant(ctx.sessionId(), ctx.me())), ParticipantRecord.class);
        int combo = 0;
        long lastPlacementAt = 0L;
        if (p != null && p.getEpoch() == epoch) {
            combo = p.getComboCount();
            lastPlacementAt = p.getLastPlacementAt();
        }
        int next = calculator.nextCombo(combo, lastPlacementAt, now);
        return new PlacementScore(next, calculator.placementPoints(moveDurationMillis, next));
    }

    /**
     * 放置成功后累加
     */
    public void applyPlacement(long epoch, PlacementScore score, long now) {
        mutate(epoch, "placement", p -> {
            p.setAccurateDrops(p.getAccurateDrops() + 1);
            p.setPoints(p.getPoints() + score.points());
            p.setComboCount(score.combo());
            p.setMaxCombo(Math.max(p.getMaxCombo(), score.combo()));
            p.setLastPlacementAt(now);
        });
    }

    /**
     * 放错位置：combo 归零
     */
    public void recordMiss(long epoch) {
        mutate(epoch, "miss", p -> p.setComboCount(0));
    }

    private void mutate(long epoch, String op, Consumer<ParticipantRecord> change) {
        String path = PuzzleKeys.participant(ctx.sessionId(), ctx.me());
        UnaryOperator<Map<String, Object>> fn = cur -> {
            ParticipantRecord p = ctx.codec().fromFields(cur, ParticipantRecord.class);
            if (p == null) {
                // 已离开会话
                return null;
            }
            if (p.getEpoch() != epoch) {
                resetCounters(p, epoch);
            }
            change.accept(p);
            return ctx.codec().toFields(p);
        };
        TxResult r = ctx.store().transactionalUpdate(path, fn);
        if (r.isConflict()) {
            ctx.status().degraded("score." + op);
        } else if (!r.isCommitted()) {
            log.debug("计分跳过（参与者记录不存在）: sessionId={}, participantId={}, op={}",
                    ctx.sessionId(), ctx.me(), op);
        }
    }

    static void resetCounters(ParticipantRecord p, long epoch) {
        p.setEpoch(epoch);
        p.setMoveCount(0);
        p.setAccurateDrops(0);
        p.setPoints(0);
        p.setComboCount(0);
        p.setMaxCombo(0);
        p.setLastPlacementAt(0);
    }
}
