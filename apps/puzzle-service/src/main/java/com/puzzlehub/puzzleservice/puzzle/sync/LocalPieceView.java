package com.puzzlehub.puzzleservice.puzzle.sync;

import com.puzzlehub.puzzleservice.puzzle.domain.dto.PieceRecord;
import com.puzzlehub.puzzleservice.puzzle.sync.event.PieceView;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 参与者本地的拼块视图。
 * 存取都做复制，外部拿到的 PieceRecord 修改不会影响视图。
 */
public class LocalPieceView {

    private final Map<String, PieceRecord> pieces = new ConcurrentHashMap<>();
    /** 已通知过的放置：epoch:pieceId */
    private final Set<String> announcedPlacements = ConcurrentHashMap.newKeySet();

    public PieceRecord get(String pieceId) {
        PieceRecord r = pieces.get(pieceId);
        return r == null ? null : r.toBuilder().build();
    }

    public void put(PieceRecord record) {
        pieces.put(record.getPieceId(), record.toBuilder().build());
    }

    public void remove(String pieceId) {
        pieces.remove(pieceId);
    }

    public void replaceAll(Collection<PieceRecord> records) {
        pieces.clear();
        records.forEach(this::put);
    }

    /**
     * 首次登记返回 true；同一轮次同一拼块的重复放置通知返回 false
     */
    public boolean markPlacementAnnounced(long epoch, String pieceId) {
        return announcedPlacements.add(epoch + ":" + pieceId);
    }

    public List<String> lockedBy(String participantId) {
        return pieces.values().stream()
                .filter(p -> participantId.equals(p.getLockOwner()))
                .map(PieceRecord::getPieceId)
                .toList();
    }

    public List<PieceView> snapshot() {
        return pieces.values().stream()
                .sorted(Comparator.comparingInt(PieceRecord::getRow).thenComparingInt(PieceRecord::getCol))
                .map(PieceView::of)
                .toList();
    }

    public int size() {
        return pieces.size();
    }
}
