package com.puzzlehub.puzzleservice.puzzle.domain.model;

import com.puzzlehub.puzzleservice.puzzle.domain.dto.PieceRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.constants.PuzzleMessages;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.PuzzleRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.Difficulty;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 拼图几何：由图片宽高比与网格推导每块的目标位姿，并生成打乱后的初始位置。
 * <p>
 * 棋盘高 1.0、宽 = 图片宽高比，原点在棋盘中心：
 * <pre>
 *   pieceWidth  = aspect / columns
 *   pieceHeight = 1 / rows
 *   targetX = (col - columns/2 + 0.5) * pieceWidth
 *   targetY = (row - rows/2 + 0.5) * pieceHeight
 * </pre>
 */
public final class PuzzleGeometry {

    /** 打乱时 x/y 的最大偏移（±） */
    static final double SCRAMBLE_XY = 1.0;
    /** 打乱时 z 的最大抬升 */
    static final double SCRAMBLE_Z = 0.5;
    /** 每边最多块数；开局时每块写一个路径，超出会把整盘写爆 */
    public static final int MAX_GRID_SIDE = 50;

    private PuzzleGeometry() {}

    /**
     * 按难度生成拼图配置；columns/rows 为空时使用难度默认网格
     *
     * @throws IllegalArgumentException 图片或网格参数无效
     */
    public static PuzzleRecord configure(String puzzleId, String imageUrl, int imageWidth, int imageHeight,
                                         Difficulty difficulty, Integer columns, Integer rows) {
        if (StringUtils.isBlank(imageUrl) || imageWidth <= 0 || imageHeight <= 0) {
            throw new IllegalArgumentException(PuzzleMessages.INVALID_IMAGE);
        }
        int cols = columns != null ? columns : difficulty.columns();
        int rs = rows != null ? rows : difficulty.rows();
        if (cols < 1 || rs < 1 || cols > MAX_GRID_SIDE || rs > MAX_GRID_SIDE) {
            throw new IllegalArgumentException(PuzzleMessages.INVALID_GRID);
        }
        int total = Math.multiplyExact(cols, rs);
        return PuzzleRecord.builder()
                .puzzleId(puzzleId)
                .imageUrl(imageUrl)
                .imageWidth(imageWidth)
                .imageHeight(imageHeight)
                .difficulty(difficulty)
                .columns(cols)
                .rows(rs)
                .totalPieces(total)
                .snapDistance(difficulty.snapDistance())
                .rotationRequired(difficulty.rotationRequired())
                .build();
    }

    public static String pieceId(int col, int row) {
        return "piece-" + col + "-" + row;
    }

    /**
     * 按行优先列出全部拼块 ID
     */
    public static List<String> pieceIds(PuzzleRecord puzzle) {
        List<String> ids = new ArrayList<>(puzzle.getColumns() * puzzle.getRows());
        for (int row = 0; row < puzzle.getRows(); row++) {
            for (int col = 0; col < puzzle.getColumns(); col++) {
                ids.add(pieceId(col, row));
            }
        }
        return ids;
    }

    public static Vec3 target(PuzzleRecord puzzle, int col, int row) {
        double aspect = aspect(puzzle);
        double pieceWidth = aspect / puzzle.getColumns();
        double pieceHeight = 1.0 / puzzle.getRows();
        double x = (col - puzzle.getColumns() / 2.0 + 0.5) * pieceWidth;
        double y = (row - puzzle.getRows() / 2.0 + 0.5) * pieceHeight;
        return new Vec3(x, y, 0);
    }

    /**
     * 为指定轮次生成全部拼块：目标位姿就位，当前位姿随机打乱，未放置、未加锁。
     */
    public static List<PieceRecord> scrambledPieces(PuzzleRecord puzzle, long epoch, Random random) {
        List<PieceRecord> pieces = new ArrayList<>(puzzle.getTotalPieces());
        for (int row = 0; row < puzzle.getRows(); row++) {
            for (int col = 0; col < puzzle.getColumns(); col++) {
                Vec3 target = target(puzzle, col, row);
                double rotation = puzzle.isRotationRequired() ? 90.0 * (1 + random.nextInt(3)) : 0.0;
                pieces.add(PieceRecord.builder()
                        .pieceId(pieceId(col, row))
                        .col(col)
                        .row(row)
                        .epoch(epoch)
                        .targetX(target.x())
                        .targetY(target.y())
                        .targetZ(target.z())
                        .targetRotation(0.0)
                        .x(target.x() + (random.nextDouble() - 0.5) * 2 * SCRAMBLE_XY)
                        .y(target.y() + (random.nextDouble() - 0.5) * 2 * SCRAMBLE_XY)
                        .z(target.z() + random.nextDouble() * SCRAMBLE_Z)
                        .rotation(rotation)
                        .placed(false)
                        .lockOwner("")
                        .seq(0L)
                        .build());
            }
        }
        return pieces;
    }

    private static double aspect(PuzzleRecord puzzle) {
        if (puzzle.getImageWidth() <= 0 || puzzle.getImageHeight() <= 0) {
            return 1.0;
        }
        return (double) puzzle.getImageWidth() / puzzle.getImageHeight();
    }
}
