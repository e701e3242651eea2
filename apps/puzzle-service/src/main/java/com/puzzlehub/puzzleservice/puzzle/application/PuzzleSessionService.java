package com.puzzlehub.puzzleservice.puzzle.application;

import com.puzzlehub.puzzleservice.infrastructure.store.SharedStore;
import com.puzzlehub.puzzleservice.puzzle.domain.constants.PuzzleMessages;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.CompletionRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.ParticipantRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.PuzzleRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.SessionRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.Difficulty;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.DropResult;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.LockResult;
import com.puzzlehub.puzzleservice.puzzle.domain.enums.ReleaseResult;
import com.puzzlehub.puzzleservice.puzzle.domain.model.PuzzleGeometry;
import com.puzzlehub.puzzleservice.puzzle.domain.model.Vec3;
import com.puzzlehub.puzzleservice.puzzle.infrastructure.store.PuzzleKeys;
import com.puzzlehub.puzzleservice.puzzle.interfaces.http.dto.ConfigurePuzzleRequest;
import com.puzzlehub.puzzleservice.puzzle.interfaces.http.dto.ParticipantSummary;
import com.puzzlehub.puzzleservice.puzzle.interfaces.http.dto.SessionSnapshot;
import com.puzzlehub.puzzleservice.puzzle.sync.ParticipantSyncClient;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * PuzzleSessionService
 * -------------------------------------------------
 * REST 与 STOMP 入口共用的编排层：按 (sessionId, userId) 找到本节点上的参与者客户端，转调同步核心。
 * 客户端不存在但存储中仍有该参与者（例如断线后重连）时，重新登记并以原身份加入。
 */
@Slf4j
@Service
public class PuzzleSessionService {

    private final ParticipantClientFactory factory;
    private final ParticipantClientRegistry registry;
    private final SharedStore store;

    public PuzzleSessionService(ParticipantClientFactory factory,
                                ParticipantClientRegistry registry,
                                SharedStore store) {
        this.factory = factory;
        this.registry = registry;
        this.store = store;
    }

    // ==================== 会话 ====================

    /**
     * 创建会话，创建者成为房主并自动加入
     */
    public SessionRecord createSession(String userId, String displayName, String sessionId,
                                       ConfigurePuzzleRequest puzzle) {
        String sid = StringUtils.isBlank(sessionId) ? UUID.randomUUID().toString() : sessionId.trim();
        ParticipantSyncClient client = factory.create(sid, userId);
        SessionRecord session = client.createSession();
        client = registry.register(client);
        client.join(displayName);
        if (puzzle != null) {
            client.configurePuzzle(toPuzzle(puzzle));
        }
        return session;
    }

    public PuzzleRecord configurePuzzle(String sessionId, String userId, ConfigurePuzzleRequest req) {
        PuzzleRecord puzzle = toPuzzle(req);
        requireClient(sessionId, userId).configurePuzzle(puzzle);
        return puzzle;
    }

    public ParticipantRecord join(String sessionId, String userId, String displayName) {
        ParticipantSyncClient client = registry.get(sessionId, userId);
        if (client == null) {
            client = registry.register(factory.create(sessionId, userId));
        }
        return client.join(displayName);
    }

    public void leave(String sessionId, String userId) {
        ParticipantSyncClient client = requireClient(sessionId, userId);
        client.leave();
        registry.unregister(sessionId, userId);
    }

    public void teardown(String sessionId, String userId) {
        requireClient(sessionId, userId).teardown();
        registry.unregister(sessionId, userId);
    }

    public SessionSnapshot snapshot(String sessionId, String userId) {
        ParticipantSyncClient client = requireClient(sessionId, userId);
        SessionRecord session = client.session();
        List<ParticipantSummary> participants = client.participants().stream()
                .map(p -> ParticipantSummary.from(p, client.isOnline(p), session.getEpoch()))
                .toList();
        return new SessionSnapshot(session, client.puzzle(), client.pieces(), client.progress(),
                participants, client.elapsedMillis(), client.status().name());
    }

    /**
     * @return 尚未完成时为 null
     */
    public CompletionRecord completion(String sessionId, String userId) {
        return requireClient(sessionId, userId).completion();
    }

    public SessionRecord start(String sessionId, String userId) {
        return requireClient(sessionId, userId).start();
    }

    public SessionRecord pause(String sessionId, String userId) {
        return requireClient(sessionId, userId).pause();
    }

    public SessionRecord resume(String sessionId, String userId) {
        return requireClient(sessionId, userId).resume();
    }

    public SessionRecord reset(String sessionId, String userId) {
        return requireClient(sessionId, userId).reset();
    }

    // ==================== 拼块 / 在线 ====================

    public LockResult grab(String sessionId, String userId, String pieceId) {
        return requireClient(sessionId, userId).grab(requirePieceId(pieceId));
    }

    public boolean move(String sessionId, String userId, String pieceId, Vec3 position, double rotation) {
        return requireClient(sessionId, userId).move(requirePieceId(pieceId), position, rotation);
    }

    public DropResult drop(String sessionId, String userId, String pieceId, Vec3 position, double rotation) {
        return requireClient(sessionId, userId).drop(requirePieceId(pieceId), position, rotation);
    }

    public ReleaseResult cancel(String sessionId, String userId, String pieceId) {
        return requireClient(sessionId, userId).cancel(requirePieceId(pieceId));
    }

    public boolean heartbeat(String sessionId, String userId) {
        return requireClient(sessionId, userId).heartbeat();
    }

    public void cursor(String sessionId, String userId, double x, double y) {
        requireClient(sessionId, userId).updateCursor(x, y);
    }

    /**
     * 找到（或恢复）参与者客户端
     *
     * @throws IllegalArgumentException 会话不存在
     * @throws IllegalStateException    不是该会话的参与者
     */
    ParticipantSyncClient requireClient(String sessionId, String userId) {
        if (StringUtils.isBlank(sessionId)) {
            throw new IllegalArgumentException(PuzzleMessages.SESSION_NOT_FOUND);
        }
        ParticipantSyncClient client = registry.get(sessionId, userId);
        if (client != null) {
            return client;
        }
        if (store.read(PuzzleKeys.session(sessionId)).isEmpty()) {
            throw new IllegalArgumentException(PuzzleMessages.SESSION_NOT_FOUND);
        }
        if (store.read(PuzzleKeys.participant(sessionId, userId)).isEmpty()) {
            throw new IllegalStateException(PuzzleMessages.NOT_A_PARTICIPANT);
        }
        client = registry.register(factory.create(sessionId, userId));
        // 重新登记断线清理，昵称保持不变
        client.join(null);
        log.info("参与者客户端已恢复: sessionId={}, userId={}", sessionId, userId);
        return client;
    }

    private static String requirePieceId(String pieceId) {
        if (StringUtils.isBlank(pieceId)) {
            throw new IllegalArgumentException(PuzzleMessages.PIECE_NOT_FOUND);
        }
        return pieceId;
    }

    private static PuzzleRecord toPuzzle(ConfigurePuzzleRequest req) {
        Difficulty difficulty = Difficulty.fromCode(req.getDifficulty());
        String puzzleId = StringUtils.defaultIfBlank(req.getPuzzleId(), UUID.randomUUID().toString());
        return PuzzleGeometry.configure(puzzleId, req.getImageUrl(), req.getImageWidth(), req.getImageHeight(),
                difficulty, req.getColumns(), req.getRows());
    }
}
