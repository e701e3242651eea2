package com.puzzlehub.puzzleservice.puzzle.sync;

import com.puzzlehub.puzzleservice.infrastructure.store.SharedStore;
import com.puzzlehub.puzzleservice.infrastructure.store.StoreCodec;
import com.puzzlehub.puzzleservice.puzzle.domain.constants.PuzzleMessages;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.PuzzleRecord;
import com.puzzlehub.puzzleservice.puzzle.domain.dto.SessionRecord;
import com.puzzlehub.puzzleservice.puzzle.infrastructure.store.PuzzleKeys;

import java.util.concurrent.atomic.AtomicReference;

/**
 * 会话与拼图配置的本地缓存：订阅回调刷新，需要权威值时直接读存储。
 */
public class SessionCache {

    private final String sessionId;
    private final SharedStore store;
    private final StoreCodec codec;
    private final AtomicReference<SessionRecord> session = new AtomicReference<>();
    private final AtomicReference<PuzzleRecord> puzzle = new AtomicReference<>();

    public SessionCache(String sessionId, SharedStore store, StoreCodec codec) {
        this.sessionId = sessionId;
        this.store = store;
        this.codec = codec;
    }

    /**
     * 从存储读取最新会话并刷新缓存
     *
     * @throws IllegalArgumentException 会话不存在
     */
    public SessionRecord loadSession() {
        SessionRecord s = codec.fromFields(store.read(PuzzleKeys.session(sessionId)), SessionRecord.class);
        if (s == null) {
            throw new IllegalArgumentException(PuzzleMessages.SESSION_NOT_FOUND);
        }
        session.set(s);
        return s;
    }

    /**
     * 缓存优先的拼图配置
     *
     * @throws IllegalStateException 尚未配置
     */
    public PuzzleRecord puzzle() {
        PuzzleRecord p = puzzle.get();
        if (p == null) {
            p = codec.fromFields(store.read(PuzzleKeys.puzzle(sessionId)), PuzzleRecord.class);
            if (p == null) {
                throw new IllegalStateException(PuzzleMessages.PUZZLE_NOT_CONFIGURED);
            }
            puzzle.set(p);
        }
        return p;
    }

    public SessionRecord cachedSession() {
        return session.get();
    }

    /**
     * @return 旧值
     */
    public SessionRecord updateSession(SessionRecord s) {
        return session.getAndSet(s);
    }

    public void updatePuzzle(PuzzleRecord p) {
        puzzle.set(p);
    }
}
