package com.puzzlehub.puzzleservice.puzzle.sync.event;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 单个参与者客户端内的事件分发；某个监听器异常不影响其他监听器与同步流程。
 */
@Slf4j
public class PuzzleEventBus {

    private final List<PuzzleEventListener> listeners = new CopyOnWriteArrayList<>();

    public void add(PuzzleEventListener listener) {
        listeners.add(listener);
    }

    public void remove(PuzzleEventListener listener) {
        listeners.remove(listener);
    }

    public void fire(Consumer<PuzzleEventListener> call) {
        for (PuzzleEventListener l : listeners) {
            try {
                call.accept(l);
            } catch (RuntimeException e) {
                log.warn("事件监听器异常: listener={}", l.getClass().getName(), e);
            }
        }
    }
}
