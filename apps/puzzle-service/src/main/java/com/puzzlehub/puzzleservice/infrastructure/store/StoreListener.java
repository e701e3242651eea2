package com.puzzlehub.puzzleservice.infrastructure.store;

/**
 * 共享存储变更回调
 */
@FunctionalInterface
public interface StoreListener {

    void onChange(StoreChange change);
}
