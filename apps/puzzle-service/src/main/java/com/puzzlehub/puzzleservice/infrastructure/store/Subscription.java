package com.puzzlehub.puzzleservice.infrastructure.store;

/**
 * 订阅句柄；重复取消是安全的。
 */
@FunctionalInterface
public interface Subscription {

    void unsubscribe();
}
