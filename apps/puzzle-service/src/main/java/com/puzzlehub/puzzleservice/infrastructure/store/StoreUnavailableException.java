package com.puzzlehub.puzzleservice.infrastructure.store;

/**
 * 共享存储不可达（连接失败、超时）。
 * 客户端据此切换到 RECONNECTING，阻止新的拼块交互，本地乐观状态保留。
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
