package com.puzzlehub.puzzleservice.infrastructure.store;

import java.util.Map;

/**
 * 乐观事务结果
 *
 * @param status   提交 / 放弃 / 冲突重试耗尽
 * @param value    提交时为写入后的值；放弃或冲突时为最后一次读到的值
 * @param attempts 实际尝试次数
 */
public record TxResult(Status status, Map<String, Object> value, int attempts) {

    public enum Status {
        /** 已提交 */
        COMMITTED,
        /** 更新函数返回 null，未写入 */
        ABORTED,
        /** 每次提交都遇到并发修改，重试次数耗尽 */
        CONFLICT
    }

    public static TxResult committed(Map<String, Object> value, int attempts) {
        return new TxResult(Status.COMMITTED, value, attempts);
    }

    public static TxResult aborted(Map<String, Object> value, int attempts) {
        return new TxResult(Status.ABORTED, value, attempts);
    }

    public static TxResult conflict(Map<String, Object> value, int attempts) {
        return new TxResult(Status.CONFLICT, value, attempts);
    }

    public boolean isCommitted() {
        return status == Status.COMMITTED;
    }

    public boolean isConflict() {
        return status == Status.CONFLICT;
    }
}
