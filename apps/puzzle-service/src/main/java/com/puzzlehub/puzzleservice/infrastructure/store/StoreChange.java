package com.puzzlehub.puzzleservice.infrastructure.store;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次路径变更通知：携带变更后的完整值（删除时 removed=true、value 为空）。
 * Redis 实现中作为 pub/sub 消息体，需保持可 JSON 序列化。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StoreChange {

    /** 变更路径 */
    private String path;

    /** 变更后的完整字段表 */
    private Map<String, Object> value;

    /** 是否为删除 */
    private boolean removed;

    public static StoreChange of(String path, Map<String, Object> value) {
        return new StoreChange(path, value, false);
    }

    public static StoreChange removal(String path) {
        return new StoreChange(path, new LinkedHashMap<>(), true);
    }
}
