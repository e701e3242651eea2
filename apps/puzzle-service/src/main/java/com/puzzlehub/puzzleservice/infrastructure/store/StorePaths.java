package com.puzzlehub.puzzleservice.infrastructure.store;

/**
 * 路径层级工具：子路径以 ":" 分隔。
 */
public final class StorePaths {

    public static final String SEPARATOR = ":";

    private StorePaths() {}

    /**
     * changedPath 是否落在 subscribedPath 或其子路径上
     */
    public static boolean covers(String subscribedPath, String changedPath) {
        return changedPath.equals(subscribedPath) || changedPath.startsWith(subscribedPath + SEPARATOR);
    }
}
