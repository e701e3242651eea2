package com.puzzlehub.puzzleservice.infrastructure.store;

import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * SharedStore
 * -------------------------------------------------------
 * 参与者之间唯一的共享中介：按路径（path）存放扁平的字段表。
 * 各客户端互不直连，只通过本接口读写并订阅变更。
 * -------------------------------------------------------
 * 语义约定：
 *  - write：整体覆盖（原有字段全部替换）；
 *  - update：部分字段合并，最后写入者胜出，不保证原子性；
 *  - transactionalUpdate：读-改-写乐观事务，冲突时以新鲜读重试，次数有上限；
 *  - subscribe：收到该路径及其所有子路径（path + ":" 前缀）的变更，回调线程不确定；
 *  - onDisconnectCleanup：连接断开时由存储侧执行的清理，仅作为加速信号，不能替代心跳判定。
 * 所有方法在存储不可达时抛出 {@link StoreUnavailableException}。
 */
public interface SharedStore {

    /**
     * 覆盖写入整个路径的值（空表等同于删除）
     */
    void write(String path, Map<String, Object> value);

    /**
     * 合并写入部分字段（last-writer-wins）
     */
    void update(String path, Map<String, Object> fields);

    /**
     * 读取路径当前值的副本；不存在时返回空表
     */
    Map<String, Object> read(String path);

    /**
     * 乐观事务更新。
     *
     * @param path     目标路径
     * @param updateFn 输入当前值副本（不存在为空表），返回新的完整值；返回 null 表示放弃（不写入）；
     *                 返回空表表示删除。冲突重试时会被再次调用，因此不能有外部副作用
     * @return 提交 / 放弃 / 重试耗尽
     */
    TxResult transactionalUpdate(String path, UnaryOperator<Map<String, Object>> updateFn);

    /**
     * 删除路径
     */
    void remove(String path);

    /**
     * 订阅路径及其子路径的变更
     *
     * @return 取消订阅句柄
     */
    Subscription subscribe(String path, StoreListener listener);

    /**
     * 登记断线清理：连接 connectionId 断开时，对 path 执行合并写入 value；value 为 null 时删除 path。
     */
    void onDisconnectCleanup(String connectionId, String path, Map<String, Object> valueOrRemoval);

    /**
     * 连接断开：执行并清空该连接登记的全部清理动作
     */
    void disconnect(String connectionId);

    /**
     * 主动离开时撤销该连接登记的清理动作（不执行）
     */
    void cancelDisconnectCleanups(String connectionId);
}
