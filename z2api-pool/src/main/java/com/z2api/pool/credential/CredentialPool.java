package com.z2api.pool.credential;

import com.z2api.common.dto.PoolSnapshot;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 凭据轮询池接口，只负责池内状态，不发起任何网络调用。
 * <p>
 * 所有修改（轮询游标、失败集合、索引、池本身）都在同一把锁内完成；
 * 探测与刷新等慢调用由 {@link com.z2api.pool.service.CredentialPoolManager} 在锁外执行，
 * 再通过这里的提交方法写回。
 */
public interface CredentialPool {

    /** 按轮询顺序取出下一个未失败凭据的有效令牌，池为空时返回空 */
    Optional<String> acquire();

    /** 标记令牌（或原始凭据）所属的池条目为失败 */
    void markFailed(String token);

    /** 将令牌（或原始凭据）所属的池条目移出失败集合 */
    void markSuccess(String token);

    /** 通过任意别名（原始字符串或有效令牌）找到当前仍在池中的条目 */
    Optional<CredentialEntry> resolve(String alias);

    /** 整体替换池内容，同时清空失败集合并重置游标 */
    void replaceAll(List<String> rawEntries);

    void clearAll();

    /**
     * 将某位置的条目原地替换为刷新后的新条目。
     *
     * @return 旧条目已不在池中时返回 false，池不变
     */
    boolean replace(PoolReplacement replacement);

    /**
     * 在一个临界区内提交一批替换。
     *
     * @return 实际生效的替换
     */
    List<PoolReplacement> replaceBatch(List<PoolReplacement> replacements);

    /**
     * 永久淘汰：从池、失败集合和索引中同时移除。
     *
     * @return 被移除的池条目数量
     */
    int evict(Collection<String> rawEntries);

    /** 池内条目的拷贝，下标即池中位置 */
    List<CredentialEntry> entries();

    /** 失败集合的拷贝（原始凭据形式） */
    Set<String> failedEntries();

    PoolSnapshot snapshot();

    int size();

    int failedCount();
}
