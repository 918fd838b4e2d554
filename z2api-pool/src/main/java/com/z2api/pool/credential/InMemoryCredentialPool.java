package com.z2api.pool.credential;

import com.z2api.common.dto.PoolSnapshot;
import com.z2api.common.util.SecretMasker;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 基于内存的凭据轮询池。
 * <p>
 * 维护四份相互关联的状态，全部由 {@link #lock} 保护：
 * <ul>
 *   <li>{@code entries}：池本身，顺序即轮询顺序，允许重复</li>
 *   <li>{@code failed}：失败集合，保存原始凭据形式，始终是池的子集</li>
 *   <li>{@code index}：别名（原始字符串 / 有效令牌）到凭据元数据，只指向池中仍持有该别名的首个条目</li>
 *   <li>{@code positions}：别名到其在池中首次出现的位置，每次修改时同步维护</li>
 * </ul>
 */
@Slf4j
public class InMemoryCredentialPool implements CredentialPool {

    private final ReentrantLock lock = new ReentrantLock();
    private final List<CredentialEntry> entries = new ArrayList<>();
    private final Set<String> failed = new LinkedHashSet<>();
    private final Map<String, CredentialEntry> index = new HashMap<>();
    private final Map<String, Integer> positions = new HashMap<>();
    private int cursor = 0;

    public InMemoryCredentialPool() {
    }

    public InMemoryCredentialPool(List<String> rawEntries) {
        replaceAll(rawEntries);
    }

    // ======================== 轮询 ========================

    @Override
    public Optional<String> acquire() {
        lock.lock();
        try {
            if (entries.isEmpty()) {
                return Optional.empty();
            }
            int size = entries.size();
            for (int attempts = 0; attempts < size; attempts++) {
                CredentialEntry entry = entries.get(cursor);
                cursor = (cursor + 1) % size;

                if (failed.contains(entry.getRaw())) {
                    continue;
                }
                if (entry.getToken() == null) {
                    log.warn("跳过无法解析出令牌的凭据: {} ({})", entry.describe(), entry.getKind());
                    continue;
                }
                return Optional.of(entry.getToken());
            }

            if (failed.isEmpty()) {
                log.error("池中 {} 个凭据都无法解析出令牌", size);
                return Optional.empty();
            }

            // 全部失败时认为失败信息已过期，清空后从头开始
            log.warn("全部 {} 个凭据均已失败，重置失败集合并重试", size);
            failed.clear();
            return entries.stream()
                    .map(CredentialEntry::getToken)
                    .filter(token -> token != null)
                    .findFirst();
        } finally {
            lock.unlock();
        }
    }

    // ======================== 失败反馈 ========================

    @Override
    public void markFailed(String token) {
        lock.lock();
        try {
            Integer position = positions.get(token);
            if (position == null) {
                log.warn("标记失败时未在池中找到凭据: {}", SecretMasker.mask(token));
                return;
            }
            if (failed.add(entries.get(position).getRaw())) {
                log.warn("凭据标记为失败: {}", SecretMasker.mask(token));
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void markSuccess(String token) {
        lock.lock();
        try {
            Integer position = positions.get(token);
            if (position == null) {
                log.debug("标记成功时未在池中找到凭据: {}", SecretMasker.mask(token));
                return;
            }
            if (failed.remove(entries.get(position).getRaw())) {
                log.info("凭据已恢复: {}", SecretMasker.mask(token));
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<CredentialEntry> resolve(String alias) {
        lock.lock();
        try {
            CredentialEntry record = index.get(alias);
            if (record != null) {
                int position = rawPosition(record.getRaw());
                if (position >= 0) {
                    return Optional.of(entries.get(position));
                }
            }
            // 索引记录已离开池时，以当前池中持有该别名的条目为准
            Integer position = positions.get(alias);
            return position == null ? Optional.empty() : Optional.of(entries.get(position));
        } finally {
            lock.unlock();
        }
    }

    // ======================== 整体替换 ========================

    @Override
    public void replaceAll(List<String> rawEntries) {
        lock.lock();
        try {
            entries.clear();
            for (String raw : rawEntries) {
                if (raw != null && !raw.isBlank()) {
                    entries.add(CredentialEntry.parse(raw.trim()));
                }
            }
            failed.clear();
            cursor = 0;
            index.clear();
            for (CredentialEntry entry : entries) {
                for (String alias : entry.aliases()) {
                    index.putIfAbsent(alias, entry);
                }
            }
            rebuildPositions();
            log.info("凭据池已更新: {} 个凭据", entries.size());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clearAll() {
        replaceAll(List.of());
    }

    // ======================== 刷新写回 ========================

    @Override
    public boolean replace(PoolReplacement replacement) {
        lock.lock();
        try {
            return applyReplacement(replacement);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<PoolReplacement> replaceBatch(List<PoolReplacement> replacements) {
        lock.lock();
        try {
            List<PoolReplacement> applied = new ArrayList<>();
            for (PoolReplacement replacement : replacements) {
                if (applyReplacement(replacement)) {
                    applied.add(replacement);
                }
            }
            return applied;
        } finally {
            lock.unlock();
        }
    }

    private boolean applyReplacement(PoolReplacement replacement) {
        int position = replacement.getPosition();
        String oldRaw = replacement.getOldRaw();
        if (position < 0 || position >= entries.size() || !entries.get(position).getRaw().equals(oldRaw)) {
            // 快照之后池发生过变化，按原始凭据重新定位
            int current = rawPosition(oldRaw);
            if (current < 0) {
                log.warn("写回刷新结果时凭据已不在池中: {}", SecretMasker.mask(oldRaw));
                return false;
            }
            position = current;
        }
        replaceAt(position, replacement.getReplacement());
        return true;
    }

    private void replaceAt(int position, CredentialEntry replacement) {
        CredentialEntry old = entries.get(position);
        entries.set(position, replacement);

        for (String alias : old.aliases()) {
            Integer owner = positions.get(alias);
            if (owner != null && owner == position) {
                positions.remove(alias);
                int next = firstPositionOf(alias);
                if (next >= 0) {
                    positions.put(alias, next);
                }
            }
        }
        for (String alias : replacement.aliases()) {
            positions.merge(alias, position, Math::min);
            index.put(alias, entries.get(positions.get(alias)));
        }

        // 旧别名若仍被其它条目使用（如同一令牌的裸形式），改指向该条目，否则删除
        for (String alias : old.aliases()) {
            if (replacement.aliases().contains(alias)) {
                continue;
            }
            Integer owner = positions.get(alias);
            if (owner == null) {
                index.remove(alias);
            } else {
                index.put(alias, entries.get(owner));
            }
        }

        if (rawPosition(old.getRaw()) < 0) {
            failed.remove(old.getRaw());
        }
    }

    /** 原始凭据在池中首次出现的位置，不在池中时为 -1 */
    private int rawPosition(String raw) {
        Integer position = positions.get(raw);
        if (position != null && entries.get(position).getRaw().equals(raw)) {
            return position;
        }
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).getRaw().equals(raw)) {
                return i;
            }
        }
        return -1;
    }

    private int firstPositionOf(String alias) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).aliases().contains(alias)) {
                return i;
            }
        }
        return -1;
    }

    // ======================== 淘汰 ========================

    @Override
    public int evict(Collection<String> rawEntries) {
        if (rawEntries.isEmpty()) {
            return 0;
        }
        lock.lock();
        try {
            Set<String> targets = new HashSet<>(rawEntries);
            Set<String> evictedAliases = new HashSet<>();
            List<CredentialEntry> kept = new ArrayList<>(entries.size());
            int removedBeforeCursor = 0;
            for (int i = 0; i < entries.size(); i++) {
                CredentialEntry entry = entries.get(i);
                if (targets.contains(entry.getRaw())) {
                    evictedAliases.addAll(entry.aliases());
                    if (i < cursor) {
                        removedBeforeCursor++;
                    }
                } else {
                    kept.add(entry);
                }
            }
            int removed = entries.size() - kept.size();
            if (removed == 0) {
                return 0;
            }

            entries.clear();
            entries.addAll(kept);
            failed.removeAll(targets);
            rebuildPositions();
            cursor = entries.isEmpty() ? 0 : (cursor - removedBeforeCursor) % entries.size();

            // 别名若仍被剩余条目使用（如同一令牌的裸形式），改指向剩余条目
            for (String alias : evictedAliases) {
                Integer owner = positions.get(alias);
                if (owner == null) {
                    index.remove(alias);
                } else {
                    index.put(alias, entries.get(owner));
                }
            }
            index.values().removeIf(record -> targets.contains(record.getRaw()));

            log.warn("永久淘汰 {} 个凭据，池中剩余 {} 个", removed, entries.size());
            return removed;
        } finally {
            lock.unlock();
        }
    }

    private void rebuildPositions() {
        positions.clear();
        for (int i = 0; i < entries.size(); i++) {
            for (String alias : entries.get(i).aliases()) {
                positions.putIfAbsent(alias, i);
            }
        }
    }

    // ======================== 查询 ========================

    @Override
    public List<CredentialEntry> entries() {
        lock.lock();
        try {
            return List.copyOf(entries);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Set<String> failedEntries() {
        lock.lock();
        try {
            return new LinkedHashSet<>(failed);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public PoolSnapshot snapshot() {
        lock.lock();
        try {
            List<String> raws = entries.stream().map(CredentialEntry::getRaw).toList();
            List<String> failedInOrder = raws.stream().filter(failed::contains).distinct().toList();
            return PoolSnapshot.builder()
                    .entries(raws)
                    .failedEntries(failedInOrder)
                    .count(raws.size())
                    .failedCount(failed.size())
                    .build();
        } finally {
            lock.unlock();
        }
    }

    /** 游标当前位置，仅供测试观察轮询公平性 */
    int cursor() {
        lock.lock();
        try {
            return cursor;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int failedCount() {
        lock.lock();
        try {
            return failed.size();
        } finally {
            lock.unlock();
        }
    }
}
