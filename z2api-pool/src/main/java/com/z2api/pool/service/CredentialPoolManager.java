package com.z2api.pool.service;

import com.z2api.common.dto.BatchRefreshResult;
import com.z2api.common.dto.PoolSnapshot;
import com.z2api.common.dto.RefreshResult;
import com.z2api.common.exception.InvalidRequestException;
import com.z2api.common.exception.UpstreamException;
import com.z2api.common.util.SecretMasker;
import com.z2api.pool.config.PoolProperties;
import com.z2api.pool.credential.CredentialEntry;
import com.z2api.pool.credential.CredentialPool;
import com.z2api.pool.credential.PoolReplacement;
import com.z2api.pool.store.ConfigStore;
import com.z2api.upstream.client.UpstreamClient;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 凭据池管理器：请求转发和管理接口唯一依赖的入口。
 * <p>
 * 池内状态的读写交给 {@link CredentialPool}（同一把锁内完成），
 * 这里负责锁外的慢操作：健康探测、重新登录、批量刷新，以及把变化镜像到持久化存储。
 */
@Slf4j
public class CredentialPoolManager implements AutoCloseable {

    /** 批量刷新时找不到邮箱的凭据使用的占位身份 */
    static final String PLACEHOLDER_EMAIL = "unknown";

    private final CredentialPool pool;
    private final UpstreamClient upstreamClient;
    private final ConfigStore configStore;
    private final PoolProperties properties;
    private final ExecutorService refreshExecutor;

    /** 最近一次配置的凭据列表（启动加载或管理接口提交），重新加载时以此为准 */
    private volatile List<String> configuredEntries = List.of();

    public CredentialPoolManager(CredentialPool pool, UpstreamClient upstreamClient,
                                 ConfigStore configStore, PoolProperties properties) {
        this.pool = pool;
        this.upstreamClient = upstreamClient;
        this.configStore = configStore;
        this.properties = properties;
        this.refreshExecutor = Executors.newCachedThreadPool(refreshThreadFactory());
    }

    private static ThreadFactory refreshThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "credential-refresh-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    // ======================== 轮询与反馈 ========================

    public Optional<String> acquire() {
        return pool.acquire();
    }

    public void markFailed(String token) {
        pool.markFailed(token);
    }

    public void markSuccess(String token) {
        pool.markSuccess(token);
    }

    public Optional<CredentialEntry> resolve(String alias) {
        return pool.resolve(alias);
    }

    public Set<String> failedEntries() {
        return pool.failedEntries();
    }

    // ======================== 健康探测 ========================

    /**
     * 探测凭据是否可用。参数可以是池中的原始凭据、有效令牌，也可以是池外的任意凭据字符串。
     * 不修改池状态，任何失败都返回 false。
     */
    public boolean healthCheck(String entryOrToken) {
        if (entryOrToken == null || entryOrToken.isBlank()) {
            return false;
        }
        CredentialEntry entry = pool.resolve(entryOrToken)
                .orElseGet(() -> CredentialEntry.parse(entryOrToken.trim()));
        String token = entry.getToken();
        if (token == null) {
            log.debug("凭据没有可用令牌，探测视为失败: {}", entry.describe());
            return false;
        }
        try {
            return upstreamClient.probe(token);
        } catch (RuntimeException e) {
            log.debug("健康探测异常: {} - {}", SecretMasker.mask(token), e.getMessage());
            return false;
        }
    }

    // ======================== 重新登录 ========================

    /**
     * 用账号密码重新登录取回新令牌，不修改池状态。
     */
    public Optional<String> refresh(String email, String password) {
        try {
            return upstreamClient.signIn(email, password);
        } catch (RuntimeException e) {
            log.error("刷新令牌出错 {}: {}", SecretMasker.maskEmail(email), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * 刷新单个凭据，成功后在原位置写回新的完整凭据。
     */
    public RefreshResult refreshSingle(String entryOrToken) {
        Optional<CredentialEntry> resolved = pool.resolve(entryOrToken);
        if (resolved.isEmpty() || !resolved.get().hasCredentials()) {
            log.warn("凭据没有账号密码信息，无法刷新: {}", SecretMasker.mask(entryOrToken));
            return RefreshResult.failure("该凭据没有账号密码信息，无法刷新");
        }

        CredentialEntry entry = resolved.get();
        String email = identityOf(entry);
        Optional<String> newToken = refresh(entry.getEmail(), entry.getPassword());
        if (newToken.isEmpty()) {
            return RefreshResult.failure("刷新令牌失败: " + SecretMasker.maskEmail(email));
        }

        CredentialEntry updated = CredentialEntry.composite(email, entry.getPassword(), newToken.get());
        if (!pool.replace(new PoolReplacement(-1, entry.getRaw(), updated))) {
            return RefreshResult.failure("凭据在刷新期间已被移除");
        }

        log.info("凭据已刷新: {}", updated.describe());
        persist();
        return RefreshResult.success(updated.getRaw(), "刷新成功");
    }

    /**
     * 并发刷新池中所有带账号密码的凭据。
     * <p>
     * 候选集合取自开始时的一份快照；调用线程按信号量逐个放行，同时在途的登录请求数不超过 {@code maxConcurrent}；
     * 全部完成后在一个临界区内把成功的结果写回池中。
     */
    public BatchRefreshResult batchRefresh(int maxConcurrent) {
        List<CredentialEntry> snapshot = pool.entries();
        List<Integer> candidates = new ArrayList<>();
        for (int i = 0; i < snapshot.size(); i++) {
            if (snapshot.get(i).hasCredentials()) {
                candidates.add(i);
            }
        }
        if (candidates.isEmpty()) {
            return BatchRefreshResult.empty();
        }

        int totalCount = candidates.size();
        int concurrency = Math.max(1, maxConcurrent);
        log.info("开始批量刷新 {} 个令牌, 并发度: {}", totalCount, concurrency);

        // 先取许可再提交任务，等待中的候选不占用线程，在途线程数不超过并发度
        Semaphore semaphore = new Semaphore(concurrency);
        List<CompletableFuture<PoolReplacement>> futures = new ArrayList<>(totalCount);
        for (Integer position : candidates) {
            CredentialEntry entry = snapshot.get(position);
            try {
                semaphore.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.add(CompletableFuture.failedFuture(new UpstreamException("等待刷新时被中断", e)));
                continue;
            }
            try {
                futures.add(CompletableFuture.supplyAsync(() -> {
                    try {
                        return refresh(entry.getEmail(), entry.getPassword())
                                .map(token -> new PoolReplacement(position, entry.getRaw(),
                                        CredentialEntry.composite(identityOf(entry), entry.getPassword(), token)))
                                .orElse(null);
                    } finally {
                        semaphore.release();
                    }
                }, refreshExecutor));
            } catch (RejectedExecutionException e) {
                semaphore.release();
                futures.add(CompletableFuture.failedFuture(new UpstreamException("刷新线程池已关闭", e)));
            }
        }

        int failedCount = 0;
        List<PoolReplacement> replacements = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                PoolReplacement replacement = futures.get(i).join();
                if (replacement == null) {
                    log.error("刷新令牌失败: {}", snapshot.get(candidates.get(i)).describe());
                    failedCount++;
                } else {
                    replacements.add(replacement);
                }
            } catch (Exception e) {
                log.error("刷新任务异常: {}", e.getMessage());
                failedCount++;
            }
        }

        List<PoolReplacement> applied = pool.replaceBatch(replacements);
        failedCount += replacements.size() - applied.size();
        List<String> updatedEntries = applied.stream()
                .map(replacement -> replacement.getReplacement().getRaw())
                .toList();
        if (!applied.isEmpty()) {
            persist();
        }

        String message = String.format("批量刷新完成: %d 个刷新成功, %d 个刷新失败", applied.size(), failedCount);
        log.info(message);
        return BatchRefreshResult.builder()
                .refreshedCount(applied.size())
                .failedCount(failedCount)
                .totalCount(totalCount)
                .updatedEntries(new ArrayList<>(updatedEntries))
                .message(message)
                .build();
    }

    /**
     * 邮箱为空的凭据仍以占位身份写成完整格式，保证刷新后不会从池中消失。
     */
    private String identityOf(CredentialEntry entry) {
        if (entry.getEmail() == null || entry.getEmail().isBlank()) {
            log.warn("凭据缺少邮箱，使用占位身份 {}: {}", PLACEHOLDER_EMAIL, entry.describe());
            return PLACEHOLDER_EMAIL;
        }
        return entry.getEmail();
    }

    // ======================== 淘汰 ========================

    /**
     * 永久淘汰一组凭据，返回实际移除的数量。
     */
    public int evict(Collection<String> rawEntries) {
        int removed = pool.evict(rawEntries);
        if (removed > 0) {
            persist();
        }
        return removed;
    }

    // ======================== 管理操作 ========================

    /**
     * 启动时加载凭据，不写回持久化存储。
     */
    public void load(List<String> rawEntries) {
        configuredEntries = List.copyOf(rawEntries);
        pool.replaceAll(rawEntries);
    }

    /**
     * 按最近一次配置的凭据列表重建凭据池，清空失败集合并重置游标。
     */
    public PoolSnapshot reload() {
        pool.replaceAll(configuredEntries);
        log.info("已按配置重新加载凭据池: {} 个凭据", pool.size());
        return pool.snapshot();
    }

    /**
     * 整体替换凭据列表（过滤空白项），并镜像到持久化存储。
     */
    public List<String> replaceAll(List<String> rawEntries) {
        List<String> valid = rawEntries == null ? List.of() : rawEntries.stream()
                .filter(raw -> raw != null && !raw.isBlank())
                .map(String::trim)
                .toList();
        if (valid.isEmpty()) {
            throw new InvalidRequestException("至少需要一个有效的 Cookie");
        }
        configuredEntries = valid;
        pool.replaceAll(valid);
        persist();
        return valid;
    }

    public void clearAll() {
        configuredEntries = List.of();
        pool.clearAll();
        persist();
    }

    public PoolSnapshot listState() {
        return pool.snapshot();
    }

    /**
     * 将当前凭据列表以逗号拼接写入持久化存储，失败只记录日志。
     */
    private void persist() {
        List<String> raws = pool.entries().stream().map(CredentialEntry::getRaw).toList();
        try {
            configStore.setValue(properties.getPersistKey(), String.join(",", raws));
        } catch (Exception e) {
            log.warn("写入持久化存储失败（不影响凭据池）: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        refreshExecutor.shutdownNow();
    }
}
