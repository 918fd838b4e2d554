package com.z2api.pool.service;

import com.z2api.common.dto.RefreshResult;
import com.z2api.pool.credential.CredentialEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 后台恢复循环：定期检查失败集合中的凭据。
 * <p>
 * 每一轮对失败凭据依次：探测 → 通过则恢复；不通过且没有账号密码则淘汰；
 * 有账号密码则重新登录，登录成功后再探测一次，仍不通过则淘汰；登录失败的留到下一轮。
 * 一轮内出错不会终止循环，而是以较短的间隔重试。
 */
@Slf4j
public class CredentialRecoveryScheduler implements SmartLifecycle {

    private final CredentialPoolManager poolManager;
    private final Duration interval;
    private final Duration errorBackoff;

    private ScheduledExecutorService executor;
    private volatile boolean running;

    public CredentialRecoveryScheduler(CredentialPoolManager poolManager, Duration interval, Duration errorBackoff) {
        this.poolManager = poolManager;
        this.interval = interval;
        this.errorBackoff = errorBackoff;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "credential-recovery");
            thread.setDaemon(true);
            return thread;
        });
        running = true;
        log.info("凭据恢复循环已启动，间隔 {} 秒，出错重试间隔 {} 秒",
                interval.toSeconds(), errorBackoff.toSeconds());
        scheduleNext(interval);
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        // 中断正在等待的下一轮
        executor.shutdownNow();
        log.info("凭据恢复循环已停止");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void scheduleNext(Duration delay) {
        if (!running) {
            return;
        }
        try {
            executor.schedule(this::runGuarded, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("恢复循环已关闭，不再调度下一轮");
        }
    }

    private void runGuarded() {
        Duration next = interval;
        try {
            runCycle();
        } catch (Exception e) {
            log.error("凭据恢复检查出错，{} 秒后重试", errorBackoff.toSeconds(), e);
            next = errorBackoff;
        }
        scheduleNext(next);
    }

    /**
     * 执行一轮恢复检查，只处理本轮开始时失败集合的快照。
     */
    public RecoveryReport runCycle() {
        Set<String> failedSnapshot = poolManager.failedEntries();
        if (failedSnapshot.isEmpty()) {
            return RecoveryReport.NOTHING_TO_CHECK;
        }
        log.info("开始检查 {} 个失败凭据", failedSnapshot.size());

        int recovered = 0;
        int refreshed = 0;
        List<String> toEvict = new ArrayList<>();

        for (String raw : failedSnapshot) {
            Optional<CredentialEntry> current = poolManager.resolve(raw);
            if (current.isEmpty()) {
                // 本轮期间已被替换或清空
                continue;
            }
            CredentialEntry entry = current.get();

            if (poolManager.healthCheck(raw)) {
                poolManager.markSuccess(raw);
                recovered++;
                continue;
            }

            if (!entry.hasCredentials()) {
                log.warn("凭据探测失败且没有账号密码，将被淘汰: {}", entry.describe());
                toEvict.add(raw);
                continue;
            }

            RefreshResult result = poolManager.refreshSingle(raw);
            if (!result.isSuccess()) {
                log.warn("凭据重新登录失败，下一轮再试: {} ({})", entry.describe(), result.getMessage());
                continue;
            }
            refreshed++;

            if (poolManager.healthCheck(result.getEntry())) {
                log.info("凭据刷新后恢复可用: {}", entry.describe());
                recovered++;
            } else {
                log.warn("凭据刷新后仍不可用，将被淘汰: {}", entry.describe());
                toEvict.add(result.getEntry());
            }
        }

        int evicted = poolManager.evict(toEvict);
        log.info("恢复检查完成: 检查 {}, 恢复 {}, 重新登录 {}, 淘汰 {}",
                failedSnapshot.size(), recovered, refreshed, evicted);
        return new RecoveryReport(failedSnapshot.size(), recovered, refreshed, evicted);
    }

    @Override
    public int getPhase() {
        // 在 Web 服务器之后启动，先于它停止
        return Integer.MAX_VALUE - 1;
    }
}
